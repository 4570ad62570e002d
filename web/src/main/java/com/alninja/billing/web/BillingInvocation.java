package com.alninja.billing.web;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.ListenableFuture;

import javax.ws.rs.core.Response;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The response to an endpoint call and the handle of the writebacks it scheduled.  The writebacks complete on their
 * own; waiting on them is only useful in tests.
 */
public class BillingInvocation {
    private final Response _response;
    private final ListenableFuture<?> _writebacks;

    public BillingInvocation(Response response, ListenableFuture<?> writebacks) {
        _response = checkNotNull(response, "response");
        _writebacks = checkNotNull(writebacks, "writebacks");
    }

    public Response getResponse() {
        return _response;
    }

    public ListenableFuture<?> getWritebacks() {
        return _writebacks;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", _response.getStatus())
                .toString();
    }
}
