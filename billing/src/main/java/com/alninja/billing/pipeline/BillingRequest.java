package com.alninja.billing.pipeline;

import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One request as seen by the billing pipeline: the client's identity, the response headers the pipeline wants set,
 * and the decision context once preprocessing has created one.  Not thread safe; a request is handled by one task
 * at a time.
 */
public class BillingRequest {
    public static final String DUNNING_WARNING_HEADER = "X-Ninja-Dunning-Warning";
    public static final String CLAIM_ISSUE_HEADER = "X-Ninja-Claim-Issue";

    private final NinjaHeaders _headers;
    private final Map<String, String> _responseHeaders = Maps.newLinkedHashMap();
    private BillingContext _context;

    public BillingRequest(NinjaHeaders headers) {
        _headers = checkNotNull(headers, "headers");
    }

    public NinjaHeaders getHeaders() {
        return _headers;
    }

    public void setResponseHeader(String name, String value) {
        _responseHeaders.put(checkNotNull(name, "name"), checkNotNull(value, "value"));
    }

    public Map<String, String> getResponseHeaders() {
        return Collections.unmodifiableMap(_responseHeaders);
    }

    @Nullable
    public BillingContext getContext() {
        return _context;
    }

    public boolean hasContext() {
        return _context != null;
    }

    public BillingContext createContext() {
        _context = new BillingContext();
        return _context;
    }

    public void discardContext() {
        _context = null;
    }
}
