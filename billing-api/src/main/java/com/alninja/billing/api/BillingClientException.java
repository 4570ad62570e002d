package com.alninja.billing.api;

/**
 * Base class for failures caused by the client's request rather than by the backend.  These are reported to the
 * caller as-is; everything else raised while evaluating billing is treated as an infrastructure fault and
 * swallowed.
 */
public abstract class BillingClientException extends RuntimeException {

    protected BillingClientException() {
    }

    protected BillingClientException(String message) {
        super(message);
    }
}
