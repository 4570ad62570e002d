package com.alninja.billing.web;

import com.alninja.billing.pipeline.BillingRequest;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

/**
 * The business logic of an endpoint, invoked once billing has let the request through.
 */
public interface EndpointHandler {

    /** Returns the response body, or null for an empty response. */
    @Nullable
    JsonNode handle(BillingRequest request);
}
