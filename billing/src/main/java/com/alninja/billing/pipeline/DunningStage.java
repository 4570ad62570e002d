package com.alninja.billing.pipeline;

/**
 * Warns the client when the owning organization is behind on payments.  Dunning never blocks.
 */
public class DunningStage {

    public void apply(BillingRequest request, BillingContext context) {
        if (context.getDunning() != null) {
            request.setResponseHeader(BillingRequest.DUNNING_WARNING_HEADER, "true");
        }
    }
}
