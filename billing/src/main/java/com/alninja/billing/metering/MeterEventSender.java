package com.alninja.billing.metering;

/**
 * Reports metered usage to the payment provider.  Implementations log failures rather than throw them.
 *
 * @see JaxRsMeterEventSender
 */
public interface MeterEventSender {

    /**
     * @param identifier idempotency key of the event; the provider counts each identifier once
     */
    void send(MeterEventType type, String customerId, String identifier);
}
