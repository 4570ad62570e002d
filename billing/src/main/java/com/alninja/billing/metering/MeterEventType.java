package com.alninja.billing.metering;

/**
 * Metered events of the pay-as-you-go plan, each counted once per organization and month.
 */
public enum MeterEventType {
    PAY_AS_YOU_GO_APP("pay_as_you_go_app", "value"),
    PAY_AS_YOU_GO_USER("pay_as_you_go_user", "users");

    private final String _eventName;
    private final String _payloadField;

    MeterEventType(String eventName, String payloadField) {
        _eventName = eventName;
        _payloadField = payloadField;
    }

    public String getEventName() {
        return _eventName;
    }

    /** Name of the payload field carrying the event's quantity. */
    public String getPayloadField() {
        return _payloadField;
    }
}
