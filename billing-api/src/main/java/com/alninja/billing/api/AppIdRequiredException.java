package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties ({"cause", "localizedMessage", "stackTrace", "suppressed"})
public class AppIdRequiredException extends BillingClientException {

    public AppIdRequiredException() {
        super("Ninja-App-Id header is required");
    }
}
