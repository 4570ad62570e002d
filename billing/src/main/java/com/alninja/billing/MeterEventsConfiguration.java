package com.alninja.billing;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.constraints.NotNull;
import java.net.URI;
import java.util.Optional;

/**
 * Where pay-as-you-go meter events are posted.  Without a secret key the events are skipped.
 */
public class MeterEventsConfiguration {

    @NotNull
    @JsonProperty("url")
    private URI _url = URI.create("https://api.stripe.com/v1/billing/meter_events");

    @NotNull
    @JsonProperty("secretKey")
    private Optional<String> _secretKey = Optional.empty();

    public URI getUrl() {
        return _url;
    }

    public MeterEventsConfiguration setUrl(URI url) {
        _url = url;
        return this;
    }

    public Optional<String> getSecretKey() {
        return _secretKey;
    }

    public MeterEventsConfiguration setSecretKey(String secretKey) {
        _secretKey = Optional.ofNullable(secretKey);
        return this;
    }
}
