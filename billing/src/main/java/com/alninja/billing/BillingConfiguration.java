package com.alninja.billing;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

public class BillingConfiguration {

    /**
     * How long loaded apps, users, organizations, blocked and dunning documents are served before reloading.
     */
    @NotNull
    @JsonProperty("cacheTtl")
    private Duration _cacheTtl = Duration.minutes(15);

    /**
     * How long new apps, and unknown users of an organization, may be used before a license is required.
     */
    @NotNull
    @JsonProperty("gracePeriod")
    private Duration _gracePeriod = Duration.days(15);

    /**
     * Self-hosted backends skip all billing.
     */
    @JsonProperty("privateBackend")
    private boolean _privateBackend;

    @NotNull
    @JsonProperty("minimumClientVersion")
    private String _minimumClientVersion = "3.1.0";

    @Min(1)
    @JsonProperty("writebackThreads")
    private int _writebackThreads = 4;

    /**
     * Limit on optimistic update attempts per document write.  Zero retries until the write succeeds.
     */
    @Min(0)
    @JsonProperty("maxUpdateAttempts")
    private int _maxUpdateAttempts;

    @Valid
    @NotNull
    @JsonProperty("meterEvents")
    private MeterEventsConfiguration _meterEvents = new MeterEventsConfiguration();

    public Duration getCacheTtl() {
        return _cacheTtl;
    }

    public BillingConfiguration setCacheTtl(Duration cacheTtl) {
        _cacheTtl = cacheTtl;
        return this;
    }

    public Duration getGracePeriod() {
        return _gracePeriod;
    }

    public BillingConfiguration setGracePeriod(Duration gracePeriod) {
        _gracePeriod = gracePeriod;
        return this;
    }

    public boolean isPrivateBackend() {
        return _privateBackend;
    }

    public BillingConfiguration setPrivateBackend(boolean privateBackend) {
        _privateBackend = privateBackend;
        return this;
    }

    public String getMinimumClientVersion() {
        return _minimumClientVersion;
    }

    public BillingConfiguration setMinimumClientVersion(String minimumClientVersion) {
        _minimumClientVersion = minimumClientVersion;
        return this;
    }

    public int getWritebackThreads() {
        return _writebackThreads;
    }

    public BillingConfiguration setWritebackThreads(int writebackThreads) {
        _writebackThreads = writebackThreads;
        return this;
    }

    public int getMaxUpdateAttempts() {
        return _maxUpdateAttempts;
    }

    public BillingConfiguration setMaxUpdateAttempts(int maxUpdateAttempts) {
        _maxUpdateAttempts = maxUpdateAttempts;
        return this;
    }

    public MeterEventsConfiguration getMeterEvents() {
        return _meterEvents;
    }

    public BillingConfiguration setMeterEvents(MeterEventsConfiguration meterEvents) {
        _meterEvents = meterEvents;
        return this;
    }
}
