package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

/**
 * Thrown when the client extension is missing a version or is older than the supported minimum.
 */
@JsonIgnoreProperties ({"cause", "localizedMessage", "stackTrace", "suppressed"})
public class UpgradeRequiredException extends BillingClientException {
    private final String _minimumVersion;
    private final String _clientVersion;

    public UpgradeRequiredException(String minimumVersion, @Nullable String clientVersion) {
        super(String.format("Extension version %s or higher required. You have %s. Please update AL Object ID Ninja.",
                minimumVersion, clientVersion));
        _minimumVersion = minimumVersion;
        _clientVersion = clientVersion;
    }

    @JsonCreator
    public UpgradeRequiredException(@JsonProperty("message") String message,
                                    @JsonProperty("minimumVersion") String minimumVersion,
                                    @JsonProperty("clientVersion") @Nullable String clientVersion) {
        super(message);
        _minimumVersion = minimumVersion;
        _clientVersion = clientVersion;
    }

    public String getMinimumVersion() {
        return _minimumVersion;
    }

    @Nullable
    public String getClientVersion() {
        return _clientVersion;
    }
}
