package com.alninja.billing.pipeline;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * Client identity sent with each request.  Values are trimmed and blank values are absent.
 */
public final class NinjaHeaders {
    private final String _appId;
    private final String _gitBranch;
    private final String _gitUserName;
    private final String _gitUserEmail;
    private final String _appPublisher;
    private final String _appName;
    private final String _appVersion;
    private final String _ninjaVersion;

    private NinjaHeaders(Builder builder) {
        _appId = builder._appId;
        _gitBranch = builder._gitBranch;
        _gitUserName = builder._gitUserName;
        _gitUserEmail = builder._gitUserEmail;
        _appPublisher = builder._appPublisher;
        _appName = builder._appName;
        _appVersion = builder._appVersion;
        _ninjaVersion = builder._ninjaVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public String getAppId() {
        return _appId;
    }

    @Nullable
    public String getGitBranch() {
        return _gitBranch;
    }

    @Nullable
    public String getGitUserName() {
        return _gitUserName;
    }

    /** Lower-cased by the parser; compare normalized regardless. */
    @Nullable
    public String getGitUserEmail() {
        return _gitUserEmail;
    }

    @Nullable
    public String getAppPublisher() {
        return _appPublisher;
    }

    @Nullable
    public String getAppName() {
        return _appName;
    }

    @Nullable
    public String getAppVersion() {
        return _appVersion;
    }

    @Nullable
    public String getNinjaVersion() {
        return _ninjaVersion;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("appId", _appId)
                .add("appPublisher", _appPublisher)
                .add("gitUserEmail", _gitUserEmail)
                .add("ninjaVersion", _ninjaVersion)
                .toString();
    }

    public static class Builder {
        private String _appId;
        private String _gitBranch;
        private String _gitUserName;
        private String _gitUserEmail;
        private String _appPublisher;
        private String _appName;
        private String _appVersion;
        private String _ninjaVersion;

        private Builder() {
        }

        private static String clean(@Nullable String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }

        public Builder appId(@Nullable String appId) {
            _appId = clean(appId);
            return this;
        }

        public Builder gitBranch(@Nullable String gitBranch) {
            _gitBranch = clean(gitBranch);
            return this;
        }

        public Builder gitUserName(@Nullable String gitUserName) {
            _gitUserName = clean(gitUserName);
            return this;
        }

        public Builder gitUserEmail(@Nullable String gitUserEmail) {
            _gitUserEmail = clean(gitUserEmail);
            return this;
        }

        public Builder appPublisher(@Nullable String appPublisher) {
            _appPublisher = clean(appPublisher);
            return this;
        }

        public Builder appName(@Nullable String appName) {
            _appName = clean(appName);
            return this;
        }

        public Builder appVersion(@Nullable String appVersion) {
            _appVersion = clean(appVersion);
            return this;
        }

        public Builder ninjaVersion(@Nullable String ninjaVersion) {
            _ninjaVersion = clean(ninjaVersion);
            return this;
        }

        public NinjaHeaders build() {
            return new NinjaHeaders(this);
        }
    }
}
