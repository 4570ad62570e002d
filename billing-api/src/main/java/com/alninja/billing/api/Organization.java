package com.alninja.billing.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A paying customer, as stored in {@code system/organizations.json}.  Only the fields the billing core reads are
 * modeled here; writebacks edit the stored JSON directly so every other field survives untouched.
 * <p>
 * Email addresses and domains in the lists are stored as entered and must be compared normalized.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Organization {
    private final String _id;
    private final String _name;
    private final SubscriptionTier _plan;
    private final List<String> _users;
    private final List<String> _deniedUsers;
    private final List<String> _domains;
    private final List<String> _pendingDomains;
    private final boolean _denyUnknownDomains;
    private final Map<String, Long> _userFirstSeenTimestamp;
    private final List<String> _publishers;
    private final boolean _doNotStoreAppNames;
    private final String _stripeCustomerId;

    @JsonCreator
    public Organization(@JsonProperty("id") String id,
                        @JsonProperty("name") @Nullable String name,
                        @JsonProperty("plan") @Nullable SubscriptionTier plan,
                        @JsonProperty("users") @Nullable Collection<String> users,
                        @JsonProperty("deniedUsers") @Nullable Collection<String> deniedUsers,
                        @JsonProperty("domains") @Nullable Collection<String> domains,
                        @JsonProperty("pendingDomains") @Nullable Collection<String> pendingDomains,
                        @JsonProperty("denyUnknownDomains") boolean denyUnknownDomains,
                        @JsonProperty("userFirstSeenTimestamp") @Nullable Map<String, Long> userFirstSeenTimestamp,
                        @JsonProperty("publishers") @Nullable Collection<String> publishers,
                        @JsonProperty("doNotStoreAppNames") boolean doNotStoreAppNames,
                        @JsonProperty("stripeCustomerId") @Nullable String stripeCustomerId) {
        _id = checkNotNull(id, "id");
        _name = name != null ? name : "";
        _plan = plan;
        _users = copyOf(users);
        _deniedUsers = copyOf(deniedUsers);
        _domains = copyOf(domains);
        _pendingDomains = copyOf(pendingDomains);
        _denyUnknownDomains = denyUnknownDomains;
        _userFirstSeenTimestamp = userFirstSeenTimestamp == null
                ? ImmutableMap.of()
                : ImmutableMap.copyOf(Maps.filterEntries(userFirstSeenTimestamp,
                        entry -> entry.getKey() != null && entry.getValue() != null));
        _publishers = copyOf(publishers);
        _doNotStoreAppNames = doNotStoreAppNames;
        _stripeCustomerId = stripeCustomerId;
    }

    private static List<String> copyOf(@Nullable Collection<String> values) {
        if (values == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String value : values) {
            if (value != null) {
                builder.add(value);
            }
        }
        return builder.build();
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    @Nullable
    public SubscriptionTier getPlan() {
        return _plan;
    }

    public List<String> getUsers() {
        return _users;
    }

    public List<String> getDeniedUsers() {
        return _deniedUsers;
    }

    public List<String> getDomains() {
        return _domains;
    }

    public List<String> getPendingDomains() {
        return _pendingDomains;
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isDenyUnknownDomains() {
        return _denyUnknownDomains;
    }

    /** Keys are normalized email addresses, values are epoch milliseconds. */
    public Map<String, Long> getUserFirstSeenTimestamp() {
        return _userFirstSeenTimestamp;
    }

    public List<String> getPublishers() {
        return _publishers;
    }

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isDoNotStoreAppNames() {
        return _doNotStoreAppNames;
    }

    @Nullable
    public String getStripeCustomerId() {
        return _stripeCustomerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Organization)) {
            return false;
        }
        Organization that = (Organization) o;
        return _denyUnknownDomains == that._denyUnknownDomains &&
                _doNotStoreAppNames == that._doNotStoreAppNames &&
                _id.equals(that._id) &&
                _name.equals(that._name) &&
                _plan == that._plan &&
                _users.equals(that._users) &&
                _deniedUsers.equals(that._deniedUsers) &&
                _domains.equals(that._domains) &&
                _pendingDomains.equals(that._pendingDomains) &&
                _userFirstSeenTimestamp.equals(that._userFirstSeenTimestamp) &&
                _publishers.equals(that._publishers) &&
                Objects.equal(_stripeCustomerId, that._stripeCustomerId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_id, _plan, _users, _deniedUsers);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", _id)
                .add("plan", _plan)
                .add("users", _users.size())
                .add("deniedUsers", _deniedUsers.size())
                .toString();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String _id;
        private String _name;
        private SubscriptionTier _plan;
        private List<String> _users = ImmutableList.of();
        private List<String> _deniedUsers = ImmutableList.of();
        private List<String> _domains = ImmutableList.of();
        private List<String> _pendingDomains = ImmutableList.of();
        private boolean _denyUnknownDomains;
        private Map<String, Long> _userFirstSeenTimestamp = ImmutableMap.of();
        private List<String> _publishers = ImmutableList.of();
        private boolean _doNotStoreAppNames;
        private String _stripeCustomerId;

        private Builder(String id) {
            _id = checkNotNull(id, "id");
        }

        public Builder name(String name) {
            _name = name;
            return this;
        }

        public Builder plan(SubscriptionTier plan) {
            _plan = plan;
            return this;
        }

        public Builder users(String... users) {
            _users = ImmutableList.copyOf(users);
            return this;
        }

        public Builder deniedUsers(String... deniedUsers) {
            _deniedUsers = ImmutableList.copyOf(deniedUsers);
            return this;
        }

        public Builder domains(String... domains) {
            _domains = ImmutableList.copyOf(domains);
            return this;
        }

        public Builder pendingDomains(String... pendingDomains) {
            _pendingDomains = ImmutableList.copyOf(pendingDomains);
            return this;
        }

        public Builder denyUnknownDomains(boolean denyUnknownDomains) {
            _denyUnknownDomains = denyUnknownDomains;
            return this;
        }

        public Builder userFirstSeen(String email, long timestamp) {
            _userFirstSeenTimestamp = ImmutableMap.<String, Long>builder()
                    .putAll(_userFirstSeenTimestamp)
                    .put(email, timestamp)
                    .build();
            return this;
        }

        public Builder publishers(String... publishers) {
            _publishers = ImmutableList.copyOf(publishers);
            return this;
        }

        public Builder doNotStoreAppNames(boolean doNotStoreAppNames) {
            _doNotStoreAppNames = doNotStoreAppNames;
            return this;
        }

        public Builder stripeCustomerId(String stripeCustomerId) {
            _stripeCustomerId = stripeCustomerId;
            return this;
        }

        public Organization build() {
            return new Organization(_id, _name, _plan, _users, _deniedUsers, _domains, _pendingDomains,
                    _denyUnknownDomains, _userFirstSeenTimestamp, _publishers, _doNotStoreAppNames, _stripeCustomerId);
        }
    }
}
