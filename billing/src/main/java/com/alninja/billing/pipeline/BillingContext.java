package com.alninja.billing.pipeline;

import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.BlockedOrganization;
import com.alninja.billing.api.DunningEntry;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.OwnerType;
import com.alninja.billing.api.PermissionResult;
import com.alninja.billing.api.UserProfile;
import com.alninja.billing.permission.PermissionDecision;
import com.alninja.billing.permission.UserUpdate;
import com.google.common.base.MoreObjects;
import com.google.common.collect.Sets;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything the pipeline learned and decided about one request.  Stages only add to it: entities are bound,
 * intents are recorded and the verdict is set, but nothing recorded is ever withdrawn.  The bound app is the one
 * exception in that claiming and force-orphaning replace it with its new ownership.
 */
public class BillingContext {
    private AppInfo _app;
    private UserProfile _user;
    private Organization _organization;
    private BlockedOrganization _blocked;
    private DunningEntry _dunning;
    private PermissionResult _permission;
    private boolean _claimIssue;
    private final Set<WritebackIntent> _intents = EnumSet.noneOf(WritebackIntent.class);
    private UserUpdate _userUpdate;
    private boolean _logUnknownUser;

    public BillingContext bindApp(AppInfo app) {
        _app = checkNotNull(app, "app");
        return this;
    }

    /** Binds an app that is not stored yet and records that it must be. */
    public BillingContext bindNewOrphan(AppInfo app) {
        bindApp(app);
        _intents.add(WritebackIntent.NEW_ORPHAN);
        return this;
    }

    /** Assigns the bound app to {@code organization} and records the claim. */
    public BillingContext claim(Organization organization) {
        checkNotNull(organization, "organization");
        _app = checkNotNull(_app, "app").withOwner(OwnerType.ORGANIZATION, organization.getId());
        _organization = organization;
        _intents.add(WritebackIntent.CLAIMED);
        return this;
    }

    /** Drops the bound app's owner, which could not be found, and records that the stored app must lose it too. */
    public BillingContext forceOrphan() {
        _app = checkNotNull(_app, "app").withoutOwner();
        _intents.add(WritebackIntent.FORCE_ORPHAN);
        return this;
    }

    public BillingContext bindUser(UserProfile user) {
        _user = checkNotNull(user, "user");
        return this;
    }

    public BillingContext bindOrganization(Organization organization) {
        _organization = checkNotNull(organization, "organization");
        return this;
    }

    public BillingContext bindBlocked(BlockedOrganization blocked) {
        _blocked = checkNotNull(blocked, "blocked");
        return this;
    }

    public BillingContext bindDunning(DunningEntry dunning) {
        _dunning = checkNotNull(dunning, "dunning");
        return this;
    }

    public BillingContext flagClaimIssue() {
        _claimIssue = true;
        return this;
    }

    /** Records the verdict and whatever user record keeping came with it. */
    public BillingContext decide(PermissionDecision decision) {
        checkNotNull(decision, "decision");
        _permission = decision.getResult();
        if (decision.getUserUpdate() != null) {
            _userUpdate = decision.getUserUpdate();
        }
        if (decision.isLogUnknownUser()) {
            _logUnknownUser = true;
        }
        return this;
    }

    @Nullable
    public AppInfo getApp() {
        return _app;
    }

    @Nullable
    public UserProfile getUser() {
        return _user;
    }

    @Nullable
    public Organization getOrganization() {
        return _organization;
    }

    @Nullable
    public BlockedOrganization getBlocked() {
        return _blocked;
    }

    @Nullable
    public DunningEntry getDunning() {
        return _dunning;
    }

    /** Null unless the permission stage ran. */
    @Nullable
    public PermissionResult getPermission() {
        return _permission;
    }

    public boolean isDenied() {
        return _permission != null && !_permission.isAllowed();
    }

    public boolean hasClaimIssue() {
        return _claimIssue;
    }

    public boolean hasIntent(WritebackIntent intent) {
        return _intents.contains(intent);
    }

    public Set<WritebackIntent> getIntents() {
        return Sets.immutableEnumSet(_intents);
    }

    @Nullable
    public UserUpdate getUserUpdate() {
        return _userUpdate;
    }

    public boolean isLogUnknownUser() {
        return _logUnknownUser;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("app", _app)
                .add("organization", _organization != null ? _organization.getId() : null)
                .add("permission", _permission)
                .add("intents", _intents)
                .add("userUpdate", _userUpdate)
                .toString();
    }
}
