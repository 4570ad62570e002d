package com.alninja.billing.cache;

import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.BlockedOrganizations;
import com.alninja.billing.api.DunningEntry;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.UserProfile;

import java.util.List;

/**
 * Bulk loader behind {@link EntityCache}.  Each method reads one whole collection; a missing collection loads as
 * empty.  Failures propagate as unchecked exceptions.
 */
public interface EntitySource {

    List<AppInfo> loadApps();

    List<UserProfile> loadUsers();

    List<Organization> loadOrganizations();

    BlockedOrganizations loadBlocked();

    List<DunningEntry> loadDunning();
}
