package com.alninja.billing.pipeline;

/**
 * App changes decided during preprocessing and persisted after the response.
 */
public enum WritebackIntent {
    /** Register a newly seen app as unowned. */
    NEW_ORPHAN,
    /** Record the organization that just claimed the app. */
    CLAIMED,
    /** Remove an owner that no longer exists. */
    FORCE_ORPHAN
}
