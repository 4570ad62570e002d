package com.alninja.billing.lifecycle;

import io.dropwizard.lifecycle.Managed;

/**
 * Registry that calls {@link Managed#start()} and {@link Managed#stop()} for each registered instance when the
 * hosting application starts and stops.
 */
public interface LifeCycleRegistry {
    <T extends Managed> T manage(T managed);
}
