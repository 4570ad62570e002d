package com.alninja.billing.lifecycle;

import com.google.common.collect.Lists;
import io.dropwizard.lifecycle.Managed;

import java.util.List;

/**
 * Starts managed objects in registration order and stops them in reverse.
 */
public class SimpleLifeCycleRegistry implements LifeCycleRegistry, Managed {
    private final List<Managed> _managed = Lists.newCopyOnWriteArrayList();

    @Override
    public void start() throws Exception {
        for (Managed managed : _managed) {
            managed.start();
        }
    }

    @Override
    public void stop() throws Exception {
        for (Managed managed : Lists.reverse(_managed)) {
            managed.stop();
        }
        _managed.clear();
    }

    @Override
    public <T extends Managed> T manage(T managed) {
        _managed.add(managed);
        return managed;
    }
}
