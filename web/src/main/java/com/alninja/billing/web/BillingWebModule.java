package com.alninja.billing.web;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.BillingModule;
import com.alninja.billing.cache.EntityCache;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.lifecycle.LifeCycleRegistry;
import com.alninja.billing.web.headers.NinjaHeaderParser;
import com.alninja.billing.web.headers.VersionCheck;
import com.alninja.billing.writeback.WritebackService;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;

import javax.ws.rs.client.Client;
import java.time.Clock;

/**
 * Guice module for running endpoints through billing.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link BillingConfiguration}
 * <li> {@link DocumentStore}
 * <li> {@link LifeCycleRegistry}
 * <li> {@link MetricRegistry}
 * <li> {@link Clock}
 * <li> JAX-RS {@link Client}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link BillingRequestHandler}
 * <li> {@link WritebackService}
 * <li> {@link EntityCache}
 * </ul>
 */
public class BillingWebModule extends PrivateModule {

    @Override
    protected void configure() {
        install(new BillingModule());

        bind(NinjaHeaderParser.class).asEagerSingleton();
        bind(VersionCheck.class).asEagerSingleton();
        bind(BillingRequestHandler.class).asEagerSingleton();

        expose(BillingRequestHandler.class);
        expose(WritebackService.class);
        expose(EntityCache.class);
    }
}
