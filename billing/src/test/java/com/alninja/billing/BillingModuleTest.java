package com.alninja.billing;

import com.alninja.billing.cache.EntityCache;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.core.InMemoryDocumentStore;
import com.alninja.billing.docstore.core.OptimisticDocumentUpdater;
import com.alninja.billing.lifecycle.LifeCycleRegistry;
import com.alninja.billing.lifecycle.SimpleLifeCycleRegistry;
import com.alninja.billing.metering.MeterEventSender;
import com.alninja.billing.permission.PermissionResolver;
import com.alninja.billing.pipeline.BillingPreprocessor;
import com.alninja.billing.pipeline.BindingStage;
import com.alninja.billing.pipeline.InvocationLogger;
import com.alninja.billing.pipeline.SuccessPostprocessor;
import com.alninja.billing.writeback.BillingWritebacks;
import com.alninja.billing.writeback.WritebackService;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.ConfigurationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.testng.annotations.Test;

import javax.ws.rs.client.Client;
import java.time.Clock;

import static org.mockito.Mockito.mock;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.fail;

public class BillingModuleTest {

    @Test
    public void testBillingModule() throws Exception {
        SimpleLifeCycleRegistry lifeCycle = new SimpleLifeCycleRegistry();
        Injector injector = Guice.createInjector(new AbstractModule() {
            @Override
            protected void configure() {
                binder().requireExplicitBindings();

                // construct the minimum necessary elements to allow a Billing module to be created.
                bind(BillingConfiguration.class).toInstance(new BillingConfiguration());
                bind(DocumentStore.class).toInstance(new InMemoryDocumentStore());
                bind(LifeCycleRegistry.class).toInstance(lifeCycle);
                bind(Clock.class).toInstance(Clock.systemUTC());
                bind(Client.class).toInstance(mock(Client.class));
                bind(MetricRegistry.class).asEagerSingleton();

                install(new BillingModule());
            }
        });

        try {
            assertNotNull(injector.getInstance(BillingPreprocessor.class));
            assertNotNull(injector.getInstance(SuccessPostprocessor.class));
            assertNotNull(injector.getInstance(InvocationLogger.class));
            assertSame(injector.getInstance(WritebackService.class), injector.getInstance(WritebackService.class));
            assertNotNull(injector.getInstance(EntityCache.class));

            // Verify that some things we expect to be private are, indeed, private
            assertPrivate(injector, BillingWritebacks.class);
            assertPrivate(injector, MeterEventSender.class);
            assertPrivate(injector, OptimisticDocumentUpdater.class);
            assertPrivate(injector, PermissionResolver.class);
            assertPrivate(injector, BindingStage.class);
        } finally {
            lifeCycle.stop();
        }
    }

    private void assertPrivate(Injector injector, Class<?> type) {
        try {
            injector.getInstance(type);
            fail();
        } catch (ConfigurationException e) {
            // Expected
        }
    }
}
