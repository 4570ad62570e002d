package com.alninja.billing;

import com.alninja.billing.cache.DocumentEntitySource;
import com.alninja.billing.cache.EntityCache;
import com.alninja.billing.cache.EntitySource;
import com.alninja.billing.claim.ClaimEvaluator;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.core.OptimisticDocumentUpdater;
import com.alninja.billing.lifecycle.LifeCycleRegistry;
import com.alninja.billing.metering.JaxRsMeterEventSender;
import com.alninja.billing.metering.MeterEventSender;
import com.alninja.billing.permission.PermissionResolver;
import com.alninja.billing.permission.UserPermissionResolver;
import com.alninja.billing.pipeline.BillingPreprocessor;
import com.alninja.billing.pipeline.BindingStage;
import com.alninja.billing.pipeline.BlockingStage;
import com.alninja.billing.pipeline.ClaimingStage;
import com.alninja.billing.pipeline.DunningStage;
import com.alninja.billing.pipeline.FaultLog;
import com.alninja.billing.pipeline.InvocationLogger;
import com.alninja.billing.pipeline.PermissionStage;
import com.alninja.billing.pipeline.SuccessPostprocessor;
import com.alninja.billing.writeback.BillingWritebacks;
import com.alninja.billing.writeback.WritebackService;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import javax.ws.rs.client.Client;
import java.time.Clock;
import java.time.Duration;

/**
 * Guice module for the billing pipeline.
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
 * <li> {@link BillingPreprocessor}
 * <li> {@link SuccessPostprocessor}
 * <li> {@link WritebackService}
 * <li> {@link InvocationLogger}
 * <li> {@link EntityCache}
 * </ul>
 */
public class BillingModule extends PrivateModule {

    @Override
    protected void configure() {
        // Entity cache over the stored documents
        bind(EntitySource.class).to(DocumentEntitySource.class).asEagerSingleton();
        bind(EntityCache.class).asEagerSingleton();

        // Pure decision logic
        bind(ClaimEvaluator.class).asEagerSingleton();
        bind(UserPermissionResolver.class).asEagerSingleton();
        bind(PermissionResolver.class).asEagerSingleton();

        // Pipeline stages
        bind(BindingStage.class).asEagerSingleton();
        bind(ClaimingStage.class).asEagerSingleton();
        bind(BlockingStage.class).asEagerSingleton();
        bind(DunningStage.class).asEagerSingleton();
        bind(PermissionStage.class).asEagerSingleton();
        bind(FaultLog.class).asEagerSingleton();

        // Persistence of decisions
        bind(MeterEventSender.class).to(JaxRsMeterEventSender.class).asEagerSingleton();
        bind(BillingWritebacks.class).asEagerSingleton();

        bind(BillingPreprocessor.class).asEagerSingleton();
        bind(SuccessPostprocessor.class).asEagerSingleton();
        bind(WritebackService.class).asEagerSingleton();
        bind(InvocationLogger.class).asEagerSingleton();
        expose(BillingPreprocessor.class);
        expose(SuccessPostprocessor.class);
        expose(WritebackService.class);
        expose(InvocationLogger.class);
        expose(EntityCache.class);
    }

    @Provides @Singleton
    OptimisticDocumentUpdater provideDocumentUpdater(DocumentStore store, BillingConfiguration configuration,
                                                     MetricRegistry metricRegistry) {
        return new OptimisticDocumentUpdater(store, configuration.getMaxUpdateAttempts(),
                Duration.ofMillis(5), Duration.ofMillis(250), metricRegistry);
    }
}
