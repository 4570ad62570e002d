package com.alninja.billing.writeback;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.SubscriptionTier;
import com.alninja.billing.lifecycle.LifeCycleRegistry;
import com.alninja.billing.pipeline.BillingContext;
import com.alninja.billing.pipeline.BillingEndpoint;
import com.alninja.billing.pipeline.BillingRequest;
import com.alninja.billing.pipeline.Capability;
import com.alninja.billing.pipeline.NinjaHeaders;
import com.alninja.billing.pipeline.WritebackIntent;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.dropwizard.lifecycle.ExecutorServiceManager;
import io.dropwizard.util.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.alninja.billing.core.Normalization.containsNormalized;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Persists a request's billing decisions after its response has been built.
 * <p>
 * Writebacks run on a dedicated pool so they never delay a response.  Each piece of work is attempted independently:
 * a failure is logged and counted, and the remaining writebacks of the request still run.
 */
public class WritebackService {
    private static final Logger _log = LoggerFactory.getLogger(WritebackService.class);

    private final BillingWritebacks _writebacks;
    private final boolean _privateBackend;
    private final ListeningExecutorService _executor;
    private final Set<ListenableFuture<?>> _pending = ConcurrentHashMap.newKeySet();
    private final Meter _failures;

    @Inject
    public WritebackService(BillingWritebacks writebacks, BillingConfiguration configuration,
                            LifeCycleRegistry lifeCycle, MetricRegistry metricRegistry) {
        _writebacks = checkNotNull(writebacks, "writebacks");
        _privateBackend = configuration.isPrivateBackend();
        _executor = defaultWritebackExecutor(configuration.getWritebackThreads(), lifeCycle);
        _failures = metricRegistry.meter(MetricRegistry.name("alninja.billing", "WritebackService", "failures"));
    }

    private static ListeningExecutorService defaultWritebackExecutor(int threads, LifeCycleRegistry lifeCycle) {
        String nameFormat = "billing-writeback-%d";
        ListeningExecutorService executor = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build()));
        lifeCycle.manage(new ExecutorServiceManager(executor, Duration.seconds(5), nameFormat));
        return executor;
    }

    /**
     * Schedules the writebacks of a request.  Requests without a decision context have nothing to write.  Once the
     * pool has been shut down the writebacks are dropped and counted as a failure, and the returned future fails.
     */
    public ListenableFuture<?> submit(BillingRequest request, BillingEndpoint endpoint) {
        BillingContext context = request.getContext();
        if (_privateBackend || context == null) {
            return Futures.immediateFuture(null);
        }
        NinjaHeaders headers = request.getHeaders();
        ListenableFuture<?> future;
        try {
            future = _executor.submit(() -> perform(context, headers, endpoint));
        } catch (RejectedExecutionException e) {
            _failures.mark();
            _log.warn("Dropping billing writebacks of endpoint {}, the writeback pool is shut down", endpoint.getMoniker(), e);
            return Futures.immediateFailedFuture(e);
        }
        _pending.add(future);
        future.addListener(() -> _pending.remove(future), MoreExecutors.directExecutor());
        return future;
    }

    /**
     * Waits until every writeback submitted so far, and any submitted while waiting, has finished.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            List<ListenableFuture<?>> pending = ImmutableList.copyOf(_pending);
            if (pending.isEmpty()) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                Futures.successfulAsList(pending).get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                // successfulAsList() substitutes null for failures so this is not expected
                throw new IllegalStateException(e.getCause());
            }
        }
    }

    void perform(BillingContext context, NinjaHeaders headers, BillingEndpoint endpoint) {
        AppInfo app = context.getApp();
        Organization organization = context.getOrganization();
        String gitEmail = headers.getGitUserEmail();

        if (app != null && context.hasIntent(WritebackIntent.NEW_ORPHAN)) {
            attempt("register app " + app.getId(), () -> _writebacks.writeBackNewOrphan(app));
        }
        if (app != null && organization != null && context.hasIntent(WritebackIntent.CLAIMED)) {
            attempt("claim app " + app.getId(), () -> _writebacks.writeBackClaimedApp(app, organization));
        }
        if (app != null && context.hasIntent(WritebackIntent.FORCE_ORPHAN)) {
            attempt("orphan app " + app.getId(), () -> _writebacks.writeBackForceOrphanedApp(app));
        }
        if (organization == null || gitEmail == null) {
            return;
        }

        if (context.getUserUpdate() != null) {
            attempt("update user " + gitEmail, () ->
                    _writebacks.writeBackUserUpdate(organization.getId(), gitEmail, context.getUserUpdate()));
        }
        attempt("record first use by " + gitEmail, () ->
                _writebacks.updateFirstSeenTimestamp(organization.getId(), gitEmail));

        if (app == null) {
            return;
        }
        if (context.isLogUnknownUser()) {
            attempt("log unknown user " + gitEmail, () ->
                    _writebacks.logUnknownUser(organization.getId(), gitEmail, app.getId()));
        }
        if (endpoint.has(Capability.USAGE_LOGGING) && !context.isDenied()
                && !containsNormalized(organization.getDeniedUsers(), gitEmail)) {
            attempt("log usage of " + endpoint.getMoniker(), () ->
                    _writebacks.logActivity(organization.getId(), app.getId(), gitEmail, endpoint.getMoniker()));

            String customerId = organization.getStripeCustomerId();
            if (organization.getPlan() == SubscriptionTier.PAY_AS_YOU_GO && !Strings.isNullOrEmpty(customerId)) {
                attempt("meter usage of app " + app.getId(), () -> _writebacks.updateBillingLog(
                        organization.getId(), app.getId(), app.getPublisher(), gitEmail, customerId));
            }
        }
    }

    private void attempt(String description, Runnable writeback) {
        try {
            writeback.run();
        } catch (RuntimeException e) {
            _failures.mark();
            _log.error("Billing writeback failed: {}", description, e);
        }
    }
}
