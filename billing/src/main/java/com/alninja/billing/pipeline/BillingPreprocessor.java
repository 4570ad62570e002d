package com.alninja.billing.pipeline;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.BillingClientException;
import com.alninja.billing.cache.EntityCache;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs the billing stages in order ahead of the endpoint handler: bind, claim, block, dunning and, for endpoints
 * requiring security, permission and enforcement.
 * <p>
 * Billing fails open.  Client errors such as a denied permission propagate to the caller unchanged.  Any other
 * failure is recorded to the fault log, the request's decision context is discarded and the request proceeds as if
 * billing did not apply.
 */
public class BillingPreprocessor {
    private static final Logger _log = LoggerFactory.getLogger(BillingPreprocessor.class);

    private final boolean _privateBackend;
    private final EntityCache _cache;
    private final BindingStage _binding;
    private final ClaimingStage _claiming;
    private final BlockingStage _blocking;
    private final DunningStage _dunning;
    private final PermissionStage _permission;
    private final FaultLog _faultLog;
    private final Meter _faults;

    @Inject
    public BillingPreprocessor(BillingConfiguration configuration, EntityCache cache,
                               BindingStage binding, ClaimingStage claiming, BlockingStage blocking,
                               DunningStage dunning, PermissionStage permission, FaultLog faultLog,
                               MetricRegistry metricRegistry) {
        _privateBackend = configuration.isPrivateBackend();
        _cache = checkNotNull(cache, "cache");
        _binding = checkNotNull(binding, "binding");
        _claiming = checkNotNull(claiming, "claiming");
        _blocking = checkNotNull(blocking, "blocking");
        _dunning = checkNotNull(dunning, "dunning");
        _permission = checkNotNull(permission, "permission");
        _faultLog = checkNotNull(faultLog, "faultLog");
        _faults = metricRegistry.meter(MetricRegistry.name("alninja.billing", "BillingPreprocessor", "faults"));
    }

    /**
     * @throws BillingClientException if the request must be rejected
     */
    public void preprocess(BillingRequest request, BillingEndpoint endpoint) {
        if (_privateBackend || !endpoint.has(Capability.BILLING)) {
            return;
        }

        NinjaHeaders headers = request.getHeaders();
        boolean security = endpoint.has(Capability.SECURITY);
        try {
            if (security) {
                _cache.invalidateAll();
            }

            BillingContext context = request.createContext();
            _binding.apply(headers, context);
            _claiming.apply(headers, context);
            _blocking.apply(context);
            _dunning.apply(request, context);

            if (security) {
                _permission.apply(headers, context);
                _permission.enforce(context);
            }
        } catch (BillingClientException e) {
            throw e;
        } catch (RuntimeException e) {
            _faults.mark();
            _log.warn("Billing failed for endpoint {} and app {}, continuing without billing",
                    endpoint.getMoniker(), headers.getAppId(), e);
            _faultLog.record(e);
            request.discardContext();
        }
    }
}
