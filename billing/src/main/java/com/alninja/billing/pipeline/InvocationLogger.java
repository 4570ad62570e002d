package com.alninja.billing.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs one line per invocation of an endpoint that asks for it.
 */
public class InvocationLogger {
    private static final Logger _log = LoggerFactory.getLogger(InvocationLogger.class);

    public void log(BillingRequest request, BillingEndpoint endpoint, int status) {
        if (!endpoint.has(Capability.LOGGING)) {
            return;
        }
        NinjaHeaders headers = request.getHeaders();
        BillingContext context = request.getContext();
        _log.info("{} app={} publisher={} email={} branch={} version={} organization={} status={}",
                endpoint.getMoniker(), headers.getAppId(), headers.getAppPublisher(), headers.getGitUserEmail(),
                headers.getGitBranch(), headers.getNinjaVersion(),
                context != null && context.getOrganization() != null ? context.getOrganization().getId() : null,
                status);
    }
}
