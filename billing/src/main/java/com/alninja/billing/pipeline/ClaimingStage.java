package com.alninja.billing.pipeline;

import com.alninja.billing.api.AppInfo;
import com.alninja.billing.cache.EntityCache;
import com.alninja.billing.claim.ClaimEvaluation;
import com.alninja.billing.claim.ClaimEvaluator;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.alninja.billing.core.Normalization.isBlank;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lets an organization claim an unowned app published under one of its publisher names.
 */
public class ClaimingStage {
    private static final Logger _log = LoggerFactory.getLogger(ClaimingStage.class);

    private final EntityCache _cache;
    private final ClaimEvaluator _evaluator;

    @Inject
    public ClaimingStage(EntityCache cache, ClaimEvaluator evaluator) {
        _cache = checkNotNull(cache, "cache");
        _evaluator = checkNotNull(evaluator, "evaluator");
    }

    public void apply(NinjaHeaders headers, BillingContext context) {
        AppInfo app = context.getApp();
        if (app == null || app.hasOwner() || isBlank(headers.getAppPublisher())) {
            return;
        }

        ClaimEvaluation evaluation = _evaluator.evaluate(
                headers.getAppPublisher(), headers.getGitUserEmail(), _cache.getOrganizations());
        if (evaluation.hasClaimIssue()) {
            _log.debug("App {} of publisher {} cannot be claimed automatically, {} candidates",
                    app.getId(), headers.getAppPublisher(), evaluation.getCandidates().size());
            context.flagClaimIssue();
        } else if (evaluation.isUnambiguous()) {
            context.claim(evaluation.getCandidates().get(0).getOrganization());
        }
    }
}
