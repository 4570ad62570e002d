package com.alninja.billing.claim;

import com.alninja.billing.api.Organization;
import com.google.common.collect.Lists;

import javax.annotation.Nullable;
import java.util.List;

import static com.alninja.billing.core.Normalization.containsNormalized;
import static com.alninja.billing.core.Normalization.domain;
import static com.alninja.billing.core.Normalization.normalize;

/**
 * Decides which organizations may take ownership of an unowned app.  An organization qualifies when it lists the
 * app's publisher and either lists the user's email or one of its domains matches the email's domain.  The user
 * match is checked first, so an organization qualifying both ways reports {@link ClaimCandidate.MatchType#USER}.
 * <p>
 * Stateless; the outcome depends only on the arguments.
 */
public class ClaimEvaluator {

    public ClaimEvaluation evaluate(@Nullable String publisher, @Nullable String email, List<Organization> organizations) {
        String normalizedEmail = normalize(email);
        String emailDomain = domain(email);

        List<Organization> publishedBy = Lists.newArrayList();
        for (Organization organization : organizations) {
            if (containsNormalized(organization.getPublishers(), publisher)) {
                publishedBy.add(organization);
            }
        }
        if (publishedBy.isEmpty()) {
            return ClaimEvaluation.noPublisherMatch();
        }

        List<ClaimCandidate> candidates = Lists.newArrayList();
        for (Organization organization : publishedBy) {
            if (!normalizedEmail.isEmpty() && containsNormalized(organization.getUsers(), normalizedEmail)) {
                candidates.add(new ClaimCandidate(organization, ClaimCandidate.MatchType.USER));
            } else if (!emailDomain.isEmpty() && containsNormalized(organization.getDomains(), emailDomain)) {
                candidates.add(new ClaimCandidate(organization, ClaimCandidate.MatchType.DOMAIN));
            }
        }
        return ClaimEvaluation.publisherMatched(candidates);
    }
}
