package com.alninja.billing.claim;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of looking for organizations that may claim an app.  {@link #isPublisherMatched()} distinguishes "no
 * organization knows this publisher" from "some do, but the user qualifies for none of them".
 */
public final class ClaimEvaluation {
    private static final ClaimEvaluation NO_PUBLISHER_MATCH = new ClaimEvaluation(false, ImmutableList.of());

    private final boolean _publisherMatched;
    private final List<ClaimCandidate> _candidates;

    private ClaimEvaluation(boolean publisherMatched, List<ClaimCandidate> candidates) {
        _publisherMatched = publisherMatched;
        _candidates = ImmutableList.copyOf(candidates);
    }

    static ClaimEvaluation noPublisherMatch() {
        return NO_PUBLISHER_MATCH;
    }

    static ClaimEvaluation publisherMatched(List<ClaimCandidate> candidates) {
        return new ClaimEvaluation(true, candidates);
    }

    public boolean isPublisherMatched() {
        return _publisherMatched;
    }

    /** Candidates in the order the organizations were supplied. */
    public List<ClaimCandidate> getCandidates() {
        return _candidates;
    }

    /** A claim can go ahead only when exactly one organization qualifies. */
    public boolean isUnambiguous() {
        return _candidates.size() == 1;
    }

    /** True when the publisher is known but the claim cannot be completed automatically. */
    public boolean hasClaimIssue() {
        return _publisherMatched && _candidates.size() != 1;
    }
}
