package com.alninja.billing.pipeline;

import com.alninja.billing.BillingConfiguration;
import com.alninja.billing.api.PermissionWarning;
import com.alninja.billing.common.json.JsonHelper;
import com.alninja.billing.permission.PermissionResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;

import javax.annotation.Nullable;
import java.time.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decorates a successful response with the permission warning, if any, and the claim issue header.
 * <p>
 * The warning is added as a {@code warning} field of an object body, or becomes the whole body when there is none.
 * Other bodies are returned unchanged.
 */
public class SuccessPostprocessor {
    private final boolean _privateBackend;
    private final PermissionResolver _resolver;
    private final Clock _clock;

    @Inject
    public SuccessPostprocessor(BillingConfiguration configuration, PermissionResolver resolver, Clock clock) {
        _privateBackend = configuration.isPrivateBackend();
        _resolver = checkNotNull(resolver, "resolver");
        _clock = checkNotNull(clock, "clock");
    }

    @Nullable
    public JsonNode postprocess(BillingRequest request, @Nullable JsonNode body) {
        BillingContext context = request.getContext();
        if (_privateBackend || context == null) {
            return body;
        }

        JsonNode result = body;
        PermissionWarning warning = _resolver.getPermissionWarning(context.getApp(), context.getPermission(), _clock.millis());
        if (warning != null) {
            result = addWarning(body, warning);
        }
        if (context.hasClaimIssue()) {
            request.setResponseHeader(BillingRequest.CLAIM_ISSUE_HEADER, "true");
        }
        return result;
    }

    private static JsonNode addWarning(@Nullable JsonNode body, PermissionWarning warning) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            ObjectNode object = JsonHelper.newObject();
            object.set("warning", JsonHelper.toTree(warning));
            return object;
        }
        if (body.isObject()) {
            ObjectNode object = ((ObjectNode) body).deepCopy();
            object.set("warning", JsonHelper.toTree(warning));
            return object;
        }
        return body;
    }
}
