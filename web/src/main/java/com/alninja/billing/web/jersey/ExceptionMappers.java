package com.alninja.billing.web.jersey;

import com.alninja.billing.api.AppIdRequiredException;
import com.alninja.billing.api.BillingClientException;
import com.alninja.billing.api.PermissionDeniedException;
import com.alninja.billing.api.UpgradeRequiredException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import java.util.Map;

public class ExceptionMappers {
    private static final Map<Class<? extends BillingClientException>, ExceptionMapper<? extends BillingClientException>> MAPPERS =
            ImmutableMap.<Class<? extends BillingClientException>, ExceptionMapper<? extends BillingClientException>>of(
                    PermissionDeniedException.class, new PermissionDeniedExceptionMapper(),
                    AppIdRequiredException.class, new AppIdRequiredExceptionMapper(),
                    UpgradeRequiredException.class, new UpgradeRequiredExceptionMapper());

    public static Iterable<Object> getMappers() {
        return ImmutableList.<Object>copyOf(MAPPERS.values());
    }

    /**
     * Maps a client error the way the registered providers would, or returns null if no mapper handles it.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public static Response toResponse(BillingClientException e) {
        for (Class<?> type = e.getClass(); BillingClientException.class.isAssignableFrom(type); type = type.getSuperclass()) {
            ExceptionMapper<BillingClientException> mapper = (ExceptionMapper<BillingClientException>) MAPPERS.get(type);
            if (mapper != null) {
                return mapper.toResponse(e);
            }
        }
        return null;
    }
}
