package com.alninja.billing.web.jersey;

import com.alninja.billing.api.UpgradeRequiredException;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

/**
 * Upgrade Required has no constant in {@link Response.Status}.
 */
@Provider
public class UpgradeRequiredExceptionMapper implements ExceptionMapper<UpgradeRequiredException> {
    public static final int UPGRADE_REQUIRED = 426;

    @Override
    public Response toResponse(UpgradeRequiredException e) {
        return Response.status(UPGRADE_REQUIRED)
                .type(MediaType.TEXT_PLAIN_TYPE)
                .entity(e.getMessage())
                .build();
    }
}
