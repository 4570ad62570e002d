package com.alninja.billing.web.jersey;

import com.alninja.billing.api.PermissionDeniedException;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

@Provider
public class PermissionDeniedExceptionMapper implements ExceptionMapper<PermissionDeniedException> {
    @Override
    public Response toResponse(PermissionDeniedException e) {
        return Response.status(Response.Status.FORBIDDEN)
                .entity(e)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .build();
    }
}
