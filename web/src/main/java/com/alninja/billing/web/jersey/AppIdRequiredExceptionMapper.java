package com.alninja.billing.web.jersey;

import com.alninja.billing.api.AppIdRequiredException;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

@Provider
public class AppIdRequiredExceptionMapper implements ExceptionMapper<AppIdRequiredException> {
    @Override
    public Response toResponse(AppIdRequiredException e) {
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.TEXT_PLAIN_TYPE)
                .entity(e.getMessage())
                .build();
    }
}
