package com.alninja.billing.web;

import com.alninja.billing.api.BillingClientException;
import com.alninja.billing.pipeline.BillingEndpoint;
import com.alninja.billing.pipeline.BillingPreprocessor;
import com.alninja.billing.pipeline.BillingRequest;
import com.alninja.billing.pipeline.InvocationLogger;
import com.alninja.billing.pipeline.NinjaHeaders;
import com.alninja.billing.pipeline.SuccessPostprocessor;
import com.alninja.billing.web.headers.NinjaHeaderParser;
import com.alninja.billing.web.headers.VersionCheck;
import com.alninja.billing.web.jersey.ExceptionMappers;
import com.alninja.billing.writeback.WritebackService;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs an endpoint inside the billing pipeline: header parsing, the version guard, billing preprocessing, the
 * endpoint itself and success post-processing.  Whatever happened, the request's writebacks are scheduled
 * afterwards.
 * <p>
 * Client errors become the responses their exception mappers produce.  Any other failure becomes a 500.
 */
public class BillingRequestHandler {
    private static final Logger _log = LoggerFactory.getLogger(BillingRequestHandler.class);

    private final NinjaHeaderParser _headerParser;
    private final VersionCheck _versionCheck;
    private final BillingPreprocessor _preprocessor;
    private final SuccessPostprocessor _postprocessor;
    private final WritebackService _writebackService;
    private final InvocationLogger _invocationLogger;

    @Inject
    public BillingRequestHandler(NinjaHeaderParser headerParser, VersionCheck versionCheck,
                                 BillingPreprocessor preprocessor, SuccessPostprocessor postprocessor,
                                 WritebackService writebackService, InvocationLogger invocationLogger) {
        _headerParser = checkNotNull(headerParser, "headerParser");
        _versionCheck = checkNotNull(versionCheck, "versionCheck");
        _preprocessor = checkNotNull(preprocessor, "preprocessor");
        _postprocessor = checkNotNull(postprocessor, "postprocessor");
        _writebackService = checkNotNull(writebackService, "writebackService");
        _invocationLogger = checkNotNull(invocationLogger, "invocationLogger");
    }

    public BillingInvocation handle(HttpHeaders httpHeaders, BillingEndpoint endpoint, EndpointHandler handler) {
        checkNotNull(endpoint, "endpoint");
        checkNotNull(handler, "handler");

        BillingRequest request = null;
        Response response = null;
        ListenableFuture<?> writebacks = Futures.immediateFuture(null);
        try {
            NinjaHeaders headers = _headerParser.parse(httpHeaders);
            request = new BillingRequest(headers);
            _versionCheck.check(headers.getNinjaVersion());
            _preprocessor.preprocess(request, endpoint);

            JsonNode body = _postprocessor.postprocess(request, handler.handle(request));
            response = ok(request, body);
        } catch (BillingClientException e) {
            response = clientError(e);
        } catch (RuntimeException e) {
            _log.error("Unexpected error in endpoint {}", endpoint.getMoniker(), e);
            response = Response.serverError()
                    .type(MediaType.TEXT_PLAIN_TYPE)
                    .entity(MoreObjects.firstNonNull(e.getMessage(), "Internal server error"))
                    .build();
        } finally {
            if (request != null) {
                writebacks = _writebackService.submit(request, endpoint);
            }
        }

        if (request != null) {
            _invocationLogger.log(request, endpoint, response.getStatus());
        }
        return new BillingInvocation(response, writebacks);
    }

    private static Response ok(BillingRequest request, JsonNode body) {
        Response.ResponseBuilder builder = Response.ok();
        if (body != null) {
            builder.entity(body).type(MediaType.APPLICATION_JSON_TYPE);
        }
        for (Map.Entry<String, String> header : request.getResponseHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static Response clientError(BillingClientException e) {
        Response response = ExceptionMappers.toResponse(e);
        if (response != null) {
            return response;
        }
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.TEXT_PLAIN_TYPE)
                .entity(MoreObjects.firstNonNull(e.getMessage(), e.getClass().getSimpleName()))
                .build();
    }
}
