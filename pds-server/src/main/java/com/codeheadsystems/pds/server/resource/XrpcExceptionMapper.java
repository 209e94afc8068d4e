package com.codeheadsystems.pds.server.resource;

import com.codeheadsystems.pds.model.XrpcError;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders failures as XRPC error bodies.
 * <p>
 * {@link RegistrationException} becomes HTTP 400 with its XRPC error name and message.
 * {@link WebApplicationException} keeps its status and headers. Anything else is an internal fault:
 * it is logged and the caller only sees {@code InternalServerError}.
 */
@Provider
public class XrpcExceptionMapper implements ExceptionMapper<RuntimeException> {

  private static final Logger log = LoggerFactory.getLogger(XrpcExceptionMapper.class);

  @Override
  public Response toResponse(final RuntimeException exception) {
    if (exception instanceof RegistrationException registration) {
      return xrpc(Response.status(Response.Status.BAD_REQUEST),
          new XrpcError(registration.getError().xrpcName(), registration.getMessage()));
    }
    if (exception instanceof WebApplicationException web) {
      final int status = web.getResponse().getStatus();
      final String error;
      if (status == Response.Status.UNAUTHORIZED.getStatusCode()) {
        error = "AuthenticationRequired";
      } else if (status >= Response.Status.INTERNAL_SERVER_ERROR.getStatusCode()) {
        error = "InternalServerError";
      } else {
        error = "InvalidRequest";
      }
      final Response.ResponseBuilder builder = Response.status(status);
      // the body is replaced, so its content headers are not carried over
      web.getResponse().getHeaders().forEach((name, values) -> {
        if (!HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name) && !HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
          values.forEach(value -> builder.header(name, value));
        }
      });
      return xrpc(builder, new XrpcError(error, web.getMessage()));
    }
    log.error("Unhandled failure: {}", exception.getMessage(), exception);
    return xrpc(Response.status(Response.Status.INTERNAL_SERVER_ERROR),
        new XrpcError("InternalServerError", "Internal Server Error"));
  }

  private static Response xrpc(final Response.ResponseBuilder builder, final XrpcError body) {
    return builder
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(body)
        .build();
  }
}
