package com.aletheia.engine.api;

import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.TaskStateConflictException;
import com.aletheia.engine.core.error.ValidationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps the engine's exceptions to HTTP: 400 validation, 404 not found,
 * 409 conflicting task state, 500 anything else.
 */
@Provider
public class EngineExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger log = Logger.getLogger(EngineExceptionMapper.class);

    @Override
    public Response toResponse(RuntimeException e) {
        if (e instanceof WebApplicationException wae) {
            return wae.getResponse();
        }
        Response.Status status = statusFor(e);
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            log.errorf(e, "Unhandled error: %s", e.getMessage());
        } else {
            log.debugf("Request rejected (%d): %s", status.getStatusCode(), e.getMessage());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(codeFor(status), messageFor(e, status)))
                .build();
    }

    static Response.Status statusFor(Throwable e) {
        if (e instanceof NotFoundException) {
            return Response.Status.NOT_FOUND;
        }
        if (e instanceof TaskStateConflictException) {
            return Response.Status.CONFLICT;
        }
        if (e instanceof ValidationException || e instanceof IllegalArgumentException) {
            return Response.Status.BAD_REQUEST;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    static String codeFor(Response.Status status) {
        return switch (status) {
            case NOT_FOUND -> "not_found";
            case CONFLICT -> "conflict";
            case BAD_REQUEST -> "validation_error";
            default -> "internal_error";
        };
    }

    private static String messageFor(RuntimeException e, Response.Status status) {
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            return "Internal error";
        }
        return e.getMessage();
    }
}
