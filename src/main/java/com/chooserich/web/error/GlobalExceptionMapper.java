package com.chooserich.web.error;

import com.chooserich.service.ErrorKind;
import com.chooserich.service.GameException;
import com.chooserich.web.model.ErrorResponse;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Exception exception) {
        if (exception instanceof GameException gameException) {
            return toResponse(gameException);
        }

        if (exception instanceof WebApplicationException webAppException) {
            int status = webAppException.getResponse().getStatus();
            return Response.status(status).entity(new ErrorResponse(webAppException.getMessage())).build();
        }

        if (exception instanceof ParseException) {
            return Response.status(Response.Status.UNAUTHORIZED)
                    .entity(new ErrorResponse("Invalid or expired token"))
                    .build();
        }

        LOG.error("Internal Server Error", exception);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(new ErrorResponse("Internal Server Error", ErrorKind.INTERNAL_ERROR.name()))
                .build();
    }

    private Response toResponse(GameException exception) {
        ErrorKind kind = exception.getKind();
        String message = exception.getMessage();
        if (kind == ErrorKind.INTERNAL_ERROR) {
            // ledger and store details stay in the log
            LOG.error("Game operation failed", exception);
            message = "Internal Server Error";
        }
        return Response.status(statusOf(kind)).entity(new ErrorResponse(message, kind.name())).build();
    }

    static int statusOf(ErrorKind kind) {
        switch (kind) {
            case INVALID_CONFIGURATION:
            case INVALID_MOVE:
                return 400;
            case INSUFFICIENT_FUNDS:
                return 402;
            case UNAUTHORIZED:
                return 403;
            case NOT_ACTIVE:
            case CONFLICT:
                return 409;
            default:
                return 500;
        }
    }
}
