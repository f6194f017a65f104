package com.libragraph.filestore.api;

import com.libragraph.filestore.api.dto.ErrorResponse;
import com.libragraph.filestore.core.access.FileUnavailableException;
import com.libragraph.filestore.core.catalog.CatalogException;
import com.libragraph.filestore.core.delete.DeletionException;
import com.libragraph.filestore.core.storage.StorageException;
import com.libragraph.filestore.core.upload.PayloadValidationException;
import com.libragraph.filestore.core.upload.UploadException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps domain failures to HTTP statuses with a JSON {@code {"error": "..."}} body.
 * Server-side failures are logged here and reported with a fixed message.
 */
public class ExceptionMappers {

    private static final Logger log = Logger.getLogger(ExceptionMappers.class);

    @ServerExceptionMapper
    public Response invalidRequest(InvalidRequestException e) {
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    @ServerExceptionMapper
    public Response invalidPayload(PayloadValidationException e) {
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    @ServerExceptionMapper
    public Response notAuthenticated(NotAuthenticatedException e) {
        return error(Response.Status.UNAUTHORIZED, e.getMessage());
    }

    @ServerExceptionMapper
    public Response unavailable(FileUnavailableException e) {
        log.debugf("Refusing %s: %s", e.storageName(), e.reason());
        return error(Response.Status.NOT_FOUND, FileUnavailableException.MESSAGE);
    }

    @ServerExceptionMapper
    public Response uploadFailed(UploadException e) {
        log.errorf(e, "Error uploading files");
        return error(Response.Status.INTERNAL_SERVER_ERROR, "Error Uploading Files");
    }

    @ServerExceptionMapper
    public Response deletionFailed(DeletionException e) {
        log.errorf(e, "Error deleting files");
        return error(Response.Status.INTERNAL_SERVER_ERROR, "Error Deleting Files");
    }

    @ServerExceptionMapper
    public Response catalogFailed(CatalogException e) {
        log.errorf(e, "Catalog failure");
        return error(Response.Status.INTERNAL_SERVER_ERROR, "Internal Server Error");
    }

    @ServerExceptionMapper
    public Response storageFailed(StorageException e) {
        log.errorf(e, "Blob store failure");
        return error(Response.Status.INTERNAL_SERVER_ERROR, "Internal Server Error");
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message))
                .build();
    }
}
