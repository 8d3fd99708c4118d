package org.qubership.cloud.solrbackup.controller.error;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import lombok.extern.slf4j.Slf4j;
import org.qubership.cloud.solrbackup.dto.v1.ErrorResponse;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupErrorCodes;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupException;

@Slf4j
public final class Utils {

    private Utils() {
    }

    public static Response buildDefaultResponse(UriInfo uriInfo, SolrBackupException e, Response.Status status) {
        return buildResponse(uriInfo, e.getErrorCode(), e.getMessage(), status);
    }

    public static Response buildResponse(UriInfo uriInfo, SolrBackupErrorCodes errorCode, String message, Response.Status status) {
        String path = uriInfo != null ? uriInfo.getPath() : null;
        log.warn("Request to {} failed with {}: {}", path, errorCode.getCode(), message);
        ErrorResponse body = ErrorResponse.builder()
                .code(errorCode.getCode())
                .reason(errorCode.getTitle())
                .message(message)
                .status(status.getStatusCode())
                .build();
        return Response.status(status).type(MediaType.APPLICATION_JSON_TYPE).entity(body).build();
    }
}
