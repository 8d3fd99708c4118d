package org.qubership.cloud.solrbackup.controller.error;

import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupErrorCodes;

import java.util.stream.Collectors;

import static org.qubership.cloud.solrbackup.controller.error.Utils.buildResponse;

@Provider
public class ConstraintViolationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        String detail = exception.getConstraintViolations().stream()
                .map(v -> {
                    String fieldName = v.getPropertyPath().toString();
                    int dotIndex = fieldName.lastIndexOf('.');
                    if (dotIndex != -1) {
                        fieldName = fieldName.substring(dotIndex + 1);
                    }
                    return String.format("%s: %s", fieldName, v.getMessage());
                })
                .collect(Collectors.joining("; "));
        return buildResponse(uriInfo, SolrBackupErrorCodes.SOLR_BACKUP_4001, detail, Response.Status.BAD_REQUEST);
    }
}
