package org.qubership.cloud.solrbackup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.qubership.cloud.solrbackup.exceptions.RequestValidationException;

import static jakarta.ws.rs.core.Response.Status.BAD_REQUEST;
import static org.qubership.cloud.solrbackup.controller.error.Utils.buildDefaultResponse;

@Provider
public class RequestValidationExceptionMapper implements ExceptionMapper<RequestValidationException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(RequestValidationException e) {
        return buildDefaultResponse(uriInfo, e, BAD_REQUEST);
    }
}
