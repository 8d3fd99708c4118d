package org.qubership.cloud.solrbackup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupException;

import static jakarta.ws.rs.core.Response.Status.INTERNAL_SERVER_ERROR;
import static org.qubership.cloud.solrbackup.controller.error.Utils.buildDefaultResponse;

@Provider
public class SolrBackupExceptionMapper implements ExceptionMapper<SolrBackupException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(SolrBackupException e) {
        return buildDefaultResponse(uriInfo, e, INTERNAL_SERVER_ERROR);
    }
}
