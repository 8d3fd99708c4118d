package org.qubership.cloud.solrbackup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupNotFoundException;

import static jakarta.ws.rs.core.Response.Status.NOT_FOUND;
import static org.qubership.cloud.solrbackup.controller.error.Utils.buildDefaultResponse;

@Provider
public class SolrBackupNotFoundExceptionMapper implements ExceptionMapper<SolrBackupNotFoundException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(SolrBackupNotFoundException e) {
        return buildDefaultResponse(uriInfo, e, NOT_FOUND);
    }
}
