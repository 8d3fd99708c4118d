package org.qubership.cloud.solrbackup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;

import static jakarta.ws.rs.core.Response.Status.BAD_GATEWAY;
import static org.qubership.cloud.solrbackup.controller.error.Utils.buildDefaultResponse;

@Provider
public class SolrApiExceptionMapper implements ExceptionMapper<SolrApiException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(SolrApiException e) {
        return buildDefaultResponse(uriInfo, e, BAD_GATEWAY);
    }
}
