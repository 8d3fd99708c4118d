package org.qubership.cloud.solrbackup.rest;

import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;

public class SolrResponseExceptionMapper implements ResponseExceptionMapper<SolrApiException> {

    @Override
    public SolrApiException toThrowable(Response response) {
        String errorMsg = response.hasEntity() ? response.readEntity(String.class) : response.getStatusInfo().getReasonPhrase();
        return new SolrApiException("admin", response.getStatus(), errorMsg, null);
    }
}
