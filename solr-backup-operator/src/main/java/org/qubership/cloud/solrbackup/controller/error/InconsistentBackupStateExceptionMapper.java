package org.qubership.cloud.solrbackup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.qubership.cloud.solrbackup.exceptions.InconsistentBackupStateException;

import static jakarta.ws.rs.core.Response.Status.CONFLICT;
import static org.qubership.cloud.solrbackup.controller.error.Utils.buildDefaultResponse;

@Provider
public class InconsistentBackupStateExceptionMapper implements ExceptionMapper<InconsistentBackupStateException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(InconsistentBackupStateException e) {
        return buildDefaultResponse(uriInfo, e, CONFLICT);
    }
}
