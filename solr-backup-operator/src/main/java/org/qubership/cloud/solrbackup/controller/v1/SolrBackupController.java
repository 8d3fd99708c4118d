package org.qubership.cloud.solrbackup.controller.v1;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.qubership.cloud.solrbackup.dto.v1.ErrorResponse;
import org.qubership.cloud.solrbackup.dto.v1.SolrBackupRequest;
import org.qubership.cloud.solrbackup.dto.v1.SolrBackupResponse;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;
import org.qubership.cloud.solrbackup.mapper.SolrBackupMapper;
import org.qubership.cloud.solrbackup.service.SolrBackupService;

import static org.qubership.cloud.solrbackup.SolrBackupApiPath.SOLR_BACKUPS_PATH_V1;

@Slf4j
@Path(SOLR_BACKUPS_PATH_V1)
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Solr backups", description = "Recurring and one-shot backups of SolrCloud collections")
public class SolrBackupController {

    private final SolrBackupService solrBackupService;
    private final SolrBackupMapper mapper;

    @Inject
    public SolrBackupController(SolrBackupService solrBackupService, SolrBackupMapper mapper) {
        this.solrBackupService = solrBackupService;
        this.mapper = mapper;
    }

    @Operation(summary = "Create or update Solr backup",
            description = "Creates the backup request or replaces its desired state. The observed state is kept"
                    + " and the request is reconciled once before the response is returned.")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Backup request stored",
                    content = @Content(schema = @Schema(implementation = SolrBackupResponse.class))),
            @APIResponse(responseCode = "400", description = "The request or its schedule is invalid",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @APIResponse(responseCode = "500", description = "An unexpected error occurred on the server")
    })
    @Path("/{name}")
    @PUT
    @Consumes(MediaType.APPLICATION_JSON)
    public Response createOrUpdate(@Parameter(description = "Name of the backup request", required = true)
                                   @PathParam("name") String name,
                                   @RequestBody(description = "Desired state of the backup", required = true)
                                   @Valid @NotNull SolrBackupRequest request) {
        log.info("Received request to create or update Solr backup {}", name);
        return Response.ok(mapper.toResponse(solrBackupService.createOrUpdate(name, mapper.toSpec(request)))).build();
    }

    @Operation(summary = "Get Solr backup", description = "Returns the desired and observed state of the backup request")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Backup request found",
                    content = @Content(schema = @Schema(implementation = SolrBackupResponse.class))),
            @APIResponse(responseCode = "404", description = "The requested resource could not be found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @Path("/{name}")
    @GET
    public Response get(@Parameter(description = "Name of the backup request", required = true)
                        @PathParam("name") String name) {
        return Response.ok(mapper.toResponse(solrBackupService.get(name))).build();
    }

    @Operation(summary = "List Solr backups")
    @APIResponse(responseCode = "200", description = "All backup requests",
            content = @Content(schema = @Schema(implementation = SolrBackupResponse.class)))
    @GET
    public Response list() {
        return Response.ok(mapper.toResponses(solrBackupService.list())).build();
    }

    @Operation(summary = "Get Solr backup status", description = "Returns the current run, the history and the next scheduled time")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Status of the backup request",
                    content = @Content(schema = @Schema(implementation = SolrBackupStatus.class))),
            @APIResponse(responseCode = "404", description = "The requested resource could not be found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @Path("/{name}/status")
    @GET
    public Response getStatus(@Parameter(description = "Name of the backup request", required = true)
                              @PathParam("name") String name) {
        SolrBackupStatus status = solrBackupService.get(name).getStatus();
        return Response.ok(status != null ? status : new SolrBackupStatus()).build();
    }

    @Operation(summary = "Reconcile Solr backup", description = "Runs one reconciliation pass immediately")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Status after the pass",
                    content = @Content(schema = @Schema(implementation = SolrBackupStatus.class))),
            @APIResponse(responseCode = "404", description = "The requested resource could not be found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @Path("/{name}/reconcile")
    @POST
    public Response reconcile(@Parameter(description = "Name of the backup request", required = true)
                              @PathParam("name") String name) {
        return Response.ok(solrBackupService.reconcile(name)).build();
    }

    @Operation(summary = "Delete Solr backup", description = "Deletes the backup request, stored backups are kept in the repository")
    @APIResponses({
            @APIResponse(responseCode = "204", description = "Backup request deleted"),
            @APIResponse(responseCode = "404", description = "The requested resource could not be found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @Path("/{name}")
    @DELETE
    public Response delete(@Parameter(description = "Name of the backup request", required = true)
                           @PathParam("name") String name) {
        solrBackupService.delete(name);
        return Response.noContent().build();
    }
}
