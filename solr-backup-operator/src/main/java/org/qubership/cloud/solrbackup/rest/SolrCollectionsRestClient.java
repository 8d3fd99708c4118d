package org.qubership.cloud.solrbackup.rest;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import io.quarkus.rest.client.reactive.ClientQueryParam;
import org.qubership.cloud.solrbackup.dto.solr.SolrAsyncResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrCollectionListResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrListBackupResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrRequestStatusResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrSystemInfoResponse;

@Path("/solr/admin")
@Produces(MediaType.APPLICATION_JSON)
public interface SolrCollectionsRestClient extends AutoCloseable {

    @GET
    @Path("/collections")
    @ClientQueryParam(name = "action", value = "BACKUP")
    @ClientQueryParam(name = "incremental", value = "true")
    SolrAsyncResponse backup(@QueryParam("collection") String collection,
                             @QueryParam("name") String name,
                             @QueryParam("repository") String repository,
                             @QueryParam("location") String location,
                             @QueryParam("async") String async);

    @GET
    @Path("/collections")
    @ClientQueryParam(name = "action", value = "REQUESTSTATUS")
    SolrRequestStatusResponse requestStatus(@QueryParam("requestid") String requestId);

    @GET
    @Path("/collections")
    @ClientQueryParam(name = "action", value = "DELETESTATUS")
    SolrResponse deleteStatus(@QueryParam("requestid") String requestId);

    @GET
    @Path("/collections")
    @ClientQueryParam(name = "action", value = "LISTBACKUP")
    SolrListBackupResponse listBackup(@QueryParam("name") String name,
                                      @QueryParam("repository") String repository,
                                      @QueryParam("location") String location);

    @GET
    @Path("/collections")
    @ClientQueryParam(name = "action", value = "DELETEBACKUP")
    SolrResponse deleteBackup(@QueryParam("name") String name,
                              @QueryParam("repository") String repository,
                              @QueryParam("location") String location,
                              @QueryParam("backupId") int backupId);

    @GET
    @Path("/collections")
    @ClientQueryParam(name = "action", value = "LIST")
    SolrCollectionListResponse listCollections();

    @GET
    @Path("/info/system")
    SolrSystemInfoResponse systemInfo();
}
