package org.qubership.cloud.solrbackup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.qubership.cloud.solrbackup.rest.SolrCollectionsRestClient;
import org.qubership.cloud.solrbackup.rest.SolrResponseExceptionMapper;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Resolves a SolrCloud reference to the API of that cloud. Clients are created once per cloud.
 */
@Slf4j
@ApplicationScoped
public class SolrClusterApiProvider {
    private final String urlTemplate;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Map<String, SolrClusterApi> clients = new ConcurrentHashMap<>();

    @Inject
    public SolrClusterApiProvider(@ConfigProperty(name = "solr-backup.solr-cloud.url-template") String urlTemplate,
                                  @ConfigProperty(name = "solr-backup.solr-cloud.connect-timeout", defaultValue = "10S") Duration connectTimeout,
                                  @ConfigProperty(name = "solr-backup.solr-cloud.read-timeout", defaultValue = "60S") Duration readTimeout) {
        this.urlTemplate = urlTemplate;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    public SolrClusterApi forCloud(String solrCloud) {
        return clients.computeIfAbsent(solrCloud, this::createClient);
    }

    String addressOf(String solrCloud) {
        return String.format(urlTemplate, solrCloud);
    }

    protected SolrClusterApi createClient(String solrCloud) {
        String address = addressOf(solrCloud);
        log.info("Create Solr admin client for SolrCloud {} at {}", solrCloud, address);
        SolrCollectionsRestClient restClient = RestClientBuilder.newBuilder().baseUri(URI.create(address))
                .register(new SolrResponseExceptionMapper())
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build(SolrCollectionsRestClient.class);
        return new SolrCollectionsApiClient(solrCloud, restClient);
    }
}
