package org.qubership.cloud.solrbackup.dto.solr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolrSystemInfoResponse extends SolrResponse {
    private Lucene lucene;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Lucene {
        @JsonProperty("solr-spec-version")
        private String solrSpecVersion;
        @JsonProperty("lucene-spec-version")
        private String luceneSpecVersion;
    }
}
