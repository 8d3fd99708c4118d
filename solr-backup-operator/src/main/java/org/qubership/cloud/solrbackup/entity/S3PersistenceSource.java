package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @deprecated unused
 */
@Deprecated
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class S3PersistenceSource {
    private String endpointUrl;
    private String region;
    private String bucket;
    private String key;
    private Integer retries;
}
