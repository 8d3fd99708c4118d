package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * @deprecated unused
 */
@Deprecated
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VolumePersistenceSource {
    private Map<String, Object> source;
    private String path;
    private String filename;
}
