package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persistence of backup data to external storage. The feature is removed, any value is accepted and dropped.
 *
 * @deprecated unused
 */
@Deprecated
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersistenceSource {
    @JsonAlias("S3")
    private S3PersistenceSource s3;
    private VolumePersistenceSource volume;
}
