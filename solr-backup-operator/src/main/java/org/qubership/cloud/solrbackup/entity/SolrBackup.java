package org.qubership.cloud.solrbackup.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * A backup request: the desired state in {@link #spec} and the observed state in {@link #status}.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true)
@Entity(name = "solr_backup")
@Table(name = "solr_backup")
public class SolrBackup {

    @Id
    @NotNull
    private String name;

    @NotNull
    @Column(name = "creation_timestamp")
    private Instant creationTimestamp;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "spec", columnDefinition = "jsonb")
    private SolrBackupSpec spec;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "status", columnDefinition = "jsonb")
    private SolrBackupStatus status;
}
