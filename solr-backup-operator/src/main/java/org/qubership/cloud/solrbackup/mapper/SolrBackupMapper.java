package org.qubership.cloud.solrbackup.mapper;

import org.mapstruct.Mapper;
import org.mapstruct.MappingConstants;
import org.qubership.cloud.solrbackup.dto.v1.SolrBackupRequest;
import org.qubership.cloud.solrbackup.dto.v1.SolrBackupResponse;
import org.qubership.cloud.solrbackup.entity.SolrBackup;
import org.qubership.cloud.solrbackup.entity.SolrBackupSpec;

import java.util.List;

@Mapper(componentModel = MappingConstants.ComponentModel.JAKARTA_CDI)
public interface SolrBackupMapper {

    SolrBackupSpec toSpec(SolrBackupRequest request);

    SolrBackupResponse toResponse(SolrBackup solrBackup);

    List<SolrBackupResponse> toResponses(List<SolrBackup> solrBackups);
}
