package org.qubership.cloud.solrbackup.repositories.pg.jpa;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.qubership.cloud.solrbackup.entity.SolrBackup;

import java.util.List;

@Transactional
@ApplicationScoped
public class SolrBackupRepository implements PanacheRepositoryBase<SolrBackup, String> {

    public SolrBackup save(SolrBackup solrBackup) {
        EntityManager entityManager = getEntityManager();
        entityManager.merge(solrBackup);
        return solrBackup;
    }

    public List<SolrBackup> findAllOrderedByName() {
        return list("order by name");
    }

    public boolean remove(String name) {
        return deleteById(name);
    }
}
