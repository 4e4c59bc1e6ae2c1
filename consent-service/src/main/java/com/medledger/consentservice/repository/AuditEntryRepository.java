package com.medledger.consentservice.repository;

import com.medledger.consentservice.models.AuditEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, String>, JpaSpecificationExecutor<AuditEntry> {

    /**
     * Chain head, the entry with the highest block number.
     */
    Optional<AuditEntry> findTopByOrderByBlockNumberDesc();

    Optional<AuditEntry> findByBlockNumber(Long blockNumber);

    @Query("select a from AuditEntry a where a.blockNumber > :afterBlock and a.blockNumber <= :toBlock "
            + "order by a.blockNumber asc")
    List<AuditEntry> findBlockRange(@Param("afterBlock") long afterBlock,
                                    @Param("toBlock") long toBlock,
                                    Pageable pageable);

    List<AuditEntry> findByResourceIdOrderByBlockNumberAsc(String resourceId);
}
