package com.nosota.msettle.repository;

import com.nosota.msettle.model.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    List<LedgerEntry> findByReferenceIdOrderByIdAsc(UUID referenceId);

    List<LedgerEntry> findByPrincipalOrderByIdAsc(String principal);

    // Journal side of the reconciliation check
    @Query("SELECT COALESCE(SUM(e.amount), 0L) FROM LedgerEntry e WHERE e.asset = :asset")
    Long sumAmountsByAsset(@Param("asset") String asset);
}
