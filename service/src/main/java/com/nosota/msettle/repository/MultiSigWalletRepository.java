package com.nosota.msettle.repository;

import com.nosota.msettle.model.MultiSigWallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MultiSigWalletRepository extends JpaRepository<MultiSigWallet, UUID> {

    /**
     * Locks the wallet row. Proposals take it to hand out sequential indexes; execution takes
     * it so that owner and threshold checks see a stable wallet.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM MultiSigWallet w WHERE w.id = :id")
    Optional<MultiSigWallet> findByIdForUpdate(@Param("id") UUID id);
}
