package com.nosota.msettle.repository;

import com.nosota.msettle.model.PendingTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PendingTransactionRepository extends JpaRepository<PendingTransaction, UUID> {

    Optional<PendingTransaction> findByWalletIdAndTxIndex(UUID walletId, Long txIndex);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM PendingTransaction t WHERE t.walletId = :walletId AND t.txIndex = :txIndex")
    Optional<PendingTransaction> findForUpdate(@Param("walletId") UUID walletId, @Param("txIndex") Long txIndex);

    List<PendingTransaction> findByWalletIdOrderByTxIndexAsc(UUID walletId);
}
