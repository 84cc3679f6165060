package com.nosota.msettle.repository;

import com.nosota.msettle.api.model.PaymentKind;
import com.nosota.msettle.api.model.PaymentStatus;
import com.nosota.msettle.model.Payment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") UUID id);

    List<Payment> findByParentPaymentIdOrderByInstallmentAsc(UUID parentPaymentId);

    /**
     * Finds pending payments of a kind whose release time has passed. Used by the keeper.
     *
     * @param kind   Payment kind (SCHEDULED)
     * @param status Payment status (PENDING)
     * @param now    Current time
     * @return Due payments, earliest first
     */
    @Query("SELECT p.id FROM Payment p WHERE p.kind = :kind AND p.status = :status " +
            "AND p.releaseTime <= :now ORDER BY p.releaseTime ASC")
    List<UUID> findDueIds(@Param("kind") PaymentKind kind,
                          @Param("status") PaymentStatus status,
                          @Param("now") Instant now);
}
