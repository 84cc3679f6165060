package com.nosota.msettle.repository;

import com.nosota.msettle.model.Escrow;
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
public interface EscrowRepository extends JpaRepository<Escrow, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Escrow e WHERE e.id = :id")
    Optional<Escrow> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT e FROM Escrow e WHERE e.buyer = :participant OR e.seller = :participant ORDER BY e.createdAt DESC")
    List<Escrow> findByParticipant(@Param("participant") String participant);
}
