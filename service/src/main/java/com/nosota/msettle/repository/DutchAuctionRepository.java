package com.nosota.msettle.repository;

import com.nosota.msettle.model.DutchAuction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DutchAuctionRepository extends JpaRepository<DutchAuction, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DutchAuction d WHERE d.id = :id")
    Optional<DutchAuction> findByIdForUpdate(@Param("id") UUID id);
}
