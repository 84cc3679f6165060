package com.nosota.msettle.repository;

import com.nosota.msettle.model.Bid;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BidRepository extends JpaRepository<Bid, UUID> {

    List<Bid> findByAuctionIdOrderByPlacedAtAscAmountAsc(UUID auctionId);
}
