package com.collectible.market.collectible_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.collectible.market.collectible_market.entity.DutchAuction;

@Repository
public interface DutchAuctionRepository extends MongoRepository<DutchAuction, Long> {
}
