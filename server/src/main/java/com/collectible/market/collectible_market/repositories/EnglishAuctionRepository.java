package com.collectible.market.collectible_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.collectible.market.collectible_market.entity.EnglishAuction;

@Repository
public interface EnglishAuctionRepository extends MongoRepository<EnglishAuction, Long> {
}
