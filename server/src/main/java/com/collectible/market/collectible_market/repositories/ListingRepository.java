package com.collectible.market.collectible_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.collectible.market.collectible_market.entity.Listing;
import com.collectible.market.collectible_market.entity.ListingStatus;

@Repository
public interface ListingRepository extends MongoRepository<Listing, Long> {
    List<Listing> findBySellerAndStatus(String seller, ListingStatus status);
}
