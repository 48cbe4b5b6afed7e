package com.collectible.market.collectible_market.cache;

import com.collectible.market.collectible_market.entity.EnglishAuction;
import com.collectible.market.collectible_market.execution.TransactionJournal;

public class EnglishAuctionStore extends RecordStore<EnglishAuction> {

    public EnglishAuctionStore(TransactionJournal journal) {
        super("Auction", journal);
    }
}
