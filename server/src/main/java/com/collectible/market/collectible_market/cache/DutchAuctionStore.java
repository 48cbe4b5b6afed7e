package com.collectible.market.collectible_market.cache;

import com.collectible.market.collectible_market.entity.DutchAuction;
import com.collectible.market.collectible_market.execution.TransactionJournal;

public class DutchAuctionStore extends RecordStore<DutchAuction> {

    public DutchAuctionStore(TransactionJournal journal) {
        super("DutchAuction", journal);
    }
}
