package com.collectible.market.collectible_market.cache;

import com.collectible.market.collectible_market.entity.CardSet;
import com.collectible.market.collectible_market.execution.TransactionJournal;

public class CardSetStore extends RecordStore<CardSet> {

    public CardSetStore(TransactionJournal journal) {
        super("CardSet", journal);
    }
}
