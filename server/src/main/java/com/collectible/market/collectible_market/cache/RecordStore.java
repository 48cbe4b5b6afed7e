package com.collectible.market.collectible_market.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.collectible.market.collectible_market.entity.MarketRecord;
import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.execution.TransactionJournal;

/**
 * In-memory arena of one record type, keyed by sequential ids starting at 0.
 *
 * This is the source of truth for settlement; MongoDB is a write-behind copy.
 * Inserts and updates are journaled so a rolled-back operation restores both
 * the record and the id counter. Touched records are marked dirty for the flusher.
 *
 * Only the settlement executor thread mutates a store.
 */
public abstract class RecordStore<T extends MarketRecord<T>> {

    private final ConcurrentHashMap<Long, T> records = new ConcurrentHashMap<>();
    private final Set<Long> dirty = ConcurrentHashMap.newKeySet();
    private final TransactionJournal journal;
    private final String recordName;
    private long nextId;

    protected RecordStore(String recordName, TransactionJournal journal) {
        this.recordName = recordName;
        this.journal = journal;
    }

    /**
     * Assign the next id and store the record.
     */
    public T insert(T record) {
        long id = nextId++;
        record.setId(id);
        records.put(id, record);
        dirty.add(id);
        journal.record(() -> {
            records.remove(id);
            nextId = id;
        });
        return record;
    }

    public Optional<T> find(long id) {
        return Optional.ofNullable(records.get(id));
    }

    /**
     * @throws MarketException NOT_FOUND if no record has this id
     */
    public T get(long id) {
        return find(id).orElseThrow(() -> new MarketException(ErrorCode.NOT_FOUND,
                String.format("%s %d does not exist", recordName, id)));
    }

    /**
     * Return the live record for mutation. A snapshot is journaled first so
     * any change made to the returned object is undone on rollback.
     */
    public T forUpdate(long id) {
        T live = get(id);
        T snapshot = live.copy();
        journal.record(() -> records.put(id, snapshot));
        dirty.add(id);
        return live;
    }

    public long count() {
        return nextId;
    }

    public Collection<T> all() {
        return records.values();
    }

    /**
     * Records with ids in [start, end], inclusive.
     */
    public List<T> range(long start, long end) {
        if (start > end || end >= nextId) {
            throw new MarketException(ErrorCode.INVALID_RANGE,
                    String.format("Invalid range [%d, %d] for %d %s records", start, end, nextId, recordName));
        }
        List<T> result = new ArrayList<>();
        for (long id = start; id <= end; id++) {
            T record = records.get(id);
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * Detached copies of every record touched since the last drain.
     */
    public List<T> drainDirty() {
        List<T> copies = new ArrayList<>();
        for (Long id : new ArrayList<>(dirty)) {
            dirty.remove(id);
            T record = records.get(id);
            if (record != null) {
                copies.add(record.copy());
            }
        }
        return copies;
    }

    /**
     * Queue records again after a failed flush.
     */
    public void markDirty(Collection<T> failed) {
        failed.forEach(record -> dirty.add(record.getId()));
    }

    public String getRecordName() {
        return recordName;
    }

    protected TransactionJournal journal() {
        return journal;
    }
}
