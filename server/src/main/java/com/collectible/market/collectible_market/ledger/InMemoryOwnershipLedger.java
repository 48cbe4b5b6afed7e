package com.collectible.market.collectible_market.ledger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.execution.TransactionJournal;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process ownership ledger. Token ids are sequential from 0.
 * Addresses are stored in canonical form, so lookups ignore case.
 * Every mutation is journaled so a failed settlement operation leaves ownership untouched.
 */
@Slf4j
public class InMemoryOwnershipLedger implements OwnershipLedger {

    private final TransactionJournal journal;
    private final ConcurrentHashMap<Long, String> owners = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, String> uris = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, String> tokenApprovals = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> operatorApprovals = new ConcurrentHashMap<>();
    private long nextTokenId;

    public InMemoryOwnershipLedger(TransactionJournal journal) {
        this.journal = journal;
    }

    @Override
    public String ownerOf(long tokenId) {
        String owner = owners.get(tokenId);
        if (owner == null) {
            throw new MarketException(ErrorCode.NOT_FOUND, "Token does not exist: " + tokenId);
        }
        return owner;
    }

    @Override
    public boolean exists(long tokenId) {
        return owners.containsKey(tokenId);
    }

    @Override
    public boolean isApprovedForAll(String owner, String operator) {
        Set<String> operators = operatorApprovals.get(Currencies.normalize(owner));
        return operators != null && operators.contains(Currencies.normalize(operator));
    }

    @Override
    public void setApprovalForAll(String owner, String operator, boolean approved) {
        Set<String> operators = operatorApprovals.computeIfAbsent(Currencies.normalize(owner),
                k -> ConcurrentHashMap.newKeySet());
        String canonicalOperator = Currencies.normalize(operator);
        boolean changed = approved ? operators.add(canonicalOperator) : operators.remove(canonicalOperator);
        if (changed) {
            journal.record(() -> {
                if (approved) {
                    operators.remove(canonicalOperator);
                } else {
                    operators.add(canonicalOperator);
                }
            });
        }
    }

    @Override
    public void approve(String owner, String operator, long tokenId) {
        if (!ownerOf(tokenId).equals(Currencies.normalize(owner))) {
            throw new MarketException(ErrorCode.NOT_APPROVED_OR_OWNER, "Only the owner may approve token " + tokenId);
        }
        restoreOnUndo(tokenApprovals, tokenId);
        tokenApprovals.put(tokenId, Currencies.normalize(operator));
    }

    @Override
    public String getApproved(long tokenId) {
        ownerOf(tokenId);
        return tokenApprovals.get(tokenId);
    }

    @Override
    public void transfer(String operator, String from, String to, long tokenId) {
        String owner = ownerOf(tokenId);
        if (!owner.equals(Currencies.normalize(from)) || !canOperate(operator, tokenId)) {
            throw new MarketException(ErrorCode.NOT_APPROVED_OR_OWNER,
                    String.format("%s cannot move token %d from %s", operator, tokenId, from));
        }
        restoreOnUndo(tokenApprovals, tokenId);
        restoreOnUndo(owners, tokenId);
        tokenApprovals.remove(tokenId);
        owners.put(tokenId, Currencies.normalize(to));
        log.debug("Token {} transferred {} -> {} by {}", tokenId, from, to, operator);
    }

    @Override
    public synchronized long mint(String to, String uri) {
        long tokenId = nextTokenId++;
        journal.record(() -> {
            owners.remove(tokenId);
            uris.remove(tokenId);
            nextTokenId = tokenId;
        });
        owners.put(tokenId, Currencies.normalize(to));
        uris.put(tokenId, uri);
        return tokenId;
    }

    @Override
    public void burn(String operator, long tokenId) {
        if (!exists(tokenId)) {
            throw new MarketException(ErrorCode.NOT_FOUND, "Token does not exist: " + tokenId);
        }
        if (!canOperate(operator, tokenId)) {
            throw new MarketException(ErrorCode.NOT_APPROVED, "Not approved to burn token " + tokenId);
        }
        restoreOnUndo(tokenApprovals, tokenId);
        restoreOnUndo(owners, tokenId);
        restoreOnUndo(uris, tokenId);
        tokenApprovals.remove(tokenId);
        owners.remove(tokenId);
        uris.remove(tokenId);
    }

    @Override
    public String tokenUri(long tokenId) {
        String uri = uris.get(tokenId);
        if (uri == null) {
            throw new MarketException(ErrorCode.NOT_FOUND, "URI query for nonexistent token " + tokenId);
        }
        return uri;
    }

    private void restoreOnUndo(Map<Long, String> map, long tokenId) {
        String previous = map.get(tokenId);
        journal.record(() -> {
            if (previous == null) {
                map.remove(tokenId);
            } else {
                map.put(tokenId, previous);
            }
        });
    }
}
