package com.collectible.market.collectible_market.ledger;

/**
 * Authoritative token ownership. The settlement engines only ever move tokens
 * through {@link #transfer}, {@link #mint} and {@link #burn}; they keep token ids,
 * never copies of ownership.
 */
public interface OwnershipLedger {

    /**
     * @throws com.collectible.market.collectible_market.error.MarketException NOT_FOUND if the token does not exist
     */
    String ownerOf(long tokenId);

    boolean exists(long tokenId);

    boolean isApprovedForAll(String owner, String operator);

    void setApprovalForAll(String owner, String operator, boolean approved);

    /**
     * Approve a single token for an operator. Only the owner may do this.
     */
    void approve(String owner, String operator, long tokenId);

    String getApproved(long tokenId);

    /**
     * True if the operator may move the token: owner, operator for all, or approved for this token.
     */
    default boolean canOperate(String operator, long tokenId) {
        String owner = ownerOf(tokenId);
        String canonical = Currencies.normalize(operator);
        return owner.equals(canonical)
                || isApprovedForAll(owner, canonical)
                || canonical.equals(getApproved(tokenId));
    }

    /**
     * Move a token. Fails NOT_APPROVED_OR_OWNER unless {@code from} owns it and the operator may move it.
     */
    void transfer(String operator, String from, String to, long tokenId);

    /**
     * Mint a new token bound to a metadata URI. Returns the new token id.
     */
    long mint(String to, String uri);

    /**
     * Fails NOT_FOUND for unknown tokens and NOT_APPROVED unless the operator may move the token.
     */
    void burn(String operator, long tokenId);

    String tokenUri(long tokenId);
}
