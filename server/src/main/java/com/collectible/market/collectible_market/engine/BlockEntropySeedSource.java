package com.collectible.market.collectible_market.engine;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;

import com.collectible.market.collectible_market.execution.TransactionJournal;

import lombok.extern.slf4j.Slf4j;

/**
 * SHA-256 over (timestamp, block number, previous seed, caller, secret salt).
 *
 * NOT cryptographically secure: anyone who learns the salt and the counter can
 * predict the next draw. Rotating the salt narrows that window.
 *
 * Advancing the chain is journaled, so a mint that rolls back does not consume
 * a block. Salt rotation is not undone.
 */
@Slf4j
public class BlockEntropySeedSource implements SeedSource {

    private final Clock clock;
    private final TransactionJournal journal;
    private final SecureRandom saltGenerator = new SecureRandom();
    private byte[] salt = new byte[32];
    private byte[] previousSeed = new byte[32];
    private long blockNumber;

    public BlockEntropySeedSource(Clock clock, TransactionJournal journal) {
        this.clock = clock;
        this.journal = journal;
        saltGenerator.nextBytes(salt);
    }

    @Override
    public synchronized BigInteger nextSeed(String caller) {
        long priorBlock = blockNumber;
        byte[] priorSeed = previousSeed;
        journal.record(() -> restore(priorBlock, priorSeed));

        MessageDigest digest = sha256();
        digest.update(ByteBuffer.allocate(Long.BYTES * 2)
                .putLong(clock.instant().getEpochSecond())
                .putLong(++blockNumber)
                .array());
        digest.update(previousSeed);
        digest.update(caller.getBytes(StandardCharsets.UTF_8));
        digest.update(salt);
        previousSeed = digest.digest();
        return new BigInteger(1, previousSeed);
    }

    @Override
    public synchronized void rotateSalt() {
        byte[] next = new byte[32];
        saltGenerator.nextBytes(next);
        salt = next;
        log.info("Card draw salt rotated at block {}", blockNumber);
    }

    private synchronized void restore(long block, byte[] seed) {
        blockNumber = block;
        previousSeed = seed;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
