package org.sparkworld.runtime.ledger;

/**
 * One audited movement of sparks.
 * <p>
 * Source and destination are agent ids, bond ids (minting), {@link SparkLedger#BENEFACTOR}
 * or {@link SparkLedger#VOID} (sparks created from or destroyed into nothing).
 *
 * @param tick The tick of the movement.
 * @param source Where the sparks came from.
 * @param destination Where the sparks went.
 * @param amount How many sparks, always positive.
 * @param reason Why.
 */
public record LedgerEntry(long tick, String source, String destination, int amount, LedgerReason reason) {

    public LedgerEntry {
        if (amount <= 0) {
            throw new IllegalArgumentException("Ledger amount must be positive, got " + amount);
        }
    }
}
