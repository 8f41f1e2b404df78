package org.sparkworld.runtime.model;

/**
 * The finite external spark pool agents may petition for grants.
 * <p>
 * The balance never goes negative and regenerates by a fixed amount every tick.
 */
public class Benefactor {

    /** Hard ceiling of a single grant, whatever the configuration says. */
    public static final int MAX_GRANT_PER_REQUEST = 5;

    private final String name;
    private final int regenerationPerTick;
    private final int maxGrantPerRequest;
    private int balance;

    /**
     * @param name Display name used as ledger source.
     * @param balance Starting balance, must not be negative.
     * @param regenerationPerTick Amount added every tick.
     * @param maxGrantPerRequest Upper bound for a single grant, in {@code [0, MAX_GRANT_PER_REQUEST]}.
     */
    public Benefactor(String name, int balance, int regenerationPerTick, int maxGrantPerRequest) {
        if (balance < 0) {
            throw new IllegalArgumentException("Benefactor balance must be >= 0, got " + balance);
        }
        requireGrantCap(maxGrantPerRequest);
        this.name = name;
        this.balance = balance;
        this.regenerationPerTick = regenerationPerTick;
        this.maxGrantPerRequest = maxGrantPerRequest;
    }

    public String getName() {
        return name;
    }

    public int getBalance() {
        return balance;
    }

    public int getRegenerationPerTick() {
        return regenerationPerTick;
    }

    public int getMaxGrantPerRequest() {
        return maxGrantPerRequest;
    }

    /**
     * Clamps a requested grant to {@code [0, maxGrantPerRequest]} and to the current balance.
     *
     * @param requested The amount an oracle decided on.
     * @return The amount that may actually be granted.
     */
    public int clamp(int requested) {
        return Math.max(0, Math.min(Math.min(requested, maxGrantPerRequest), balance));
    }

    /**
     * Withdraws a grant.
     *
     * @param amount An amount previously returned by {@link #clamp(int)}.
     * @throws IllegalArgumentException if the amount exceeds the balance.
     */
    public void withdraw(int amount) {
        if (amount < 0 || amount > balance) {
            throw new IllegalArgumentException("Cannot withdraw " + amount + " from balance " + balance);
        }
        this.balance -= amount;
    }

    /**
     * Adds the per-tick regeneration.
     */
    public void regenerate() {
        this.balance += regenerationPerTick;
    }

    /**
     * @param maxGrantPerRequest A configured per-request grant bound.
     * @throws IllegalArgumentException if it lies outside {@code [0, MAX_GRANT_PER_REQUEST]}.
     */
    public static void requireGrantCap(int maxGrantPerRequest) {
        if (maxGrantPerRequest < 0 || maxGrantPerRequest > MAX_GRANT_PER_REQUEST) {
            throw new IllegalArgumentException("max-grant-per-request must be in [0, " + MAX_GRANT_PER_REQUEST
                + "], got " + maxGrantPerRequest);
        }
    }
}
