package org.sparkworld.runtime;

import org.sparkworld.runtime.model.Benefactor;

import com.typesafe.config.Config;

/**
 * How the benefactor pool is set up at genesis.
 *
 * @param name Display name of the benefactor.
 * @param initialBalance Starting balance, or {@code -1} for one spark per genesis agent.
 * @param regenerationPerTick Sparks added per tick, or {@code -1} for {@code max(1, floor(sqrt(n)))}.
 * @param maxGrantPerRequest Upper bound of a single grant, at most {@link Benefactor#MAX_GRANT_PER_REQUEST}.
 */
public record BenefactorPolicy(String name, int initialBalance, int regenerationPerTick, int maxGrantPerRequest) {

    public static final int AUTO = -1;

    public BenefactorPolicy {
        Benefactor.requireGrantCap(maxGrantPerRequest);
    }

    /**
     * @return Automatic balance and regeneration, grants of at most 5.
     */
    public static BenefactorPolicy defaults() {
        return new BenefactorPolicy("Bob", AUTO, AUTO, Benefactor.MAX_GRANT_PER_REQUEST);
    }

    /**
     * Reads a {@code sparkworld.benefactor} block. {@code initial-balance} and
     * {@code regeneration-per-tick} may be {@code auto}.
     */
    public static BenefactorPolicy fromConfig(Config benefactor) {
        return new BenefactorPolicy(
            benefactor.getString("name"),
            readAuto(benefactor, "initial-balance"),
            readAuto(benefactor, "regeneration-per-tick"),
            benefactor.getInt("max-grant-per-request"));
    }

    /**
     * Creates the benefactor for a world with {@code agentCount} genesis agents.
     */
    public Benefactor create(int agentCount) {
        int balance = initialBalance == AUTO ? agentCount : initialBalance;
        int regeneration = regenerationPerTick == AUTO
            ? Math.max(1, (int) Math.floor(Math.sqrt(agentCount)))
            : regenerationPerTick;
        return new Benefactor(name, balance, regeneration, maxGrantPerRequest);
    }

    private static int readAuto(Config config, String path) {
        if ("auto".equalsIgnoreCase(config.getString(path))) {
            return AUTO;
        }
        return config.getInt(path);
    }
}
