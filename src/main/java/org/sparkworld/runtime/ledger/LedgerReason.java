package org.sparkworld.runtime.ledger;

/**
 * Why sparks moved.
 */
public enum LedgerReason {
    UPKEEP,
    BOND_MINT,
    BENEFACTOR_GRANT,
    RAID_THEFT,
    RAID_STAKE_LOSS,
    SPAWN_COST,
    SPAWN_ENDOWMENT
}
