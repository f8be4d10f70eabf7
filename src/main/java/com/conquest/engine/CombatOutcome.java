package com.conquest.engine;

/**
 * Losses produced by resolving one attack.
 *
 * @param attackerLosses armies removed from the attacking territory
 * @param defenderLosses armies removed from the defending territory
 * @param survivors      committed attackers left to move in if the territory is captured
 */
public record CombatOutcome(int attackerLosses, int defenderLosses, int survivors) {}
