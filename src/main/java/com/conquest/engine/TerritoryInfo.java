package com.conquest.engine;

/**
 * Snapshot of a territory's state during a game.
 *
 * @param owner  owning player, or {@code null} while unclaimed (claim stage only)
 * @param armies armies stationed in the territory
 */
public record TerritoryInfo(Player owner, int armies) {

    public boolean isOwnedBy(Player player) {
        return owner != null && owner == player;
    }

    public boolean isClaimed() {
        return owner != null;
    }
}
