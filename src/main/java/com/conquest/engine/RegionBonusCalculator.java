package com.conquest.engine;

import com.conquest.model.Geography;
import com.conquest.model.Region;
import com.conquest.model.Territory;
import lombok.RequiredArgsConstructor;

/**
 * Recomputes a player's region bonus from the current territory ownership.
 */
@RequiredArgsConstructor
class RegionBonusCalculator {

    private final Geography geography;
    private final TerritoryStore territories;

    /**
     * Replace the player's cached continent bonus with the sum of the bonuses of every region the player
     * fully controls.
     */
    void recalculate(Player player) {
        int bonus = 0;
        for (Region region : geography.getRegions()) {
            // a player owning fewer territories than the region has cannot control it
            if (player.getOwnedTerritoryCount() < region.size()) {
                continue;
            }
            if (controls(player, region)) {
                bonus += region.bonus();
            }
        }
        player.setContinentBonus(bonus);
    }

    boolean controls(Player player, Region region) {
        for (Territory territory : region.territories()) {
            if (!territories.isOwnedBy(territory.index(), player)) {
                return false;
            }
        }
        return true;
    }
}
