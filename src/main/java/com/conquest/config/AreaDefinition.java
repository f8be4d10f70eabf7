package com.conquest.config;

import java.util.List;

/**
 * An area on the map (a continent in the classic world map).
 * Controlling all territories in an area grants bonus reinforcements.
 *
 * @param key         unique key within this map, e.g. "EUROPE"
 * @param name        display name, e.g. "Europe"
 * @param bonusArmies reinforcement bonus for controlling the whole area
 * @param territories territories that belong to this area
 */
public record AreaDefinition(
        String key,
        String name,
        int bonusArmies,
        List<TerritoryDefinition> territories
) {

    public AreaDefinition {
        territories = territories == null ? List.of() : territories;
    }
}
