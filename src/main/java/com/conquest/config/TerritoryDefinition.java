package com.conquest.config;

import java.util.List;

/**
 * A single territory on the map.
 *
 * @param key       unique key within this map, e.g. "WESTERN_EUROPE"
 * @param name      display name, e.g. "Western Europe"
 * @param neighbors keys of the territories this territory connects to
 */
public record TerritoryDefinition(
        String key,
        String name,
        List<String> neighbors
) {

    public TerritoryDefinition {
        // a territory without a neighbors entry is isolated
        neighbors = neighbors == null ? List.of() : neighbors;
    }
}
