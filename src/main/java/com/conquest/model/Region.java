package com.conquest.model;

import java.util.List;

/**
 * A group of territories (a continent on the classic map).
 * Controlling every territory in a region grants bonus reinforcements.
 *
 * @param key         unique key within the map, e.g. "EUROPE"
 * @param name        display name
 * @param bonus       reinforcement bonus for controlling the whole region
 * @param territories member territories, never empty
 */
public record Region(String key, String name, int bonus, List<Territory> territories) {

    public Region {
        territories = List.copyOf(territories);
    }

    public int size() {
        return territories.size();
    }
}
