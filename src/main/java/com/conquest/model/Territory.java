package com.conquest.model;

/**
 * Handle of a single territory on a map.
 *
 * @param index 0-based position in the owning {@link Geography}; used as the engine's array index
 * @param key   unique key within the map, e.g. "WESTERN_EUROPE"
 * @param name  display name, e.g. "Western Europe"
 */
public record Territory(int index, String key, String name) {

    @Override
    public String toString() {
        return key;
    }
}
