package com.conquest.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map graph consumed by the game engine: an ordered sequence of territories,
 * a symmetric adjacency relation between them and their grouping into regions.
 * <p>
 * Instances are created through {@link #builder()}, which validates the graph: keys are unique,
 * no territory is adjacent to itself, every region is non-empty and a territory belongs to at
 * most one region.
 */
public final class Geography {

    private final List<Territory> territories;
    private final Map<String, Territory> territoriesByKey;
    private final BitSet[] adjacency;
    private final List<Region> regions;
    private final Region[] regionByTerritory;

    private Geography(List<Territory> territories, BitSet[] adjacency, List<Region> regions) {
        this.territories = Collections.unmodifiableList(territories);
        this.adjacency = adjacency;
        this.regions = Collections.unmodifiableList(regions);
        this.territoriesByKey = new LinkedHashMap<>();
        for (Territory t : territories) {
            territoriesByKey.put(t.key(), t);
        }
        this.regionByTerritory = new Region[territories.size()];
        for (Region region : regions) {
            for (Territory t : region.territories()) {
                regionByTerritory[t.index()] = region;
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Territory> getTerritories() {
        return territories;
    }

    public List<Region> getRegions() {
        return regions;
    }

    public int size() {
        return territories.size();
    }

    public boolean isEmpty() {
        return territories.isEmpty();
    }

    /**
     * Whether the handle belongs to this geography (same index and key).
     */
    public boolean contains(Territory territory) {
        if (territory == null) return false;
        int index = territory.index();
        return index >= 0 && index < territories.size() && territories.get(index).equals(territory);
    }

    public Territory territory(int index) {
        return territories.get(index);
    }

    public Optional<Territory> findTerritory(String key) {
        return Optional.ofNullable(territoriesByKey.get(key));
    }

    /**
     * Get a territory by its key.
     *
     * @throws IllegalArgumentException if the key is unknown
     */
    public Territory territory(String key) {
        return findTerritory(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown territory: " + key));
    }

    /**
     * The region a territory belongs to, if any.
     */
    public Optional<Region> regionOf(Territory territory) {
        if (!contains(territory)) return Optional.empty();
        return Optional.ofNullable(regionByTerritory[territory.index()]);
    }

    public boolean areAdjacent(Territory a, Territory b) {
        return contains(a) && contains(b) && adjacency[a.index()].get(b.index());
    }

    /**
     * Territories adjacent to {@code territory}, in index order; empty for a handle of another geography.
     */
    public List<Territory> neighbors(Territory territory) {
        List<Territory> result = new ArrayList<>();
        if (!contains(territory)) return result;
        BitSet bits = adjacency[territory.index()];
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            result.add(territories.get(i));
        }
        return result;
    }

    /**
     * Fluent builder. Territories receive their index in the order they are added; adjacency
     * added in either direction is stored in both.
     */
    public static final class Builder {

        private final List<Territory> territories = new ArrayList<>();
        private final Map<String, Territory> byKey = new LinkedHashMap<>();
        private final List<String[]> links = new ArrayList<>();
        private final List<RegionSpec> regions = new ArrayList<>();

        private Builder() {
        }

        public Builder territory(String key) {
            return territory(key, key);
        }

        public Builder territory(String key, String name) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Territory key must not be blank");
            }
            if (byKey.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate territory key: " + key);
            }
            Territory territory = new Territory(territories.size(), key, name);
            territories.add(territory);
            byKey.put(key, territory);
            return this;
        }

        public Builder adjacent(String a, String b) {
            links.add(new String[]{a, b});
            return this;
        }

        /**
         * Declare a region over territories that were (or will be) added to this builder.
         */
        public Builder region(String key, String name, int bonus, List<String> territoryKeys) {
            regions.add(new RegionSpec(key, name, bonus, List.copyOf(territoryKeys)));
            return this;
        }

        public Builder region(String key, int bonus, String... territoryKeys) {
            return region(key, key, bonus, List.of(territoryKeys));
        }

        public Geography build() {
            BitSet[] adjacency = new BitSet[territories.size()];
            for (int i = 0; i < adjacency.length; i++) {
                adjacency[i] = new BitSet(adjacency.length);
            }
            for (String[] link : links) {
                Territory a = resolve(link[0]);
                Territory b = resolve(link[1]);
                if (a.equals(b)) {
                    throw new IllegalArgumentException("Territory cannot be adjacent to itself: " + a.key());
                }
                adjacency[a.index()].set(b.index());
                adjacency[b.index()].set(a.index());
            }

            List<Region> built = new ArrayList<>();
            BitSet assigned = new BitSet(territories.size());
            for (RegionSpec spec : regions) {
                if (spec.territoryKeys().isEmpty()) {
                    throw new IllegalArgumentException("Region has no territories: " + spec.key());
                }
                if (spec.bonus() < 0) {
                    throw new IllegalArgumentException("Region bonus must be non-negative: " + spec.key());
                }
                List<Territory> members = new ArrayList<>();
                for (String key : spec.territoryKeys()) {
                    Territory t = resolve(key);
                    if (assigned.get(t.index())) {
                        throw new IllegalArgumentException("Territory " + key + " belongs to more than one region");
                    }
                    assigned.set(t.index());
                    members.add(t);
                }
                built.add(new Region(spec.key(), spec.name(), spec.bonus(), members));
            }
            return new Geography(new ArrayList<>(territories), adjacency, built);
        }

        private Territory resolve(String key) {
            Territory t = byKey.get(key);
            if (t == null) {
                throw new IllegalArgumentException("Unknown territory: " + key);
            }
            return t;
        }

        private record RegionSpec(String key, String name, int bonus, List<String> territoryKeys) {}
    }
}
