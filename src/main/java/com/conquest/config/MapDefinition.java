package com.conquest.config;

import com.conquest.model.Geography;

import java.util.List;
import java.util.Objects;

/**
 * Root definition of a playable map, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "classic-world"
 * @param name        human-readable name
 * @param description short description of the map
 * @param author      map author / credit
 * @param minPlayers  recommended minimum players
 * @param maxPlayers  recommended maximum players
 * @param areas       the regions (continents in the classic map)
 */
public record MapDefinition(
        String id,
        String name,
        String description,
        String author,
        int minPlayers,
        int maxPlayers,
        List<AreaDefinition> areas
) {

    /**
     * Build the engine's geography. Territories are indexed in file order, area by area; a neighbor listed
     * on only one side still makes both territories adjacent.
     *
     * @throws IllegalArgumentException if a neighbor key is unknown, a territory key is repeated or an area is empty
     */
    public Geography toGeography() {
        Geography.Builder builder = Geography.builder();
        for (AreaDefinition area : areas) {
            if (area == null || area.territories().stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Map '" + id + "' has an empty area or territory entry");
            }
            for (TerritoryDefinition territory : area.territories()) {
                builder.territory(territory.key(), territory.name());
            }
        }
        for (AreaDefinition area : areas) {
            builder.region(area.key(), area.name(), area.bonusArmies(),
                    area.territories().stream().map(TerritoryDefinition::key).toList());
            for (TerritoryDefinition territory : area.territories()) {
                for (String neighbor : territory.neighbors()) {
                    builder.adjacent(territory.key(), neighbor);
                }
            }
        }
        return builder.build();
    }
}
