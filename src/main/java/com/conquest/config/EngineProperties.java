package com.conquest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Engine settings bound from {@code conquest.engine.*}.
 *
 * @param randomSeed    seed for every new game's random generator; unseeded when absent
 * @param defaultMap    map used when a game is created without a map id
 * @param mapsDirectory folder scanned for custom map files, relative to the working directory
 */
@ConfigurationProperties(prefix = "conquest.engine")
public record EngineProperties(
        Long randomSeed,
        @DefaultValue("classic-world") String defaultMap,
        @DefaultValue("maps") String mapsDirectory
) {

    public static EngineProperties defaults() {
        return new EngineProperties(null, "classic-world", "maps");
    }
}
