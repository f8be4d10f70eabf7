package com.conquest.config;

import com.conquest.model.Geography;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads all available map definitions at startup and turns them into geographies on demand.
 * <p>
 * Maps are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:maps/*.json}: built-in maps</li>
 *   <li>External folder: {@code conquest.engine.maps-directory} (default {@code ./maps/}): custom maps</li>
 * </ol>
 * If a custom map has the same {@code id} as a built-in map, the custom one wins.
 */
@Component
@Slf4j
public class MapLoader {

    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    /** All loaded maps keyed by their id. */
    @Getter
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();

    private final Map<String, Geography> geographies = new HashMap<>();

    public MapLoader(ObjectMapper objectMapper, EngineProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    public void loadMaps() {
        loadClasspathMaps();
        loadExternalMaps();

        if (maps.isEmpty()) {
            log.warn("No map definitions found! Games cannot be created without at least one map.");
        } else {
            log.info("Loaded {} map(s): {}", maps.size(),
                    maps.values().stream().map(MapDefinition::name).toList());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded map definition.
     */
    public List<MapDefinition> getAvailableMaps() {
        return List.copyOf(maps.values());
    }

    /**
     * Get a specific map by its id.
     *
     * @throws IllegalArgumentException if the map id is unknown
     */
    public MapDefinition getMap(String mapId) {
        MapDefinition map = mapId == null ? null : maps.get(mapId);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + mapId
                    + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    /**
     * Get the geography of a map. Built once per map and shared, since geographies are immutable.
     *
     * @throws IllegalArgumentException if the map id is unknown or the map's graph is invalid
     */
    public Geography getGeography(String mapId) {
        MapDefinition map = getMap(mapId);
        Geography geography = geographies.get(map.id());
        if (geography == null) {
            geography = map.toGeography();
            geographies.put(map.id(), geography);
            log.debug("Built geography for map '{}' with {} territories and {} regions",
                    map.id(), geography.size(), geography.getRegions().size());
        }
        return geography;
    }

    // ── classpath maps ──────────────────────────────────────────────────

    private void loadClasspathMaps() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    register(objectMapper.readValue(is, MapDefinition.class));
                    log.info("Loaded built-in map from classpath: {}", resource.getFilename());
                } catch (IOException | JacksonException | IllegalArgumentException e) {
                    log.error("Failed to load classpath map: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for maps: {}", e.getMessage());
        }
    }

    // ── external maps ───────────────────────────────────────────────────

    private void loadExternalMaps() {
        Path externalDir = Paths.get(properties.mapsDirectory());
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external maps directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalMapFile);
        } catch (IOException e) {
            log.error("Error reading external maps directory", e);
        }
    }

    private void loadExternalMapFile(Path path) {
        try {
            MapDefinition map = objectMapper.readValue(path.toFile(), MapDefinition.class);
            register(map);
            log.info("Loaded custom map '{}' ({}) from {}", map.name(), map.id(), path);
        } catch (JacksonException | IllegalArgumentException e) {
            log.error("Failed to load custom map: {}", path, e);
        }
    }

    private void register(MapDefinition map) {
        if (map.id() == null || map.id().isBlank()) {
            throw new IllegalArgumentException("Map definition has no id");
        }
        if (map.areas() == null) {
            throw new IllegalArgumentException("Map '" + map.id() + "' has no areas");
        }
        // build eagerly so an invalid graph is rejected before the map is listed
        Geography geography = map.toGeography();
        if (geography.isEmpty()) {
            throw new IllegalArgumentException("Map '" + map.id() + "' has no territories");
        }
        maps.put(map.id(), map);
        geographies.put(map.id(), geography);
    }
}
