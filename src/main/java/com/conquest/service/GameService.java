package com.conquest.service;

import com.conquest.config.EngineProperties;
import com.conquest.config.MapLoader;
import com.conquest.engine.Game;
import com.conquest.model.Geography;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Creates games on the loaded maps, giving each game its own random generator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final MapLoader mapLoader;
    private final EngineProperties properties;

    /**
     * Create a game on the default map with default player names.
     */
    public Game createGame(int playerCount) {
        return createGame(properties.defaultMap(), playerCount);
    }

    /**
     * Create a game on the given map with default player names.
     */
    public Game createGame(String mapId, int playerCount) {
        Geography geography = mapLoader.getGeography(mapId);
        Game game = new Game(geography, playerCount, newRandom());
        log.info("Created game on map '{}' for {} players", mapId, playerCount);
        return game;
    }

    /**
     * Create a game on the given map; the turn order follows the order of {@code playerNames}.
     *
     * @throws IllegalArgumentException for an unknown map, a blank or repeated name, or a player count
     *                                  outside 2..6
     */
    public Game createGame(String mapId, List<String> playerNames) {
        Set<String> seen = new HashSet<>();
        for (String name : playerNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Player name must not be blank");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Player name already taken: " + name);
            }
        }

        Game game = createGame(mapId, playerNames.size());
        for (int i = 0; i < playerNames.size(); i++) {
            game.getPlayers().get(i).setName(playerNames.get(i));
        }
        log.info("Players: {}", playerNames);
        return game;
    }

    RandomGenerator newRandom() {
        Long seed = properties.randomSeed();
        return seed != null ? new Random(seed) : new SecureRandom();
    }
}
