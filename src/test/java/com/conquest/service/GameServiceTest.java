package com.conquest.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.conquest.config.EngineProperties;
import com.conquest.config.MapLoader;
import com.conquest.engine.Game;
import com.conquest.engine.GameStage;
import com.conquest.engine.Player;
import com.conquest.model.Geography;

/**
 * Unit tests for game creation on loaded maps.
 */
@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    @Mock private MapLoader mapLoader;

    private GameService gameService;
    private Geography geography;

    @BeforeEach
    void setUp() {
        gameService = new GameService(mapLoader, EngineProperties.defaults());
        geography = Geography.builder()
                .territory("A").territory("B").territory("C")
                .adjacent("A", "B").adjacent("B", "C")
                .region("ALL", 3, "A", "B", "C")
                .build();
    }

    @Nested
    @DisplayName("createGame()")
    class CreateGameTests {

        @Test
        @DisplayName("should use the default map when none is given")
        void shouldUseDefaultMap() {
            when(mapLoader.getGeography("classic-world")).thenReturn(geography);

            Game game = gameService.createGame(3);

            assertEquals(GameStage.CLAIM, game.getStage());
            assertEquals(3, game.getPlayers().size());
            assertEquals(geography, game.getGeography());
        }

        @Test
        @DisplayName("should name players in turn order")
        void shouldNamePlayers() {
            when(mapLoader.getGeography("tiny")).thenReturn(geography);

            Game game = gameService.createGame("tiny", List.of("Alice", "Bob"));

            assertEquals(List.of("Alice", "Bob"), game.getPlayers().stream().map(Player::getName).toList());
            assertEquals("Alice", game.getCurrentPlayer().getName());
        }

        @Test
        @DisplayName("should reject blank and repeated names before loading the map")
        void shouldRejectBadNames() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> gameService.createGame("tiny", List.of("Alice", "Alice")));
            assertTrue(ex.getMessage().contains("already taken"));

            assertThrows(IllegalArgumentException.class,
                    () -> gameService.createGame("tiny", List.of("Alice", " ")));
            verify(mapLoader, never()).getGeography(anyString());
        }

        @Test
        @DisplayName("should reject unsupported player counts")
        void shouldRejectPlayerCount() {
            when(mapLoader.getGeography("tiny")).thenReturn(geography);

            assertThrows(IllegalArgumentException.class, () -> gameService.createGame("tiny", 7));
            assertThrows(IllegalArgumentException.class, () -> gameService.createGame("tiny", List.of("Solo")));
        }

        @Test
        @DisplayName("should propagate unknown map errors")
        void shouldPropagateUnknownMap() {
            when(mapLoader.getGeography("missing")).thenThrow(new IllegalArgumentException("Unknown map: missing"));

            assertThrows(IllegalArgumentException.class, () -> gameService.createGame("missing", 2));
        }
    }

    @Nested
    @DisplayName("Randomness")
    class RandomTests {

        @Test
        @DisplayName("should use a secure generator when no seed is configured")
        void shouldUseSecureRandomByDefault() {
            assertInstanceOf(SecureRandom.class, gameService.newRandom());
        }

        @Test
        @DisplayName("a configured seed should make every game replay the same rolls")
        void shouldSeedGenerator() {
            GameService seeded = new GameService(mapLoader, new EngineProperties(99L, "classic-world", "maps"));

            Random first = (Random) seeded.newRandom();
            Random second = (Random) seeded.newRandom();

            assertEquals(first.nextDouble(), second.nextDouble());
            assertEquals(first.nextInt(42), second.nextInt(42));
        }
    }
}
