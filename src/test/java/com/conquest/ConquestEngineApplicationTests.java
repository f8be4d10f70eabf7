package com.conquest;

import com.conquest.config.MapLoader;
import com.conquest.engine.Game;
import com.conquest.engine.GameStage;
import com.conquest.service.GameService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ConquestEngineApplicationTests {

    @Autowired
    private MapLoader mapLoader;

    @Autowired
    private GameService gameService;

    @Test
    void contextLoads() {
        assertNotNull(mapLoader.getMap("classic-world"));
    }

    @Test
    void createsGameOnDefaultMap() {
        Game game = gameService.createGame(4);

        assertEquals(GameStage.CLAIM, game.getStage());
        assertEquals(42, game.getUnclaimedTerritoryCount());
        assertEquals(30, game.getCurrentPlayer().getDraftArmies());
    }
}
