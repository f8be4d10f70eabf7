package com.conquest.engine;

import com.conquest.model.Geography;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegionBonusCalculatorTest {

    private Geography geography;
    private TerritoryStore store;
    private RegionBonusCalculator calculator;
    private Player player;

    @BeforeEach
    void setUp() {
        geography = GameFixtures.fourInALine();
        store = new TerritoryStore(geography.size());
        calculator = new RegionBonusCalculator(geography, store);
        player = new Player(0);
    }

    private void give(String... keys) {
        for (String key : keys) {
            store.setOwner(geography.territory(key).index(), player);
        }
        player.setOwnedTerritoryCount(keys.length);
    }

    @Test
    void shouldSumBonusesOfFullyOwnedRegions() {
        give("A", "B", "C", "D");

        calculator.recalculate(player);

        assertEquals(5, player.getContinentBonus());
    }

    @Test
    void shouldIgnorePartiallyOwnedRegions() {
        give("A", "B", "C");

        calculator.recalculate(player);

        assertEquals(2, player.getContinentBonus());
        assertTrue(calculator.controls(player, geography.getRegions().get(0)));
        assertFalse(calculator.controls(player, geography.getRegions().get(1)));
    }

    @Test
    void shouldDropBonusWhenRegionIsLost() {
        give("C", "D");
        calculator.recalculate(player);
        assertEquals(3, player.getContinentBonus());

        store.setOwner(geography.territory("D").index(), new Player(1));
        player.setOwnedTerritoryCount(1);
        calculator.recalculate(player);

        assertEquals(0, player.getContinentBonus());
    }
}
