package com.conquest.engine;

import com.conquest.exception.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CombatResolverTest {

    private RandomGenerator random;
    private CombatResolver resolver;

    @BeforeEach
    void setUp() {
        random = mock(RandomGenerator.class);
        resolver = new CombatResolver(random);
    }

    @Test
    @DisplayName("one defender: a low roll should remove the defender")
    void shouldWinAgainstSingleDefender() {
        when(random.nextDouble()).thenReturn(0.1);

        assertEquals(new CombatOutcome(0, 1, 3), resolver.resolve(3, 1));
    }

    @Test
    @DisplayName("one defender: a high roll should remove one attacker")
    void shouldLoseAgainstSingleDefender() {
        when(random.nextDouble()).thenReturn(0.95);

        assertEquals(new CombatOutcome(1, 0, 2), resolver.resolve(2, 1));
    }

    @Test
    @DisplayName("two defenders: rolls in the mutual band should cost one army each")
    void shouldTradeOneForOne() {
        when(random.nextDouble()).thenReturn(0.0);

        assertEquals(new CombatOutcome(1, 1, 2), resolver.resolve(3, 2));
        assertEquals(new CombatOutcome(1, 1, 1), resolver.resolve(2, 2));
    }

    @Test
    @DisplayName("a single attacker against two defenders never trades one for one")
    void shouldNeverTradeWithSingleAttacker() {
        when(random.nextDouble()).thenReturn(0.0);

        assertEquals(new CombatOutcome(0, 1, 1), resolver.resolve(1, 2));

        when(random.nextDouble()).thenReturn(0.99);

        assertEquals(new CombatOutcome(1, 0, 1), resolver.resolve(1, 2));
    }

    @Test
    @DisplayName("two defenders: the loser should lose two armies outside the mutual band")
    void shouldLoseTwoOutsideMutualBand() {
        when(random.nextDouble()).thenReturn(0.5);
        assertEquals(new CombatOutcome(0, 2, 3), resolver.resolve(3, 2));

        when(random.nextDouble()).thenReturn(0.9);
        assertEquals(new CombatOutcome(2, 0, 3), resolver.resolve(3, 2));
    }

    @Test
    @DisplayName("probabilities should be valid and favor larger attacks")
    void shouldHaveConsistentTables() {
        for (int i = 0; i < 3; i++) {
            assertTrue(CombatResolver.SINGLE_WIN[i] > 0 && CombatResolver.SINGLE_WIN[i] < 1);
            assertTrue(CombatResolver.BOTH_LOSE[i] <= CombatResolver.DOUBLE_WIN[i]);
            assertTrue(CombatResolver.DOUBLE_WIN[i] < 1);
        }
        for (int i = 1; i < 3; i++) {
            assertTrue(CombatResolver.SINGLE_WIN[i] > CombatResolver.SINGLE_WIN[i - 1]);
        }
    }

    @Test
    @DisplayName("losses should never exceed the armies committed")
    void shouldRespectCommittedArmies() {
        CombatResolver seeded = new CombatResolver(new SplittableRandom(42));
        for (int n = 0; n < 1000; n++) {
            int attackers = 1 + n % 3;
            int defenders = 1 + n / 3 % 2;
            CombatOutcome outcome = seeded.resolve(attackers, defenders);

            assertTrue(outcome.attackerLosses() <= attackers);
            assertTrue(outcome.defenderLosses() <= defenders);
            assertTrue(outcome.attackerLosses() + outcome.defenderLosses() >= 1);
            assertTrue(outcome.survivors() == attackers || outcome.survivors() == attackers - 1);
        }
    }

    @Test
    @DisplayName("declarations should be checked against the armies present")
    void shouldCheckDeclaration() {
        assertDoesNotThrow(() -> resolver.checkDeclaration(3, 2, 4, 2));
        assertDoesNotThrow(() -> resolver.checkDeclaration(1, 1, 2, 1));

        assertThrows(InvalidArgumentException.class, () -> resolver.checkDeclaration(0, 1, 5, 5));
        assertThrows(InvalidArgumentException.class, () -> resolver.checkDeclaration(4, 1, 5, 5));
        assertThrows(InvalidArgumentException.class, () -> resolver.checkDeclaration(3, 1, 3, 5));
        assertThrows(InvalidArgumentException.class, () -> resolver.checkDeclaration(1, 0, 5, 5));
        assertThrows(InvalidArgumentException.class, () -> resolver.checkDeclaration(1, 3, 5, 5));
        assertThrows(InvalidArgumentException.class, () -> resolver.checkDeclaration(1, 2, 5, 1));
    }
}
