package com.conquest.engine;

import com.conquest.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * Resolves attacks with precomputed outcome probabilities instead of rolling dice.
 * One uniform draw decides each attack.
 */
@Slf4j
class CombatResolver {

    // values from Osborne, "Markov Chains for the RISK Board Game Revisited"

    /** Chance the attacker wins with 1, 2 or 3 attackers against one defender. */
    static final double[] SINGLE_WIN = {15d / 36, 125d / 216, 855d / 1296};

    /** Chance the attacker wins outright with 1, 2 or 3 attackers against two defenders. */
    static final double[] DOUBLE_WIN = {55d / 216, 715d / 1296, 5501d / 7776};

    /** Chance both sides lose one army with 1, 2 or 3 attackers against two defenders. */
    static final double[] BOTH_LOSE = {0, 420d / 1296, 2611d / 7776};

    private final RandomGenerator random;

    CombatResolver(RandomGenerator random) {
        this.random = random;
    }

    /**
     * Validate the committed army counts against the armies present in both territories.
     */
    void checkDeclaration(int attackers, int defenders, int attackingArmies, int defendingArmies) {
        if (attackers < 1 || attackers > 3 || attackingArmies - 1 < attackers) {
            throw new InvalidArgumentException("Invalid number of attackers: " + attackers
                    + " (territory has " + attackingArmies + " armies)");
        }
        if (defenders < 1 || defenders > 2 || defendingArmies < defenders) {
            throw new InvalidArgumentException("Invalid number of defenders: " + defenders
                    + " (territory has " + defendingArmies + " armies)");
        }
    }

    CombatOutcome resolve(int attackers, int defenders) {
        double roll = random.nextDouble();
        int i = attackers - 1;
        CombatOutcome outcome;

        if (defenders == 1) {
            outcome = roll < SINGLE_WIN[i]
                    ? new CombatOutcome(0, 1, attackers)
                    : new CombatOutcome(1, 0, attackers);
        } else if (roll < BOTH_LOSE[i]) {
            outcome = new CombatOutcome(1, 1, attackers - 1);
        } else {
            int losses = attackers == 1 ? 1 : 2;
            outcome = roll < DOUBLE_WIN[i]
                    ? new CombatOutcome(0, losses, attackers)
                    : new CombatOutcome(losses, 0, attackers);
        }

        log.debug("{} vs {} rolled {} -> {}", attackers, defenders, roll, outcome);
        return outcome;
    }
}
