package com.conquest.engine;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A player in a game and that player's counters. Only the engine mutates the counters;
 * the presentation layer may rename the player.
 */
@Getter
@ToString
public class Player {

    /** Position in the turn order, fixed at creation. */
    private final int index;

    @Setter
    private String name;

    @Setter(AccessLevel.PACKAGE)
    private boolean defeated;

    @Setter(AccessLevel.PACKAGE)
    private int ownedTerritoryCount;

    /** Armies still to be placed in the claim, populate or draft stage. */
    @Setter(AccessLevel.PACKAGE)
    private int draftArmies;

    @Setter(AccessLevel.PACKAGE)
    private int singleStarCards;

    @Setter(AccessLevel.PACKAGE)
    private int doubleStarCards;

    @Setter(AccessLevel.PACKAGE)
    private int capturesThisTurn;

    /** Total bonus of fully owned regions; recomputed whenever the owned territory count changes. */
    @Setter(AccessLevel.PACKAGE)
    private int continentBonus;

    Player(int index) {
        this.index = index;
        this.name = "Player " + (index + 1);
    }

    /**
     * Total stars on the cards this player holds. Each double star card counts twice.
     */
    public int getStars() {
        return singleStarCards + doubleStarCards * 2;
    }

    void defeat() {
        this.defeated = true;
    }

    void resetTurnData() {
        this.capturesThisTurn = 0;
    }
}
