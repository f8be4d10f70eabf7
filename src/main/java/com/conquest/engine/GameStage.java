package com.conquest.engine;

/**
 * Represents the current stage of a game. The stage decides which {@link Game} operations are legal.
 */
public enum GameStage {
    INITIALIZING,       // Before the first real stage is set; never observable
    CLAIM,              // Current player claims an unowned territory
    POPULATE,           // Current player places one initial army on an owned territory
    DRAFT,              // Current player places reinforcements and may trade in cards
    ATTACK,             // Current player attacks or skips to maneuver
    INVADE,             // Current player moves extra armies into a just-captured territory
    MANEUVER,           // Current player moves armies between adjacent territories or skips
    FINISHED            // A single undefeated player remains
}
