package com.conquest.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Predicate;

/**
 * Keeps track of whose turn it is. Players form a fixed circle; advancing skips defeated players.
 */
@Slf4j
class TurnManager {

    private final List<Player> players;
    private int currentIndex;

    TurnManager(List<Player> players) {
        if (players.isEmpty()) {
            throw new IllegalArgumentException("At least one player is required");
        }
        this.players = players;
    }

    Player current() {
        return players.get(currentIndex);
    }

    int currentIndex() {
        return currentIndex;
    }

    /**
     * Advance to the next undefeated player.
     *
     * @return false if no other undefeated player exists
     */
    boolean advance() {
        return advance(null);
    }

    /**
     * Advance to the next undefeated player accepted by {@code eligible}. The outgoing player's per-turn
     * data is reset only when the pointer actually moves.
     *
     * @return false, leaving the pointer unchanged, if the scan returns to the current player
     */
    boolean advance(Predicate<Player> eligible) {
        int next = currentIndex;
        do {
            next = (next + 1) % players.size();
            if (next == currentIndex) {
                return false;
            }
        } while (players.get(next).isDefeated() || eligible != null && !eligible.test(players.get(next)));

        current().resetTurnData();
        log.debug("Turn passes from {} to {}", current().getName(), players.get(next).getName());
        currentIndex = next;
        return true;
    }
}
