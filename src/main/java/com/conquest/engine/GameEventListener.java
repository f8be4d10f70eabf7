package com.conquest.engine;

import com.conquest.model.Territory;

/**
 * Callbacks fired by a {@link Game} once the operation that raised them has finished changing state.
 * All methods default to doing nothing.
 */
public interface GameEventListener {

    default void onStageChanged(Game game, GameStage previous, GameStage current) {
    }

    default void onTerritoryCaptured(Game game, Territory from, Territory to, Player capturer, Player previousOwner) {
    }

    default void onPlayerDefeated(Game game, Player defeated, Player by) {
    }
}
