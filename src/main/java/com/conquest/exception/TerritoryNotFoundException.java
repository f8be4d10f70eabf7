package com.conquest.exception;

import com.conquest.model.Territory;

/**
 * Thrown when a territory handle does not belong to the geography a game was created with.
 */
public class TerritoryNotFoundException extends IllegalArgumentException {

    public TerritoryNotFoundException(Territory territory) {
        super("Territory not found: " + territory);
    }
}
