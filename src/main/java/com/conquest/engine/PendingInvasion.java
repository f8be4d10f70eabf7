package com.conquest.engine;

import com.conquest.model.Territory;

/**
 * The territories involved in the capture that opened the invade stage.
 */
public record PendingInvasion(Territory from, Territory to) {}
