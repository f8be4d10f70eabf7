package com.conquest.engine;

/**
 * Mutable owner and army count for every territory of a game, addressed by territory index.
 */
class TerritoryStore {

    private final Player[] owners;
    private final int[] armies;

    TerritoryStore(int size) {
        this.owners = new Player[size];
        this.armies = new int[size];
    }

    int size() {
        return armies.length;
    }

    Player owner(int index) {
        return owners[index];
    }

    int armies(int index) {
        return armies[index];
    }

    boolean isOwnedBy(int index, Player player) {
        return owners[index] != null && owners[index] == player;
    }

    void setOwner(int index, Player player) {
        owners[index] = player;
    }

    void setArmies(int index, int count) {
        if (count < 0) {
            throw new IllegalStateException("Army count cannot be negative: " + count);
        }
        armies[index] = count;
    }

    void addArmies(int index, int delta) {
        setArmies(index, armies[index] + delta);
    }

    /**
     * Move armies between two territories.
     */
    void move(int from, int to, int count) {
        addArmies(from, -count);
        addArmies(to, count);
    }

    TerritoryInfo info(int index) {
        return new TerritoryInfo(owners[index], armies[index]);
    }
}
