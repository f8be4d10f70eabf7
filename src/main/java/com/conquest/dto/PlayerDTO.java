package com.conquest.dto;

import com.conquest.engine.Player;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for player representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerDTO {

    private int index;
    private String name;
    private boolean defeated;
    private int territoryCount;
    private int totalArmies;
    private int draftArmies;
    private int singleStarCards;
    private int doubleStarCards;
    private int stars;
    private int continentBonus;
    private boolean isCurrentPlayer;

    public static PlayerDTO fromPlayer(Player player) {
        return PlayerDTO.builder()
                .index(player.getIndex())
                .name(player.getName())
                .defeated(player.isDefeated())
                .territoryCount(player.getOwnedTerritoryCount())
                .draftArmies(player.getDraftArmies())
                .singleStarCards(player.getSingleStarCards())
                .doubleStarCards(player.getDoubleStarCards())
                .stars(player.getStars())
                .continentBonus(player.getContinentBonus())
                .build();
    }
}
