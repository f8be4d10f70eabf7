package com.conquest.dto;

import com.conquest.engine.Game;
import com.conquest.engine.Player;
import com.conquest.model.Region;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for region representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegionDTO {

    private String key;
    private String name;
    private int bonusArmies;
    private int territoryCount;
    private String controlledBy;

    public static RegionDTO fromRegion(Game game, Region region) {
        Player first = game.getTerritoryInfo(region.territories().get(0)).owner();
        Player controller = first != null && region.territories().stream()
                .allMatch(t -> game.getTerritoryInfo(t).isOwnedBy(first)) ? first : null;

        return RegionDTO.builder()
                .key(region.key())
                .name(region.name())
                .bonusArmies(region.bonus())
                .territoryCount(region.size())
                .controlledBy(controller != null ? controller.getName() : null)
                .build();
    }
}
