package com.conquest.dto;

import com.conquest.engine.Game;
import com.conquest.engine.TerritoryInfo;
import com.conquest.model.Region;
import com.conquest.model.Territory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for territory representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TerritoryDTO {

    private int index;
    private String key;
    private String name;
    private String regionKey;
    private Integer ownerIndex;
    private String ownerName;
    private int armies;
    private List<String> neighborKeys;
    private boolean canAttackFrom;

    public static TerritoryDTO fromTerritory(Game game, Territory territory) {
        TerritoryInfo info = game.getTerritoryInfo(territory);
        return TerritoryDTO.builder()
                .index(territory.index())
                .key(territory.key())
                .name(territory.name())
                .regionKey(game.getGeography().regionOf(territory).map(Region::key).orElse(null))
                .ownerIndex(info.owner() != null ? info.owner().getIndex() : null)
                .ownerName(info.owner() != null ? info.owner().getName() : null)
                .armies(info.armies())
                .neighborKeys(game.getGeography().neighbors(territory).stream()
                        .map(Territory::key)
                        .toList())
                .canAttackFrom(info.armies() > 1)
                .build();
    }
}
