package com.conquest.dto;

import com.conquest.engine.CardEconomy;
import com.conquest.engine.Game;
import com.conquest.engine.GameStage;
import com.conquest.engine.PendingInvasion;
import com.conquest.engine.Player;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a game for a presentation layer. Changing the DTO does not affect the game.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameStateDTO {

    private GameStage stage;
    private PlayerDTO currentPlayer;
    private List<PlayerDTO> players;
    private List<TerritoryDTO> territories;
    private List<RegionDTO> regions;
    private int totalTerritories;
    private int unclaimedTerritories;
    private String invadeFromKey;
    private String invadeToKey;
    private int drawSingleStarCards;
    private int drawDoubleStarCards;
    private int discardedSingleStarCards;
    private int discardedDoubleStarCards;
    private String winnerName;

    public static GameStateDTO fromGame(Game game) {
        List<TerritoryDTO> territories = game.getGeography().getTerritories().stream()
                .map(t -> TerritoryDTO.fromTerritory(game, t))
                .toList();

        Map<Integer, Integer> armiesByOwner = new HashMap<>();
        for (TerritoryDTO t : territories) {
            if (t.getOwnerIndex() != null) {
                armiesByOwner.merge(t.getOwnerIndex(), t.getArmies(), Integer::sum);
            }
        }

        Player current = game.getCurrentPlayer();
        List<PlayerDTO> players = game.getPlayers().stream()
                .map(p -> {
                    PlayerDTO dto = PlayerDTO.fromPlayer(p);
                    dto.setTotalArmies(armiesByOwner.getOrDefault(p.getIndex(), 0));
                    dto.setCurrentPlayer(p == current);
                    return dto;
                })
                .toList();

        CardEconomy cards = game.getCards();
        PendingInvasion invasion = game.getPendingInvasion().orElse(null);

        return GameStateDTO.builder()
                .stage(game.getStage())
                .currentPlayer(players.get(current.getIndex()))
                .players(players)
                .territories(territories)
                .regions(game.getGeography().getRegions().stream()
                        .map(r -> RegionDTO.fromRegion(game, r))
                        .toList())
                .totalTerritories(territories.size())
                .unclaimedTerritories(game.getUnclaimedTerritoryCount())
                .invadeFromKey(invasion != null ? invasion.from().key() : null)
                .invadeToKey(invasion != null ? invasion.to().key() : null)
                .drawSingleStarCards(cards.getDrawSingle())
                .drawDoubleStarCards(cards.getDrawDouble())
                .discardedSingleStarCards(cards.getDiscardSingle())
                .discardedDoubleStarCards(cards.getDiscardDouble())
                .winnerName(game.getWinner().map(Player::getName).orElse(null))
                .build();
    }
}
