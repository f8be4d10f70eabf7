package com.conquest.engine;

import com.conquest.exception.InvalidArgumentException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * The deck of star cards: a draw pile and a discard pile, each split into single and double star cards.
 * Cards are only counted; together with the cards held by players every card is always accounted for.
 */
@Slf4j
@Getter
public class CardEconomy {

    public static final int SINGLE_STAR_CARDS = 30;
    public static final int DOUBLE_STAR_CARDS = 12;

    /** Bonus armies for trading in 2 to 10 stars. */
    private static final int[] ARMIES_FOR_STARS = {2, 4, 7, 10, 13, 17, 21, 25, 30};

    @Getter(AccessLevel.NONE)
    private final RandomGenerator random;

    private int drawSingle = SINGLE_STAR_CARDS;
    private int drawDouble = DOUBLE_STAR_CARDS;
    private int discardSingle;
    private int discardDouble;

    CardEconomy(RandomGenerator random) {
        this.random = random;
    }

    /**
     * Number of bonus armies granted for trading in the given number of stars.
     *
     * @throws InvalidArgumentException if {@code stars} is outside 2..10
     */
    public static int armiesForStars(int stars) {
        if (stars < 2 || stars > 10) {
            throw new InvalidArgumentException("Stars must be between 2 and 10, got " + stars);
        }
        return ARMIES_FOR_STARS[stars - 2];
    }

    /**
     * Draw a card for the player. An exhausted draw pile is refilled from the discard pile;
     * if both are empty nothing is given.
     */
    void giveCard(Player player) {
        int total = drawSingle + drawDouble;
        if (total == 0) {
            drawSingle = discardSingle;
            drawDouble = discardDouble;
            discardSingle = discardDouble = 0;
            total = drawSingle + drawDouble;
            if (total == 0) {
                log.debug("No star cards left to give to {}", player.getName());
                return;
            }
            log.debug("Reshuffled {} discarded cards into the draw pile", total);
        }

        if (random.nextInt(total) < drawSingle) {
            drawSingle--;
            player.setSingleStarCards(player.getSingleStarCards() + 1);
        } else {
            drawDouble--;
            player.setDoubleStarCards(player.getDoubleStarCards() + 1);
        }
    }

    /**
     * Check that the player can trade in {@code stars}. An odd total can only be formed with at least
     * one single star card.
     */
    void checkTradeIn(Player player, int stars) {
        int maxStars = Math.min(10, player.getStars());
        if (stars < 2 || stars > maxStars) {
            throw new InvalidArgumentException("Cannot trade in " + stars + " stars; allowed range is 2.." + maxStars);
        }
        if (player.getSingleStarCards() == 0 && stars % 2 != 0) {
            throw new InvalidArgumentException("An odd number of stars requires at least one single star card");
        }
    }

    /**
     * Move the cards worth {@code stars} from the player to the discard pile, spending double star cards first.
     *
     * @return the bonus armies earned
     */
    int tradeIn(Player player, int stars) {
        checkTradeIn(player, stars);

        int doubleSpent = Math.min(stars / 2, player.getDoubleStarCards());
        int singleSpent = stars - doubleSpent * 2;

        player.setDoubleStarCards(player.getDoubleStarCards() - doubleSpent);
        player.setSingleStarCards(player.getSingleStarCards() - singleSpent);
        discardDouble += doubleSpent;
        discardSingle += singleSpent;

        return armiesForStars(stars);
    }

    /**
     * Hand every card of {@code from} to {@code to}.
     */
    void transferAll(Player from, Player to) {
        to.setSingleStarCards(to.getSingleStarCards() + from.getSingleStarCards());
        to.setDoubleStarCards(to.getDoubleStarCards() + from.getDoubleStarCards());
        from.setSingleStarCards(0);
        from.setDoubleStarCards(0);
    }
}
