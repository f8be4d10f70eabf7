package com.conquest.engine;

import com.conquest.exception.InvalidArgumentException;
import com.conquest.exception.InvalidStateException;
import com.conquest.exception.TerritoryNotFoundException;
import com.conquest.model.Geography;
import com.conquest.model.Territory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;

/**
 * The state of one game and the only way to change it.
 * <p>
 * Every operation belongs to a single {@link GameStage} and fails with {@link InvalidStateException} when
 * called in any other stage. Arguments are fully validated before anything is changed, so a failing call
 * leaves the game untouched. A game is not thread-safe; operations must be called by one caller in sequence.
 * <p>
 * Randomness (combat and card draws) comes exclusively from the generator passed to the constructor, so two
 * games created with equally seeded generators and fed the same operations evolve identically.
 */
@Slf4j
public class Game {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 6;

    private final Geography geography;
    private final List<Player> players;
    private final TerritoryStore territories;
    private final TurnManager turns;
    private final CardEconomy cards;
    private final CombatResolver combat;
    private final RegionBonusCalculator regionBonus;
    private final List<GameEventListener> listeners = new ArrayList<>();

    /** Events raised by the running operation, delivered once its state changes are complete. */
    private final List<Consumer<GameEventListener>> pendingEvents = new ArrayList<>();

    private GameStage stage = GameStage.INITIALIZING;

    /** Unclaimed territories left, in the claim stage. */
    private int unclaimedTerritories;

    /** Source and target of the capture being followed up, in the invade stage. */
    private int moveFrom = -1;
    private int moveTo = -1;

    /**
     * Create a game in the claim stage.
     *
     * @throws IllegalArgumentException if the geography is missing or empty, the player count is outside
     *                                  2..6, the generator is missing, or the players' initial armies cannot
     *                                  cover every territory
     */
    public Game(Geography geography, int playerCount, RandomGenerator random) {
        if (geography == null || geography.isEmpty()) {
            throw new IllegalArgumentException("A non-empty geography is required");
        }
        if (playerCount < MIN_PLAYERS || playerCount > MAX_PLAYERS) {
            throw new IllegalArgumentException("Player count must be between " + MIN_PLAYERS + " and "
                    + MAX_PLAYERS + ", got " + playerCount);
        }
        if (random == null) {
            throw new IllegalArgumentException("A random generator is required");
        }
        if (geography.size() > playerCount * initialArmies(playerCount)) {
            throw new IllegalArgumentException("Map has " + geography.size() + " territories but "
                    + playerCount + " players can only claim " + playerCount * initialArmies(playerCount));
        }

        this.geography = geography;
        List<Player> created = new ArrayList<>(playerCount);
        for (int i = 0; i < playerCount; i++) {
            created.add(new Player(i));
        }
        this.players = Collections.unmodifiableList(created);
        this.territories = new TerritoryStore(geography.size());
        this.turns = new TurnManager(players);
        this.cards = new CardEconomy(random);
        this.combat = new CombatResolver(random);
        this.regionBonus = new RegionBonusCalculator(geography, territories);

        setStage(GameStage.CLAIM);
        pendingEvents.clear();
        log.info("Created game with {} players on a map of {} territories", playerCount, geography.size());
    }

    /**
     * Number of initial armies each player receives: 40 for two players, five fewer for each extra player.
     */
    public static int initialArmies(int playerCount) {
        return 40 - (playerCount - 2) * 5;
    }

    /**
     * Bonus armies for trading in 2 to 10 stars.
     *
     * @throws InvalidArgumentException outside that range
     */
    public static int armiesForStars(int stars) {
        return CardEconomy.armiesForStars(stars);
    }

    // ── read accessors ──────────────────────────────────────────────────

    public GameStage getStage() {
        return stage;
    }

    public Geography getGeography() {
        return geography;
    }

    public List<Player> getPlayers() {
        return players;
    }

    /**
     * The player whose turn it is. Once the game is finished this is the winner.
     */
    public Player getCurrentPlayer() {
        return turns.current();
    }

    public CardEconomy getCards() {
        return cards;
    }

    public int getUnclaimedTerritoryCount() {
        return stage == GameStage.CLAIM ? unclaimedTerritories : 0;
    }

    public TerritoryInfo getTerritoryInfo(Territory territory) {
        return territories.info(indexOf(territory));
    }

    public Optional<PendingInvasion> getPendingInvasion() {
        if (stage != GameStage.INVADE) return Optional.empty();
        return Optional.of(new PendingInvasion(geography.territory(moveFrom), geography.territory(moveTo)));
    }

    public Optional<Player> getWinner() {
        if (stage != GameStage.FINISHED) return Optional.empty();
        return players.stream().filter(p -> !p.isDefeated()).findFirst();
    }

    public void addListener(GameEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GameEventListener listener) {
        listeners.remove(listener);
    }

    // ── operations ──────────────────────────────────────────────────────

    /**
     * Claim an unowned territory for the current player and pass the turn. Claiming the last territory
     * moves the game to the populate stage.
     */
    public void claim(Territory territory) {
        assertStage(GameStage.CLAIM);
        int index = indexOf(territory);
        if (territories.owner(index) != null) {
            throw new InvalidArgumentException("Territory " + territory.key() + " is already claimed");
        }

        Player player = turns.current();
        territories.setOwner(index, player);
        territories.setArmies(index, 1);
        player.setDraftArmies(player.getDraftArmies() - 1);
        onTerritoryGained(player);
        log.debug("{} claimed {}", player.getName(), territory.key());

        turns.advance();
        if (--unclaimedTerritories == 0) {
            setStage(GameStage.POPULATE);
            if (turns.current().getDraftArmies() == 0) {
                advancePopulation();
            }
        }
        firePendingEvents();
    }

    /**
     * Place one initial army on a territory of the current player and pass the turn to the next player with
     * armies left. When nobody has armies left the game moves to the draft stage.
     */
    public void populate(Territory territory) {
        assertStage(GameStage.POPULATE);
        int index = indexOf(territory);
        Player player = turns.current();
        assertOwned(index, territory);
        if (player.getDraftArmies() == 0) {
            throw new InvalidArgumentException(player.getName() + " has no armies left to place");
        }

        territories.addArmies(index, 1);
        player.setDraftArmies(player.getDraftArmies() - 1);
        log.debug("{} populated {}", player.getName(), territory.key());
        advancePopulation();
        firePendingEvents();
    }

    /**
     * Place reinforcements on a territory of the current player. Placing the last one moves the game to the
     * attack stage.
     */
    public void draft(Territory territory, int armies) {
        assertStage(GameStage.DRAFT);
        int index = indexOf(territory);
        Player player = turns.current();
        assertOwned(index, territory);
        if (armies < 0 || armies > player.getDraftArmies()) {
            throw new InvalidArgumentException("Cannot draft " + armies + " armies; "
                    + player.getDraftArmies() + " available");
        }

        territories.addArmies(index, armies);
        player.setDraftArmies(player.getDraftArmies() - armies);
        log.debug("{} drafted {} armies to {}", player.getName(), armies, territory.key());
        if (player.getDraftArmies() == 0) {
            setStage(GameStage.ATTACK);
        }
        firePendingEvents();
    }

    /**
     * Trade in star cards of the current player for bonus draft armies.
     */
    public void tradeInCards(int stars) {
        assertStage(GameStage.DRAFT);
        Player player = turns.current();
        int bonus = cards.tradeIn(player, stars);
        player.setDraftArmies(player.getDraftArmies() + bonus);
        log.debug("{} traded in {} stars for {} armies", player.getName(), stars, bonus);
    }

    /**
     * Attack {@code to} from {@code from} with 1 to 3 attackers against 1 or 2 defenders.
     * <p>
     * On capture the surviving attackers move in, the first capture of the turn earns a card, and a defender
     * who lost their last territory is defeated and hands over their cards. If armies remain that could
     * follow, the game moves to the invade stage. The game finishes when a single player remains.
     *
     * @return whether the territory was captured
     */
    public boolean attack(Territory from, Territory to, int attackers, int defenders) {
        assertStage(GameStage.ATTACK);
        int attackIndex = indexOf(from);
        int defendIndex = indexOf(to);
        Player attacker = turns.current();
        assertOwned(attackIndex, from);
        assertAdjacent(from, to);
        if (territories.isOwnedBy(defendIndex, attacker)) {
            throw new InvalidArgumentException("Cannot attack your own territory " + to.key());
        }
        combat.checkDeclaration(attackers, defenders, territories.armies(attackIndex), territories.armies(defendIndex));

        CombatOutcome outcome = combat.resolve(attackers, defenders);
        territories.addArmies(attackIndex, -outcome.attackerLosses());
        territories.addArmies(defendIndex, -outcome.defenderLosses());

        if (territories.armies(defendIndex) != 0) {
            return false;
        }

        Player defender = territories.owner(defendIndex);
        territories.move(attackIndex, defendIndex, outcome.survivors());
        territories.setOwner(defendIndex, attacker);
        onTerritoryGained(attacker);
        onTerritoryLost(defender);

        if (attacker.getCapturesThisTurn() == 0) {
            cards.giveCard(attacker);
        }
        attacker.setCapturesThisTurn(attacker.getCapturesThisTurn() + 1);
        log.info("{} captured {} from {}", attacker.getName(), to.key(), defender.getName());
        pendingEvents.add(l -> l.onTerritoryCaptured(this, from, to, attacker, defender));

        if (defender.isDefeated()) {
            cards.transferAll(defender, attacker);
            log.info("{} was defeated by {}", defender.getName(), attacker.getName());
            pendingEvents.add(l -> l.onPlayerDefeated(this, defender, attacker));
        }

        if (remainingPlayers() == 1) {
            setStage(GameStage.FINISHED);
        } else if (territories.armies(attackIndex) > 1) {
            moveFrom = attackIndex;
            moveTo = defendIndex;
            setStage(GameStage.INVADE);
        }
        firePendingEvents();
        return true;
    }

    /**
     * Move additional armies from the attacking territory into the territory just captured and return to
     * the attack stage.
     */
    public void invade(int armies) {
        assertStage(GameStage.INVADE);
        if (armies < 0 || armies >= territories.armies(moveFrom)) {
            throw new InvalidArgumentException("Cannot invade with " + armies + " armies; "
                    + (territories.armies(moveFrom) - 1) + " can move");
        }

        territories.move(moveFrom, moveTo, armies);
        log.debug("{} moved {} armies into {}", turns.current().getName(), armies,
                geography.territory(moveTo).key());
        endInvasion();
        firePendingEvents();
    }

    /**
     * Move armies between two adjacent territories of the current player, then pass the turn.
     */
    public void maneuver(Territory from, Territory to, int armies) {
        assertStage(GameStage.MANEUVER);
        int fromIndex = indexOf(from);
        int toIndex = indexOf(to);
        assertOwned(fromIndex, from);
        assertOwned(toIndex, to);
        if (armies < 0 || armies >= territories.armies(fromIndex)) {
            throw new InvalidArgumentException("Cannot move " + armies + " armies; "
                    + (territories.armies(fromIndex) - 1) + " can move");
        }
        assertAdjacent(from, to);

        territories.move(fromIndex, toIndex, armies);
        log.debug("{} maneuvered {} armies from {} to {}", turns.current().getName(), armies, from.key(), to.key());
        endTurn();
        firePendingEvents();
    }

    /**
     * Skip the current stage: attack goes to maneuver, maneuver ends the turn and invade returns to attack.
     */
    public void skip() {
        switch (stage) {
            case ATTACK -> setStage(GameStage.MANEUVER);
            case MANEUVER -> endTurn();
            case INVADE -> endInvasion();
            default -> throw new InvalidStateException("The " + stage + " stage cannot be skipped");
        }
        firePendingEvents();
    }

    // ── internals ───────────────────────────────────────────────────────

    private void setStage(GameStage next) {
        if (next == stage) return;
        GameStage previous = stage;
        stage = next;
        onStageEntered();
        log.debug("Stage {} -> {} (current player: {})", previous, next, turns.current().getName());
        if (next == GameStage.FINISHED) {
            log.info("Game finished, {} wins", turns.current().getName());
        }
        pendingEvents.add(l -> l.onStageChanged(this, previous, next));
    }

    /**
     * Deliver the events of the finished operation in the order they were raised. A listener exception
     * reaches the caller and the remaining events are dropped; the game state is already settled.
     */
    private void firePendingEvents() {
        List<Consumer<GameEventListener>> events = List.copyOf(pendingEvents);
        pendingEvents.clear();
        for (Consumer<GameEventListener> event : events) {
            for (GameEventListener listener : List.copyOf(listeners)) {
                event.accept(listener);
            }
        }
    }

    private void onStageEntered() {
        switch (stage) {
            case CLAIM -> {
                unclaimedTerritories = territories.size();
                int initial = initialArmies(players.size());
                players.forEach(p -> p.setDraftArmies(initial));
            }
            case DRAFT -> {
                Player player = turns.current();
                int granted = Math.max(3, player.getOwnedTerritoryCount() / 3) + player.getContinentBonus();
                player.setDraftArmies(player.getDraftArmies() + granted);
            }
            default -> {
            }
        }
    }

    /**
     * Pass the turn to the next player with initial armies left. The current player keeps the turn when they
     * are the only one with armies left; when nobody has any the next player starts drafting.
     */
    private void advancePopulation() {
        if (turns.advance(p -> p.getDraftArmies() > 0)) return;
        if (turns.current().getDraftArmies() > 0) return;
        turns.advance();
        setStage(GameStage.DRAFT);
    }

    private void endInvasion() {
        moveFrom = moveTo = -1;
        setStage(GameStage.ATTACK);
    }

    private void endTurn() {
        turns.advance();
        setStage(GameStage.DRAFT);
    }

    private void onTerritoryGained(Player player) {
        player.setOwnedTerritoryCount(player.getOwnedTerritoryCount() + 1);
        regionBonus.recalculate(player);
    }

    private void onTerritoryLost(Player player) {
        player.setOwnedTerritoryCount(player.getOwnedTerritoryCount() - 1);
        if (player.getOwnedTerritoryCount() == 0) {
            player.defeat();
        }
        regionBonus.recalculate(player);
    }

    private long remainingPlayers() {
        return players.stream().filter(p -> !p.isDefeated()).count();
    }

    private int indexOf(Territory territory) {
        if (!geography.contains(territory)) {
            throw new TerritoryNotFoundException(territory);
        }
        return territory.index();
    }

    private void assertStage(GameStage expected) {
        if (stage != expected) {
            throw new InvalidStateException("The game is not in the " + expected + " stage (current: " + stage + ")");
        }
    }

    private void assertOwned(int index, Territory territory) {
        if (!territories.isOwnedBy(index, turns.current())) {
            throw new InvalidArgumentException("Territory " + territory.key() + " does not belong to "
                    + turns.current().getName());
        }
    }

    private void assertAdjacent(Territory a, Territory b) {
        if (!geography.areAdjacent(a, b)) {
            throw new InvalidArgumentException("Territories " + a.key() + " and " + b.key() + " are not adjacent");
        }
    }
}
