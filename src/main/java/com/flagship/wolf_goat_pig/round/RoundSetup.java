package com.flagship.wolf_goat_pig.round;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the engine needs to start a round: the players in their initial
 * tee order and the par of every hole.
 *
 * Invariant: exactly {@link #PLAYER_COUNT} distinct players, one par per hole.
 */
@Value
public class RoundSetup {

    public static final int PLAYER_COUNT = 4;
    private static final int MIN_PAR = 3;
    private static final int MAX_PAR = 6;

    List<Player> players;
    List<Integer> pars;

    private RoundSetup(List<Player> players, List<Integer> pars) {
        this.players = List.copyOf(players);
        this.pars = List.copyOf(pars);
    }

    /**
     * Creates a setup, assigning tee-order indexes from the order of the ids.
     *
     * @throws IllegalArgumentException if the player list or pars are invalid
     */
    public static RoundSetup of(List<String> playerIds, List<Integer> pars) {
        Objects.requireNonNull(playerIds, "playerIds");
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < playerIds.size(); i++) {
            String id = playerIds.get(i);
            players.add(new Player(PlayerId.of(id), id, i, BigDecimal.ZERO));
        }
        return withPlayers(players, pars);
    }

    /**
     * Creates a setup from fully described players. Tee-order indexes must be
     * 0..3 and match list order.
     */
    public static RoundSetup withPlayers(List<Player> players, List<Integer> pars) {
        Objects.requireNonNull(players, "players");
        Objects.requireNonNull(pars, "pars");
        if (players.size() != PLAYER_COUNT) {
            throw new IllegalArgumentException(
                String.format("A round needs exactly %d players, got %d", PLAYER_COUNT, players.size()));
        }
        Set<PlayerId> seen = new HashSet<>();
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            if (!seen.add(player.getId())) {
                throw new IllegalArgumentException("Duplicate player: " + player.getId());
            }
            if (player.getTeeOrderIndex() != i) {
                throw new IllegalArgumentException(
                    String.format("Player %s has tee order %d but is seated at %d",
                        player.getId(), player.getTeeOrderIndex(), i));
            }
        }
        if (pars.isEmpty()) {
            throw new IllegalArgumentException("A round needs at least one hole");
        }
        for (int i = 0; i < pars.size(); i++) {
            Integer par = pars.get(i);
            if (par == null || par < MIN_PAR || par > MAX_PAR) {
                throw new IllegalArgumentException(
                    String.format("Hole %d has invalid par %s", i + 1, par));
            }
        }
        return new RoundSetup(players, pars);
    }

    public int holeCount() {
        return pars.size();
    }

    public List<PlayerId> playerIds() {
        return players.stream().map(Player::getId).toList();
    }

    public Optional<Player> findPlayer(PlayerId id) {
        return players.stream().filter(p -> p.getId().equals(id)).findFirst();
    }

    public boolean hasPlayer(PlayerId id) {
        return findPlayer(id).isPresent();
    }

    public int teeOrderIndexOf(PlayerId id) {
        return findPlayer(id)
            .map(Player::getTeeOrderIndex)
            .orElseThrow(() -> new IllegalArgumentException("Player not in round: " + id));
    }
}
