package com.example.matrixgame.game.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Player;

/**
 * Turns a roster into acting units. Every "is this sub-phase done" question in
 * the lifecycle is answered from here so that proposal uniqueness, argumentation
 * and voting all agree on what a unit is.
 * <p>
 * Only active, non-NPC players are ever counted.
 */
@Component
public class ActingUnitCalculator {

    public static String actingUnitKey(Player player) {
        return player.getPersonaId() != null
                ? "persona:" + player.getPersonaId()
                : "player:" + player.getId();
    }

    public List<ActingUnit> groupActingUnits(Collection<Player> players) {
        Map<String, List<Player>> grouped = new LinkedHashMap<>();
        for (Player player : players) {
            if (!player.isActive() || player.isNpc()) {
                continue;
            }
            grouped.computeIfAbsent(actingUnitKey(player), key -> new ArrayList<>()).add(player);
        }

        List<ActingUnit> units = new ArrayList<>(grouped.size());
        grouped.forEach((key, members) -> units.add(new ActingUnit(key, members.get(0).getPersonaId(), members)));
        return units;
    }

    public int countActingUnits(Collection<Player> players) {
        return groupActingUnits(players).size();
    }

    public List<Long> getPersonaMemberIds(Collection<Player> players, Long personaId) {
        if (personaId == null) {
            return List.of();
        }
        return players.stream()
                .filter(Player::isActive)
                .filter(Player::isHuman)
                .filter(player -> personaId.equals(player.getPersonaId()))
                .map(Player::getId)
                .toList();
    }

    /**
     * The unit the player acts in. NPC and inactive players form a unit of their own.
     */
    public ActingUnit unitOf(Player player, Collection<Player> players) {
        if (player.isActive() && player.isHuman()) {
            String key = actingUnitKey(player);
            for (ActingUnit unit : groupActingUnits(players)) {
                if (unit.key().equals(key)) {
                    return unit;
                }
            }
        }
        return new ActingUnit(actingUnitKey(player), player.getPersonaId(), List.of(player));
    }

    /**
     * Votes needed before an action resolves. Under one-vote-per-persona a shared
     * persona votes once; otherwise every active human votes.
     */
    public int votingThreshold(Collection<Player> players, GameSettings settings) {
        if (settings.isOnePerPersonaVoting()) {
            return countActingUnits(players);
        }
        return (int) players.stream()
                .filter(Player::isActive)
                .filter(Player::isHuman)
                .count();
    }

    /**
     * Actions a round needs: every human unit plus the NPC when one is playing.
     */
    public int totalActionsRequired(Collection<Player> players) {
        boolean npcPresent = players.stream().anyMatch(player -> player.isActive() && player.isNpc());
        return countActingUnits(players) + (npcPresent ? 1 : 0);
    }

    public long countCompletedUnits(Collection<Player> players, Collection<Long> doneIds) {
        return groupActingUnits(players).stream()
                .filter(unit -> unit.anyMemberIn(doneIds))
                .count();
    }

    public List<ActingUnit> pendingUnits(Collection<Player> players, Collection<Long> doneIds) {
        return groupActingUnits(players).stream()
                .filter(unit -> !unit.anyMemberIn(doneIds))
                .toList();
    }
}
