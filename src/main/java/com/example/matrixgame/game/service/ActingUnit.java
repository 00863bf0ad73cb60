package com.example.matrixgame.game.service;

import java.util.Collection;
import java.util.List;

import com.example.matrixgame.game.domain.entity.Player;

/**
 * One independently-acting entity in a round: a solo player, or every active
 * member of a persona counted once.
 *
 * @param key       stable key, {@code persona:<id>} or {@code player:<id>}
 * @param personaId persona shared by the members, null for a solo player
 * @param members   active members in join order
 */
public record ActingUnit(String key, Long personaId, List<Player> members) {

    public ActingUnit {
        members = List.copyOf(members);
    }

    /**
     * The persona lead when there is one, otherwise the earliest member.
     */
    public Player representative() {
        return members.stream()
                .filter(Player::isPersonaLead)
                .findFirst()
                .orElse(members.get(0));
    }

    public List<Long> memberIds() {
        return members.stream().map(Player::getId).toList();
    }

    public boolean contains(Long playerId) {
        return members.stream().anyMatch(member -> member.getId().equals(playerId));
    }

    public boolean anyMemberIn(Collection<Long> playerIds) {
        return members.stream().anyMatch(member -> playerIds.contains(member.getId()));
    }

    public boolean isShared() {
        return members.size() > 1;
    }
}
