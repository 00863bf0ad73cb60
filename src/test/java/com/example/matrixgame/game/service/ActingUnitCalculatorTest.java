package com.example.matrixgame.game.service;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.PersonaVotingMode;

import static org.assertj.core.api.Assertions.assertThat;

class ActingUnitCalculatorTest {

    private final ActingUnitCalculator calculator = new ActingUnitCalculator();

    private static Player player(long id, Long personaId, boolean lead) {
        return Player.builder()
                .id(id)
                .gameId(1L)
                .userId("user-" + id)
                .playerName("player" + id)
                .personaId(personaId)
                .isPersonaLead(lead)
                .build();
    }

    private static Player npc(long id, long personaId) {
        return Player.builder()
                .id(id)
                .gameId(1L)
                .userId(Player.NPC_USER_ID)
                .personaId(personaId)
                .isPersonaLead(true)
                .isNpc(true)
                .build();
    }

    @Test
    @DisplayName("shared persona members form one unit, solo players one each")
    void groupsByPersona() {
        Player a = player(1, 10L, true);
        Player b = player(2, 10L, false);
        Player c = player(3, null, false);

        List<ActingUnit> units = calculator.groupActingUnits(List.of(a, b, c));

        assertThat(units).hasSize(2);
        assertThat(units.get(0).key()).isEqualTo("persona:10");
        assertThat(units.get(0).memberIds()).containsExactly(1L, 2L);
        assertThat(units.get(0).representative()).isSameAs(a);
        assertThat(units.get(1).key()).isEqualTo("player:3");
    }

    @Test
    @DisplayName("NPC and inactive players are never counted")
    void excludesNpcAndInactive() {
        Player a = player(1, null, false);
        Player gone = player(2, null, false);
        gone.setActive(false);

        assertThat(calculator.countActingUnits(List.of(a, gone, npc(3, 99)))).isEqualTo(1);
    }

    @Test
    @DisplayName("a round needs one action per human unit plus the NPC")
    void totalActionsRequired() {
        List<Player> players = List.of(player(1, 10L, true), player(2, 10L, false), player(3, null, false));

        assertThat(calculator.totalActionsRequired(players)).isEqualTo(2);
        assertThat(calculator.totalActionsRequired(List.of(players.get(0), players.get(2), npc(4, 99))))
                .isEqualTo(3);
    }

    @Test
    @DisplayName("one-per-persona voting counts units, each-member counts humans")
    void votingThreshold() {
        List<Player> players = List.of(player(1, 10L, true), player(2, 10L, false), player(3, null, false));
        GameSettings settings = new GameSettings();
        settings.setAllowSharedPersonas(true);

        settings.setSharedPersonaVoting(PersonaVotingMode.ONE_PER_PERSONA);
        assertThat(calculator.votingThreshold(players, settings)).isEqualTo(2);

        settings.setSharedPersonaVoting(PersonaVotingMode.EACH_MEMBER);
        assertThat(calculator.votingThreshold(players, settings)).isEqualTo(3);
    }

    @Test
    @DisplayName("one-per-persona is ignored while sharing is off")
    void votingThresholdWithoutSharing() {
        List<Player> players = List.of(player(1, 10L, true), player(2, null, false));
        GameSettings settings = new GameSettings();
        settings.setSharedPersonaVoting(PersonaVotingMode.ONE_PER_PERSONA);

        assertThat(calculator.votingThreshold(players, settings)).isEqualTo(2);
    }

    @Test
    @DisplayName("a unit is done as soon as any member is")
    void completedAndPendingUnits() {
        List<Player> players = List.of(player(1, 10L, true), player(2, 10L, false), player(3, null, false));

        assertThat(calculator.countCompletedUnits(players, Set.of(2L))).isEqualTo(1);
        assertThat(calculator.pendingUnits(players, Set.of(2L)))
                .extracting(ActingUnit::key)
                .containsExactly("player:3");
    }

    @Test
    @DisplayName("the representative falls back to the earliest member without a lead")
    void representativeWithoutLead() {
        Player b = player(2, 10L, false);
        Player c = player(3, 10L, false);

        ActingUnit unit = calculator.unitOf(c, List.of(b, c));

        assertThat(unit.isShared()).isTrue();
        assertThat(unit.representative()).isSameAs(b);
        assertThat(calculator.getPersonaMemberIds(List.of(b, c), 10L)).containsExactly(2L, 3L);
    }
}
