package com.example.matrixgame.action.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Persona;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;
import com.example.matrixgame.game.repository.PersonaRepository;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.game.service.ActingUnit;
import com.example.matrixgame.game.service.ActingUnitCalculator;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;

/**
 * Proposes the NPC's scripted action once every human acting unit has had its turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NpcActionService {

    private final ActionRepository actionRepository;
    private final PlayerRepository playerRepository;
    private final PersonaRepository personaRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final GameValidator gameValidator;
    private final ActionService actionService;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    @Transactional
    public Optional<Action> checkAndProposeNpcAction(Long gameId) {
        Game game = gameValidator.getGame(gameId);
        if (game.getStatus() != GameStatus.ACTIVE || game.getCurrentPhase() != GamePhase.PROPOSAL
                || game.getCurrentRoundId() == null) {
            return Optional.empty();
        }

        Optional<Player> npc = playerRepository.findFirstByGameIdAndIsNpcTrueAndIsActiveTrue(gameId);
        if (npc.isEmpty()) {
            return Optional.empty();
        }
        Long roundId = game.getCurrentRoundId();
        if (actionRepository.existsByRoundIdAndInitiatorId(roundId, npc.get().getId())) {
            return Optional.empty();
        }

        List<Player> players = playerRepository.findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId);
        for (ActingUnit unit : actingUnitCalculator.groupActingUnits(players)) {
            if (!actionRepository.existsByRoundIdAndActingUnitKey(roundId, unit.key())) {
                return Optional.empty();
            }
        }

        Persona persona = personaRepository.findById(npc.get().getPersonaId())
                .orElseThrow(ErrorCode.PERSONA_NOT_FOUND::commonException);
        Action action = actionService.createAction(game, npc.get(), ActingUnitCalculator.actingUnitKey(npc.get()),
                persona.scriptedActionDescription(), persona.scriptedDesiredOutcome());
        actionService.openArgumentation(game, action);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", action.getId());
        data.put("sequenceNumber", action.getSequenceNumber());
        data.put("personaId", persona.getId());
        data.put("personaName", persona.getName());
        gameEventService.log(gameId, Player.NPC_USER_ID, GameEventType.NPC_ACTION_PROPOSED, data);
        gameNotifier.notify(NotificationKind.ACTION_PROPOSED, gameId, data);

        log.info("[npc] proposed: gameId={}, actionId={}, persona={}", gameId, action.getId(), persona.getName());
        return Optional.of(action);
    }
}
