package com.example.matrixgame.action.service;

import java.util.List;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.resolution.ResolutionMethod;

/**
 * Lookups and guards for action-scoped operations.
 */
@Component
@RequiredArgsConstructor
public class ActionValidator {

    private final ActionRepository actionRepository;
    private final PlayerRepository playerRepository;

    public Action getAction(Long actionId) {
        return actionRepository.findById(actionId)
                .orElseThrow(ErrorCode.ACTION_NOT_FOUND::commonException);
    }

    /**
     * Loads the action with a row lock held until the surrounding transaction ends.
     */
    public Action lockAction(Long actionId) {
        return actionRepository.findByIdForUpdate(actionId)
                .orElseThrow(ErrorCode.ACTION_NOT_FOUND::commonException);
    }

    public void requireStatus(Action action, ActionStatus status) {
        if (action.getStatus() == status) {
            return;
        }
        ErrorCode errorCode = switch (status) {
            case ARGUING -> ErrorCode.ACTION_NOT_ARGUING;
            case VOTING -> ErrorCode.ACTION_NOT_VOTING;
            case RESOLVED, NARRATED -> ErrorCode.ACTION_NOT_RESOLVED;
        };
        throw errorCode.commonException();
    }

    public List<Player> activePlayers(Long gameId) {
        return playerRepository.findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId);
    }

    public Player getInitiator(Action action) {
        return playerRepository.findById(action.getInitiatorId())
                .orElseThrow(ErrorCode.PLAYER_NOT_FOUND::commonException);
    }

    public ResolutionMethod resolutionMethod(Game game) {
        return ResolutionMethod.fromId(game.getSettings().getResolutionMethod());
    }

    /**
     * The game's action in flight must be this one.
     */
    public void requireCurrentAction(Game game, Action action) {
        if (!action.getId().equals(game.getCurrentActionId())) {
            throw ErrorCode.WRONG_PHASE.commonException("Action " + action.getId() + " is not the current action");
        }
    }
}
