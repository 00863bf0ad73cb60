package com.example.matrixgame.timeout.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.timeout.dto.SweepResult;
import com.example.matrixgame.timeout.dto.TimeoutResult;
import com.example.matrixgame.timeout.dto.TimeoutStatus;
import com.example.matrixgame.timeout.handler.PhaseTimeoutHandlerFactory;
import com.example.matrixgame.timeout.handler.VotingTimeoutHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeoutServiceTest {

    @Mock
    private GameRepository gameRepository;

    @Mock
    private GameValidator gameValidator;

    @Mock
    private GameEventService gameEventService;

    @Mock
    private PhaseTimeoutHandlerFactory handlerFactory;

    @Mock
    private GameNotifier gameNotifier;

    @Mock
    private VotingTimeoutHandler votingTimeoutHandler;

    @InjectMocks
    private TimeoutService timeoutService;

    private static Game votingGame(long id, int votingTimeoutHours, LocalDateTime phaseStartedAt) {
        GameSettings settings = new GameSettings();
        settings.setVotingTimeoutHours(votingTimeoutHours);
        return Game.builder()
                .id(id)
                .status(GameStatus.ACTIVE)
                .currentPhase(GamePhase.VOTING)
                .phaseStartedAt(phaseStartedAt)
                .currentActionId(100L + id)
                .settings(settings)
                .build();
    }

    @Test
    @DisplayName("infinite and not-yet-elapsed timeouts are left alone")
    void skipsUnexpiredGames() {
        Game infinite = votingGame(1, GameSettings.INFINITE_TIMEOUT, LocalDateTime.now().minusDays(30));
        Game fresh = votingGame(2, 24, LocalDateTime.now().minusHours(1));
        when(gameRepository.findAllByStatusAndDeletedAtIsNullAndCurrentPhaseInAndPhaseStartedAtIsNotNull(
                any(GameStatus.class), anyCollection())).thenReturn(List.of(infinite, fresh));

        SweepResult result = timeoutService.processAllTimeouts();

        assertThat(result.gamesChecked()).isEqualTo(2);
        assertThat(result.processed()).isEmpty();
        assertThat(result.failures()).isEmpty();
        verify(handlerFactory, never()).getHandler(any());
    }

    @Test
    @DisplayName("an expired phase goes to its handler")
    void dispatchesExpiredGame() {
        Game expired = votingGame(3, 2, LocalDateTime.now().minusHours(3));
        TimeoutResult handled = new TimeoutResult(3L, 103L, GamePhase.VOTING, List.of(7L), GamePhase.RESOLUTION, false);
        when(gameRepository.findAllByStatusAndDeletedAtIsNullAndCurrentPhaseInAndPhaseStartedAtIsNotNull(
                any(GameStatus.class), anyCollection())).thenReturn(List.of(expired));
        when(handlerFactory.getHandler(GamePhase.VOTING)).thenReturn(Optional.of(votingTimeoutHandler));
        when(votingTimeoutHandler.handle(expired)).thenReturn(Optional.of(handled));

        SweepResult result = timeoutService.processAllTimeouts();

        assertThat(result.processed()).containsExactly(handled);
    }

    @Test
    @DisplayName("losing a race to a player is not a failure; other errors are collected and the sweep goes on")
    void failuresDoNotAbortSweep() {
        Game raced = votingGame(4, 0, LocalDateTime.now().minusMinutes(5));
        Game broken = votingGame(5, 0, LocalDateTime.now().minusMinutes(5));
        Game fine = votingGame(6, 0, LocalDateTime.now().minusMinutes(5));
        TimeoutResult handled = new TimeoutResult(6L, 106L, GamePhase.VOTING, List.of(), GamePhase.RESOLUTION, false);
        when(gameRepository.findAllByStatusAndDeletedAtIsNullAndCurrentPhaseInAndPhaseStartedAtIsNotNull(
                any(GameStatus.class), anyCollection())).thenReturn(List.of(raced, broken, fine));
        when(handlerFactory.getHandler(GamePhase.VOTING)).thenReturn(Optional.of(votingTimeoutHandler));
        when(votingTimeoutHandler.handle(raced)).thenThrow(ErrorCode.ALREADY_RESOLVED.commonException());
        when(votingTimeoutHandler.handle(broken)).thenThrow(new IllegalStateException("boom"));
        when(votingTimeoutHandler.handle(fine)).thenReturn(Optional.of(handled));

        SweepResult result = timeoutService.processAllTimeouts();

        assertThat(result.processed()).containsExactly(handled);
        assertThat(result.failures()).extracting(SweepResult.SweepFailure::gameId).containsExactly(5L);
    }

    @Test
    @DisplayName("a uniqueness violation from a player's concurrent write counts as a lost race")
    void uniquenessViolationIsNotAFailure() {
        // given
        Game raced = votingGame(9, 0, LocalDateTime.now().minusMinutes(5));
        when(gameRepository.findAllByStatusAndDeletedAtIsNullAndCurrentPhaseInAndPhaseStartedAtIsNotNull(
                any(GameStatus.class), anyCollection())).thenReturn(List.of(raced));
        when(handlerFactory.getHandler(GamePhase.VOTING)).thenReturn(Optional.of(votingTimeoutHandler));
        when(votingTimeoutHandler.handle(raced))
                .thenThrow(new DataIntegrityViolationException("uk_vote_action_player"));

        // when
        SweepResult result = timeoutService.processAllTimeouts();

        // then
        assertThat(result.gamesChecked()).isEqualTo(1);
        assertThat(result.processed()).isEmpty();
        assertThat(result.failures()).isEmpty();
    }

    @Test
    @DisplayName("status reports the deadline of a finite phase")
    void timeoutStatus() {
        LocalDateTime started = LocalDateTime.now().minusHours(1);
        when(gameValidator.getGame(7L)).thenReturn(votingGame(7, 4, started));

        TimeoutStatus status = timeoutService.getTimeoutStatus(7L);

        assertThat(status.isInfinite()).isFalse();
        assertThat(status.deadline()).isEqualTo(started.plusHours(4));
        assertThat(status.remainingMillis()).isPositive();
        assertThat(status.isExpired()).isFalse();
    }

    @Test
    void infiniteTimeoutStatus() {
        when(gameValidator.getGame(8L)).thenReturn(votingGame(8, GameSettings.INFINITE_TIMEOUT, LocalDateTime.now()));

        TimeoutStatus status = timeoutService.getTimeoutStatus(8L);

        assertThat(status.isInfinite()).isTrue();
        assertThat(status.deadline()).isNull();
        assertThat(status.isExpired()).isFalse();
    }
}
