package com.example.matrixgame.support;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.dto.request.ProposeActionRequest;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.ArgumentRepository;
import com.example.matrixgame.action.repository.VoteRepository;
import com.example.matrixgame.action.service.ActionService;
import com.example.matrixgame.action.service.ArbiterService;
import com.example.matrixgame.action.service.HostOverrideService;
import com.example.matrixgame.action.service.NarrationService;
import com.example.matrixgame.action.service.ResolutionService;
import com.example.matrixgame.action.service.VoteService;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameEvent;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Persona;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.dto.request.CreateGameRequest;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.game.repository.RoundRepository;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameService;
import com.example.matrixgame.game.service.RoundService;

/**
 * Shared fixtures for tests that drive a game through the services against the in-memory database.
 * Every game gets fresh user ids, so tests never see each other's rows.
 */
@SpringBootTest
public abstract class IntegrationTestSupport {

    @Autowired
    protected GameService gameService;

    @Autowired
    protected RoundService roundService;

    @Autowired
    protected GameEventService gameEventService;

    @Autowired
    protected ActionService actionService;

    @Autowired
    protected VoteService voteService;

    @Autowired
    protected NarrationService narrationService;

    @Autowired
    protected ResolutionService resolutionService;

    @Autowired
    protected HostOverrideService hostOverrideService;

    @Autowired
    protected ArbiterService arbiterService;

    @Autowired
    protected GameRepository gameRepository;

    @Autowired
    protected PlayerRepository playerRepository;

    @Autowired
    protected RoundRepository roundRepository;

    @Autowired
    protected ActionRepository actionRepository;

    @Autowired
    protected ArgumentRepository argumentRepository;

    @Autowired
    protected VoteRepository voteRepository;

    @Autowired
    protected TransactionTemplate transactionTemplate;

    protected static String newUserId(String name) {
        return name + "-" + UUID.randomUUID();
    }

    protected static CreateGameRequest.PersonaRequest persona(String name) {
        return new CreateGameRequest.PersonaRequest(name, name + " faction", false, null, null);
    }

    protected static CreateGameRequest.PersonaRequest npcPersona(String name, String action, String outcome) {
        return new CreateGameRequest.PersonaRequest(name, name + " faction", true, action, outcome);
    }

    // ================== game setup ================== //

    protected Game createGame(String hostUserId, CreateGameRequest.PersonaRequest... personas) {
        return gameService.createGame(hostUserId, new CreateGameRequest(
                "Crisis " + UUID.randomUUID(), "integration test", "host", null, Arrays.asList(personas)));
    }

    /**
     * Applies settings straight on the row, bypassing the host checks of the settings endpoint.
     */
    protected void changeSettings(Long gameId, Consumer<GameSettings> change) {
        Game game = gameRepository.findById(gameId).orElseThrow();
        change.accept(game.getSettings());
        gameRepository.saveAndFlush(game);
    }

    protected Player join(Long gameId, String userId) {
        return gameService.joinGame(gameId, userId, userId.substring(0, userId.indexOf('-')), null);
    }

    protected Player join(Long gameId, String userId, Long personaId) {
        return gameService.joinGame(gameId, userId, userId.substring(0, userId.indexOf('-')), personaId);
    }

    protected Long personaId(Long gameId, String name) {
        return gameService.getPersonas(gameId).stream()
                .filter(persona -> persona.getName().equals(name))
                .map(Persona::getId)
                .findFirst()
                .orElseThrow();
    }

    // ================== action helpers ================== //

    protected Action propose(Long gameId, String userId) {
        return actionService.propose(gameId, userId, new ProposeActionRequest(
                "Blockade the strait", "Supply lines are cut", List.of("Our navy outnumbers theirs")));
    }

    /**
     * Moves the start of the current phase into the past so the sweep sees it as stale.
     */
    protected void ageCurrentPhase(Long gameId, int hours) {
        GamePhase current = phase(gameId);
        transactionTemplate.executeWithoutResult(status ->
                gameRepository.resetPhaseStartedAt(gameId, current, LocalDateTime.now().minusHours(hours)));
    }

    // ================== reads ================== //

    protected Game game(Long gameId) {
        return gameRepository.findById(gameId).orElseThrow();
    }

    protected Action action(Long actionId) {
        return actionRepository.findById(actionId).orElseThrow();
    }

    protected Round currentRound(Long gameId) {
        return roundRepository.findById(game(gameId).getCurrentRoundId()).orElseThrow();
    }

    protected GamePhase phase(Long gameId) {
        return game(gameId).getCurrentPhase();
    }

    protected Long playerId(Long gameId, String userId) {
        return playerRepository.findByGameIdAndUserId(gameId, userId).orElseThrow().getId();
    }

    protected List<GameEvent> events(Long gameId, GameEventType type) {
        return gameEventService.getEvents(gameId, type);
    }

    /**
     * Ids stored in event JSON come back as Integer or Long depending on size.
     */
    protected static List<Long> ids(Object jsonList) {
        return ((List<?>) jsonList).stream()
                .map(value -> ((Number) value).longValue())
                .toList();
    }
}
