package com.example.matrixgame.game.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.service.ActionFlowService;
import com.example.matrixgame.action.service.NpcActionService;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Persona;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameRole;
import com.example.matrixgame.game.domain.state.GameStatus;
import com.example.matrixgame.game.dto.request.CreateGameRequest;
import com.example.matrixgame.game.dto.request.GameSettingsRequest;
import com.example.matrixgame.game.dto.response.GameResponse;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.repository.PersonaRepository;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;

/**
 * Lobby and roster management: everything that happens around the action lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameRepository gameRepository;
    private final PlayerRepository playerRepository;
    private final PersonaRepository personaRepository;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final RoundService roundService;
    private final GameEventService gameEventService;
    private final ActionFlowService actionFlowService;
    private final NpcActionService npcActionService;
    private final GameNotifier gameNotifier;

    // ================== create / read ================== //

    @Transactional
    public Game createGame(String userId, CreateGameRequest request) {
        GameSettings settings = request.settings() != null
                ? request.settings().applyTo(new GameSettings())
                : new GameSettings();
        gameValidator.validateSettings(settings);

        List<CreateGameRequest.PersonaRequest> personas = request.personas() != null ? request.personas() : List.of();
        if (personas.stream().filter(CreateGameRequest.PersonaRequest::isNpc).count() > 1) {
            throw ErrorCode.MULTIPLE_NPC_PERSONAS.commonException();
        }

        Game game = gameRepository.save(Game.createNew(request.name(), request.description(), userId, settings));
        for (CreateGameRequest.PersonaRequest persona : personas) {
            personaRepository.save(toPersona(game.getId(), persona));
        }
        playerRepository.save(Player.builder()
                .gameId(game.getId())
                .userId(userId)
                .playerName(request.hostName())
                .isHost(true)
                .joinedAt(LocalDateTime.now())
                .build());

        gameEventService.log(game.getId(), userId, GameEventType.GAME_CREATED,
                Map.of("name", game.getName(), "personaCount", personas.size()));
        log.info("[game] created: gameId={}, host={}", game.getId(), userId);
        return game;
    }

    @Transactional(readOnly = true)
    public GameResponse getGame(Long gameId) {
        Game game = gameValidator.getGame(gameId);
        return GameResponse.from(game,
                playerRepository.findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId),
                personaRepository.findAllByGameIdOrderByIdAsc(gameId));
    }

    @Transactional(readOnly = true)
    public List<Game> listGames(String userId) {
        List<Long> gameIds = playerRepository.findAllByUserIdAndIsActiveTrue(userId).stream()
                .map(Player::getGameId)
                .distinct()
                .toList();
        if (gameIds.isEmpty()) {
            return List.of();
        }
        return gameRepository.findAllByIdInAndDeletedAtIsNullOrderByCreatedAtDesc(gameIds);
    }

    @Transactional(readOnly = true)
    public List<Player> getPlayers(Long gameId) {
        gameValidator.getGame(gameId);
        return playerRepository.findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId);
    }

    @Transactional(readOnly = true)
    public List<Persona> getPersonas(Long gameId) {
        gameValidator.getGame(gameId);
        return personaRepository.findAllByGameIdOrderByIdAsc(gameId);
    }

    // ================== lobby ================== //

    @Transactional
    public Player joinGame(Long gameId, String userId, String playerName, Long personaId) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireLobby(game);

        Optional<Player> existing = playerRepository.findByGameIdAndUserId(gameId, userId);
        if (existing.isPresent() && existing.get().isActive()) {
            throw ErrorCode.CONFLICT.commonException("Already a member of this game");
        }

        Player player = existing.orElseGet(() -> Player.builder()
                .gameId(gameId)
                .userId(userId)
                .build());
        boolean rejoin = existing.isPresent();
        player.setPlayerName(playerName);
        player.setActive(true);
        player.setPersonaId(null);
        player.setPersonaLead(false);
        player.setJoinedAt(LocalDateTime.now());
        if (personaId != null) {
            claimPersona(game, player, personaId);
        }
        player = playerRepository.saveAndFlush(player);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("playerId", player.getId());
        data.put("playerName", playerName);
        data.put("personaId", player.getPersonaId());
        gameEventService.log(gameId, userId, rejoin ? GameEventType.PLAYER_REJOINED : GameEventType.PLAYER_JOINED, data);
        gameNotifier.notify(NotificationKind.PLAYER_JOINED, gameId, data);

        log.info("[game] joined: gameId={}, userId={}, rejoin={}", gameId, userId, rejoin);
        return player;
    }

    /**
     * Soft leave. During an active game the pending sub-phase is re-checked against the smaller roster.
     */
    @Transactional
    public void leaveGame(Long gameId, String userId) {
        Game game = gameValidator.getGame(gameId);
        Player player = gameValidator.requireMember(gameId, userId);
        if (player.isHost()) {
            throw ErrorCode.HOST_CANNOT_LEAVE.commonException();
        }

        releasePersona(player);
        player.setActive(false);
        playerRepository.saveAndFlush(player);

        gameEventService.log(gameId, userId, GameEventType.PLAYER_LEFT, Map.of("playerId", player.getId()));
        gameNotifier.notify(NotificationKind.PLAYER_LEFT, gameId, Map.of("playerId", player.getId()));
        log.info("[game] left: gameId={}, userId={}", gameId, userId);

        if (game.getStatus() == GameStatus.ACTIVE) {
            if (game.getCurrentPhase() == GamePhase.PROPOSAL) {
                npcActionService.checkAndProposeNpcAction(gameId);
            } else {
                actionFlowService.reevaluatePending(gameId);
            }
        }
    }

    @Transactional
    public Player selectPersona(Long gameId, String userId, Long personaId) {
        Game game = gameValidator.getGame(gameId);
        Player player = gameValidator.requireMember(gameId, userId);
        gameValidator.requireLobby(game);
        if (Objects.equals(player.getPersonaId(), personaId)) {
            return player;
        }

        releasePersona(player);
        player.setPersonaId(null);
        player.setPersonaLead(false);
        if (personaId != null) {
            claimPersona(game, player, personaId);
        }
        Player saved = playerRepository.save(player);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("playerId", player.getId());
        data.put("personaId", personaId);
        data.put("isPersonaLead", saved.isPersonaLead());
        gameEventService.log(gameId, userId, GameEventType.PERSONA_SELECTED, data);
        gameNotifier.notify(NotificationKind.GAME_UPDATED, gameId, data);
        return saved;
    }

    @Transactional
    public Persona addPersona(Long gameId, String userId, CreateGameRequest.PersonaRequest request) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        gameValidator.requireLobby(game);
        if (request.isNpc() && personaRepository.findFirstByGameIdAndIsNpcTrue(gameId).isPresent()) {
            throw ErrorCode.MULTIPLE_NPC_PERSONAS.commonException();
        }

        Persona persona = personaRepository.save(toPersona(gameId, request));
        gameNotifier.notify(NotificationKind.GAME_UPDATED, gameId, Map.of("personaId", persona.getId()));
        return persona;
    }

    @Transactional
    public Player setPersonaLead(Long gameId, String userId, Long personaId, Long playerId) {
        gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        personaRepository.findByIdAndGameId(personaId, gameId)
                .orElseThrow(ErrorCode.PERSONA_NOT_FOUND::commonException);

        List<Player> members = playerRepository.findAllByGameIdAndPersonaIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId, personaId);
        Player target = members.stream()
                .filter(member -> member.getId().equals(playerId))
                .findFirst()
                .orElseThrow(ErrorCode.NOT_PERSONA_MEMBER::commonException);
        for (Player member : members) {
            member.setPersonaLead(member == target);
        }
        playerRepository.saveAll(members);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("personaId", personaId);
        data.put("leadPlayerId", playerId);
        gameEventService.log(gameId, userId, GameEventType.PERSONA_LEAD_CHANGED, data);
        gameNotifier.notify(NotificationKind.GAME_UPDATED, gameId, data);
        return target;
    }

    @Transactional
    public Player setPlayerRole(Long gameId, String userId, Long playerId, GameRole role) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        if (game.getCurrentPhase() == GamePhase.ARBITER_REVIEW) {
            throw ErrorCode.ARBITER_REVIEW_IN_PROGRESS.commonException();
        }

        Player target = playerRepository.findById(playerId)
                .filter(player -> player.getGameId().equals(gameId))
                .filter(Player::isActive)
                .filter(Player::isHuman)
                .orElseThrow(ErrorCode.PLAYER_NOT_FOUND::commonException);
        if (role == GameRole.ARBITER) {
            playerRepository.findFirstByGameIdAndGameRoleAndIsActiveTrue(gameId, GameRole.ARBITER)
                    .filter(arbiter -> !arbiter.getId().equals(playerId))
                    .ifPresent(arbiter -> {
                        throw ErrorCode.ARBITER_ALREADY_ASSIGNED.commonException();
                    });
        }
        target.setGameRole(role);
        Player saved = playerRepository.save(target);

        gameEventService.log(gameId, userId, GameEventType.PLAYER_ROLE_CHANGED,
                Map.of("playerId", playerId, "role", role.name()));
        gameNotifier.notify(NotificationKind.GAME_UPDATED, gameId, Map.of("playerId", playerId, "role", role.name()));
        return saved;
    }

    @Transactional
    public Game updateSettings(Long gameId, String userId, GameSettingsRequest request) {
        Game game = gameValidator.lockGame(gameId);
        gameValidator.requireHost(gameId, userId);
        if (game.getStatus() == GameStatus.COMPLETED) {
            throw ErrorCode.GAME_NOT_ACTIVE.commonException();
        }

        String previousMethod = game.getSettings().getResolutionMethod();
        request.applyTo(game.getSettings());
        gameValidator.validateSettings(game.getSettings());
        if (game.getCurrentActionId() != null && !previousMethod.equals(game.getSettings().getResolutionMethod())) {
            throw ErrorCode.INVALID_SETTINGS.commonException("Resolution method cannot change while an action is in progress");
        }
        Game saved = gameRepository.save(game);

        gameEventService.log(gameId, userId, GameEventType.SETTINGS_UPDATED, Map.of("gameId", gameId));
        gameNotifier.notify(NotificationKind.GAME_UPDATED, gameId, Map.of("settingsUpdated", true));
        return saved;
    }

    // ================== start / delete ================== //

    @Transactional
    public Game startGame(Long gameId, String userId) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        gameValidator.requireLobby(game);

        List<Player> humans = playerRepository.findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId).stream()
                .filter(Player::isHuman)
                .toList();
        if (humans.size() < GameValidator.MIN_PLAYERS) {
            throw ErrorCode.NOT_ENOUGH_PLAYERS.commonException(
                    "At least " + GameValidator.MIN_PLAYERS + " players are required to start");
        }
        if (game.getSettings().isPersonasRequired() && humans.stream().anyMatch(player -> player.getPersonaId() == null)) {
            throw ErrorCode.PERSONA_REQUIRED.commonException();
        }

        personaRepository.findFirstByGameIdAndIsNpcTrue(gameId)
                .ifPresent(persona -> playerRepository.save(Player.npc(gameId, persona)));

        game.setStatus(GameStatus.ACTIVE);
        gameRepository.saveAndFlush(game);
        roundService.createRound(gameId, 1);
        Game started = gamePhaseService.transitionPhase(gameId, GamePhase.PROPOSAL);

        gameEventService.log(gameId, userId, GameEventType.GAME_STARTED, Map.of("playerCount", humans.size()));
        gameNotifier.notify(NotificationKind.GAME_STARTED, gameId, Map.of("roundId", started.getCurrentRoundId()));

        log.info("[game] started: gameId={}, players={}", gameId, humans.size());
        return started;
    }

    @Transactional
    public void deleteGame(Long gameId, String userId) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        gameValidator.requireLobby(game);

        game.setDeletedAt(LocalDateTime.now());
        gameRepository.save(game);
        gameEventService.log(gameId, userId, GameEventType.GAME_DELETED, Map.of("gameId", gameId));
        log.info("[game] deleted: gameId={}", gameId);
    }

    // ================== personas ================== //

    private void claimPersona(Game game, Player player, Long personaId) {
        Persona persona = personaRepository.findByIdAndGameId(personaId, game.getId())
                .orElseThrow(ErrorCode.PERSONA_NOT_FOUND::commonException);
        if (persona.isNpc()) {
            throw ErrorCode.NPC_PERSONA_NOT_SELECTABLE.commonException();
        }

        List<Player> holders = playerRepository
                .findAllByGameIdAndPersonaIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(game.getId(), personaId).stream()
                .filter(holder -> !holder.getUserId().equals(player.getUserId()))
                .toList();
        if (!holders.isEmpty() && !game.getSettings().isAllowSharedPersonas()) {
            throw ErrorCode.PERSONA_ALREADY_CLAIMED.commonException();
        }
        player.setPersonaId(personaId);
        player.setPersonaLead(holders.isEmpty());
    }

    /**
     * Hands the lead of the player's persona to the next member in join order.
     */
    private void releasePersona(Player player) {
        if (player.getPersonaId() == null || !player.isPersonaLead()) {
            return;
        }
        playerRepository.findAllByGameIdAndPersonaIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(player.getGameId(), player.getPersonaId())
                .stream()
                .filter(member -> !member.getId().equals(player.getId()))
                .findFirst()
                .ifPresent(next -> {
                    next.setPersonaLead(true);
                    playerRepository.save(next);
                    gameEventService.log(player.getGameId(), null, GameEventType.PERSONA_LEAD_CHANGED,
                            Map.of("personaId", player.getPersonaId(), "leadPlayerId", next.getId()));
                });
        player.setPersonaLead(false);
    }

    private Persona toPersona(Long gameId, CreateGameRequest.PersonaRequest request) {
        return Persona.builder()
                .gameId(gameId)
                .name(request.name())
                .description(request.description())
                .isNpc(request.isNpc())
                .npcActionDescription(request.npcActionDescription())
                .npcDesiredOutcome(request.npcDesiredOutcome())
                .build();
    }
}
