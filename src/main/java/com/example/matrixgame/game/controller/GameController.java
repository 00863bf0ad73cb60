package com.example.matrixgame.game.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.dto.request.CreateGameRequest;
import com.example.matrixgame.game.dto.request.GameSettingsRequest;
import com.example.matrixgame.game.dto.request.JoinGameRequest;
import com.example.matrixgame.game.dto.request.SelectPersonaRequest;
import com.example.matrixgame.game.dto.request.SetPersonaLeadRequest;
import com.example.matrixgame.game.dto.request.SetPlayerRoleRequest;
import com.example.matrixgame.game.dto.request.TransitionPhaseRequest;
import com.example.matrixgame.game.dto.response.GameEventResponse;
import com.example.matrixgame.game.dto.response.GameResponse;
import com.example.matrixgame.game.dto.response.PersonaResponse;
import com.example.matrixgame.game.dto.response.PlayerResponse;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameService;
import com.example.matrixgame.global.dto.CommonResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameController {

    private static final String USER_HEADER = "X-User-Id";

    private final GameService gameService;
    private final GamePhaseService gamePhaseService;
    private final GameEventService gameEventService;

    @PostMapping
    public ResponseEntity<CommonResponse<GameResponse>> createGame(@RequestHeader(USER_HEADER) String userId,
                                                                   @Valid @RequestBody CreateGameRequest request) {
        Long gameId = gameService.createGame(userId, request).getId();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(gameService.getGame(gameId), "Game created"));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<List<GameResponse>>> listGames(@RequestHeader(USER_HEADER) String userId) {
        List<GameResponse> games = gameService.listGames(userId).stream()
                .map(GameResponse::summary)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(games));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<CommonResponse<GameResponse>> getGame(@PathVariable Long gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameService.getGame(gameId)));
    }

    @DeleteMapping("/{gameId}")
    public ResponseEntity<CommonResponse<Void>> deleteGame(@RequestHeader(USER_HEADER) String userId,
                                                           @PathVariable Long gameId) {
        gameService.deleteGame(gameId, userId);
        return ResponseEntity.ok(CommonResponse.success(null, "Game deleted"));
    }

    @PostMapping("/{gameId}/join")
    public ResponseEntity<CommonResponse<PlayerResponse>> joinGame(@RequestHeader(USER_HEADER) String userId,
                                                                   @PathVariable Long gameId,
                                                                   @Valid @RequestBody JoinGameRequest request) {
        var player = gameService.joinGame(gameId, userId, request.playerName(), request.personaId());
        return ResponseEntity.ok(CommonResponse.success(PlayerResponse.from(player), "Joined game"));
    }

    @PostMapping("/{gameId}/leave")
    public ResponseEntity<CommonResponse<Void>> leaveGame(@RequestHeader(USER_HEADER) String userId,
                                                          @PathVariable Long gameId) {
        gameService.leaveGame(gameId, userId);
        return ResponseEntity.ok(CommonResponse.success(null, "Left game"));
    }

    @PutMapping("/{gameId}/persona")
    public ResponseEntity<CommonResponse<PlayerResponse>> selectPersona(@RequestHeader(USER_HEADER) String userId,
                                                                        @PathVariable Long gameId,
                                                                        @RequestBody SelectPersonaRequest request) {
        var player = gameService.selectPersona(gameId, userId, request.personaId());
        return ResponseEntity.ok(CommonResponse.success(PlayerResponse.from(player)));
    }

    @GetMapping("/{gameId}/personas")
    public ResponseEntity<CommonResponse<List<PersonaResponse>>> getPersonas(@PathVariable Long gameId) {
        List<PersonaResponse> personas = gameService.getPersonas(gameId).stream()
                .map(PersonaResponse::from)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(personas));
    }

    @PostMapping("/{gameId}/personas")
    public ResponseEntity<CommonResponse<PersonaResponse>> addPersona(@RequestHeader(USER_HEADER) String userId,
                                                                      @PathVariable Long gameId,
                                                                      @Valid @RequestBody CreateGameRequest.PersonaRequest request) {
        var persona = gameService.addPersona(gameId, userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(PersonaResponse.from(persona)));
    }

    @PutMapping("/{gameId}/personas/{personaId}/lead")
    public ResponseEntity<CommonResponse<PlayerResponse>> setPersonaLead(@RequestHeader(USER_HEADER) String userId,
                                                                         @PathVariable Long gameId,
                                                                         @PathVariable Long personaId,
                                                                         @Valid @RequestBody SetPersonaLeadRequest request) {
        var lead = gameService.setPersonaLead(gameId, userId, personaId, request.playerId());
        return ResponseEntity.ok(CommonResponse.success(PlayerResponse.from(lead)));
    }

    @GetMapping("/{gameId}/players")
    public ResponseEntity<CommonResponse<List<PlayerResponse>>> getPlayers(@PathVariable Long gameId) {
        List<PlayerResponse> players = gameService.getPlayers(gameId).stream()
                .map(PlayerResponse::from)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(players));
    }

    @PutMapping("/{gameId}/players/{playerId}/role")
    public ResponseEntity<CommonResponse<PlayerResponse>> setPlayerRole(@RequestHeader(USER_HEADER) String userId,
                                                                        @PathVariable Long gameId,
                                                                        @PathVariable Long playerId,
                                                                        @Valid @RequestBody SetPlayerRoleRequest request) {
        var player = gameService.setPlayerRole(gameId, userId, playerId, request.role());
        return ResponseEntity.ok(CommonResponse.success(PlayerResponse.from(player)));
    }

    @PutMapping("/{gameId}/settings")
    public ResponseEntity<CommonResponse<GameResponse>> updateSettings(@RequestHeader(USER_HEADER) String userId,
                                                                       @PathVariable Long gameId,
                                                                       @RequestBody GameSettingsRequest request) {
        gameService.updateSettings(gameId, userId, request);
        return ResponseEntity.ok(CommonResponse.success(gameService.getGame(gameId), "Settings updated"));
    }

    @PostMapping("/{gameId}/start")
    public ResponseEntity<CommonResponse<GameResponse>> startGame(@RequestHeader(USER_HEADER) String userId,
                                                                  @PathVariable Long gameId) {
        gameService.startGame(gameId, userId);
        return ResponseEntity.ok(CommonResponse.success(gameService.getGame(gameId), "Game started"));
    }

    @PostMapping("/{gameId}/phase")
    public ResponseEntity<CommonResponse<GameResponse>> transitionPhase(@RequestHeader(USER_HEADER) String userId,
                                                                        @PathVariable Long gameId,
                                                                        @Valid @RequestBody TransitionPhaseRequest request) {
        gamePhaseService.transitionPhase(gameId, request.phase(), userId);
        return ResponseEntity.ok(CommonResponse.success(gameService.getGame(gameId)));
    }

    @GetMapping("/{gameId}/events")
    public ResponseEntity<CommonResponse<List<GameEventResponse>>> getEvents(@PathVariable Long gameId,
                                                                             @RequestParam(required = false) GameEventType type) {
        gameService.getGame(gameId);
        var events = type != null ? gameEventService.getEvents(gameId, type) : gameEventService.getEvents(gameId);
        return ResponseEntity.ok(CommonResponse.success(events.stream().map(GameEventResponse::from).toList()));
    }
}
