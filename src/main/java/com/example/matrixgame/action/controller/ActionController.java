package com.example.matrixgame.action.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.matrixgame.action.dto.request.AddArgumentRequest;
import com.example.matrixgame.action.dto.request.ContentRequest;
import com.example.matrixgame.action.dto.request.ProposeActionRequest;
import com.example.matrixgame.action.dto.request.SubmitVoteRequest;
import com.example.matrixgame.action.dto.request.UpdateActionRequest;
import com.example.matrixgame.action.dto.response.ActionResponse;
import com.example.matrixgame.action.dto.response.ArgumentResponse;
import com.example.matrixgame.action.dto.response.ArgumentationProgress;
import com.example.matrixgame.action.dto.response.NarrationResponse;
import com.example.matrixgame.action.dto.response.VoteProgress;
import com.example.matrixgame.action.dto.response.VoteResponse;
import com.example.matrixgame.action.service.ActionService;
import com.example.matrixgame.action.service.HostOverrideService;
import com.example.matrixgame.action.service.NarrationService;
import com.example.matrixgame.action.service.ResolutionService;
import com.example.matrixgame.action.service.VoteService;
import com.example.matrixgame.game.dto.response.GameResponse;
import com.example.matrixgame.global.dto.CommonResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ActionController {

    private static final String USER_HEADER = "X-User-Id";

    private final ActionService actionService;
    private final VoteService voteService;
    private final ResolutionService resolutionService;
    private final NarrationService narrationService;
    private final HostOverrideService hostOverrideService;

    // ================== proposal ================== //

    @PostMapping("/games/{gameId}/actions")
    public ResponseEntity<CommonResponse<ActionResponse>> propose(@RequestHeader(USER_HEADER) String userId,
                                                                  @PathVariable Long gameId,
                                                                  @Valid @RequestBody ProposeActionRequest request) {
        var action = actionService.propose(gameId, userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(ActionResponse.from(action), "Action proposed"));
    }

    @GetMapping("/games/{gameId}/actions")
    public ResponseEntity<CommonResponse<List<ActionResponse>>> getActions(@PathVariable Long gameId) {
        List<ActionResponse> actions = actionService.getActions(gameId).stream()
                .map(ActionResponse::from)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(actions));
    }

    @PostMapping("/games/{gameId}/actions/skip-to-next")
    public ResponseEntity<CommonResponse<GameResponse>> skipToNextAction(@RequestHeader(USER_HEADER) String userId,
                                                                         @PathVariable Long gameId) {
        var game = hostOverrideService.skipToNextAction(gameId, userId);
        return ResponseEntity.ok(CommonResponse.success(GameResponse.summary(game), "Proposals skipped"));
    }

    @GetMapping("/actions/{actionId}")
    public ResponseEntity<CommonResponse<ActionResponse>> getAction(@PathVariable Long actionId) {
        return ResponseEntity.ok(CommonResponse.success(ActionResponse.from(actionService.getAction(actionId))));
    }

    @PutMapping("/actions/{actionId}")
    public ResponseEntity<CommonResponse<ActionResponse>> updateAction(@RequestHeader(USER_HEADER) String userId,
                                                                       @PathVariable Long actionId,
                                                                       @Valid @RequestBody UpdateActionRequest request) {
        var action = hostOverrideService.updateAction(actionId, userId, request);
        return ResponseEntity.ok(CommonResponse.success(ActionResponse.from(action)));
    }

    // ================== argumentation ================== //

    @GetMapping("/actions/{actionId}/arguments")
    public ResponseEntity<CommonResponse<List<ArgumentResponse>>> getArguments(@PathVariable Long actionId) {
        List<ArgumentResponse> arguments = actionService.getArguments(actionId).stream()
                .map(ArgumentResponse::from)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(arguments));
    }

    @PostMapping("/actions/{actionId}/arguments")
    public ResponseEntity<CommonResponse<ArgumentResponse>> addArgument(@RequestHeader(USER_HEADER) String userId,
                                                                        @PathVariable Long actionId,
                                                                        @Valid @RequestBody AddArgumentRequest request) {
        var argument = actionService.addArgument(actionId, userId, request.argumentType(), request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(ArgumentResponse.from(argument)));
    }

    @PutMapping("/actions/{actionId}/arguments/{argumentId}")
    public ResponseEntity<CommonResponse<ArgumentResponse>> updateArgument(@RequestHeader(USER_HEADER) String userId,
                                                                           @PathVariable Long actionId,
                                                                           @PathVariable Long argumentId,
                                                                           @Valid @RequestBody ContentRequest request) {
        var argument = hostOverrideService.updateArgument(actionId, argumentId, userId, request.content());
        return ResponseEntity.ok(CommonResponse.success(ArgumentResponse.from(argument)));
    }

    @PostMapping("/actions/{actionId}/complete-argumentation")
    public ResponseEntity<CommonResponse<ArgumentationProgress>> completeArgumentation(@RequestHeader(USER_HEADER) String userId,
                                                                                       @PathVariable Long actionId) {
        return ResponseEntity.ok(CommonResponse.success(actionService.completeArgumentation(actionId, userId)));
    }

    @PostMapping("/actions/{actionId}/skip-argumentation")
    public ResponseEntity<CommonResponse<ActionResponse>> skipArgumentation(@RequestHeader(USER_HEADER) String userId,
                                                                            @PathVariable Long actionId) {
        var action = hostOverrideService.skipArgumentation(actionId, userId);
        return ResponseEntity.ok(CommonResponse.success(ActionResponse.from(action), "Argumentation skipped"));
    }

    // ================== voting / resolution ================== //

    @GetMapping("/actions/{actionId}/votes")
    public ResponseEntity<CommonResponse<List<VoteResponse>>> getVotes(@PathVariable Long actionId) {
        List<VoteResponse> votes = voteService.getVotes(actionId).stream()
                .map(VoteResponse::from)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(votes));
    }

    @PostMapping("/actions/{actionId}/votes")
    public ResponseEntity<CommonResponse<VoteProgress>> submitVote(@RequestHeader(USER_HEADER) String userId,
                                                                   @PathVariable Long actionId,
                                                                   @Valid @RequestBody SubmitVoteRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(voteService.submitVote(actionId, userId, request.voteType())));
    }

    @PostMapping("/actions/{actionId}/skip-voting")
    public ResponseEntity<CommonResponse<ActionResponse>> skipVoting(@RequestHeader(USER_HEADER) String userId,
                                                                     @PathVariable Long actionId) {
        var action = hostOverrideService.skipVoting(actionId, userId);
        return ResponseEntity.ok(CommonResponse.success(ActionResponse.from(action), "Voting skipped"));
    }

    @PostMapping("/actions/{actionId}/resolve")
    public ResponseEntity<CommonResponse<ActionResponse>> resolve(@RequestHeader(USER_HEADER) String userId,
                                                                  @PathVariable Long actionId) {
        var action = resolutionService.resolve(actionId, userId);
        return ResponseEntity.ok(CommonResponse.success(ActionResponse.from(action)));
    }

    // ================== narration ================== //

    @GetMapping("/actions/{actionId}/narration")
    public ResponseEntity<CommonResponse<NarrationResponse>> getNarration(@PathVariable Long actionId) {
        return ResponseEntity.ok(CommonResponse.success(NarrationResponse.from(narrationService.getNarration(actionId))));
    }

    @PostMapping("/actions/{actionId}/narration")
    public ResponseEntity<CommonResponse<NarrationResponse>> submitNarration(@RequestHeader(USER_HEADER) String userId,
                                                                             @PathVariable Long actionId,
                                                                             @Valid @RequestBody ContentRequest request) {
        var narration = narrationService.submitNarration(actionId, userId, request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(NarrationResponse.from(narration)));
    }

    @PutMapping("/actions/{actionId}/narration")
    public ResponseEntity<CommonResponse<NarrationResponse>> updateNarration(@RequestHeader(USER_HEADER) String userId,
                                                                             @PathVariable Long actionId,
                                                                             @Valid @RequestBody ContentRequest request) {
        var narration = hostOverrideService.updateNarration(actionId, userId, request.content());
        return ResponseEntity.ok(CommonResponse.success(NarrationResponse.from(narration)));
    }
}
