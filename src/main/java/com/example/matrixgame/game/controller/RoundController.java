package com.example.matrixgame.game.controller;

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

import com.example.matrixgame.game.dto.request.RoundSummaryRequest;
import com.example.matrixgame.game.dto.response.RoundResponse;
import com.example.matrixgame.game.dto.response.RoundSummaryResponse;
import com.example.matrixgame.game.service.RoundService;
import com.example.matrixgame.global.dto.CommonResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RoundController {

    private final RoundService roundService;

    @GetMapping("/games/{gameId}/rounds")
    public ResponseEntity<CommonResponse<List<RoundResponse>>> getRounds(@PathVariable Long gameId) {
        List<RoundResponse> rounds = roundService.getRounds(gameId).stream()
                .map(RoundResponse::from)
                .toList();
        return ResponseEntity.ok(CommonResponse.success(rounds));
    }

    @GetMapping("/rounds/{roundId}/summary")
    public ResponseEntity<CommonResponse<RoundSummaryResponse>> getRoundSummary(@PathVariable Long roundId) {
        return ResponseEntity.ok(CommonResponse.success(RoundSummaryResponse.from(roundService.getRoundSummary(roundId))));
    }

    @PostMapping("/rounds/{roundId}/summary")
    public ResponseEntity<CommonResponse<RoundSummaryResponse>> submitRoundSummary(@RequestHeader("X-User-Id") String userId,
                                                                                   @PathVariable Long roundId,
                                                                                   @Valid @RequestBody RoundSummaryRequest request) {
        var summary = roundService.submitRoundSummary(roundId, userId, request.content());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(RoundSummaryResponse.from(summary), "Round summary submitted"));
    }

    @PutMapping("/rounds/{roundId}/summary")
    public ResponseEntity<CommonResponse<RoundSummaryResponse>> updateRoundSummary(@RequestHeader("X-User-Id") String userId,
                                                                                   @PathVariable Long roundId,
                                                                                   @Valid @RequestBody RoundSummaryRequest request) {
        var summary = roundService.updateRoundSummary(roundId, userId, request.content());
        return ResponseEntity.ok(CommonResponse.success(RoundSummaryResponse.from(summary)));
    }
}
