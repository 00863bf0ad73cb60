package com.example.matrixgame.action.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.matrixgame.action.dto.response.ArgumentResponse;
import com.example.matrixgame.action.service.ArbiterService;
import com.example.matrixgame.global.dto.CommonResponse;
import com.example.matrixgame.resolution.ResolutionResult;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/actions/{actionId}")
@RequiredArgsConstructor
public class ArbiterController {

    private final ArbiterService arbiterService;

    @PostMapping("/arguments/{argumentId}/strong")
    public ResponseEntity<CommonResponse<ArgumentResponse>> markArgumentStrong(@RequestHeader("X-User-Id") String userId,
                                                                               @PathVariable Long actionId,
                                                                               @PathVariable Long argumentId) {
        var argument = arbiterService.markArgumentStrong(actionId, argumentId, userId);
        return ResponseEntity.ok(CommonResponse.success(ArgumentResponse.from(argument)));
    }

    @PostMapping("/arbiter-review/complete")
    public ResponseEntity<CommonResponse<ResolutionResult>> completeArbiterReview(@RequestHeader("X-User-Id") String userId,
                                                                                  @PathVariable Long actionId) {
        return ResponseEntity.ok(CommonResponse.success(arbiterService.completeArbiterReview(actionId, userId),
                "Arbiter review completed"));
    }
}
