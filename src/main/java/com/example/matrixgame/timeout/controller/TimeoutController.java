package com.example.matrixgame.timeout.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.matrixgame.global.dto.CommonResponse;
import com.example.matrixgame.timeout.dto.TimeoutStatus;
import com.example.matrixgame.timeout.service.TimeoutService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/games/{gameId}/timeout")
@RequiredArgsConstructor
public class TimeoutController {

    private final TimeoutService timeoutService;

    @GetMapping
    public ResponseEntity<CommonResponse<TimeoutStatus>> getTimeoutStatus(@PathVariable Long gameId) {
        return ResponseEntity.ok(CommonResponse.success(timeoutService.getTimeoutStatus(gameId)));
    }

    @PostMapping("/extend")
    public ResponseEntity<CommonResponse<TimeoutStatus>> extendTimeout(@RequestHeader("X-User-Id") String userId,
                                                                       @PathVariable Long gameId) {
        return ResponseEntity.ok(CommonResponse.success(timeoutService.extendTimeout(gameId, userId), "Timeout extended"));
    }
}
