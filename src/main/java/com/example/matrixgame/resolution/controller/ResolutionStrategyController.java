package com.example.matrixgame.resolution.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.matrixgame.global.dto.CommonResponse;
import com.example.matrixgame.resolution.ResolutionStrategyRegistry;
import com.example.matrixgame.resolution.StrategyInfo;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/resolution-strategies")
@RequiredArgsConstructor
public class ResolutionStrategyController {

    private final ResolutionStrategyRegistry resolutionStrategyRegistry;

    @GetMapping
    public ResponseEntity<CommonResponse<List<StrategyInfo>>> getStrategies() {
        return ResponseEntity.ok(CommonResponse.success(resolutionStrategyRegistry.getAllStrategies()));
    }
}
