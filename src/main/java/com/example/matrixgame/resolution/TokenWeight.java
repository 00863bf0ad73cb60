package com.example.matrixgame.resolution;

public record TokenWeight(int successTokens, int failureTokens) {
}
