package com.example.matrixgame.resolution;

import java.util.LinkedHashMap;
import java.util.Map;

public record ResolutionResult(
        ResultType resultType,
        int resultValue,
        Map<String, Object> strategyData) {

    public static ResolutionResult of(ResultType resultType, Map<String, Object> strategyData) {
        return new ResolutionResult(resultType, resultType.getValue(), strategyData);
    }

    /**
     * Payload persisted on the action: the strategy data plus resultType and resultValue.
     */
    public Map<String, Object> toResolutionData() {
        Map<String, Object> data = new LinkedHashMap<>(strategyData);
        data.put("resultType", resultType.name());
        data.put("resultValue", resultValue);
        return data;
    }
}
