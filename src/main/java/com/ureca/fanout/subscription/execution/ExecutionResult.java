package com.ureca.fanout.subscription.execution;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * 연산 실행 결과 (GraphQL 응답 형태)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExecutionResult(
        Object data,
        List<Map<String, Object>> errors
) {

    public static ExecutionResult of(Object data) {
        return new ExecutionResult(data, List.of());
    }

    public static ExecutionResult error(String message) {
        return new ExecutionResult(null, List.of(Map.of("message", message)));
    }
}
