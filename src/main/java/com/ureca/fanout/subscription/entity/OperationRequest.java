package com.ureca.fanout.subscription.entity;

import java.util.Map;

/**
 * 구독 등록 시 저장된 GraphQL 연산
 */
public record OperationRequest(
        String query,
        String operationName,
        Map<String, Object> variables
) {
}
