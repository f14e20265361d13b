package com.ureca.fanout.subscription.execution;

import com.ureca.fanout.changelog.dto.ChangeLogBatchContext;
import com.ureca.fanout.subscription.entity.Connection;
import com.ureca.fanout.subscription.entity.OperationRequest;

import java.util.Map;

/**
 * 실행 엔진 호출 파라미터
 */
public record ExecutionRequest(
        OperationRequest operation,
        Connection connection,
        SingleEventSource eventSource, // 이 구독자 전용, 한 번만 사용
        ExecutionMode mode,
        Map<String, Object> context, // resolver 에 넘길 사용자 컨텍스트
        ChangeLogBatchContext batchContext // 호스트 호출 정보
) {
}
