package com.ureca.fanout.subscription.entity;

/**
 * 이벤트 이름별로 등록된 (연결, 연산) 쌍
 */
public record Subscriber(
        Connection connection, // 공유 참조 (소유하지 않음)
        OperationRequest operation,
        String operationId, // 클라이언트가 붙인 구독 id, 응답 메시지 id 로 사용
        String event
) {
}
