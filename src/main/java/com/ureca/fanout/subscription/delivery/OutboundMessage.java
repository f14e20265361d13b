package com.ureca.fanout.subscription.delivery;

/**
 * 연결로 보내는 메시지 (전송 후 버려짐, 저장하지 않는다)
 */
public record OutboundMessage(
        String id, // 구독 operationId
        String type, // 프로토콜별 data 태그
        Object payload // 실행 결과
) {
}
