package com.ureca.fanout.subscription.entity;

/**
 * 변경 레코드 한 건에서 만들어진 구독 이벤트
 * payload 는 직렬화된 JSON 문자열이거나 이미 구조화된 값
 */
public record SubscriptionEvent(
        String eventName,
        Object payload
) {
}
