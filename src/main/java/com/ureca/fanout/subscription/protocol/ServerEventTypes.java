package com.ureca.fanout.subscription.protocol;

/**
 * 서버 -> 클라이언트 메시지 타입 태그 모음
 */
public record ServerEventTypes(
        String connectionAck,
        String data, // 실행 결과 전송
        String error,
        String complete,
        String keepAlive
) {
}
