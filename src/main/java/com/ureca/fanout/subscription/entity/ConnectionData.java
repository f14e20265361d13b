package com.ureca.fanout.subscription.entity;

import java.util.Map;

/**
 * 연결 저장소가 관리하는 연결 메타데이터
 */
public record ConnectionData(
        Boolean useLegacyProtocol, // null 이면 현행 프로토콜
        Map<String, Object> context // connection_init 시 받은 컨텍스트, 실행 컨텍스트에 합쳐진다
) {

    public ConnectionData {
        context = context == null ? Map.of() : context;
    }

    public static ConnectionData of(Boolean useLegacyProtocol) {
        return new ConnectionData(useLegacyProtocol, Map.of());
    }
}
