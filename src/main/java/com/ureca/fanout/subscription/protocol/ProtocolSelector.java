package com.ureca.fanout.subscription.protocol;

import com.ureca.fanout.subscription.entity.Connection;

/**
 * 연결에 저장된 프로토콜 플래그 -> 메시지 어휘 조회
 * 순수 함수, 플래그가 없으면 현행 프로토콜
 */
public class ProtocolSelector {

    public static GraphQLProtocol select(Boolean useLegacyProtocol) {
        return Boolean.TRUE.equals(useLegacyProtocol)
                ? GraphQLProtocol.LEGACY
                : GraphQLProtocol.GRAPHQL_TRANSPORT_WS;
    }

    public static GraphQLProtocol forConnection(Connection connection) {
        return select(connection.useLegacyProtocol());
    }

    private ProtocolSelector() {
        // 인스턴스화 방지
    }
}
