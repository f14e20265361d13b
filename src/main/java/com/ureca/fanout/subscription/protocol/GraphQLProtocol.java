package com.ureca.fanout.subscription.protocol;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 연결이 사용하는 GraphQL over WebSocket 프로토콜
 * 닫힌 선택지이므로 새 프로토콜 추가 시 Enum만 수정
 */
@Getter
@RequiredArgsConstructor
public enum GraphQLProtocol {
    // subscriptions-transport-ws
    LEGACY(new ServerEventTypes(
            "connection_ack", "data", "error", "complete", "ka")),

    // graphql-ws
    GRAPHQL_TRANSPORT_WS(new ServerEventTypes(
            "connection_ack", "next", "error", "complete", "ping"));

    private final ServerEventTypes serverEventTypes;
}
