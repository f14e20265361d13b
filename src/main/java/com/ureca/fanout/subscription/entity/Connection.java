package com.ureca.fanout.subscription.entity;

/**
 * 클라이언트 연결 (연결 저장소 소유, 여기서는 읽기만 한다)
 */
public record Connection(
        String id,
        ConnectionData data
) {

    public Boolean useLegacyProtocol() {
        return data == null ? null : data.useLegacyProtocol();
    }
}
