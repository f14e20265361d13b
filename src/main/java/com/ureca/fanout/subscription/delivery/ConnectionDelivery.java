package com.ureca.fanout.subscription.delivery;

import com.ureca.fanout.subscription.entity.Connection;

/**
 * 연결 단위 메시지 전송
 */
public interface ConnectionDelivery {

    /**
     * @param connection 대상 연결
     * @param message    전송할 메시지
     * @throws ConnectionGoneException 이미 끊긴 연결
     */
    void sendToConnection(Connection connection, OutboundMessage message);
}
