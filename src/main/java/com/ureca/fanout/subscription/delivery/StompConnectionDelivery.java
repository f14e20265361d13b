package com.ureca.fanout.subscription.delivery;

import com.ureca.fanout.common.exception.InternalServerException;
import com.ureca.fanout.subscription.entity.Connection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;

import static com.ureca.fanout.common.BaseCode.DELIVERY_FAILED;

/**
 * STOMP 사용자 목적지로 메시지 전송
 * 연결 id 를 사용자 이름으로 사용한다 (/user/{connectionId}/queue/graphql)
 */
@Slf4j
@RequiredArgsConstructor
public class StompConnectionDelivery implements ConnectionDelivery {

    private final SimpMessagingTemplate messaging;
    private final SimpUserRegistry userRegistry;
    private final String destination;

    @Override
    public void sendToConnection(Connection connection, OutboundMessage message) {
        String connectionId = connection.id();

        // 세션이 없는 사용자에게 보내면 조용히 버려지므로 먼저 확인
        if (userRegistry.getUser(connectionId) == null) {
            throw new ConnectionGoneException(connectionId);
        }

        try {
            messaging.convertAndSendToUser(connectionId, destination, message);
        } catch (MessageDeliveryException e) {
            throw new ConnectionGoneException(connectionId, e);
        } catch (MessagingException e) {
            throw new InternalServerException(DELIVERY_FAILED, "메시지 전송 실패. connectionId: " + connectionId, e);
        }

        log.debug("[Delivery] 전송 완료. connectionId: {}, operationId: {}, type: {}",
                connectionId, message.id(), message.type());
    }
}
