package com.ureca.fanout.config;

import com.ureca.fanout.subscription.delivery.ConnectionDelivery;
import com.ureca.fanout.subscription.delivery.StompConnectionDelivery;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.websocket.servlet.WebSocketMessagingAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;

/**
 * STOMP 메시지 브로커가 구성된 애플리케이션이면 연결 전송을 STOMP 로 등록
 */
@AutoConfiguration(after = WebSocketMessagingAutoConfiguration.class)
@ConditionalOnClass(SimpMessagingTemplate.class)
@EnableConfigurationProperties(FanoutProperties.class)
public class StompDeliveryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionDelivery.class)
    @ConditionalOnBean({SimpMessagingTemplate.class, SimpUserRegistry.class})
    public StompConnectionDelivery stompConnectionDelivery(
            SimpMessagingTemplate messagingTemplate,
            SimpUserRegistry userRegistry,
            FanoutProperties properties
    ) {
        return new StompConnectionDelivery(messagingTemplate, userRegistry, properties.delivery().destination());
    }
}
