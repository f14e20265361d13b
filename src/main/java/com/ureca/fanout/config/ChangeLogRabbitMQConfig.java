package com.ureca.fanout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.changelog.listener.ChangeLogBatchListener;
import com.ureca.fanout.changelog.service.StreamEventProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * 변경 로그 큐 배치 소비 설정
 * <p>
 * 리스너 예외 시 배치 전체 NACK + 재큐잉 (호스트 재전달)
 * 파이프라인은 내부 실패로 예외를 던지지 않으므로 재전달은 인프라 장애일 때만 발생
 */
@AutoConfiguration(after = {RabbitAutoConfiguration.class, FanoutAutoConfiguration.class})
@ConditionalOnBean({StreamEventProcessor.class, ConnectionFactory.class})
@ConditionalOnProperty(prefix = "fanout.change-log", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChangeLogRabbitMQConfig {

    public static final String CONTAINER_FACTORY_NAME = "changeLogBatchContainerFactory";

    @Bean
    public Queue changeLogQueue(FanoutProperties properties) {
        return new Queue(properties.changeLog().queue(), true);
    }

    @Bean(name = CONTAINER_FACTORY_NAME)
    public SimpleRabbitListenerContainerFactory changeLogBatchContainerFactory(
            ConnectionFactory connectionFactory,
            FanoutProperties properties
    ) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setBatchListener(true);
        factory.setConsumerBatchEnabled(true);
        factory.setBatchSize(properties.changeLog().batchSize());
        factory.setPrefetchCount(properties.changeLog().batchSize());

        // 레코드는 도착 순서대로 처리
        factory.setConcurrentConsumers(1);
        factory.setMaxConcurrentConsumers(1);
        factory.setDefaultRequeueRejected(true);
        return factory;
    }

    @Bean
    public ChangeLogBatchListener changeLogBatchListener(
            StreamEventProcessor streamEventProcessor,
            ObjectProvider<ObjectMapper> objectMapper,
            ObjectProvider<MeterRegistry> meterRegistry,
            FanoutProperties properties
    ) {
        return new ChangeLogBatchListener(
                streamEventProcessor,
                objectMapper.getIfAvailable(ObjectMapper::new),
                meterRegistry.getIfAvailable(() -> Metrics.globalRegistry),
                properties.changeLog().queue()
        );
    }
}
