package com.ureca.fanout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.changelog.service.AttributeValueConverter;
import com.ureca.fanout.changelog.service.ChangeRecordDecoder;
import com.ureca.fanout.changelog.service.StreamEventProcessor;
import com.ureca.fanout.subscription.delivery.ConnectionDelivery;
import com.ureca.fanout.subscription.dispatcher.SubscriberDispatcher;
import com.ureca.fanout.subscription.execution.ExecutionContextProvider;
import com.ureca.fanout.subscription.execution.OperationExecutor;
import com.ureca.fanout.subscription.registry.SubscriberRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.task.TaskExecutionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 팬아웃 파이프라인 자동 구성
 * <p>
 * 호스트 애플리케이션이 구독자 저장소(SubscriberRegistry), 실행 엔진(OperationExecutor),
 * 연결 전송(ConnectionDelivery, STOMP 구성 시 자동 등록)을 제공하면 활성화된다
 */
@Slf4j
@AutoConfiguration(after = {StompDeliveryAutoConfiguration.class, TaskExecutionAutoConfiguration.class})
@ConditionalOnBean({SubscriberRegistry.class, OperationExecutor.class, ConnectionDelivery.class})
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutAutoConfiguration {

    public static final String DISPATCH_EXECUTOR_NAME = "fanoutDispatchExecutor";

    @Bean
    @ConditionalOnMissingBean
    public AttributeValueConverter attributeValueConverter() {
        return new AttributeValueConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeRecordDecoder changeRecordDecoder(
            AttributeValueConverter attributeValueConverter,
            FanoutProperties properties
    ) {
        return new ChangeRecordDecoder(
                attributeValueConverter,
                properties.changeLog().eventAttribute(),
                properties.changeLog().payloadAttribute()
        );
    }

    // 기본값: 설정 파일의 고정 컨텍스트 + 연결의 connection_init 컨텍스트 (같은 키는 연결 값 우선)
    @Bean
    @ConditionalOnMissingBean
    public ExecutionContextProvider executionContextProvider(FanoutProperties properties) {
        return (connection, batchContext) -> {
            if (connection == null || connection.data() == null || connection.data().context().isEmpty()) {
                return properties.executionContext();
            }
            Map<String, Object> context = new HashMap<>(properties.executionContext());
            context.putAll(connection.data().context());
            return context;
        };
    }

    /**
     * 구독자 처리 전용 Executor
     * <p>
     * 동시 실행 폭은 구독자 페이지 크기로 이미 제한된다
     * 호스트의 기본 applicationTaskExecutor 가 먼저 등록된 뒤 추가된다 (Executor 타입 조건에 걸리지 않도록)
     * 거부(큐 초과, 종료 중)되면 SubscriberDispatcher 가 호출 스레드에서 직접 처리
     * 우아한 종료 : 진행 중인 전송 10초 대기
     */
    @Bean(name = DISPATCH_EXECUTOR_NAME)
    @ConditionalOnMissingBean(name = DISPATCH_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor fanoutDispatchExecutor(FanoutProperties properties) {
        FanoutProperties.Dispatch dispatch = properties.dispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(dispatch.corePoolSize());
        executor.setMaxPoolSize(dispatch.maxPoolSize());
        executor.setQueueCapacity(dispatch.queueCapacity());
        executor.setThreadNamePrefix("Fanout-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[Fanout] Dispatch Executor 초기화 완료. core: {}, max: {}",
                dispatch.corePoolSize(), dispatch.maxPoolSize());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriberDispatcher subscriberDispatcher(
            SubscriberRegistry subscriberRegistry,
            OperationExecutor operationExecutor,
            ConnectionDelivery connectionDelivery,
            ExecutionContextProvider executionContextProvider,
            ObjectProvider<ObjectMapper> objectMapper,
            @Qualifier(DISPATCH_EXECUTOR_NAME) Executor dispatchExecutor,
            ObjectProvider<MeterRegistry> meterRegistry,
            FanoutProperties properties
    ) {
        return new SubscriberDispatcher(
                subscriberRegistry,
                operationExecutor,
                connectionDelivery,
                executionContextProvider,
                objectMapper.getIfAvailable(ObjectMapper::new),
                dispatchExecutor,
                meterRegistry.getIfAvailable(() -> Metrics.globalRegistry),
                properties.dispatch().pageSize()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamEventProcessor streamEventProcessor(
            ChangeRecordDecoder changeRecordDecoder,
            SubscriberDispatcher subscriberDispatcher,
            ObjectProvider<MeterRegistry> meterRegistry
    ) {
        return new StreamEventProcessor(
                changeRecordDecoder,
                subscriberDispatcher,
                meterRegistry.getIfAvailable(() -> Metrics.globalRegistry)
        );
    }
}
