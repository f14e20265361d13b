package com.ureca.fanout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

@ConfigurationProperties(prefix = "fanout")
public record FanoutProperties(
        @DefaultValue ChangeLog changeLog,
        @DefaultValue Dispatch dispatch,
        @DefaultValue Delivery delivery,
        Map<String, Object> executionContext // 모든 실행에 넘길 고정 컨텍스트
) {

    public FanoutProperties {
        executionContext = executionContext == null ? Map.of() : Map.copyOf(executionContext);
    }

    public record ChangeLog(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("fanout.change-log.queue") String queue,
            @DefaultValue("100") int batchSize,
            @DefaultValue("event") String eventAttribute,
            @DefaultValue("payload") String payloadAttribute
    ) {
    }

    public record Dispatch(
            @DefaultValue("50") int pageSize,
            @DefaultValue("10") int corePoolSize,
            @DefaultValue("50") int maxPoolSize,
            @DefaultValue("100") int queueCapacity
    ) {
    }

    public record Delivery(
            @DefaultValue("/queue/graphql") String destination
    ) {
    }
}
