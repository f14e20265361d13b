package com.ureca.fanout.changelog.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.changelog.dto.ChangeLogBatchContext;
import com.ureca.fanout.changelog.dto.StreamRecordMessage;
import com.ureca.fanout.changelog.entity.ChangeRecord;
import com.ureca.fanout.changelog.service.StreamEventProcessor;
import com.ureca.fanout.config.ChangeLogRabbitMQConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 변경 로그 큐 배치 수신
 * <p>
 * 리스너가 예외를 던지면 배치 전체가 재전달되므로
 * 읽을 수 없는 메시지는 로그만 남기고 제외한다
 * 구독자 저장소 장애는 그대로 던져 배치를 다시 받는다
 */
@Slf4j
@RequiredArgsConstructor
public class ChangeLogBatchListener {

    private final StreamEventProcessor streamEventProcessor;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String queueName;

    @RabbitListener(
            queues = "${fanout.change-log.queue:fanout.change-log.queue}",
            containerFactory = ChangeLogRabbitMQConfig.CONTAINER_FACTORY_NAME
    )
    public void handleBatch(List<Message> messages) {
        List<ChangeRecord> records = new ArrayList<>(messages.size());

        for (Message message : messages) {
            ChangeRecord record = readRecord(message);
            if (record != null) {
                records.add(record);
            }
        }

        streamEventProcessor.process(records, ChangeLogBatchContext.of(queueName, messages.size()));
    }

    // 읽을 수 없는 메시지는 null (본문이 JSON null 인 경우 포함)
    private ChangeRecord readRecord(Message message) {
        String messageId = message.getMessageProperties().getMessageId();
        try {
            StreamRecordMessage body = objectMapper.readValue(message.getBody(), StreamRecordMessage.class);
            if (body == null) {
                log.error("[ChangeLog] 메시지 본문 없음. 제외. messageId: {}", messageId);
                countUnreadable();
                return null;
            }
            return body.toChangeRecord();
        } catch (IOException | RuntimeException e) {
            log.error("[ChangeLog] 메시지 JSON 파싱 실패. 제외. messageId: {}", messageId, e);
            countUnreadable();
            return null;
        }
    }

    private void countUnreadable() {
        Counter.builder(StreamEventProcessor.RECORD_METRIC)
                .tag("result", "unreadable")
                .register(meterRegistry).increment();
    }
}
