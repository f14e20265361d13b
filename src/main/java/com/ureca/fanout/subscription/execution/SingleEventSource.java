package com.ureca.fanout.subscription.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.common.exception.InternalServerException;
import com.ureca.fanout.subscription.entity.SubscriptionEvent;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.ureca.fanout.common.BaseCode.SUBSCRIPTION_EVENT_SOURCE_CONSUMED;

/**
 * 이미 알고 있는 이벤트 한 건을 구독 실행 경로에 흘려보내는 일회용 소스
 * <p>
 * 실행 엔진의 "이벤트 이름 구독 후 첫 값 대기" 흐름을 실제 브로커 없이 충족시킨다
 * 이름이 일치하면 payload 하나를 내보내고 끝나며, 일치하지 않으면 아무것도 내보내지 않는다
 * (이벤트, 구독자) 쌍마다 새로 만들고 한 번 구독한 뒤 버린다
 */
public class SingleEventSource {

    private final SubscriptionEvent event;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public SingleEventSource(SubscriptionEvent event, ObjectMapper objectMapper) {
        this.event = event;
        this.objectMapper = objectMapper;
    }

    public Publisher<Object> asyncIterator(String eventName) {
        return asyncIterator(List.of(eventName));
    }

    /**
     * 이벤트 이름 구독
     *
     * @param eventNames 구독할 이벤트 이름 목록
     * @return 최대 1개 원소를 가진 유한 스트림, 두 번째 구독은 오류
     */
    public Publisher<Object> asyncIterator(Collection<String> eventNames) {
        return Flux.defer(() -> {
            if (!consumed.compareAndSet(false, true)) {
                return Flux.error(new InternalServerException(SUBSCRIPTION_EVENT_SOURCE_CONSUMED));
            }
            if (!eventNames.contains(event.eventName())) {
                return Flux.empty();
            }
            return Mono.fromCallable(this::readPayload).flux();
        });
    }

    public String getEventName() {
        return event.eventName();
    }

    // 문자열 payload 는 구독 시점에 JSON 해석
    private Object readPayload() throws JsonProcessingException {
        Object payload = event.payload();
        if (payload instanceof String json) {
            return objectMapper.readValue(json, Object.class);
        }
        return payload;
    }
}
