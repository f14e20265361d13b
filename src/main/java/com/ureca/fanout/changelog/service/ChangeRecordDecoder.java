package com.ureca.fanout.changelog.service;

import com.ureca.fanout.changelog.entity.ChangeRecord;
import com.ureca.fanout.changelog.exception.ChangeRecordDecodeException;
import com.ureca.fanout.subscription.entity.SubscriptionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * 변경 레코드 -> 구독 이벤트 변환
 * <p>
 * INSERT 만 처리한다. 같은 이벤트가 수정/삭제(TTL 만료 등)로 다시 관측되면
 * 중복 전송이 되기 때문
 * 부수 효과 없음
 */
@Slf4j
@RequiredArgsConstructor
public class ChangeRecordDecoder {

    private final AttributeValueConverter attributeValueConverter;
    private final String eventAttribute;
    private final String payloadAttribute;

    /**
     * 레코드 해석
     *
     * @param record 변경 레코드
     * @return 구독 이벤트, INSERT 가 아니면 empty
     * @throws ChangeRecordDecodeException 이미지가 없거나 형식이 잘못된 경우
     */
    public Optional<SubscriptionEvent> decode(ChangeRecord record) {
        if (!record.isInsert()) {
            log.debug("[ChangeLog] INSERT 아님. 건너뜀. recordId: {}, mutationKind: {}",
                    record.recordId(), record.mutationKind());
            return Optional.empty();
        }

        if (!record.hasNewImage()) {
            throw new ChangeRecordDecodeException("INSERT 레코드에 새 이미지가 없습니다. recordId: " + record.recordId());
        }

        Map<String, Object> image = attributeValueConverter.unmarshall(record.newImage());

        Object eventName = image.get(eventAttribute);
        if (!(eventName instanceof String name) || name.isBlank()) {
            throw new ChangeRecordDecodeException(
                    "이벤트 이름 속성이 없습니다. recordId: " + record.recordId() + ", attribute: " + eventAttribute);
        }

        // payload 가 없는 이벤트는 빈 객체로 취급
        Object payload = image.get(payloadAttribute);
        return Optional.of(new SubscriptionEvent(name, payload == null ? Map.of() : payload));
    }
}
