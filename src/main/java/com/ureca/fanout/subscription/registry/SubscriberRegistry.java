package com.ureca.fanout.subscription.registry;

import com.ureca.fanout.subscription.entity.Subscriber;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;

/**
 * 이벤트 이름별 구독자 조회 (외부 구독 저장소)
 * <p>
 * 팬아웃이 커도 메모리와 요청 크기를 제한하기 위해 페이지 단위로 조회한다
 * 이벤트마다 0 페이지부터 새로 조회하며, 조회 자체의 장애는 예외로 전파한다
 */
public interface SubscriberRegistry {

    Slice<Subscriber> findByEventName(String eventName, Pageable pageable);
}
