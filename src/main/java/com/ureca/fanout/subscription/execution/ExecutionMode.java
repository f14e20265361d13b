package com.ureca.fanout.subscription.execution;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 실행 엔진 호출 모드
 * 엔진은 registerSubscriptions 가 false 면 구독 저장소에 새 구독을 기록하면 안 된다
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionMode {
    DELIVER_ONLY(false, true); // 이미 등록된 구독에 이벤트 재생 (등록 금지)

    private final boolean registerSubscriptions;
    private final boolean useSubscriptions;
}
