package com.ureca.fanout.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // 변경 로그
    CHANGE_RECORD_DECODE_FAILED("CHANGE_RECORD_DECODE_FAILED_422", "변경 레코드를 해석할 수 없습니다."),
    CHANGE_RECORD_UNSUPPORTED_ATTRIBUTE("CHANGE_RECORD_UNSUPPORTED_ATTRIBUTE_422", "지원하지 않는 속성 타입입니다."),

    // 구독 실행
    SUBSCRIPTION_EXECUTION_FAILED("SUBSCRIPTION_EXECUTION_FAILED_500", "구독 연산 실행 중 오류가 발생했습니다."),
    SUBSCRIPTION_EVENT_SOURCE_CONSUMED("SUBSCRIPTION_EVENT_SOURCE_CONSUMED_500", "이벤트 소스는 한 번만 구독할 수 있습니다."),

    // 전송
    CONNECTION_GONE("CONNECTION_GONE_410", "이미 종료된 연결입니다."),
    DELIVERY_FAILED("DELIVERY_FAILED_500", "연결로 메시지 전송에 실패했습니다.");

    private final String code;
    private final String message;
}
