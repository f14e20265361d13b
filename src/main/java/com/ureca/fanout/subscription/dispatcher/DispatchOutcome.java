package com.ureca.fanout.subscription.dispatcher;

public enum DispatchOutcome {
    DELIVERED, // 메시지 전송 완료
    FILTERED, // 실행 결과 값 없음 (구독 필터가 이벤트를 거름)
    NOT_STARTED, // 실행 엔진이 스트림 대신 오류 결과 반환
    FAILED; // 실행 또는 전송 중 예외 (처리 완료로 간주)

    public String metricTag() {
        return name().toLowerCase();
    }
}
