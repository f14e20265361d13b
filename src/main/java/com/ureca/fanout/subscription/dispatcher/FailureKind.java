package com.ureca.fanout.subscription.dispatcher;

public enum FailureKind {
    EXECUTION_START, // 실행 엔진 호출 자체가 실패
    EXECUTION_VALUE, // 결과 스트림에서 첫 값 수신 중 실패
    DELIVERY, // 연결 종료 또는 전송 장애
    UNEXPECTED // 위 단계 밖의 오류 (메시지 구성 등)
}
