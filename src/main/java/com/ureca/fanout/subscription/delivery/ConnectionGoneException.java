package com.ureca.fanout.subscription.delivery;

import com.ureca.fanout.common.exception.InternalServerException;

import static com.ureca.fanout.common.BaseCode.CONNECTION_GONE;

/**
 * 전송 대상 연결이 이미 끊긴 경우
 * 연결 정리는 연결 저장소 책임
 */
public class ConnectionGoneException extends InternalServerException {

    public ConnectionGoneException(String connectionId) {
        super(CONNECTION_GONE, "이미 종료된 연결: " + connectionId);
    }

    public ConnectionGoneException(String connectionId, Throwable cause) {
        super(CONNECTION_GONE, "이미 종료된 연결: " + connectionId, cause);
    }
}
