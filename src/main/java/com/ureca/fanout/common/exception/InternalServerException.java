package com.ureca.fanout.common.exception;

import com.ureca.fanout.common.BaseCode;

/**
 * 파이프라인 내부에서 발생하는 복구 불가능한 예외
 * 구독자 또는 레코드 단위에서 잡혀 결과 값으로 변환된다
 */
public class InternalServerException extends BaseCustomException {

    public InternalServerException(BaseCode baseCode) {
        super(baseCode);
    }

    public InternalServerException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }

    public InternalServerException(BaseCode baseCode, String message, Throwable cause) {
        super(baseCode, message, cause);
    }
}
