package com.ureca.fanout.common.exception;

import com.ureca.fanout.common.BaseCode;
import lombok.Getter;

/**
 * 파이프라인 예외 공통 부모
 * 구독자 처리 결과에 남길 수 있도록 오류 코드를 함께 들고 다닌다
 */
@Getter
public abstract class BaseCustomException extends RuntimeException {
    private final BaseCode baseCode;

    protected BaseCustomException(BaseCode baseCode) {
        super(baseCode.getMessage());
        this.baseCode = baseCode;
    }

    protected BaseCustomException(BaseCode baseCode, String detail) {
        super(detail);
        this.baseCode = baseCode;
    }

    protected BaseCustomException(BaseCode baseCode, String detail, Throwable cause) {
        super(detail, cause);
        this.baseCode = baseCode;
    }

    // 결과/로그용 요약: [코드] 상세 메시지
    public String toSummary() {
        return "[" + baseCode.getCode() + "] " + getMessage();
    }
}
