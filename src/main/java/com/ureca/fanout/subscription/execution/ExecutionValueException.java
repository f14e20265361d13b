package com.ureca.fanout.subscription.execution;

import com.ureca.fanout.common.exception.InternalServerException;

import static com.ureca.fanout.common.BaseCode.SUBSCRIPTION_EXECUTION_FAILED;

// 실행 결과에서 첫 값을 꺼내는 중 발생한 오류
public class ExecutionValueException extends InternalServerException {

    public ExecutionValueException(String operationId, Throwable cause) {
        super(SUBSCRIPTION_EXECUTION_FAILED, "구독 결과 수신 실패. operationId: " + operationId, cause);
    }
}
