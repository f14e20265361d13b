package com.ureca.fanout.subscription.execution;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.reactivestreams.Publisher;

/**
 * 실행 엔진 호출 결과
 * <p>
 * 구독이 시작되면 결과 스트림(Publisher), 시작 단계에서 실패하면
 * (검증 오류, resolver 오류 등) 스트림이 아닌 오류 결과를 담는다
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionOutcome {

    private final Publisher<ExecutionResult> results;
    private final ExecutionResult errorResult;

    public static ExecutionOutcome subscribed(Publisher<ExecutionResult> results) {
        return new ExecutionOutcome(results, null);
    }

    public static ExecutionOutcome failed(ExecutionResult errorResult) {
        return new ExecutionOutcome(null, errorResult);
    }

    public boolean isSubscribed() {
        return results != null;
    }
}
