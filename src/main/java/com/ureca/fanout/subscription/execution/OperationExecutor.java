package com.ureca.fanout.subscription.execution;

/**
 * GraphQL 구독 실행 엔진 (외부 협력자)
 * <p>
 * 연산 파싱, 검증, resolver 실행은 엔진 책임
 * 구독 resolver 는 request.eventSource() 에서 이벤트를 받아야 한다
 * DELIVER_ONLY 모드에서는 새 구독을 등록하면 안 된다
 */
public interface OperationExecutor {

    ExecutionOutcome execute(ExecutionRequest request);
}
