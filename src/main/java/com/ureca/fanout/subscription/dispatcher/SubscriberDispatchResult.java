package com.ureca.fanout.subscription.dispatcher;

import com.ureca.fanout.common.exception.BaseCustomException;
import com.ureca.fanout.subscription.entity.Subscriber;

/**
 * 구독자 한 명에 대한 처리 결과
 * 실패도 여기서 끝난다 (상위로 예외를 던지지 않음)
 */
public record SubscriberDispatchResult(
        String connectionId,
        String operationId,
        DispatchOutcome outcome,
        FailureKind failureKind, // FAILED 일 때만 존재
        String errorMessage
) {

    public static SubscriberDispatchResult delivered(Subscriber subscriber) {
        return of(subscriber, DispatchOutcome.DELIVERED, null, null);
    }

    public static SubscriberDispatchResult filtered(Subscriber subscriber) {
        return of(subscriber, DispatchOutcome.FILTERED, null, null);
    }

    public static SubscriberDispatchResult notStarted(Subscriber subscriber) {
        return of(subscriber, DispatchOutcome.NOT_STARTED, null, null);
    }

    public static SubscriberDispatchResult failed(Subscriber subscriber, FailureKind failureKind, Throwable cause) {
        String errorMessage = cause instanceof BaseCustomException custom ? custom.toSummary() : cause.getMessage();
        return of(subscriber, DispatchOutcome.FAILED, failureKind, errorMessage);
    }

    private static SubscriberDispatchResult of(Subscriber subscriber, DispatchOutcome outcome,
                                               FailureKind failureKind, String errorMessage) {
        String connectionId = subscriber.connection() == null ? null : subscriber.connection().id();
        return new SubscriberDispatchResult(connectionId, subscriber.operationId(), outcome, failureKind, errorMessage);
    }
}
