package com.ureca.fanout.changelog.dto;

import java.time.Instant;

/**
 * 배치 호출 단위 컨텍스트
 * 실행 엔진에 호스트 호출 정보로 그대로 전달된다
 */
public record ChangeLogBatchContext(
        String source, // 배치를 전달한 큐 이름
        int recordCount,
        Instant receivedAt
) {

    public static ChangeLogBatchContext of(String source, int recordCount) {
        return new ChangeLogBatchContext(source, recordCount, Instant.now());
    }
}
