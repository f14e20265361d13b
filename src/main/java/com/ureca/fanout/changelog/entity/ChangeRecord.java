package com.ureca.fanout.changelog.entity;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * 변경 로그에서 전달된 레코드 한 건
 * 이 파이프라인에서는 읽기 전용
 */
public record ChangeRecord(
        String recordId, // 변경 로그상의 레코드 식별자 (로그 추적용)
        MutationKind mutationKind,
        Map<String, JsonNode> newImage // 속성 인코딩된 새 이미지, 없을 수 있음
) {

    public boolean isInsert() {
        return mutationKind == MutationKind.INSERT;
    }

    public boolean hasNewImage() {
        return newImage != null;
    }
}
