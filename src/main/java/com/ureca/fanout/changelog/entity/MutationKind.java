package com.ureca.fanout.changelog.entity;

import java.util.HashMap;
import java.util.Map;

/**
 * 변경 로그 레코드의 변경 종류
 * INSERT 외에는 전부 무시 대상
 */
public enum MutationKind {
    INSERT, // 새 이벤트 기록 (유일한 처리 대상)
    MODIFY, // 기존 항목 수정 (TTL 갱신 등)
    REMOVE, // 항목 삭제 (TTL 만료 포함)
    OTHER; // 알 수 없는 종류

    private static final Map<String, MutationKind> NAME_MAP;

    static {
        NAME_MAP = new HashMap<>();
        for (MutationKind kind : values()) {
            NAME_MAP.put(kind.name(), kind);
        }
    }

    /**
     * 레코드의 eventName 문자열로 조회
     * 모르는 값은 예외 대신 OTHER 로 취급하여 건너뛰게 한다
     *
     * @param name 변경 종류 (예: "INSERT")
     * @return MutationKind
     */
    public static MutationKind from(String name) {
        if (name == null) {
            return OTHER;
        }
        return NAME_MAP.getOrDefault(name, OTHER);
    }
}
