package com.ureca.fanout.subscription.execution;

import com.ureca.fanout.changelog.dto.ChangeLogBatchContext;
import com.ureca.fanout.subscription.entity.Connection;

import java.util.Map;

// 실행마다 resolver 에 넘길 컨텍스트 생성
@FunctionalInterface
public interface ExecutionContextProvider {

    Map<String, Object> provide(Connection connection, ChangeLogBatchContext batchContext);
}
