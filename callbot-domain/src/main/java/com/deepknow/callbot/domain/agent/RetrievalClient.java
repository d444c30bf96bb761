package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.common.CancellationToken;

import java.util.List;

public interface RetrievalClient {
    /**
     * 按相关度降序返回文档；失败抛出 BackendFailureException。
     */
    List<RetrievedDocument> retrieve(String query, int topK, CancellationToken cancel);
}
