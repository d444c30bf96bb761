package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.conversation.model.Answer;

import java.util.List;
import java.util.function.Consumer;

/**
 * 检索增强生成后端。实现需响应 {@link CancellationToken}：取消后尽快中止网络调用并抛出
 * {@link com.deepknow.callbot.domain.common.ExchangeCancelledException}；其他失败抛出
 * {@link com.deepknow.callbot.domain.common.BackendFailureException}。
 */
public interface GenerationClient {

    Answer generate(GenerationRequest request, CancellationToken cancel);

    /**
     * 流式生成。onRetrievalDone 须在 onToken 之前或与之交错至少调用一次；返回的文本为完整回复。
     */
    Answer generateStream(GenerationRequest request,
                          CancellationToken cancel,
                          Consumer<List<String>> onRetrievalDone,
                          Consumer<String> onToken);

    default String name() {
        return getClass().getSimpleName();
    }
}
