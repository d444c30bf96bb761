package com.deepknow.callbot.domain.conversation.service;

import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.conversation.event.StreamEventSink;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;

/**
 * 单次问答编排入口。传输层（HTTP、事件流、音频桥接、RPC）只依赖此接口，实现放在 infra 层。
 */
public interface AssistantService {

    /**
     * 阻塞式：清洗 → 缓存/合并 → 生成 → 过滤，返回终态结果。
     */
    ExchangeResult respond(ExchangeRequest request);

    /**
     * 流式：按顺序向 sink 推送事件。cancel 触发后不再推送，结果状态为 CANCELLED。
     */
    ExchangeResult stream(ExchangeRequest request, StreamEventSink sink, CancellationToken cancel);
}
