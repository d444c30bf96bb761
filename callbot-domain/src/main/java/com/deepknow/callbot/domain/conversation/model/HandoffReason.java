package com.deepknow.callbot.domain.conversation.model;

/**
 * 转人工的原因，{@link #code()} 为对外上报的稳定编码。
 */
public enum HandoffReason {
    // 输入阶段短路
    EMPTY_INPUT,
    RESTRICTED_TOPIC,
    NO_SCOPE,
    // 后端调用
    BACKEND_FAILURE,
    TIMEOUT,
    BACKEND_DECLINED,
    NO_DOCUMENTS,
    // 生成后的回复过滤
    EMPTY_REPLY,
    RESTRICTED_REPLY,
    NO_CONTEXT_REPLY,
    TRANSFER_REPLY;

    public String code() {
        return name().toLowerCase();
    }
}
