package com.deepknow.callbot.domain.bridge.service;

/**
 * 双工音频桥接：一个客户端套接字对应一个转写连接，最终转写按会话 FIFO 串行送入问答编排。
 * 端点层应仅依赖此接口，具体实现放在 infra 层。
 */
public interface AudioBridgeService {

    /**
     * @return 本桥接会话的 sessionId
     */
    default String open(String wsId, ClientChannel channel, String scopeId) {
        return open(wsId, channel, scopeId, BridgeProtocol.NATIVE);
    }

    /**
     * @return 本桥接会话的 sessionId
     */
    String open(String wsId, ClientChannel channel, String scopeId, BridgeProtocol protocol);

    void onAudio(String wsId, byte[] frame);

    void onText(String wsId, String text);

    /** 幂等：取消进行中的交换并关闭两端连接。 */
    void close(String wsId, String reason);

    int activeCount();
}
