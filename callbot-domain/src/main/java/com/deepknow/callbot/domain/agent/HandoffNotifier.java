package com.deepknow.callbot.domain.agent;

/**
 * 转人工通知。尽力而为：不阻塞主流程，失败只记录日志。
 */
public interface HandoffNotifier {
    void notifyHandoff(HandoffNotice notice);
}
