package com.deepknow.callbot.domain.bridge.service;

/**
 * 客户端套接字的帧协议。
 * <ul>
 *   <li>NATIVE：二进制帧为 PCM 音频，文本帧为 start / audio / stop 控制事件，回传转写与问答事件。</li>
 *   <li>TWILIO：Twilio Media Streams，音频只走 media 事件的 base64 负载，二进制帧忽略；
 *   出站事件带 streamSid，转人工时追加 transfer_to_human 标记。</li>
 * </ul>
 */
public enum BridgeProtocol {
    NATIVE,
    TWILIO
}
