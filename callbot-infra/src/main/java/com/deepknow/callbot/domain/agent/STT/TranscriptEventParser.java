package com.deepknow.callbot.domain.agent.STT;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 转写事件解析：兼容 Deepgram 结构 {channel.alternatives[0].transcript, is_final/speech_final}
 * 与通用结构 {transcript, isFinal}。无文本的事件（元数据、心跳）返回 null。
 */
public final class TranscriptEventParser {

    private TranscriptEventParser() {}

    public static ParsedTranscript parse(ObjectMapper mapper, String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode alt = root.path("channel").path("alternatives").path(0);
        if (alt.path("transcript").isTextual()) {
            boolean isFinal = root.path("is_final").asBoolean(false) || root.path("speech_final").asBoolean(false);
            return toResult(alt.path("transcript").asText(), isFinal);
        }
        if (root.path("transcript").isTextual()) {
            boolean isFinal = root.path("isFinal").asBoolean(false) || root.path("is_final").asBoolean(false);
            return toResult(root.path("transcript").asText(), isFinal);
        }
        return null;
    }

    private static ParsedTranscript toResult(String text, boolean isFinal) {
        String t = text == null ? "" : text.trim();
        return t.isEmpty() ? null : new ParsedTranscript(t, isFinal);
    }

    public static final class ParsedTranscript {
        private final String text;
        private final boolean isFinal;

        public ParsedTranscript(String text, boolean isFinal) {
            this.text = text;
            this.isFinal = isFinal;
        }

        public String getText() { return text; }
        public boolean isFinal() { return isFinal; }
    }
}
