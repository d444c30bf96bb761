package com.deepknow.callbot.domain.agent.LLM;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * 上游 text/event-stream 解析：按空行切分事件块，合并多行 data，识别 [DONE]。
 */
public final class EventStreamReader {

    @FunctionalInterface
    public interface Handler {
        /**
         * @return false 表示停止读取
         */
        boolean onEvent(String eventType, String data);
    }

    public static final String DONE = "[DONE]";

    private EventStreamReader() {}

    public static void read(InputStream in, Handler handler) throws IOException {
        BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String eventType = "message";
        StringBuilder data = null;
        String line;
        while ((line = br.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null && !dispatch(eventType, data, handler)) {
                    return;
                }
                eventType = "message";
                data = null;
                continue;
            }
            if (line.startsWith("event:")) {
                eventType = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                if (data == null) {
                    data = new StringBuilder();
                } else {
                    data.append('\n');
                }
                data.append(line.substring(5).trim());
            }
        }
        if (data != null) {
            dispatch(eventType, data, handler);
        }
    }

    private static boolean dispatch(String eventType, StringBuilder data, Handler handler) {
        String payload = data.toString().trim();
        if (payload.isEmpty()) {
            return true;
        }
        if (DONE.equals(payload)) {
            return false;
        }
        return handler.onEvent(eventType, payload);
    }
}
