package com.deepknow.callbot.domain.agent.LLM;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventStreamReaderTest {

    @Test
    void splitsEventsAndJoinsMultiLineData() throws IOException {
        List<String> seen = new ArrayList<>();
        String body = "event: delta\ndata: {\"a\":1}\n\n"
                + ": keep-alive\n\n"
                + "data: line1\ndata: line2\n\n";

        EventStreamReader.read(stream(body), (type, data) -> seen.add(type + "|" + data));

        assertThat(seen).containsExactly("delta|{\"a\":1}", "message|line1\nline2");
    }

    @Test
    void stopsAtDoneMarker() throws IOException {
        List<String> seen = new ArrayList<>();
        String body = "data: one\n\ndata: [DONE]\n\ndata: two\n\n";

        EventStreamReader.read(stream(body), (type, data) -> seen.add(data));

        assertThat(seen).containsExactly("one");
    }

    @Test
    void handlerCanStopReading() throws IOException {
        List<String> seen = new ArrayList<>();
        String body = "data: one\n\ndata: two\n\n";

        EventStreamReader.read(stream(body), (type, data) -> {
            seen.add(data);
            return false;
        });

        assertThat(seen).containsExactly("one");
    }

    @Test
    void dispatchesTrailingEventWithoutBlankLine() throws IOException {
        List<String> seen = new ArrayList<>();

        EventStreamReader.read(stream("data: tail"), (type, data) -> seen.add(data));

        assertThat(seen).containsExactly("tail");
    }

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
