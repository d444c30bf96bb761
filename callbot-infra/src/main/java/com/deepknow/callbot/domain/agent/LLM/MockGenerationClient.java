package com.deepknow.callbot.domain.agent.LLM;

import com.deepknow.callbot.domain.agent.GenerationClient;
import com.deepknow.callbot.domain.agent.GenerationRequest;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.common.ExchangeCancelledException;
import com.deepknow.callbot.domain.conversation.model.Answer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * 开发用 Mock 生成后端：不调用外部服务，按词输出演示答案。
 */
public class MockGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(MockGenerationClient.class);

    private final long tokenDelayMs;

    public MockGenerationClient(long tokenDelayMs) {
        this.tokenDelayMs = Math.max(0, tokenDelayMs);
    }

    @Override
    public Answer generate(GenerationRequest request, CancellationToken cancel) {
        cancel.throwIfCancelled();
        String answer = answerFor(request);
        log.info("Mock generate: scopeId={} sessionId={} preview=\"{}\"", request.getScopeId(), request.getSessionId(), preview(answer, 80));
        return Answer.answer(answer, citationsFor(request));
    }

    @Override
    public Answer generateStream(GenerationRequest request, CancellationToken cancel,
                                 Consumer<List<String>> onRetrievalDone, Consumer<String> onToken) {
        List<String> citations = citationsFor(request);
        onRetrievalDone.accept(citations);
        String full = answerFor(request);
        String[] words = full.split(" ");
        for (int i = 0; i < words.length; i++) {
            cancel.throwIfCancelled();
            pause();
            onToken.accept(i == 0 ? words[i] : " " + words[i]);
        }
        cancel.throwIfCancelled();
        log.info("Mock stream end: words={} sessionId={}", words.length, request.getSessionId());
        return Answer.answer(full, citations);
    }

    @Override
    public String name() {
        return "mock";
    }

    private void pause() {
        if (tokenDelayMs <= 0) return;
        try {
            Thread.sleep(tokenDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeCancelledException("interrupted");
        }
    }

    private static String answerFor(GenerationRequest request) {
        return "[mock] Based on the available documents, here is a short answer to: " + request.getQuery();
    }

    private static List<String> citationsFor(GenerationRequest request) {
        return List.of("mock-" + request.getScopeId());
    }

    private static String preview(String s, int n) {
        if (s == null) return "null";
        return s.length() <= n ? s : s.substring(0, n) + "...";
    }
}
