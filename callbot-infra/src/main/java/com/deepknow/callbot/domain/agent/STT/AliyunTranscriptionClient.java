package com.deepknow.callbot.domain.agent.STT;

import com.alibaba.dashscope.audio.asr.translation.TranslationRecognizerParam;
import com.alibaba.dashscope.audio.asr.translation.TranslationRecognizerRealtime;
import com.alibaba.dashscope.audio.asr.translation.results.TranslationRecognizerResult;
import com.alibaba.dashscope.common.ResultCallback;
import com.deepknow.callbot.domain.agent.TranscriptionClient;
import com.deepknow.callbot.domain.agent.TranscriptionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 阿里云百炼实时识别转写客户端（DashScope Java SDK）。
 * 参考示例：TranslationRecognizerRealtime，发送 ByteBuffer 音频帧并以回调接收转写结果。
 */
public class AliyunTranscriptionClient implements TranscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(AliyunTranscriptionClient.class);
    private static final long READY_DELAY_MS = 300;

    private final SttConfigProperties config;
    private final ScheduledExecutorService scheduler;

    private volatile TranscriptionListener listener;
    private volatile String sessionId;
    private volatile TranslationRecognizerRealtime translator;

    // 就绪门控与缓冲
    private volatile boolean ready = false;
    private volatile boolean startupFailed = false;
    private final ConcurrentLinkedQueue<byte[]> pending = new ConcurrentLinkedQueue<>();

    public AliyunTranscriptionClient(SttConfigProperties config, ScheduledExecutorService scheduler) {
        this.config = config;
        this.scheduler = scheduler;
    }

    @Override
    public void start(String sessionId, TranscriptionListener listener) {
        this.sessionId = sessionId;
        this.listener = listener;

        var builder = TranslationRecognizerParam.builder()
                .model(config.getAliyunModel())
                .format("pcm")
                .sampleRate(config.getSampleRate() <= 0 ? 16000 : config.getSampleRate())
                .transcriptionEnabled(true)
                .sourceLanguage(config.getLanguage() == null ? "auto" : config.getLanguage());
        // 未配置环境变量时 SDK 会读取自身默认的 DASHSCOPE_API_KEY
        String apiKey = config.resolveAliyunApiKey();
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.apiKey(apiKey);
        }
        TranslationRecognizerParam param = builder.build();

        try {
            translator = new TranslationRecognizerRealtime();
            translator.call(param, new ResultCallback<TranslationRecognizerResult>() {
                @Override
                public void onEvent(TranslationRecognizerResult result) {
                    try {
                        if (result.getTranscriptionResult() == null) return;
                        String text = result.getTranscriptionResult().getText();
                        if (text != null && !text.isEmpty()) {
                            listener.onTranscript(text, result.isSentenceEnd());
                        }
                    } catch (Exception e) {
                        log.warn("Handle transcription result failed: sessionId={}", sessionId, e);
                    }
                }

                @Override
                public void onComplete() {
                    log.info("Aliyun STT transcription complete: sessionId={}", sessionId);
                    listener.onClosed(1000, "complete");
                }

                @Override
                public void onError(Exception e) {
                    log.error("Aliyun STT error: sessionId={}", sessionId, e);
                    startupFailed = true;
                    listener.onError(e);
                }
            });
            log.info("Aliyun STT session starting: model={} sessionId={}", config.getAliyunModel(), sessionId);
            // 简单就绪延时：避免在连接未建立时发送音频导致 idle 错误
            scheduler.schedule(this::markReady, READY_DELAY_MS, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.error("Start Aliyun STT session failed: sessionId={}", sessionId, e);
            listener.onError(e);
        }
    }

    private void markReady() {
        if (startupFailed || translator == null) {
            log.warn("Aliyun STT startup failed; skip ready signal and draining, sessionId={}", sessionId);
            return;
        }
        log.info("Aliyun STT ready; draining {} buffered frames, sessionId={}", pending.size(), sessionId);
        // 将缓冲的音频帧依次发送
        byte[] buf;
        while ((buf = pending.poll()) != null) {
            send(buf);
        }
        ready = true;
        listener.onReady();
    }

    @Override
    public void sendAudio(byte[] pcmChunk) {
        if (translator == null || pcmChunk == null) return;
        if (!ready) {
            // 缓冲未就绪的音频帧，设置上限避免无限增长
            if (pending.size() >= Math.max(1, config.getMaxPendingFrames())) {
                pending.poll();
            }
            pending.offer(Arrays.copyOf(pcmChunk, pcmChunk.length));
            return;
        }
        send(pcmChunk);
    }

    private void send(byte[] frame) {
        TranslationRecognizerRealtime t = translator;
        if (t == null) return;
        try {
            t.sendAudioFrame(ByteBuffer.wrap(frame));
        } catch (Exception e) {
            log.warn("sendAudio failed: sessionId={}", sessionId, e);
            listener.onError(e);
        }
    }

    @Override
    public void close() {
        TranslationRecognizerRealtime t = translator;
        translator = null;
        ready = false;
        pending.clear();
        if (t == null) return;
        try {
            if (t.getDuplexApi() != null) {
                t.getDuplexApi().close(1000, "bye");
            }
            log.info("Aliyun STT closed: sessionId={}", sessionId);
        } catch (Exception e) {
            log.warn("Close Aliyun STT failed: sessionId={}", sessionId, e);
        }
    }
}
