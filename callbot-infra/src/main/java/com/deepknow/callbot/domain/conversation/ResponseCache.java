package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.domain.common.CallbotException;
import com.deepknow.callbot.domain.conversation.model.Answer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 已完成答案的 TTL 缓存，附带同 key 请求合并。
 * <ul>
 *   <li>条目按插入顺序淘汰（非严格 LRU），超过 TTL 视为不存在并在下次查询时清除；</li>
 *   <li>同一 key 同时最多一个计算在途，后到者等待同一结果；</li>
 *   <li>只缓存 answer，handoff 不缓存。</li>
 * </ul>
 */
public class ResponseCache {
    private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

    public enum Source { HIT, JOINED, COMPUTED, BYPASS }

    private final long ttlMs;
    private final int maxEntries;
    private final Clock clock;
    // guarded by this
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Answer>> inflight = new ConcurrentHashMap<>();

    public ResponseCache(long ttlMs, int maxEntries, Clock clock) {
        this.ttlMs = ttlMs;
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static String key(String scopeId, String cleanText) {
        return (scopeId == null ? "" : scopeId) + "::" + (cleanText == null ? "" : cleanText.toLowerCase(Locale.ROOT));
    }

    public Resolution resolve(String key, boolean bypass, Supplier<Answer> compute) {
        if (bypass) {
            return new Resolution(compute.get(), Source.BYPASS);
        }
        Answer cached = lookup(key);
        if (cached != null) {
            return new Resolution(cached, Source.HIT);
        }

        CompletableFuture<Answer> mine = new CompletableFuture<>();
        CompletableFuture<Answer> existing = inflight.putIfAbsent(key, mine);
        if (existing != null) {
            logger.debug("Cache inflight joined: key={}", key);
            return new Resolution(await(existing), Source.JOINED);
        }

        // 注册前另一个计算可能刚好完成并写入缓存
        Answer raced = lookup(key);
        if (raced != null) {
            inflight.remove(key, mine);
            mine.complete(raced);
            return new Resolution(raced, Source.HIT);
        }

        Answer result;
        try {
            result = compute.get();
        } catch (RuntimeException e) {
            inflight.remove(key, mine);
            mine.completeExceptionally(e);
            throw e;
        }
        inflight.remove(key, mine);
        if (result != null && result.isAnswer()) {
            store(key, result);
        }
        mine.complete(result);
        return new Resolution(result, Source.COMPUTED);
    }

    /**
     * @return 未过期的缓存答案，没有时返回 null
     */
    public Answer lookup(String key) {
        synchronized (this) {
            Entry e = entries.get(key);
            if (e == null) {
                return null;
            }
            if (clock.millis() - e.createdAtMillis > ttlMs) {
                entries.remove(key);
                return null;
            }
            return e.answer;
        }
    }

    public void store(String key, Answer answer) {
        if (ttlMs <= 0 || answer == null || !answer.isAnswer()) {
            return;
        }
        synchronized (this) {
            entries.remove(key);
            entries.put(key, new Entry(answer, clock.millis()));
            Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
            while (entries.size() > maxEntries && it.hasNext()) {
                it.next();
                it.remove();
            }
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public int inflightCount() {
        return inflight.size();
    }

    private static Answer await(CompletableFuture<Answer> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CallbotException("inflight computation failed", cause);
        }
    }

    private static final class Entry {
        private final Answer answer;
        private final long createdAtMillis;

        Entry(Answer answer, long createdAtMillis) {
            this.answer = answer;
            this.createdAtMillis = createdAtMillis;
        }
    }

    public static final class Resolution {
        private final Answer answer;
        private final Source source;

        public Resolution(Answer answer, Source source) {
            this.answer = answer;
            this.source = source;
        }

        public Answer getAnswer() { return answer; }
        public Source getSource() { return source; }
    }
}
