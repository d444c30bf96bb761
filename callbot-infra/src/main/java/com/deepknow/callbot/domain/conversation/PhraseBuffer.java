package com.deepknow.callbot.domain.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 将增量文本片段聚合成以词为边界的短语，便于逐段播报或展示。
 * <p>
 * 达到最小词数且以句末标点加空白结尾时整体输出；否则每凑满最大词数输出一次。
 * 按词数切分时只计入后面已跟空白的完整词，跨片段的半个词不会被截断。
 */
public class PhraseBuffer {
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s\\z");

    private final int minWords;
    private final int maxWords;
    private final Consumer<String> onPhrase;
    private final StringBuilder buffer = new StringBuilder(256);

    public PhraseBuffer(int minWords, int maxWords, Consumer<String> onPhrase) {
        this.minWords = Math.max(1, minWords);
        this.maxWords = Math.max(this.minWords, maxWords);
        this.onPhrase = onPhrase;
    }

    public synchronized void push(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return;
        }
        buffer.append(fragment);
        List<int[]> words = words();
        if (words.size() < minWords) {
            return;
        }
        if (SENTENCE_END.matcher(buffer).find()) {
            emit(words, words.size());
            return;
        }
        int complete = endsWithWhitespace() ? words.size() : words.size() - 1;
        while (complete >= maxWords) {
            emit(words, maxWords);
            words = words();
            complete = endsWithWhitespace() ? words.size() : words.size() - 1;
        }
    }

    /** 强制输出剩余内容并清空。 */
    public synchronized void flush() {
        List<int[]> words = words();
        if (words.isEmpty()) {
            buffer.setLength(0);
            return;
        }
        emit(words, words.size());
    }

    public synchronized String remainder() {
        return buffer.toString();
    }

    private void emit(List<int[]> words, int count) {
        StringBuilder phrase = new StringBuilder();
        for (int i = 0; i < count; i++) {
            int[] w = words.get(i);
            if (i > 0) phrase.append(' ');
            phrase.append(buffer, w[0], w[1]);
        }
        int cut = words.get(count - 1)[1];
        String tail = buffer.substring(cut);
        buffer.setLength(0);
        buffer.append(stripLeading(tail));
        onPhrase.accept(phrase.toString());
    }

    // [start, end) 区间
    private List<int[]> words() {
        List<int[]> out = new ArrayList<>();
        int i = 0;
        int n = buffer.length();
        while (i < n) {
            while (i < n && Character.isWhitespace(buffer.charAt(i))) i++;
            if (i >= n) break;
            int start = i;
            while (i < n && !Character.isWhitespace(buffer.charAt(i))) i++;
            out.add(new int[]{start, i});
        }
        return out;
    }

    private boolean endsWithWhitespace() {
        return buffer.length() > 0 && Character.isWhitespace(buffer.charAt(buffer.length() - 1));
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return s.substring(i);
    }
}
