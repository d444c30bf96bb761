package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.config.PolicyProperties;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.HandoffReason;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 输入清洗与输出过滤策略：控制字符与噪声 token 清理、敏感话题拦截、回复拒答识别、转人工话术选择。
 */
public class ConversationPolicy {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
    // 语种判断只做 ASCII 大小写折叠：Unicode 折叠会让 İ 与 i 互相匹配，几乎所有英文都会被判成土耳其语。
    // 默认正则已显式列出土耳其字母的大小写。
    private static final int LANGUAGE_FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x{0000}-\\x{0008}\\x{000B}\\x{000C}\\x{000E}-\\x{001F}\\x{007F}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // 会打散缓存 key 或泄漏进提示词的易变 token
    private static final List<Pattern> NOISE_TOKENS = List.of(
            Pattern.compile("\\bnonce=\\d+\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsession=[A-Za-z0-9_-]{3,}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:ts|timestamp|time)=\\d{10,16}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}(?::\\d{2})?(?:\\.\\d{1,3})?(?:Z|[+-]\\d{2}:?\\d{2})?\\b"),
            Pattern.compile("\\b[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[(?:[A-Za-z0-9:_=-]{2,80})\\]"),
            Pattern.compile("\\{(?:[A-Za-z0-9:_=-]{2,80})\\}"),
            Pattern.compile("\\((?:[A-Za-z0-9:_=-]{2,80})\\)"),
            Pattern.compile("<(?:[A-Za-z0-9:_=-]{2,80})>")
    );

    private static final Pattern CITATION_MARKER = Pattern.compile("【[^】]*】");
    private static final Pattern DANGLING_CITATION_MARKER = Pattern.compile("【[^】]*$");

    private final Pattern restricted;
    private final Pattern noContext;
    private final Pattern transfer;
    private final Pattern secondaryLanguage;
    private final String primaryMessage;
    private final String secondaryMessage;
    private final int maxUserTextChars;
    private final int maxReplyChars;

    public ConversationPolicy(PolicyProperties props, int maxUserTextChars, int maxReplyChars) {
        this.restricted = Pattern.compile(props.getRestrictedPattern(), FLAGS);
        this.noContext = Pattern.compile(props.getNoContextPattern(), FLAGS);
        this.transfer = Pattern.compile(props.getTransferPattern(), FLAGS);
        this.secondaryLanguage = Pattern.compile(props.getSecondaryLanguagePattern(), LANGUAGE_FLAGS);
        this.primaryMessage = props.getHandoffMessagePrimary();
        this.secondaryMessage = props.getHandoffMessageSecondary();
        this.maxUserTextChars = maxUserTextChars;
        this.maxReplyChars = maxReplyChars;
    }

    /**
     * 去噪 → 清洗 → 截断。结果为空表示无可用输入。
     */
    public String cleanUserText(String raw) {
        return sanitize(stripNoiseTokens(raw), maxUserTextChars);
    }

    public static String sanitize(String text, int maxChars) {
        String normalized = text == null ? "" : text;
        normalized = CONTROL_CHARS.matcher(normalized).replaceAll(" ");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        if (maxChars > 0 && normalized.length() > maxChars) {
            return normalized.substring(0, maxChars);
        }
        return normalized;
    }

    public String stripNoiseTokens(String text) {
        String value = text == null ? "" : text;
        for (Pattern p : NOISE_TOKENS) {
            value = p.matcher(value).replaceAll(" ");
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public boolean isRestricted(String text) {
        return text != null && restricted.matcher(text).find();
    }

    public boolean isSecondaryLanguage(String text) {
        return text != null && !text.isEmpty() && secondaryLanguage.matcher(text).find();
    }

    public String handoffMessageFor(String text) {
        return isSecondaryLanguage(text) ? secondaryMessage : primaryMessage;
    }

    public Answer handoff(String languageHint, HandoffReason reason) {
        return Answer.handoff(handoffMessageFor(languageHint), reason);
    }

    /** 移除【…】引用标记，压缩空白并截断。 */
    public String cleanupReply(String raw) {
        String value = raw == null ? "" : raw;
        value = CITATION_MARKER.matcher(value).replaceAll(" ");
        value = DANGLING_CITATION_MARKER.matcher(value).replaceAll(" ");
        return sanitize(value, maxReplyChars);
    }

    /**
     * @return 回复应被拒绝的原因；可以直接下发时返回 null
     */
    public HandoffReason rejectReply(String reply) {
        if (reply == null || reply.isEmpty()) return HandoffReason.EMPTY_REPLY;
        if (restricted.matcher(reply).find()) return HandoffReason.RESTRICTED_REPLY;
        if (noContext.matcher(reply).find()) return HandoffReason.NO_CONTEXT_REPLY;
        if (transfer.matcher(reply).find()) return HandoffReason.TRANSFER_REPLY;
        return null;
    }

    /**
     * 对后端返回做最终裁决：后端主动 handoff 或回复命中拒答规则时，统一替换为固定话术。
     */
    public Answer finalizeAnswer(Answer generated, String cleanText) {
        if (generated == null) {
            return handoff(cleanText, HandoffReason.EMPTY_REPLY);
        }
        if (!generated.isAnswer()) {
            HandoffReason reason = generated.getHandoffReason() == null ? HandoffReason.BACKEND_DECLINED : generated.getHandoffReason();
            return handoff(cleanText, reason);
        }
        String reply = cleanupReply(generated.getText());
        HandoffReason rejected = rejectReply(reply);
        if (rejected != null) {
            return handoff(cleanText, rejected);
        }
        return Answer.answer(reply, generated.getCitations());
    }

    public int getMaxUserTextChars() { return maxUserTextChars; }
    public int getMaxReplyChars() { return maxReplyChars; }
}
