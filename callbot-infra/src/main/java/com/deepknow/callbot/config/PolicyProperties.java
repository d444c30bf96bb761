package com.deepknow.callbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 问答策略的可调正则与转人工话术。话题与拒答正则按 Unicode 大小写不敏感编译；语种正则只折叠 ASCII 大小写。
 */
@ConfigurationProperties(prefix = "policy")
public class PolicyProperties {
    public static final String DEFAULT_RESTRICTED_PATTERN =
            "\\b(tedavi|ila[cç]|doz|re[cç]ete|tan[ıi]|te[sş]his|ameliyat|yan etki|treatment|medicine|medication|dosage|prescription|diagnosis|drug|side effects?)\\b";
    public static final String DEFAULT_NO_CONTEXT_PATTERN =
            "\\b(i don't have|i do not have|outside my available information|out of scope|bilgim yok|kapsam(?:ımın)? dışında|bilgiye ulaşılamadı|bulunamadı|bulamadım|mevcut değil|dokümanda yer almıyor)\\b";
    public static final String DEFAULT_TRANSFER_PATTERN =
            "\\b(transfer|call center|çağrı merkezi|aktarıyorum|yönlendir(?:in|iyorum))\\b";
    public static final String DEFAULT_SECONDARY_LANGUAGE_PATTERN =
            "[çğıöşüÇĞİÖŞÜ]|\\b(merhaba|randevu|hastane|doktor|hangi|nas[ıi]l|neden|lütfen|için|m[ıi]|mi)\\b";
    public static final String DEFAULT_HANDOFF_MESSAGE_PRIMARY =
            "This topic is outside my available information. I will transfer your call to a human call center agent.";
    public static final String DEFAULT_HANDOFF_MESSAGE_SECONDARY =
            "Bu konu kapsamımın dışında görünüyor. Çağrınızı insan çağrı merkezine aktarıyorum.";

    private String restrictedPattern = DEFAULT_RESTRICTED_PATTERN;
    private String noContextPattern = DEFAULT_NO_CONTEXT_PATTERN;
    private String transferPattern = DEFAULT_TRANSFER_PATTERN;
    private String secondaryLanguagePattern = DEFAULT_SECONDARY_LANGUAGE_PATTERN;
    private String handoffMessagePrimary = DEFAULT_HANDOFF_MESSAGE_PRIMARY;   // 英文
    private String handoffMessageSecondary = DEFAULT_HANDOFF_MESSAGE_SECONDARY; // 土耳其语

    public String getRestrictedPattern() { return restrictedPattern; }
    public void setRestrictedPattern(String restrictedPattern) { this.restrictedPattern = restrictedPattern; }
    public String getNoContextPattern() { return noContextPattern; }
    public void setNoContextPattern(String noContextPattern) { this.noContextPattern = noContextPattern; }
    public String getTransferPattern() { return transferPattern; }
    public void setTransferPattern(String transferPattern) { this.transferPattern = transferPattern; }
    public String getSecondaryLanguagePattern() { return secondaryLanguagePattern; }
    public void setSecondaryLanguagePattern(String secondaryLanguagePattern) { this.secondaryLanguagePattern = secondaryLanguagePattern; }
    public String getHandoffMessagePrimary() { return handoffMessagePrimary; }
    public void setHandoffMessagePrimary(String handoffMessagePrimary) { this.handoffMessagePrimary = handoffMessagePrimary; }
    public String getHandoffMessageSecondary() { return handoffMessageSecondary; }
    public void setHandoffMessageSecondary(String handoffMessageSecondary) { this.handoffMessageSecondary = handoffMessageSecondary; }
}
