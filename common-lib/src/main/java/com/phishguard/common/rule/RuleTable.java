package com.phishguard.common.rule;


import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.phishguard.common.model.RiskCategory.AUTHORITY;
import static com.phishguard.common.model.RiskCategory.BAD_GRAMMAR;
import static com.phishguard.common.model.RiskCategory.FINANCIAL;
import static com.phishguard.common.model.RiskCategory.GENERIC_GREETING;
import static com.phishguard.common.model.RiskCategory.PSYCHOLOGICAL_TRICKS;
import static com.phishguard.common.model.RiskCategory.SUSPICIOUS_LINKS;
import static com.phishguard.common.model.RiskCategory.THREAT;
import static com.phishguard.common.model.RiskCategory.UNEXPECTED_ATTACHMENT;
import static com.phishguard.common.model.RiskCategory.UNEXPECTED_REWARD;
import static com.phishguard.common.model.RiskCategory.URGENCY;

/**
 * Immutable, ordered set of heuristic {@link Rule}s plus the category
 * {@link CorrelationBonus} table applied on top of them.
 *
 * <p>Rule order does not affect the score (weights are summed) but fixes the
 * order of evidence in output.
 *
 * <h3>Correlation bonuses</h3>
 * <pre>
 *   Urgency               + Financial        → +20
 *   Threat                + Suspicious Links → +25
 *   Authority             + Financial        → +25
 *   Authority             + Urgency          → +20
 *   Unexpected Attachment + Urgency          → +15
 *   Threat                + Authority        → +20
 * </pre>
 */
public final class RuleTable {

    public static final int DEFAULT_UPPERCASE_RUN = 5;

    public static final List<String> DEFAULT_SUSPICIOUS_TLDS = List.of(
        "xyz", "top", "zip", "click", "gq", "tk", "ml", "cf", "ga", "rest", "country", "kim"
    );

    private final List<Rule> rules;
    private final List<CorrelationBonus> bonuses;

    public RuleTable(List<Rule> rules, List<CorrelationBonus> bonuses) {
        if (rules == null || bonuses == null) {
            throw new IllegalArgumentException("Rules and bonuses must not be null");
        }
        Set<String> ids = new HashSet<>();
        for (Rule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.rules   = List.copyOf(rules);
        this.bonuses = List.copyOf(bonuses);
    }

    public List<Rule> rules() {
        return rules;
    }

    public List<CorrelationBonus> bonuses() {
        return bonuses;
    }

    public static RuleTable defaults() {
        return defaults(DEFAULT_UPPERCASE_RUN, DEFAULT_SUSPICIOUS_TLDS);
    }

    /**
     * Default rule set with the two lexical knobs exposed.
     *
     * @param uppercaseRunLength minimum run of capitals flagged as shouting
     * @param suspiciousTlds     top-level domains treated as throw-away hosting
     */
    public static RuleTable defaults(int uppercaseRunLength, List<String> suspiciousTlds) {
        return new RuleTable(defaultRules(uppercaseRunLength, suspiciousTlds), defaultBonuses());
    }

    public static List<CorrelationBonus> defaultBonuses() {
        return List.of(
            new CorrelationBonus(URGENCY,               FINANCIAL,        20),
            new CorrelationBonus(THREAT,                SUSPICIOUS_LINKS, 25),
            new CorrelationBonus(AUTHORITY,             FINANCIAL,        25),
            new CorrelationBonus(AUTHORITY,             URGENCY,          20),
            new CorrelationBonus(UNEXPECTED_ATTACHMENT, URGENCY,          15),
            new CorrelationBonus(THREAT,                AUTHORITY,        20)
        );
    }

    private static List<Rule> defaultRules(int uppercaseRunLength, List<String> suspiciousTlds) {
        return List.of(
            // ── Urgency ────────────────────────────────────────────────────
            new Rule("urgency.immediate-action", URGENCY, 25,
                PhraseContainsMatcher.of("urgent", "immediately", "immediate action", "act now",
                    "final warning", "final notice", "within 24 hours", "within 48 hours", "right away",
                    "as soon as possible", "expires today"),
                "Creates a sense of urgency or pressure to act immediately."),
            new Rule("urgency.limited-time", URGENCY, 10,
                PhraseContainsMatcher.of("limited time", "offer expires", "expires soon", "last chance",
                    "only today", "before it's too late"),
                "Pressures you with a limited-time offer."),

            // ── Financial ──────────────────────────────────────────────────
            new Rule("financial.payment-language", FINANCIAL, 15,
                KeywordSetMatcher.of("bank", "banking", "payment", "invoice", "refund", "billing",
                    "wire", "transaction", "paypal", "bitcoin", "crypto"),
                "Uses financial or payment-related language."),
            new Rule("financial.card-details", FINANCIAL, 20,
                PhraseContainsMatcher.of("credit card", "card number", "cvv", "bank account number",
                    "routing number", "billing information", "payment details"),
                "Requests payment card or banking details."),

            // ── Authority ──────────────────────────────────────────────────
            new Rule("authority.credential-request", AUTHORITY, 20,
                PhraseContainsMatcher.of("verify your account", "verify your identity", "confirm your account",
                    "confirm your identity", "update your account", "validate your account",
                    "login credentials", "your password", "social security"),
                "Asks you to verify an account or hand over credentials."),
            new Rule("authority.sensitive-identifier", AUTHORITY, 15,
                KeywordSetMatcher.of("password", "passcode", "ssn", "pin", "otp"),
                "Requests sensitive information such as a password, PIN or SSN."),
            new Rule("authority.impersonation", AUTHORITY, 15,
                PhraseContainsMatcher.of("it department", "security team", "help desk", "helpdesk",
                    "system administrator", "account team", "fraud department", "tax office",
                    "internal revenue service"),
                "Claims to come from an official department or authority."),

            // ── Suspicious links ───────────────────────────────────────────
            new Rule("links.url-shortener", SUSPICIOUS_LINKS, 30,
                RegexMatcher.of("\\b(?:bit\\.ly|tinyurl\\.com|t\\.co|goo\\.gl|ow\\.ly|is\\.gd|buff\\.ly|rb\\.gy|cutt\\.ly)\\b"),
                "Uses a URL shortener which can hide the true destination."),
            new Rule("links.ip-address", SUSPICIOUS_LINKS, 20,
                RegexMatcher.of("https?://\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}"),
                "Contains a direct IP address link instead of a domain name."),
            new Rule("links.obfuscated-host", SUSPICIOUS_LINKS, 25,
                RegexMatcher.of("https?://[^\\s/]*@"),
                "Contains a link that hides its real destination behind an @ sign."),
            new Rule("links.suspicious-tld", SUSPICIOUS_LINKS, 15,
                RegexMatcher.domainSuffix(suspiciousTlds),
                "Links to a domain on a top-level domain often used for throw-away sites."),
            new Rule("links.click-prompt", SUSPICIOUS_LINKS, 10,
                PhraseContainsMatcher.of("click here", "click the link", "click below", "follow this link",
                    "tap the link"),
                "Pushes you to click a link without saying where it leads."),

            // ── Generic greeting ───────────────────────────────────────────
            new Rule("greeting.generic", GENERIC_GREETING, 10,
                RegexMatcher.of("\\bdear (?:customer|user|client|member|valued (?:member|customer)|account holder|sir or madam|sir/madam)"),
                "Uses a generic greeting instead of your name."),

            // ── Bad grammar ────────────────────────────────────────────────
            new Rule("grammar.misspelling", BAD_GRAMMAR, 5,
                KeywordSetMatcher.of("kindly", "plese", "verry", "congratulation", "recieve", "acount",
                    "pasword", "informations", "immediatly", "adress"),
                "Contains common spelling or grammatical errors."),
            new Rule("grammar.shouting", BAD_GRAMMAR, 5,
                RegexMatcher.uppercaseRun(uppercaseRunLength),
                "Uses long runs of capital letters, an unprofessional pressure tactic."),

            // ── Unexpected reward ──────────────────────────────────────────
            new Rule("reward.prize", UNEXPECTED_REWARD, 20,
                PhraseContainsMatcher.of("you have won", "you've won", "you won", "prize", "lottery",
                    "free gift", "claim your reward", "claim your prize", "gift card", "winner"),
                "Promises an unexpected prize or reward."),

            // ── Threat ─────────────────────────────────────────────────────
            new Rule("threat.account-action", THREAT, 25,
                PhraseContainsMatcher.of("account will be suspended", "account will be closed",
                    "account has been suspended", "account has been locked", "account locked",
                    "will be terminated", "permanently deleted", "legal action", "failure to comply",
                    "suspicious activity", "unauthorized access"),
                "Threatens negative consequences such as a suspended account or legal action."),

            // ── Unexpected attachment ──────────────────────────────────────
            new Rule("attachment.reference", UNEXPECTED_ATTACHMENT, 15,
                KeywordSetMatcher.of("attachment", "download", "document", "enclosed"),
                "References an unsolicited attachment or download."),
            new Rule("attachment.risky-file", UNEXPECTED_ATTACHMENT, 20,
                RegexMatcher.of("\\b[\\w-]+\\.(?:exe|scr|bat|cmd|vbs|js|jar|iso|zip|rar|docm|xlsm)\\b"),
                "Mentions a file type commonly used to deliver malware."),

            // ── Psychological tricks ───────────────────────────────────────
            new Rule("psychology.pressure", PSYCHOLOGICAL_TRICKS, 15,
                PhraseContainsMatcher.of("do not share", "don't tell", "keep this confidential",
                    "you have been selected", "you've been selected", "exclusive offer", "100% guaranteed",
                    "risk-free", "risk free", "do not ignore", "once in a lifetime"),
                "Uses psychological pressure such as secrecy, exclusivity or guarantees.")
        );
    }
}
