package com.phonepe.agentrecall.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.agentrecall.core.model.ContentFormat;
import com.phonepe.agentrecall.core.model.SourceType;
import com.phonepe.agentrecall.core.utils.JsonUtils;
import com.phonepe.agentrecall.core.utils.SimilarityUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic validator. Confidence blends source trust with a lexical complexity estimate and subtracts penalties
 * for patterns typical of junk or injected content.
 */
@Slf4j
public class DefaultMemoryValidator implements MemoryValidator {
    public static final String BASE64_BLOB = "base64_blob";
    public static final String REPEATED_CHARACTERS = "repeated_characters";
    public static final String REPEATED_TOKENS = "repeated_tokens";
    public static final String URL_SPAM_PATTERN = "url_spam_pattern";

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern BASE64 = Pattern.compile("\\b(?:[A-Za-z0-9+/]{80,}={0,2})\\b");
    private static final Pattern LONG_REPEAT = Pattern.compile("(.)\\1{15,}");
    private static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKDOWN_HINT = Pattern.compile(
            "(^|\\n)\\s{0,3}(#{1,6}\\s|[-*+]\\s|\\d+\\.\\s|>|\\|.+\\|)|```|\\[[^\\]]+\\]\\([^)]+\\)",
            Pattern.MULTILINE);
    private static final Pattern HTML = Pattern.compile(
            "<(?:!doctype|html|head|body|div|span|p|a|ul|ol|li|table|script|style)\\b[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE_BLOCK = Pattern.compile("<style[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_COMMENT = Pattern.compile("<!--[\\s\\S]*?-->");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern DECIMAL_ENTITY = Pattern.compile("&#(\\d{1,5});");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#x([a-f0-9]{1,6});", Pattern.CASE_INSENSITIVE);
    private static final Pattern PUNCTUATION = Pattern.compile("[.,;:!?()\\[\\]{}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, Double> PENALTIES = Map.of(BASE64_BLOB, 0.35,
                                                                REPEATED_CHARACTERS, 0.2,
                                                                REPEATED_TOKENS, 0.2,
                                                                URL_SPAM_PATTERN, 0.15);
    private static final int URL_SPAM_COUNT = 8;
    private static final int REPEATED_TOKEN_MIN_TOKENS = 12;
    private static final double REPEATED_TOKEN_SHARE = 0.35;
    private static final int MAX_KEY_LENGTH = 256;

    private final MemoryValidationConfig config;
    private final ObjectMapper mapper;

    public DefaultMemoryValidator() {
        this(MemoryValidationConfig.DEFAULT);
    }

    public DefaultMemoryValidator(MemoryValidationConfig config) {
        this.config = Objects.requireNonNullElse(config, MemoryValidationConfig.DEFAULT);
        this.mapper = JsonUtils.createMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public MemoryValidationResult validate(MemoryValidationInput input) {
        final var sourceType = input.getSourceType().canonical();
        var content = input.getContent().replace("\r\n", "\n");
        if (content.isBlank()) {
            return MemoryValidationResult.rejected(input, "Memory content is empty");
        }
        if (hasEncodingArtifacts(content)) {
            return MemoryValidationResult.rejected(input, "Memory content contains encoding artifacts");
        }
        final var notes = new ArrayList<String>();
        final var detectedFormat = detectFormat(content, input.getDeclaredContentType());
        final String normalizedType;
        switch (detectedFormat) {
            case JSON -> {
                final JsonNode parsed;
                try {
                    parsed = mapper.readTree(content);
                }
                catch (JsonProcessingException e) {
                    log.debug("Rejecting unparseable JSON from {}: {}", input.getSourceId(), e.getOriginalMessage());
                    return MemoryValidationResult.rejected(input, "Invalid JSON payload");
                }
                if (sourceType == SourceType.TOOL_OUTPUT || sourceType == SourceType.WEB_SCRAPE) {
                    final var issue = structuralIssue(parsed);
                    if (issue != null) {
                        return MemoryValidationResult.rejected(input, issue);
                    }
                    notes.add("Structured output schema validated");
                }
                content = parsed.toString();
                normalizedType = "json";
            }
            case HTML -> {
                content = sanitizeHtml(content);
                normalizedType = "text";
                notes.add("HTML sanitized to plain text");
            }
            case MARKDOWN -> {
                content = content.replaceAll("\\n{3,}", "\n\n").trim();
                normalizedType = "markdown";
                notes.add("Markdown normalized");
            }
            default -> {
                content = content.trim();
                normalizedType = "text";
            }
        }
        if (content.isBlank()) {
            return MemoryValidationResult.rejected(input, "Memory content is empty after normalization");
        }
        if (hasEncodingArtifacts(content)) {
            return MemoryValidationResult.rejected(input,
                                                   "Memory content contains encoding artifacts after normalization");
        }
        if (content.length() > config.getMaxEntryLength()) {
            if (normalizedType.equals("json")) {
                return MemoryValidationResult.rejected(
                        input, "JSON memory exceeds max length (%d)".formatted(config.getMaxEntryLength()));
            }
            content = truncate(content, config.getMaxEntryLength());
            notes.add("Content truncated to %d chars".formatted(config.getMaxEntryLength()));
        }
        final var flags = anomalyFlags(content);
        final var confidence = confidenceScore(sourceType, content, flags);
        final var quarantined = confidence < config.getQuarantineThreshold();
        if (quarantined) {
            log.debug("Entry from {} scored {} with flags {}, below quarantine threshold {}",
                      input.getSourceId(), confidence, flags, config.getQuarantineThreshold());
        }
        return MemoryValidationResult.builder()
                .accepted(true)
                .quarantined(quarantined)
                .sourceType(sourceType)
                .sourceId(input.getSourceId())
                .normalizedContent(content)
                .normalizedContentType(normalizedType)
                .detectedFormat(detectedFormat)
                .confidenceScore(confidence)
                .anomalyFlags(flags)
                .validationNotes(notes)
                .build();
    }

    /**
     * Declared type wins. Otherwise bracketed content is JSON, then HTML and Markdown are detected by markup hints.
     */
    public static ContentFormat detectFormat(String content, String declaredContentType) {
        final var declared = Strings.nullToEmpty(declaredContentType).toLowerCase(Locale.ROOT).trim();
        if (!declared.isEmpty()) {
            if (declared.contains("json")) {
                return ContentFormat.JSON;
            }
            if (declared.contains("html")) {
                return ContentFormat.HTML;
            }
            if (declared.contains("markdown") || declared.equals("md")) {
                return ContentFormat.MARKDOWN;
            }
            if (declared.equals("text")) {
                return ContentFormat.TEXT;
            }
        }
        final var trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return ContentFormat.TEXT;
        }
        if ((trimmed.startsWith("{") && trimmed.endsWith("}")) || (trimmed.startsWith("[") && trimmed.endsWith("]"))) {
            return ContentFormat.JSON;
        }
        if (HTML.matcher(trimmed).find()) {
            return ContentFormat.HTML;
        }
        if (MARKDOWN_HINT.matcher(trimmed).find()) {
            return ContentFormat.MARKDOWN;
        }
        return ContentFormat.TEXT;
    }

    public static List<String> anomalyFlags(String content) {
        final var flags = new LinkedHashSet<String>();
        if (BASE64.matcher(content).find()) {
            flags.add(BASE64_BLOB);
        }
        if (LONG_REPEAT.matcher(content).find()) {
            flags.add(REPEATED_CHARACTERS);
        }
        if (URL.matcher(content).results().count() >= URL_SPAM_COUNT) {
            flags.add(URL_SPAM_PATTERN);
        }
        final var tokens = tokens(content);
        if (tokens.size() >= REPEATED_TOKEN_MIN_TOKENS) {
            final var counts = new HashMap<String, Integer>();
            int maxCount = 0;
            for (final var token : tokens) {
                maxCount = Math.max(maxCount, counts.merge(token, 1, Integer::sum));
            }
            if ((double) maxCount / tokens.size() >= REPEATED_TOKEN_SHARE) {
                flags.add(REPEATED_TOKENS);
            }
        }
        return List.copyOf(flags);
    }

    public static double sourceTrust(SourceType sourceType) {
        return switch (sourceType.canonical()) {
            case USER_INPUT -> 0.95;
            case TOOL_OUTPUT -> 0.72;
            case WEB_SCRAPE -> 0.58;
            default -> 0.85;
        };
    }

    public static double confidenceScore(SourceType sourceType, String content, List<String> flags) {
        final var anomalyPenalty = flags.stream().mapToDouble(flag -> PENALTIES.getOrDefault(flag, 0.0)).sum();
        final var tokens = tokens(content);
        final double complexity;
        final double lengthPenalty;
        if (tokens.isEmpty()) {
            complexity = 0;
            lengthPenalty = 0.3;
        }
        else {
            final var uniqueCount = new HashSet<>(tokens).size();
            final var uniqueRatio = (double) uniqueCount / tokens.size();
            final var punctuationRatio = (double) PUNCTUATION.matcher(content).results().count()
                    / Math.max(1, content.length());
            final var normalizedLength = Math.min(1, Math.log10(content.length() + 10) / 4);
            var score = uniqueRatio * 0.65 + normalizedLength * 0.25 + Math.min(1, punctuationRatio * 20) * 0.1;
            if (tokens.size() < 5) {
                score -= 0.1;
            }
            complexity = SimilarityUtils.clamp(score);
            final var lengthComplexityRatio = (double) content.length() / Math.max(1, uniqueCount * 12);
            lengthPenalty = lengthComplexityRatio > 1.5
                            ? SimilarityUtils.clamp((lengthComplexityRatio - 1.5) / 4.5) * 0.3
                            : 0;
        }
        return SimilarityUtils.clamp(sourceTrust(sourceType) * 0.6 + complexity * 0.4 - anomalyPenalty - lengthPenalty);
    }

    private String structuralIssue(JsonNode payload) {
        if (!payload.isObject() && !payload.isArray()) {
            return "Structured tool output must be a JSON object or array";
        }
        return walk(payload, 1, new int[]{0, 0});
    }

    /**
     * @param counters node count and key count so far
     */
    private String walk(JsonNode node, int depth, int[] counters) {
        if (depth > config.getMaxJsonDepth()) {
            return "JSON depth exceeds limit (%d)".formatted(config.getMaxJsonDepth());
        }
        if (++counters[0] > config.getMaxJsonNodes()) {
            return "JSON node count exceeds limit (%d)".formatted(config.getMaxJsonNodes());
        }
        if (node.isArray()) {
            if (node.size() > config.getMaxJsonArrayItems()) {
                return "JSON array size exceeds limit (%d)".formatted(config.getMaxJsonArrayItems());
            }
            for (final var item : node) {
                final var issue = walk(item, depth + 1, counters);
                if (issue != null) {
                    return issue;
                }
            }
            return null;
        }
        if (node.isObject()) {
            counters[1] += node.size();
            if (counters[1] > config.getMaxJsonKeys()) {
                return "JSON key count exceeds limit (%d)".formatted(config.getMaxJsonKeys());
            }
            final var fields = node.fields();
            while (fields.hasNext()) {
                final var field = fields.next();
                final var key = field.getKey();
                if (key.isBlank()) {
                    return "JSON contains an empty key";
                }
                if (key.length() > MAX_KEY_LENGTH) {
                    return "JSON contains an oversized key";
                }
                if (hasEncodingArtifacts(key)) {
                    return "JSON key contains encoding artifacts";
                }
                final var issue = walk(field.getValue(), depth + 1, counters);
                if (issue != null) {
                    return issue;
                }
            }
            return null;
        }
        if (node.isTextual() && node.textValue().length() > config.getMaxJsonStringLength()) {
            return "JSON string field exceeds limit (%d)".formatted(config.getMaxJsonStringLength());
        }
        return null;
    }

    private static boolean hasEncodingArtifacts(String content) {
        return CONTROL_CHARACTERS.matcher(content).find() || content.indexOf('\uFFFD') >= 0;
    }

    private static List<String> tokens(String content) {
        return Arrays.stream(WHITESPACE.split(content.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    private static String sanitizeHtml(String content) {
        var text = SCRIPT_BLOCK.matcher(content).replaceAll(" ");
        text = STYLE_BLOCK.matcher(text).replaceAll(" ");
        text = HTML_COMMENT.matcher(text).replaceAll(" ");
        text = TAG.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(decodeEntities(text)).replaceAll(" ").trim();
    }

    private static String decodeEntities(String text) {
        var decoded = text.replaceAll("(?i)&nbsp;", " ")
                .replaceAll("(?i)&lt;", "<")
                .replaceAll("(?i)&gt;", ">")
                .replaceAll("(?i)&quot;", "\"")
                .replaceAll("(?i)&#39;", "'");
        decoded = DECIMAL_ENTITY.matcher(decoded)
                .replaceAll(match -> Matcher.quoteReplacement(codePoint(match.group(), match.group(1), 10)));
        decoded = HEX_ENTITY.matcher(decoded)
                .replaceAll(match -> Matcher.quoteReplacement(codePoint(match.group(), match.group(1), 16)));
        //Last, so that an escaped entity is decoded only once
        return decoded.replaceAll("(?i)&amp;", "&");
    }

    private static String codePoint(String entity, String digits, int radix) {
        final var codePoint = Integer.parseInt(digits, radix);
        return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : entity;
    }

    /**
     * Cuts at {@code maxLength} chars without splitting a surrogate pair
     */
    static String truncate(String content, int maxLength) {
        if (content.length() <= maxLength) {
            return content;
        }
        final var end = maxLength > 0 && Character.isHighSurrogate(content.charAt(maxLength - 1))
                        ? maxLength - 1
                        : maxLength;
        return content.substring(0, end);
    }
}
