package com.governorHq.llmGateway.guard.rules;

import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled rule: one identifier, one or more patterns.
 * The rule matches when any pattern matches; patterns are tried in declaration order.
 */
@Getter
public class PatternRule {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final int SNIPPET_LENGTH = 80;

    private final String id;
    private final List<Pattern> patterns;

    public PatternRule(String id, List<String> patternSources) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        if (patternSources == null || patternSources.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " has no patterns");
        }
        this.id = id;
        this.patterns = patternSources.stream()
                .map(source -> Pattern.compile(source, FLAGS))
                .toList();
    }

    /**
     * Finds the first match of this rule in the text.
     *
     * @param text normalized text
     * @return the match, or empty if no pattern matches
     */
    public Optional<RuleMatch> find(String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(new RuleMatch(snippet(pattern), matcher.group()));
            }
        }
        return Optional.empty();
    }

    public boolean matches(String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String snippet(Pattern pattern) {
        String source = pattern.pattern();
        return source.length() > SNIPPET_LENGTH ? source.substring(0, SNIPPET_LENGTH) : source;
    }

    /**
     * @param pattern truncated source of the pattern that matched
     * @param matched matched substring
     */
    public record RuleMatch(String pattern, String matched) {
    }
}
