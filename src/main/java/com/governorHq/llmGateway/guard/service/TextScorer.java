package com.governorHq.llmGateway.guard.service;

import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.guard.model.RuleCategory;
import com.governorHq.llmGateway.guard.model.Verdict;
import com.governorHq.llmGateway.guard.model.Violation;
import com.governorHq.llmGateway.guard.rules.PatternRule;
import com.governorHq.llmGateway.guard.rules.PatternRuleSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.Optional;

/**
 * Scores text against the pattern rule set.
 * <p>
 * Scoring is a pure function of the text and the policy: no shared state is
 * read or written, so the same instance is called for input and output of a
 * request and from any number of threads.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Normalize to NFC so combining characters cannot split a literal match.</li>
 *   <li>Each matching negative rule adds one violation and deducts its category weight.</li>
 *   <li>A single +0.1 bonus if at least one suggestive rule matches.</li>
 *   <li>Crisis rules set a flag, evaluation stops at the first match.</li>
 *   <li>Confidence is clamped to [0, 1] and rounded to two decimals.</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
public class TextScorer {

    static final double SUGGESTIVE_BONUS = 0.1;

    private final PatternRuleSet ruleSet;

    /**
     * Scores one text.
     *
     * @param text   text to score, may be null or empty
     * @param policy active policy; a disabled policy always yields the neutral verdict
     * @return verdict, never null
     */
    public Verdict score(String text, PolicyProperties policy) {
        if (policy == null || !policy.enabled() || text == null || text.isEmpty()) {
            return Verdict.neutral();
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
        Verdict.VerdictBuilder verdict = Verdict.builder();
        double confidence = 1.0;
        boolean safe = true;

        for (RuleCategory category : RuleCategory.values()) {
            if (!category.isNegative()) {
                continue;
            }
            PatternRuleSet.CategoryRules categoryRules = ruleSet.rulesFor(category);
            for (PatternRule rule : categoryRules.rules()) {
                Optional<PatternRule.RuleMatch> match = rule.find(normalized);
                if (match.isPresent()) {
                    verdict.violation(Violation.builder()
                            .category(category)
                            .severity(categoryRules.severity())
                            .ruleId(rule.getId())
                            .pattern(match.get().pattern())
                            .matched(match.get().matched())
                            .build());
                    confidence -= categoryRules.weight();
                    safe = false;
                }
            }
        }

        if (anyMatch(RuleCategory.SUGGESTIVE, normalized)) {
            confidence += SUGGESTIVE_BONUS;
        }

        return verdict
                .safe(safe)
                .confidence(round(clamp(confidence)))
                .crisisSignal(anyMatch(RuleCategory.CRISIS, normalized))
                .build();
    }

    private boolean anyMatch(RuleCategory category, String normalized) {
        for (PatternRule rule : ruleSet.rulesFor(category).rules()) {
            if (rule.matches(normalized)) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
