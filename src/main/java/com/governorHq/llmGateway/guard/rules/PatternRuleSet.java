package com.governorHq.llmGateway.guard.rules;

import com.governorHq.llmGateway.guard.model.RuleCategory;
import com.governorHq.llmGateway.guard.model.Severity;
import com.governorHq.llmGateway.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, versioned table of pattern rules grouped by category.
 * <p>
 * Pure data: the {@code TextScorer} interprets it. Adding rules or patterns
 * only requires editing {@code policy/pattern-rules.json}.
 */
@Slf4j
public class PatternRuleSet {

    public static final String DEFAULT_RESOURCE = "policy/pattern-rules.json";

    private final String version;
    private final Map<RuleCategory, CategoryRules> categories;

    private PatternRuleSet(String version, Map<RuleCategory, CategoryRules> categories) {
        this.version = version;
        this.categories = Collections.unmodifiableMap(categories);
    }

    /**
     * Loads the bundled rule table.
     */
    public static PatternRuleSet loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads and compiles a rule table from the classpath.
     *
     * @param resourcePath classpath location of the JSON table
     * @throws UncheckedIOException if the resource is missing or unreadable
     * @throws IllegalArgumentException if the table is inconsistent
     */
    public static PatternRuleSet load(String resourcePath) {
        RuleSetDefinition definition;
        try {
            definition = JsonFileLoader.loadAsObject(resourcePath, RuleSetDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load pattern rules from " + resourcePath, e);
        }
        PatternRuleSet ruleSet = fromDefinition(definition);
        log.info("Pattern rule set loaded - resource: {}, version: {}, rules: {}",
                resourcePath, ruleSet.getVersion(), ruleSet.ruleCount());
        return ruleSet;
    }

    /**
     * Compiles an in-memory definition.
     */
    public static PatternRuleSet fromDefinition(RuleSetDefinition definition) {
        if (definition == null || definition.getCategories() == null) {
            throw new IllegalArgumentException("Rule set definition has no categories");
        }
        Map<RuleCategory, CategoryRules> compiled = new EnumMap<>(RuleCategory.class);
        for (RuleSetDefinition.CategoryDefinition categoryDefinition : definition.getCategories()) {
            RuleCategory category = categoryDefinition.getCategory();
            if (category == null) {
                throw new IllegalArgumentException("Category entry without a category name");
            }
            if (compiled.containsKey(category)) {
                throw new IllegalArgumentException("Duplicate category: " + category.getId());
            }
            if (category.isNegative()
                    && (categoryDefinition.getWeight() == null || categoryDefinition.getWeight() <= 0
                    || categoryDefinition.getSeverity() == null)) {
                throw new IllegalArgumentException("Negative category " + category.getId()
                        + " needs a positive weight and a severity");
            }
            List<PatternRule> rules = categoryDefinition.getRules() == null
                    ? List.of()
                    : categoryDefinition.getRules().stream()
                            .map(rule -> new PatternRule(rule.getId(), rule.getPatterns()))
                            .toList();
            double weight = categoryDefinition.getWeight() != null ? categoryDefinition.getWeight() : 0.0;
            compiled.put(category, new CategoryRules(category, weight, categoryDefinition.getSeverity(), rules));
        }
        return new PatternRuleSet(definition.getVersion(), compiled);
    }

    public String getVersion() {
        return version;
    }

    /**
     * Rules of a category in declaration order; empty if the table defines none.
     */
    public CategoryRules rulesFor(RuleCategory category) {
        CategoryRules rules = categories.get(category);
        return rules != null ? rules : new CategoryRules(category, 0.0, null, List.of());
    }

    public int ruleCount() {
        return categories.values().stream().mapToInt(c -> c.rules().size()).sum();
    }

    /**
     * @param category category of the rules
     * @param weight   confidence deducted per matching rule (negative categories)
     * @param severity reporting label (negative categories)
     * @param rules    rules in declaration order
     */
    public record CategoryRules(RuleCategory category, double weight, Severity severity, List<PatternRule> rules) {
    }
}
