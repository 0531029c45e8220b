package com.tracequery.functions;

import com.tracequery.config.DuplicatePolicy;
import com.tracequery.exception.FunctionNotFoundException;
import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.types.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Infers the output semantic type of a function call from its argument semantic types.
 *
 * <p>Rules are kept per function name. For a query, every rule of equal arity whose
 * pattern matches (see {@link SemanticRule#matches(List)}) is a candidate, and the
 * candidate with the most exact positions wins. Between candidates of equal specificity
 * the earliest registered rule wins; that choice is deterministic but carries no meaning,
 * and is logged at debug level when it happens.
 *
 * <p>Example, with rules registered under {@code "test"}:
 * <pre>
 *   {UNSPECIFIED, UNSPECIFIED, BYTES} -> POD_NAME
 *   {UPID,        UNSPECIFIED, BYTES} -> BYTES
 *
 *   lookup({UPID, SERVICE_NAME, BYTES})        = BYTES     (2 exact positions beat 1)
 *   lookup({UNSPECIFIED, SERVICE_NAME, BYTES}) = POD_NAME  (UPID is not satisfied)
 * </pre>
 */
public final class SemanticRuleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SemanticRuleRegistry.class);

    private final DuplicatePolicy duplicatePolicy;
    private final Map<String, List<SemanticRule>> rules = new HashMap<>();
    private boolean frozen;

    public SemanticRuleRegistry() {
        this(DuplicatePolicy.REJECT);
    }

    public SemanticRuleRegistry(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    /**
     * Adds a rule for a function.
     *
     * @param name the function name
     * @param argPattern the argument pattern, {@code ST_UNSPECIFIED} as wildcard
     * @param outputType the semantic type produced when the rule wins
     * @throws InvalidDescriptorException if the same pattern is already registered for the
     *         name and the policy is {@link DuplicatePolicy#REJECT}
     * @throws IllegalStateException if the registry belongs to an initialized RegistryInfo
     */
    public void insert(String name, List<SemanticType> argPattern, SemanticType outputType) {
        Objects.requireNonNull(name, "name");
        if (frozen) {
            throw new IllegalStateException("Semantic rule registry is read-only");
        }
        SemanticRule rule = new SemanticRule(argPattern, outputType);
        List<SemanticRule> existing = rules.computeIfAbsent(name, k -> new ArrayList<>());
        for (int i = 0; i < existing.size(); i++) {
            if (existing.get(i).argPattern().equals(rule.argPattern())) {
                if (duplicatePolicy == DuplicatePolicy.REJECT) {
                    throw new InvalidDescriptorException(
                        "Duplicate semantic type rule: " + name + rule.argPattern());
                }
                existing.set(i, rule);
                return;
            }
        }
        existing.add(rule);
    }

    /**
     * Looks up the output semantic type for a call.
     *
     * @param name the function name
     * @param query the argument semantic types of the call
     * @return the output type of the most specific matching rule
     * @throws FunctionNotFoundException if the name has no rules or no rule matches
     */
    public SemanticType lookup(String name, List<SemanticType> query) {
        if (!rules.containsKey(name)) {
            throw new FunctionNotFoundException("No semantic type rules registered for " + name, name);
        }
        return find(name, query).orElseThrow(() -> new FunctionNotFoundException(
            "No semantic type rule for " + name + " matches " + query, name));
    }

    /**
     * Looks up the output semantic type for a call without failing.
     *
     * @param name the function name
     * @param query the argument semantic types of the call
     * @return the output type of the most specific matching rule, or empty if none matches
     */
    public Optional<SemanticType> find(String name, List<SemanticType> query) {
        List<SemanticRule> candidates = rules.get(name);
        if (candidates == null) {
            return Optional.empty();
        }

        SemanticRule best = null;
        boolean tied = false;
        for (SemanticRule rule : candidates) {
            if (!rule.matches(query)) {
                continue;
            }
            if (best == null || rule.specificity() > best.specificity()) {
                best = rule;
                tied = false;
            } else if (rule.specificity() == best.specificity()) {
                tied = true;
            }
        }

        if (tied) {
            logger.debug("Semantic rules for {} tie at specificity {} for {}; using first registered {}",
                name, best.specificity(), query, best.argPattern());
        }
        return best == null ? Optional.empty() : Optional.of(best.outputType());
    }

    /**
     * Returns the rules registered for a name, in registration order.
     */
    public List<SemanticRule> rules(String name) {
        List<SemanticRule> registered = rules.get(name);
        return registered == null ? List.of() : Collections.unmodifiableList(registered);
    }

    void freeze() {
        frozen = true;
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    /**
     * Returns the total number of registered rules.
     */
    public int size() {
        return rules.values().stream().mapToInt(List::size).sum();
    }
}
