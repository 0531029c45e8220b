package com.tracequery.functions;

import com.tracequery.types.SemanticType;

import java.util.List;
import java.util.Objects;

/**
 * One semantic inference rule: an argument pattern and the semantic type it produces.
 *
 * <p>{@link SemanticType#ST_UNSPECIFIED} in the pattern matches any query value at that
 * position. Matching is asymmetric: an unspecified query value only matches a wildcard.
 */
public record SemanticRule(List<SemanticType> argPattern, SemanticType outputType) {

    public SemanticRule {
        argPattern = List.copyOf(Objects.requireNonNull(argPattern, "argPattern"));
        Objects.requireNonNull(outputType, "outputType");
    }

    /**
     * Whether this rule applies to a call with the given argument semantic types.
     *
     * @param query the argument semantic types of the call
     * @return true if the lengths are equal and every position is a wildcard or an exact match
     */
    public boolean matches(List<SemanticType> query) {
        if (query.size() != argPattern.size()) {
            return false;
        }
        for (int i = 0; i < argPattern.size(); i++) {
            SemanticType expected = argPattern.get(i);
            if (!expected.isWildcard() && expected != query.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of positions that constrain the argument to an exact semantic type.
     */
    public int specificity() {
        int count = 0;
        for (SemanticType type : argPattern) {
            if (!type.isWildcard()) {
                count++;
            }
        }
        return count;
    }
}
