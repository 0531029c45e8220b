package com.tracequery.descriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * A UDF descriptor set: every scalar UDF, UDA and UDTF known to the platform, plus the
 * semantic type rules for the scalar UDFs and UDAs.
 *
 * <p>All lists keep the order they were declared in.
 */
public record UdfInfo(
    List<ScalarUdfSpec> scalarUdfs,
    List<UdaSpec> udas,
    List<UdtfSpec> udtfs,
    List<SemanticTypeRule> semanticTypeRules) {

    /** Descriptor set with no entries. */
    public static final UdfInfo EMPTY = new UdfInfo(List.of(), List.of(), List.of(), List.of());

    public UdfInfo {
        scalarUdfs = List.copyOf(scalarUdfs == null ? List.of() : scalarUdfs);
        udas = List.copyOf(udas == null ? List.of() : udas);
        udtfs = List.copyOf(udtfs == null ? List.of() : udtfs);
        semanticTypeRules = List.copyOf(semanticTypeRules == null ? List.of() : semanticTypeRules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Incremental construction of a descriptor set, mostly for tests and tooling.
     */
    public static final class Builder {
        private final List<ScalarUdfSpec> scalarUdfs = new ArrayList<>();
        private final List<UdaSpec> udas = new ArrayList<>();
        private final List<UdtfSpec> udtfs = new ArrayList<>();
        private final List<SemanticTypeRule> rules = new ArrayList<>();

        private Builder() {}

        public Builder addScalarUdf(ScalarUdfSpec spec) {
            scalarUdfs.add(spec);
            return this;
        }

        public Builder addUda(UdaSpec spec) {
            udas.add(spec);
            return this;
        }

        public Builder addUdtf(UdtfSpec spec) {
            udtfs.add(spec);
            return this;
        }

        public Builder addSemanticTypeRule(SemanticTypeRule rule) {
            rules.add(rule);
            return this;
        }

        public UdfInfo build() {
            return new UdfInfo(scalarUdfs, udas, udtfs, rules);
        }
    }
}
