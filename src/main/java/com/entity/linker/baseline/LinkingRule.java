package com.entity.linker.baseline;

import com.entity.linker.core.exception.SchemaMismatchException;
import com.entity.linker.core.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A fixed conjunction of {@code feature >= minimum} conditions.
 */
public class LinkingRule {
    private final String name;
    private final List<Condition> conditions;

    private LinkingRule(Builder builder) {
        this.name = builder.name;
        this.conditions = List.copyOf(builder.conditions);
    }

    public String getName() {
        return name;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    /**
     * Returns true if every condition holds for the vector.
     *
     * @throws SchemaMismatchException if the vector's schema lacks a feature the rule uses
     */
    public boolean matches(FeatureVector vector) {
        for (Condition condition : conditions) {
            int index = vector.getSchema().indexOf(condition.feature());
            if (index < 0) {
                throw new SchemaMismatchException("Rule '" + name + "' needs feature '" + condition.feature()
                        + "' missing from schema " + vector.getSchema().names());
            }
            if (vector.get(index) < condition.minimum()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "LinkingRule{name='" + name + "', conditions=" + conditions + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param feature feature name
     * @param minimum inclusive lower bound the feature value must reach
     */
    public record Condition(String feature, double minimum) {
        public Condition {
            Objects.requireNonNull(feature, "feature is required");
            if (minimum < 0.0 || minimum > 1.0) {
                throw new IllegalArgumentException("minimum must be between 0.0 and 1.0");
            }
        }
    }

    public static class Builder {
        private String name;
        private final List<Condition> conditions = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder require(String feature, double minimum) {
            conditions.add(new Condition(feature, minimum));
            return this;
        }

        /**
         * Requires the feature to be exactly 1.0.
         */
        public Builder requireExact(String feature) {
            return require(feature, 1.0);
        }

        public LinkingRule build() {
            Objects.requireNonNull(name, "name is required");
            if (conditions.isEmpty()) {
                throw new IllegalArgumentException("rule must have at least one condition");
            }
            return new LinkingRule(this);
        }
    }
}
