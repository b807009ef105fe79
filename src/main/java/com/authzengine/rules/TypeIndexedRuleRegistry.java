package com.authzengine.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule registry backed by a map from request type to the rules registered for it.
 *
 * Instances are built once, at composition time, and never change afterwards,
 * so they can be shared between concurrent authorizations without locking.
 * Rules keep their registration order within a request type.
 */
public final class TypeIndexedRuleRegistry implements RuleRegistry {

    private final Map<Class<?>, List<AuthorizationRule<?>>> rulesByType;

    private TypeIndexedRuleRegistry(Map<Class<?>, List<AuthorizationRule<?>>> rulesByType) {
        Map<Class<?>, List<AuthorizationRule<?>>> copy = new LinkedHashMap<>();
        rulesByType.forEach((type, rules) -> copy.put(type, List.copyOf(rules)));
        this.rulesByType = Collections.unmodifiableMap(copy);
    }

    public static TypeIndexedRuleRegistry of(Collection<? extends AuthorizationRule<?>> rules) {
        return builder().registerAll(rules).build();
    }

    public static TypeIndexedRuleRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<AuthorizationRule<T>> resolveRules(Class<T> requestType) {
        if (requestType == null) {
            throw new IllegalArgumentException("Request type cannot be null");
        }
        List<AuthorizationRule<?>> rules = rulesByType.getOrDefault(requestType, List.of());
        return (List<AuthorizationRule<T>>) (List<?>) rules;
    }

    /**
     * Request types that have at least one rule registered.
     */
    public Set<Class<?>> getRequestTypes() {
        return rulesByType.keySet();
    }

    /**
     * Total number of registered rules across all request types.
     */
    public int size() {
        return rulesByType.values().stream().mapToInt(List::size).sum();
    }

    public static final class Builder {

        private final Map<Class<?>, List<AuthorizationRule<?>>> rulesByType = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(AuthorizationRule<?> rule) {
            if (rule == null) {
                throw new IllegalArgumentException("Rule cannot be null");
            }
            Class<?> requestType = rule.getRequestType();
            if (requestType == null) {
                throw new IllegalArgumentException("Rule " + rule.getRuleName() + " declares no request type");
            }
            rulesByType.computeIfAbsent(requestType, type -> new ArrayList<>()).add(rule);
            return this;
        }

        public Builder registerAll(Collection<? extends AuthorizationRule<?>> rules) {
            if (rules == null) {
                throw new IllegalArgumentException("Rules cannot be null");
            }
            rules.forEach(this::register);
            return this;
        }

        public TypeIndexedRuleRegistry build() {
            return new TypeIndexedRuleRegistry(rulesByType);
        }
    }
}
