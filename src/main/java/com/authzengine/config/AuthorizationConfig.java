package com.authzengine.config;

import com.authzengine.authorization.AuthorizationEngine;
import com.authzengine.rules.AuthorizationRule;
import com.authzengine.rules.TypeIndexedRuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the rule registry and the authorization engine.
 *
 * Every {@link AuthorizationRule} bean in the context is registered, in
 * {@code @Order} order. Modules contribute rules by declaring a component;
 * nothing here needs to change when a rule is added.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuthorizationEngineProperties.class)
public class AuthorizationConfig {

    @Bean
    public TypeIndexedRuleRegistry ruleRegistry(ObjectProvider<AuthorizationRule<?>> rules) {
        List<AuthorizationRule<?>> orderedRules = rules.orderedStream().collect(Collectors.toList());
        TypeIndexedRuleRegistry registry = TypeIndexedRuleRegistry.of(orderedRules);

        log.info("Registered {} authorization rules for {} request types", registry.size(),
            registry.getRequestTypes().size());
        registry.getRequestTypes().forEach(type -> log.debug("  - {}: {}", type.getSimpleName(),
            registry.resolveRules(type).stream()
                .map(AuthorizationRule::getRuleName)
                .collect(Collectors.joining(", "))));

        return registry;
    }

    @Bean
    public ThreadPoolTaskExecutor ruleEvaluationExecutor(AuthorizationEngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getParallelism());
        executor.setMaxPoolSize(properties.getParallelism());
        executor.setThreadNamePrefix(properties.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public AuthorizationEngine authorizationEngine(TypeIndexedRuleRegistry ruleRegistry,
                                                   ThreadPoolTaskExecutor ruleEvaluationExecutor,
                                                   AuthorizationEngineProperties properties) {
        log.info("Authorization engine evaluates rules in {} mode", properties.getEvaluationMode());
        return new AuthorizationEngine(ruleRegistry, ruleEvaluationExecutor, properties.getEvaluationMode());
    }
}
