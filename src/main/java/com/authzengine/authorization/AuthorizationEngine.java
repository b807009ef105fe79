package com.authzengine.authorization;

import com.authzengine.rules.AuthorizationResult;
import com.authzengine.rules.AuthorizationRule;
import com.authzengine.rules.RuleRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Authorization engine that evaluates every rule registered for a request type
 * and aggregates their verdicts into a single {@link AuthorizationOutcome}.
 *
 * Authorization flow:
 * 1. Reject a null request before any rule runs
 * 2. Resolve the rules registered for the request type
 * 3. Evaluate all of them (no rule short-circuits the others)
 * 4. Collect the failure messages in registry order
 * 5. Return ALLOWED, DENIED or DENIED_MULTIPLE
 *
 * A rule that throws aborts the authorization and its exception reaches the
 * caller unchanged; it is never turned into a denial. In parallel mode every
 * submitted evaluation is awaited first and the failure of the earliest rule
 * in registry order is rethrown.
 *
 * The engine keeps no per-call state and may be shared between threads.
 */
@Slf4j
public class AuthorizationEngine {

    private final RuleRegistry ruleRegistry;
    private final Executor executor;
    private final EvaluationMode evaluationMode;

    public AuthorizationEngine(RuleRegistry ruleRegistry) {
        this(ruleRegistry, Runnable::run, EvaluationMode.SEQUENTIAL);
    }

    public AuthorizationEngine(RuleRegistry ruleRegistry, Executor executor, EvaluationMode evaluationMode) {
        if (ruleRegistry == null) {
            throw new IllegalArgumentException("Rule registry cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        if (evaluationMode == null) {
            throw new IllegalArgumentException("Evaluation mode cannot be null");
        }
        this.ruleRegistry = ruleRegistry;
        this.executor = executor;
        this.evaluationMode = evaluationMode;
    }

    /**
     * Authorize a request using the rules registered for {@code requestType}.
     *
     * Rules are looked up by the given type only, never by the request's
     * runtime class, so a subtype instance passed as {@code requestType}
     * is checked against the rules of {@code requestType}.
     *
     * @param requestType the type the rules are registered against
     * @param request the request to authorize
     * @return the aggregated outcome
     * @throws IllegalArgumentException if the type or the request is null
     */
    public <T> AuthorizationOutcome authorize(Class<T> requestType, T request) {
        validate(requestType, request);

        List<AuthorizationRule<T>> rules = ruleRegistry.resolveRules(requestType);
        log.debug("Evaluating {} rules for {}", rules.size(), requestType.getSimpleName());

        List<AuthorizationResult> results = evaluationMode == EvaluationMode.PARALLEL && rules.size() > 1
            ? evaluateInParallel(rules, request)
            : evaluateSequentially(rules, request);

        return aggregate(requestType, results);
    }

    /**
     * Authorize a request on the engine's executor.
     *
     * The returned future completes once every rule has completed. If a rule
     * threw, it completes exceptionally with that rule's exception as cause.
     *
     * @throws IllegalArgumentException immediately if the type or the request is null
     */
    public <T> CompletableFuture<AuthorizationOutcome> authorizeAsync(Class<T> requestType, T request) {
        validate(requestType, request);

        List<AuthorizationRule<T>> rules = ruleRegistry.resolveRules(requestType);
        log.debug("Submitting {} rules for {}", rules.size(), requestType.getSimpleName());

        List<CompletableFuture<AuthorizationResult>> futures = submitAll(rules, request);
        return awaitAll(futures)
            .thenApply(ignored -> aggregate(requestType, collect(futures)));
    }

    public EvaluationMode getEvaluationMode() {
        return evaluationMode;
    }

    private <T> void validate(Class<T> requestType, T request) {
        if (requestType == null) {
            throw new IllegalArgumentException("Request type cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("Authorization request cannot be null");
        }
    }

    private <T> List<AuthorizationResult> evaluateSequentially(List<AuthorizationRule<T>> rules, T request) {
        List<AuthorizationResult> results = new ArrayList<>(rules.size());
        for (AuthorizationRule<T> rule : rules) {
            results.add(evaluate(rule, request));
        }
        return results;
    }

    private <T> List<AuthorizationResult> evaluateInParallel(List<AuthorizationRule<T>> rules, T request) {
        List<CompletableFuture<AuthorizationResult>> futures = submitAll(rules, request);
        awaitAll(futures).join();
        return collect(futures);
    }

    private <T> List<CompletableFuture<AuthorizationResult>> submitAll(List<AuthorizationRule<T>> rules, T request) {
        List<CompletableFuture<AuthorizationResult>> futures = new ArrayList<>(rules.size());
        for (AuthorizationRule<T> rule : rules) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(rule, request), executor));
        }
        return futures;
    }

    // Completes normally once every future is done, whatever their outcome.
    private static CompletableFuture<Void> awaitAll(List<CompletableFuture<AuthorizationResult>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .handle((ignored, error) -> null);
    }

    private static List<AuthorizationResult> collect(List<CompletableFuture<AuthorizationResult>> futures) {
        List<AuthorizationResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<AuthorizationResult> future : futures) {
            if (future.isCompletedExceptionally()) {
                throw rethrow(future.handle((result, error) -> error).join());
            }
            results.add(future.join());
        }
        return results;
    }

    private static <T> AuthorizationResult evaluate(AuthorizationRule<T> rule, T request) {
        AuthorizationResult result = rule.evaluate(request);
        if (result == null) {
            throw new IllegalStateException("Rule " + rule.getRuleName() + " returned no result");
        }
        return result;
    }

    private static AuthorizationOutcome aggregate(Class<?> requestType, List<AuthorizationResult> results) {
        List<String> failures = new ArrayList<>();
        for (AuthorizationResult result : results) {
            if (!result.isSuccessful()) {
                failures.add(result.getMessage());
            }
        }

        AuthorizationOutcome outcome = AuthorizationOutcome.fromFailures(failures);
        log.debug("Authorization for {} completed: {} ({} of {} rules failed)",
            requestType.getSimpleName(), outcome.getStatus(), failures.size(), results.size());
        return outcome;
    }

    private static RuntimeException rethrow(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new CompletionException(cause);
    }
}
