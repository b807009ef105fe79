package com.authzengine.rules;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TypeIndexedRuleRegistry.
 *
 * Rules are looked up by exact request type and keep their registration order.
 */
class TypeIndexedRuleRegistryTest {

    static class Transfer {
    }

    static class InternationalTransfer extends Transfer {
    }

    static class Deposit {
    }

    @Test
    void testUnregisteredTypeResolvesToEmptyList() {
        TypeIndexedRuleRegistry registry = TypeIndexedRuleRegistry.of(List.of(RecordingRule.passing(Transfer.class)));

        assertTrue(registry.resolveRules(Deposit.class).isEmpty());
        assertTrue(TypeIndexedRuleRegistry.empty().resolveRules(Transfer.class).isEmpty());
    }

    @Test
    void testRegistrationOrderPreservedPerType() {
        RecordingRule<Transfer> first = RecordingRule.failing(Transfer.class, "first");
        RecordingRule<Deposit> deposit = RecordingRule.passing(Deposit.class);
        RecordingRule<Transfer> second = RecordingRule.failing(Transfer.class, "second");

        TypeIndexedRuleRegistry registry = TypeIndexedRuleRegistry.builder()
            .register(first)
            .register(deposit)
            .register(second)
            .build();

        assertEquals(List.of(first, second), registry.resolveRules(Transfer.class));
        assertEquals(List.of(deposit), registry.resolveRules(Deposit.class));
        assertEquals(3, registry.size());
        assertEquals(2, registry.getRequestTypes().size());
    }

    @Test
    void testLookupIsNominal() {
        TypeIndexedRuleRegistry registry = TypeIndexedRuleRegistry.of(List.of(RecordingRule.passing(Transfer.class)));

        // A rule for the supertype does not apply to the subtype
        assertTrue(registry.resolveRules(InternationalTransfer.class).isEmpty());
    }

    @Test
    void testRegistryNotAffectedByBuilderAfterBuild() {
        TypeIndexedRuleRegistry.Builder builder = TypeIndexedRuleRegistry.builder()
            .register(RecordingRule.passing(Transfer.class));
        TypeIndexedRuleRegistry registry = builder.build();

        builder.register(RecordingRule.passing(Transfer.class));

        assertEquals(1, registry.resolveRules(Transfer.class).size());
        assertThrows(UnsupportedOperationException.class,
            () -> registry.resolveRules(Transfer.class).add(RecordingRule.passing(Transfer.class)));
    }

    @Test
    void testInvalidArguments() {
        TypeIndexedRuleRegistry registry = TypeIndexedRuleRegistry.empty();

        assertThrows(IllegalArgumentException.class, () -> registry.resolveRules(null));
        assertThrows(IllegalArgumentException.class, () -> TypeIndexedRuleRegistry.builder().register(null));
        assertThrows(IllegalArgumentException.class,
            () -> TypeIndexedRuleRegistry.builder().register(new RecordingRule<>(null, "untyped",
                request -> AuthorizationResult.success())));
    }
}
