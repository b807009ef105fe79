package com.authzengine.security;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ClaimsPrincipalTest {

    private final UUID tenant = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

    private final ClaimsPrincipal principal = ClaimsPrincipal.of(
        Claim.of(ClaimTypes.SUBJECT, " alice "),
        Claim.of(ClaimTypes.ROLE, "teller"),
        Claim.of(ClaimTypes.ROLE, "auditor"),
        Claim.of(ClaimTypes.TENANT_ID, tenant.toString()),
        Claim.of(ClaimTypes.EMAIL_VERIFIED, "true")
    );

    @Test
    void testGetClaimValue() {
        assertEquals("alice", principal.getClaimValue(ClaimTypes.SUBJECT));
        assertEquals("alice", principal.getClaimValue("SUB"));
        assertNull(principal.getClaimValue(ClaimTypes.EMAIL));
    }

    @Test
    void testGetClaimValues() {
        assertEquals(List.of("teller", "auditor"), principal.getClaimValues(ClaimTypes.ROLE));
        assertTrue(principal.getClaimValues(ClaimTypes.EMAIL).isEmpty());
        assertTrue(principal.hasClaim(ClaimTypes.ROLE, "auditor"));
        assertFalse(principal.hasClaim(ClaimTypes.ROLE, "admin"));
    }

    @Test
    void testValuesComparedTrimmed() {
        assertTrue(principal.hasClaim(ClaimTypes.SUBJECT, "alice"));
        assertEquals(List.of("alice"), principal.getClaimValues(ClaimTypes.SUBJECT));
        assertFalse(principal.hasClaim(ClaimTypes.SUBJECT, " alice "));
    }

    @Test
    void testTypedValues() {
        assertEquals(tenant, principal.getClaimValueAsUuid(ClaimTypes.TENANT_ID));
        assertTrue(principal.getClaimValueAsBoolean(ClaimTypes.EMAIL_VERIFIED));
        assertFalse(principal.getClaimValueAsBoolean(ClaimTypes.NAME));
        assertThrows(IllegalArgumentException.class, () -> principal.getClaimValueAsUuid(ClaimTypes.NAME));
        assertThrows(IllegalArgumentException.class, () -> principal.getClaimValueAsUuid(ClaimTypes.SUBJECT));
    }

    @Test
    void testWithUniqueClaimReplacesAllOfType() {
        ClaimsPrincipal updated = principal.withUniqueClaim("Role", "admin");

        assertEquals(List.of("admin"), updated.getClaimValues(ClaimTypes.ROLE));
        assertEquals(List.of("teller", "auditor"), principal.getClaimValues(ClaimTypes.ROLE));
        assertEquals("alice", updated.getClaimValue(ClaimTypes.SUBJECT));
    }

    @Test
    void testWithClaimAppends() {
        ClaimsPrincipal updated = principal.withClaim(ClaimTypes.ROLE, "admin");

        assertEquals(List.of("teller", "auditor", "admin"), updated.getClaimValues(ClaimTypes.ROLE));
    }

    @Test
    void testBlankClaimsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Claim.of(" ", "value"));
        assertThrows(IllegalArgumentException.class, () -> Claim.of(ClaimTypes.SUBJECT, null));
        assertThrows(IllegalArgumentException.class, () -> principal.withUniqueClaim(ClaimTypes.ROLE, ""));
    }
}
