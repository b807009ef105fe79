package com.authzengine.security;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Immutable set of claims describing an authenticated principal.
 *
 * Claim types are matched case-insensitively. Claim values are read and
 * compared with surrounding whitespace trimmed.
 */
@ToString
@EqualsAndHashCode
public class ClaimsPrincipal {

    private final List<Claim> claims;

    public ClaimsPrincipal(Collection<Claim> claims) {
        if (claims == null) {
            throw new IllegalArgumentException("Claims cannot be null");
        }
        this.claims = List.copyOf(claims);
    }

    public static ClaimsPrincipal of(Claim... claims) {
        return new ClaimsPrincipal(Arrays.asList(claims));
    }

    public static ClaimsPrincipal anonymous() {
        return new ClaimsPrincipal(List.of());
    }

    public List<Claim> getClaims() {
        return claims;
    }

    /**
     * First value of the given claim type, trimmed.
     *
     * @return the value, or null if the principal has no such claim
     */
    public String getClaimValue(String claimType) {
        return claims.stream()
            .filter(claim -> claim.isOfType(claimType))
            .map(claim -> claim.getValue().trim())
            .findFirst()
            .orElse(null);
    }

    /**
     * All values of the given claim type, trimmed, in claim order.
     */
    public List<String> getClaimValues(String claimType) {
        return claims.stream()
            .filter(claim -> claim.isOfType(claimType))
            .map(claim -> claim.getValue().trim())
            .collect(Collectors.toList());
    }

    /**
     * @throws IllegalArgumentException if the claim is missing or not a UUID
     */
    public UUID getClaimValueAsUuid(String claimType) {
        String value = getClaimValue(claimType);
        if (value == null) {
            throw new IllegalArgumentException("Principal has no " + claimType + " claim");
        }
        return UUID.fromString(value);
    }

    /**
     * @return false if the claim is missing
     */
    public boolean getClaimValueAsBoolean(String claimType) {
        return Boolean.parseBoolean(getClaimValue(claimType));
    }

    public boolean hasClaim(String claimType, String value) {
        return claims.stream()
            .anyMatch(claim -> claim.isOfType(claimType) && claim.getValue().trim().equals(value));
    }

    /**
     * Copy of this principal where every claim of the given type is replaced by a single new one.
     */
    public ClaimsPrincipal withUniqueClaim(String claimType, String value) {
        Claim replacement = Claim.of(claimType, value);
        List<Claim> updated = new ArrayList<>(claims.size() + 1);
        for (Claim claim : claims) {
            if (!claim.isOfType(claimType)) {
                updated.add(claim);
            }
        }
        updated.add(replacement);
        return new ClaimsPrincipal(updated);
    }

    /**
     * Copy of this principal with one more claim.
     */
    public ClaimsPrincipal withClaim(String claimType, String value) {
        List<Claim> updated = new ArrayList<>(claims);
        updated.add(Claim.of(claimType, value));
        return new ClaimsPrincipal(updated);
    }
}
