package com.authzengine.security;

/**
 * OpenID Connect claim types.
 */
public final class ClaimTypes {

    /**
     * Subject identifier, unique within the issuer.
     */
    public static final String SUBJECT = "sub";

    public static final String NAME = "name";

    public static final String EMAIL = "email";

    public static final String EMAIL_VERIFIED = "email_verified";

    /**
     * Roles granted to the principal. May appear more than once.
     */
    public static final String ROLE = "role";

    /**
     * Tenant the principal belongs to.
     */
    public static final String TENANT_ID = "tid";

    /**
     * Authentication context class reference.
     */
    public static final String ACR = "acr";

    private ClaimTypes() {
    }
}
