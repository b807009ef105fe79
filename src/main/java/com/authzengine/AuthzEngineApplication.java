package com.authzengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Authz Engine.
 *
 * The Spring context is the composition root: every authorization rule
 * declared as a component is registered against its request type, and the
 * resulting registry is handed to the authorization engine once at startup.
 */
@SpringBootApplication
public class AuthzEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthzEngineApplication.class, args);
    }
}
