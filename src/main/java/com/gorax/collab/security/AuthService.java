package com.gorax.collab.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;

@ApplicationScoped
public class AuthService {

    static final String DEFAULT_TENANT = "default";

    @Inject
    JsonWebToken jwt;

    /**
     * Get the current user's id from the JWT subject.
     * Returns null if not authenticated.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (RuntimeException e) {
            return null;
        }
    }

    public boolean isAuthenticated() {
        return getCurrentUserId() != null;
    }

    /**
     * Display name for presence, falling back to the user id.
     */
    public String getUserName() {
        for (String claim : new String[] {"name", "preferred_username", "email"}) {
            String value = claim(claim);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return getCurrentUserId();
    }

    public String getTenantId() {
        String tenant = claim("tenant_id");
        return tenant == null || tenant.isBlank() ? DEFAULT_TENANT : tenant;
    }

    private String claim(String name) {
        Object value = jwt.getClaim(name);
        if (value == null) {
            return null;
        }
        return value instanceof JsonString json ? json.getString() : value.toString();
    }
}
