package com.splitttr.coedit.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

@ApplicationScoped
public class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    @Inject
    JsonWebToken jwt;

    /**
     * Subject of the caller's JWT, the only user id the relay trusts.
     * Returns null if not authenticated.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (RuntimeException e) {
            LOG.debugf("No usable JWT on this request: %s", e.getMessage());
            return null;
        }
    }

    public boolean isAuthenticated() {
        String userId = getCurrentUserId();
        return userId != null && !userId.isBlank();
    }
}
