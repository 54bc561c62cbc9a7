package com.splitttr.coedit.security;

import org.eclipse.microprofile.jwt.JsonWebToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AuthServiceTest {

    private AuthService auth;
    private JsonWebToken jwt;

    @BeforeEach
    void setUp() {
        jwt = mock(JsonWebToken.class);
        auth = new AuthService();
        auth.jwt = jwt;
    }

    @Test
    void subjectIsTheUserId() {
        when(jwt.getSubject()).thenReturn("alice");

        assertEquals("alice", auth.getCurrentUserId());
        assertTrue(auth.isAuthenticated());
    }

    @Test
    void missingOrBlankSubjectIsAnonymous() {
        when(jwt.getSubject()).thenReturn(null, " ");

        assertFalse(auth.isAuthenticated());
        assertFalse(auth.isAuthenticated());
    }

    @Test
    void unreadableTokenIsAnonymous() {
        when(jwt.getSubject()).thenThrow(new IllegalStateException("no request context"));

        assertNull(auth.getCurrentUserId());
        assertFalse(auth.isAuthenticated());
    }
}
