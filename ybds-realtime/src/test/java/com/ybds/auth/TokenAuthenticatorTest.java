package com.ybds.auth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the token extraction strategies.
 */
@ExtendWith(MockitoExtension.class)
class TokenAuthenticatorTest {

    private static final Identity ALICE = new Identity("alice", Set.of("customer"));

    @Mock
    private TokenValidator validator;

    @Test
    void testQueryTokenIsValidated() throws Exception {
        when(validator.validate("tok")).thenReturn(ALICE);

        Identity identity = new QueryTokenAuthenticator(validator)
            .authenticate(new FakeRequestContext().query("token", "tok"));

        assertEquals(ALICE, identity);
    }

    @Test
    void testQueryParameterNameIsConfigurable() throws Exception {
        when(validator.validate("tok")).thenReturn(ALICE);

        assertEquals(ALICE, new QueryTokenAuthenticator("access_token", validator)
            .authenticate(new FakeRequestContext().query("access_token", "tok")));
    }

    @Test
    void testBearerHeaderIsCaseInsensitive() throws Exception {
        when(validator.validate("tok")).thenReturn(ALICE);

        assertEquals(ALICE, new BearerTokenAuthenticator(validator)
            .authenticate(new FakeRequestContext().header("Authorization", "bearer tok")));
    }

    @Test
    void testBearerRejectsOtherSchemes() throws Exception {
        AuthenticationException e = assertThrows(AuthenticationException.class,
            () -> new BearerTokenAuthenticator(validator)
                .authenticate(new FakeRequestContext().header("Authorization", "Basic dXNlcjpwYXNz")));

        assertEquals("No token provided (bearer)", e.getMessage());
        verify(validator, never()).validate(anyString());
    }

    @Test
    void testCustomHeader() throws Exception {
        when(validator.validate("tok")).thenReturn(ALICE);

        assertEquals(ALICE, new HeaderTokenAuthenticator("X-Auth-Token", validator)
            .authenticate(new FakeRequestContext().header("X-Auth-Token", " tok ")));
    }

    @Test
    void testMissingTokenFailsWithoutCallingValidator() throws Exception {
        assertThrows(AuthenticationException.class,
            () -> new QueryTokenAuthenticator(validator).authenticate(new FakeRequestContext()));
        verify(validator, never()).validate(anyString());
    }

    @Test
    void testValidatorFailurePropagates() throws Exception {
        when(validator.validate("bad")).thenThrow(new AuthenticationException("Token expired"));

        AuthenticationException e = assertThrows(AuthenticationException.class,
            () -> new QueryTokenAuthenticator(validator).authenticate(new FakeRequestContext().query("token", "bad")));
        assertEquals("Token expired", e.getMessage());
    }

    @Test
    void testAnonymousAlwaysSucceeds() {
        Identity identity = new AnonymousAuthenticator().authenticate(new FakeRequestContext());

        assertEquals("anonymous", identity.userId());
        assertTrue(identity.hasRole("guest"));
    }
}
