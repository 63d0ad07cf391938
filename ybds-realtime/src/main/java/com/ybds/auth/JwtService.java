package com.ybds.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;

/**
 * JWT service for token generation and validation.
 *
 * Simple HS256 implementation. Claims: {@code sub} (user id), {@code roles} (string array),
 * {@code iat} and {@code exp} (epoch seconds).
 */
public final class JwtService implements TokenValidator {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final byte[] secret;
    private final long expirationMs;

    public JwtService(String secret, long expirationMs) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret key is required");
        }
        if (expirationMs <= 0) {
            throw new IllegalArgumentException("JWT expiration must be positive");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.expirationMs = expirationMs;
    }

    /**
     * Generate a signed token for the user.
     */
    public String generateToken(String userId, Collection<String> roles) {
        long now = System.currentTimeMillis();
        return generateToken(userId, roles, now / 1000, (now + expirationMs) / 1000);
    }

    String generateToken(String userId, Collection<String> roles, long issuedAtSec, long expiresAtSec) {
        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", userId);
        ArrayNode roleArray = claims.putArray("roles");
        if (roles != null) {
            roles.forEach(roleArray::add);
        }
        claims.put("iat", issuedAtSec);
        claims.put("exp", expiresAtSec);

        String payload = base64Encode(claims.toString());
        String signature = sign(HEADER + "." + payload);
        return HEADER + "." + payload + "." + signature;
    }

    /**
     * Validate the token and return the identity it carries.
     */
    @Override
    public Identity validate(String token) throws AuthenticationException {
        if (token == null || token.isEmpty()) {
            throw new AuthenticationException("Missing token");
        }

        // Remove "Bearer " prefix if present
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new AuthenticationException("Invalid token format");
        }

        String expectedSig = sign(parts[0] + "." + parts[1]);
        if (!MessageDigest.isEqual(expectedSig.getBytes(StandardCharsets.US_ASCII),
                parts[2].getBytes(StandardCharsets.US_ASCII))) {
            throw new AuthenticationException("Invalid token signature");
        }

        JsonNode claims;
        try {
            claims = MAPPER.readTree(base64Decode(parts[1]));
        } catch (Exception e) {
            throw new AuthenticationException("Unreadable token claims", e);
        }

        JsonNode sub = claims.get("sub");
        JsonNode exp = claims.get("exp");
        if (sub == null || !sub.isTextual() || sub.asText().isEmpty() || exp == null || !exp.canConvertToLong()) {
            throw new AuthenticationException("Missing required claims");
        }

        if (System.currentTimeMillis() > exp.asLong() * 1000) {
            throw new AuthenticationException("Token expired");
        }

        List<String> roles = new ArrayList<>();
        JsonNode roleNode = claims.get("roles");
        if (roleNode != null && roleNode.isArray()) {
            roleNode.forEach(r -> roles.add(r.asText()));
        }

        log.debug("Token valid for user {}", sub.asText());
        return Identity.of(sub.asText(), roles);
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    private static String base64Decode(String data) {
        return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
    }
}
