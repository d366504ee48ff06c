package tech.codegrant.server.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange), S256 only.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Client sends code_challenge in the authorization request
 * 4. Server stores code_challenge with the authorization code
 * 5. Client sends code_verifier in the token request
 * 6. Server verifies SHA256(code_verifier) == stored code_challenge
 *
 * The plain method is not supported.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    static final int MIN_LENGTH = 43;
    static final int MAX_LENGTH = 128;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Pattern UNRESERVED = Pattern.compile("^[A-Za-z0-9\\-._~]+$");

    /**
     * Generate a random code verifier: 48 random bytes, 64 base64url characters.
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify a code verifier against the challenge stored with the code.
     * Malformed verifiers never match.
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge) {
        if (codeChallenge == null || !isValidCodeVerifier(codeVerifier)) {
            return false;
        }
        String computed = generateCodeChallenge(codeVerifier);
        return MessageDigest.isEqual(
            computed.getBytes(StandardCharsets.US_ASCII),
            codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_S256.equals(method);
    }

    /**
     * A challenge must be 43-128 characters.
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return codeChallenge != null
            && codeChallenge.length() >= MIN_LENGTH
            && codeChallenge.length() <= MAX_LENGTH;
    }

    /**
     * Per RFC 7636: 43-128 characters, unreserved characters only.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        if (codeVerifier == null) {
            return false;
        }
        if (codeVerifier.length() < MIN_LENGTH || codeVerifier.length() > MAX_LENGTH) {
            return false;
        }
        return UNRESERVED.matcher(codeVerifier).matches();
    }
}
