package tech.codegrant.server.oauth;

import java.util.Optional;

/**
 * Expiring store for authorization codes with an atomic take.
 *
 * <p>Implementations must guarantee that for any code, at most one call to
 * {@link #consumeIfValid(String)} ever returns a value, including when many
 * calls race.
 */
public interface AuthorizationCodeStore {

    /**
     * Mint a new code bound to the given grant and store it until it expires.
     *
     * @return the code value handed to the client
     */
    String issue(String clientId, String userId, String redirectUri, String scope,
                 String codeChallenge, String codeChallengeMethod);

    /**
     * Atomically remove and return the code if it exists and has not expired.
     * Unknown, expired and already consumed codes all yield empty.
     */
    Optional<AuthorizationCode> consumeIfValid(String code);

    enum StoreType {
        MEMORY,
        REDIS
    }
}
