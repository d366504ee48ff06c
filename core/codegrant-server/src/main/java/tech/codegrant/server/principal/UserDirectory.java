package tech.codegrant.server.principal;

import java.util.Optional;

/**
 * Credential store consulted by the consent step and the userinfo endpoint.
 */
public interface UserDirectory {

    /**
     * Check a username and password. Unknown users, inactive users and wrong
     * passwords all yield empty.
     */
    Optional<UserAccount> authenticate(String username, String password);

    /**
     * Look up an active user by subject identifier.
     */
    Optional<UserAccount> findById(String userId);
}
