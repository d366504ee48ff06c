package tech.codegrant.server.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.config.RegistryConfig;
import tech.codegrant.server.token.SecureTokens;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * User directory seeded from {@code codegrant.registry.users.*}.
 *
 * Plaintext passwords are hashed once when the directory loads. Lookups for
 * unknown usernames still run an Argon2 verification against a throwaway
 * hash so that response time does not reveal whether the account exists.
 */
@ApplicationScoped
public class ConfigUserDirectory implements UserDirectory {

    private static final Logger LOG = Logger.getLogger(ConfigUserDirectory.class);

    private final PasswordService passwordService;
    private final Map<String, UserAccount> usersByName;
    private final Map<String, UserAccount> usersById;
    private final String dummyHash;

    @Inject
    public ConfigUserDirectory(RegistryConfig config, PasswordService passwordService) {
        this.passwordService = passwordService;
        this.dummyHash = passwordService.hashPassword(SecureTokens.generate());

        Map<String, UserAccount> byName = new HashMap<>();
        Map<String, UserAccount> byId = new HashMap<>();
        config.users().forEach((username, entry) -> {
            String hash = entry.passwordHash()
                .or(() -> entry.password().map(passwordService::hashPassword))
                .orElseThrow(() -> new IllegalStateException(
                    "User '" + username + "' must configure password or password-hash"));

            UserAccount user = new UserAccount(
                entry.id().orElse(username),
                username,
                entry.email(),
                entry.fullName().orElse(username),
                hash);
            user.active = entry.active();

            byName.put(username, user);
            byId.put(user.id, user);
        });

        this.usersByName = Collections.unmodifiableMap(byName);
        this.usersById = Collections.unmodifiableMap(byId);
        LOG.infof("Loaded %d user account(s)", usersByName.size());
    }

    @Override
    public Optional<UserAccount> authenticate(String username, String password) {
        UserAccount user = username != null ? usersByName.get(username) : null;
        if (user == null) {
            passwordService.verifyPassword(password != null ? password : "", dummyHash);
            LOG.debugf("Login failed: unknown user");
            return Optional.empty();
        }

        if (!passwordService.verifyPassword(password, user.passwordHash)) {
            LOG.debugf("Login failed for user %s: bad password", username);
            return Optional.empty();
        }

        if (!user.active) {
            LOG.debugf("Login failed for user %s: account inactive", username);
            return Optional.empty();
        }

        return Optional.of(user);
    }

    @Override
    public Optional<UserAccount> findById(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(usersById.get(userId)).filter(user -> user.active);
    }
}
