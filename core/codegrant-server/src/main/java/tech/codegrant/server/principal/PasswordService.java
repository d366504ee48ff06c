package tech.codegrant.server.principal;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.config.AuthServerConfig;

/**
 * Argon2id hashing for user passwords and client secrets.
 *
 * Default parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 *
 * Hashes are PHC strings, e.g. $argon2id$v=19$m=65536,t=3,p=4$...
 */
@ApplicationScoped
public class PasswordService {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;
    private final int iterations;
    private final int memoryCost;
    private final int parallelism;

    @Inject
    public PasswordService(AuthServerConfig config) {
        this(config.argon2().iterations(), config.argon2().memoryCost(), config.argon2().parallelism());
    }

    public PasswordService(int iterations, int memoryCost, int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
        this.iterations = iterations;
        this.memoryCost = memoryCost;
        this.parallelism = parallelism;
    }

    /**
     * Hash a secret using Argon2id.
     *
     * @param plainPassword The plain text secret
     * @return The hash in PHC format
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return argon2.hash(iterations, memoryCost, parallelism, plainPassword.toCharArray());
    }

    /**
     * Verify a secret against a PHC hash. Null inputs and malformed hashes never match.
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }

        try {
            return argon2.verify(passwordHash, plainPassword.toCharArray());
        } catch (RuntimeException e) {
            LOG.warnf("Rejecting verification against malformed Argon2 hash: %s", e.getMessage());
            return false;
        }
    }
}
