package tech.codegrant.server.store;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import tech.codegrant.server.oauth.AuthorizationCodeStore;

import java.time.Duration;

/**
 * Configuration for the authorization code store.
 */
@ConfigMapping(prefix = "codegrant.store")
public interface StoreConfig {

    /**
     * Store backend type: MEMORY or REDIS.
     */
    @WithDefault("MEMORY")
    AuthorizationCodeStore.StoreType type();

    /**
     * Deadline applied to every backend call. A consume that exceeds it
     * is treated as a miss.
     */
    @WithDefault("PT2S")
    Duration operationTimeout();

    /**
     * Maximum number of live codes held by the in-memory store.
     */
    @WithDefault("100000")
    long maxSize();

    /**
     * Redis configuration (only used when type=REDIS).
     */
    Redis redis();

    interface Redis {
        /**
         * Redis key prefix for code entries.
         */
        @WithDefault("codegrant:")
        String keyPrefix();
    }
}
