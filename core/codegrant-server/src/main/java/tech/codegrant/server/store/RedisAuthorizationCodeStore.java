package tech.codegrant.server.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.TimeoutException;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.codegrant.server.config.AuthServerConfig;
import tech.codegrant.server.oauth.AuthorizationCode;
import tech.codegrant.server.token.SecureTokens;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed code store for multi-instance deployments.
 *
 * <p>Codes are written with {@code SET key value EX ttl} and consumed with
 * {@code GETDEL} (Redis 6.2+), which makes the take atomic across instances.
 * Key format: {@code <key-prefix>auth_code:<code>}.
 *
 * <p>Every call is bounded by {@code codegrant.store.operation-timeout}. A
 * consume that times out returns empty. Any other failure raises
 * {@link CodeStoreUnavailableException}.
 *
 * <p>To enable:
 * <ol>
 *   <li>Configure: quarkus.redis.hosts=redis://localhost:6379</li>
 *   <li>Set: codegrant.store.type=REDIS</li>
 * </ol>
 */
@Singleton
@Typed(RedisAuthorizationCodeStore.class)
@LookupIfProperty(name = "codegrant.store.type", stringValue = "REDIS")
public class RedisAuthorizationCodeStore extends AbstractAuthorizationCodeStore {

    private static final Logger LOG = Logger.getLogger(RedisAuthorizationCodeStore.class);

    static final String KEY_SEGMENT = "auth_code:";

    private final ReactiveValueCommands<String, String> values;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration operationTimeout;

    @Inject
    public RedisAuthorizationCodeStore(AuthServerConfig authConfig, StoreConfig storeConfig, Clock clock,
                                       Instance<ReactiveRedisDataSource> redisInstance, ObjectMapper objectMapper) {
        this(requireRedis(redisInstance), objectMapper, storeConfig.redis().keyPrefix(),
            storeConfig.operationTimeout(), authConfig.authorizationCodeExpiry(), clock);
    }

    public RedisAuthorizationCodeStore(ReactiveRedisDataSource redis, ObjectMapper objectMapper, String keyPrefix,
                                       Duration operationTimeout, Duration codeExpiry, Clock clock) {
        super(codeExpiry, clock);
        this.values = redis.value(String.class, String.class);
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.operationTimeout = operationTimeout;
        LOG.infof("Redis code store initialized: keyPrefix=%s, timeout=%s", keyPrefix, operationTimeout);
    }

    private static ReactiveRedisDataSource requireRedis(Instance<ReactiveRedisDataSource> redisInstance) {
        if (!redisInstance.isResolvable()) {
            throw new IllegalStateException(
                "codegrant.store.type=REDIS but no Redis client is available. Configure quarkus.redis.hosts.");
        }
        return redisInstance.get();
    }

    String buildKey(String code) {
        return keyPrefix + KEY_SEGMENT + code;
    }

    @Override
    protected void save(AuthorizationCode authCode, Duration ttl) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(authCode);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize authorization code", e);
        }

        long seconds = Math.max(1, ttl.toSeconds());
        try {
            values.setex(buildKey(authCode.code), seconds, payload)
                .await().atMost(operationTimeout);
        } catch (TimeoutException e) {
            throw new CodeStoreUnavailableException("Timed out storing authorization code", e);
        } catch (RuntimeException e) {
            throw new CodeStoreUnavailableException("Failed to store authorization code", e);
        }
    }

    @Override
    protected Optional<AuthorizationCode> take(String code) {
        String payload;
        try {
            payload = values.getdel(buildKey(code)).await().atMost(operationTimeout);
        } catch (TimeoutException e) {
            LOG.warnf("Timed out consuming authorization code %s after %s, treating as invalid",
                SecureTokens.logPrefix(code), operationTimeout);
            return Optional.empty();
        } catch (RuntimeException e) {
            throw new CodeStoreUnavailableException("Failed to consume authorization code", e);
        }

        if (payload == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(payload, AuthorizationCode.class));
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Unreadable authorization code entry %s, treating as invalid", SecureTokens.logPrefix(code));
            return Optional.empty();
        }
    }
}
