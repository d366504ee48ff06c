package tech.codegrant.server.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.codegrant.server.config.AuthServerConfig;
import tech.codegrant.server.oauth.AuthorizationCode;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * In-memory code store using Caffeine.
 *
 * <p>Single-node only. The take is a removal on the cache's concurrent map
 * view, so of any number of racing consumers exactly one sees the entry.
 *
 * <p>Note: @Typed excludes AuthorizationCodeStore from bean types so only the
 * AuthorizationCodeStoreProducer can provide the interface.
 */
@Singleton
@Typed(InMemoryAuthorizationCodeStore.class)
public class InMemoryAuthorizationCodeStore extends AbstractAuthorizationCodeStore {

    private final Cache<String, AuthorizationCode> codes;

    @Inject
    public InMemoryAuthorizationCodeStore(AuthServerConfig authConfig, StoreConfig storeConfig, Clock clock) {
        this(authConfig.authorizationCodeExpiry(), storeConfig.maxSize(), clock);
    }

    public InMemoryAuthorizationCodeStore(Duration codeExpiry, long maxSize, Clock clock) {
        super(codeExpiry, clock);
        this.codes = Caffeine.newBuilder()
            .expireAfterWrite(codeExpiry)
            .maximumSize(maxSize)
            .build();
    }

    @Override
    protected void save(AuthorizationCode authCode, Duration ttl) {
        codes.put(authCode.code, authCode);
    }

    @Override
    protected Optional<AuthorizationCode> take(String code) {
        return Optional.ofNullable(codes.asMap().remove(code));
    }
}
