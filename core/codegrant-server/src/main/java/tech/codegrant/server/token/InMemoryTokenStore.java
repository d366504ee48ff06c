package tech.codegrant.server.token;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.codegrant.server.config.AuthServerConfig;
import tech.codegrant.server.store.StoreConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Token store backed by Caffeine caches. Entries are evicted once their lifetime has passed.
 */
@ApplicationScoped
public class InMemoryTokenStore implements TokenStore {

    private final Cache<String, AccessToken> accessTokens;
    private final Cache<String, RefreshToken> refreshTokens;

    @Inject
    public InMemoryTokenStore(AuthServerConfig authConfig, StoreConfig storeConfig) {
        this(authConfig.accessTokenExpiry(), authConfig.refreshTokens().expiry(), storeConfig.maxSize());
    }

    public InMemoryTokenStore(Duration accessTokenExpiry, Duration refreshTokenExpiry, long maxSize) {
        this.accessTokens = Caffeine.newBuilder()
            .expireAfterWrite(accessTokenExpiry)
            .maximumSize(maxSize)
            .build();
        this.refreshTokens = Caffeine.newBuilder()
            .expireAfterWrite(refreshTokenExpiry)
            .maximumSize(maxSize)
            .build();
    }

    @Override
    public void saveAccessToken(AccessToken accessToken) {
        accessTokens.put(accessToken.tokenHash, accessToken);
    }

    @Override
    public Optional<AccessToken> findAccessToken(String tokenHash) {
        return Optional.ofNullable(accessTokens.getIfPresent(tokenHash));
    }

    @Override
    public void saveRefreshToken(RefreshToken refreshToken) {
        refreshTokens.put(refreshToken.tokenHash, refreshToken);
    }

    @Override
    public Optional<RefreshToken> findRefreshToken(String tokenHash) {
        return Optional.ofNullable(refreshTokens.getIfPresent(tokenHash));
    }

    @Override
    public Optional<RefreshToken> consumeRefreshToken(String tokenHash, String replacedByHash, Instant now) {
        AtomicReference<RefreshToken> consumed = new AtomicReference<>();
        refreshTokens.asMap().computeIfPresent(tokenHash, (hash, current) -> {
            if (!current.isValid(now)) {
                return current;
            }
            consumed.set(current);
            return current.revoke(now, replacedByHash);
        });
        return Optional.ofNullable(consumed.get());
    }

    @Override
    public int revokeTokenFamily(String tokenFamily, Instant now) {
        AtomicInteger revoked = new AtomicInteger();
        refreshTokens.asMap().replaceAll((hash, token) -> {
            if (tokenFamily.equals(token.tokenFamily) && !token.revoked) {
                revoked.incrementAndGet();
                return token.revoke(now, null);
            }
            return token;
        });
        accessTokens.asMap().values().removeIf(token -> tokenFamily.equals(token.tokenFamily));
        return revoked.get();
    }
}
