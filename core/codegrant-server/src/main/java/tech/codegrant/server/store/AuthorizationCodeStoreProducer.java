package tech.codegrant.server.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.oauth.AuthorizationCodeStore;

/**
 * CDI producer that selects the AuthorizationCodeStore implementation
 * based on configuration.
 */
@ApplicationScoped
public class AuthorizationCodeStoreProducer {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeStoreProducer.class);

    @Inject
    StoreConfig config;

    @Inject
    Instance<InMemoryAuthorizationCodeStore> inMemoryStore;

    @Inject
    Instance<RedisAuthorizationCodeStore> redisStore;

    @Produces
    @ApplicationScoped
    public AuthorizationCodeStore authorizationCodeStore() {
        AuthorizationCodeStore.StoreType type = config.type();
        LOG.infof("Initializing authorization code store: type=%s, timeout=%s", type, config.operationTimeout());

        return switch (type) {
            case MEMORY -> {
                LOG.info("Using in-memory code store (Caffeine)");
                yield inMemoryStore.get();
            }
            case REDIS -> {
                LOG.info("Using Redis code store");
                yield redisStore.get();
            }
        };
    }
}
