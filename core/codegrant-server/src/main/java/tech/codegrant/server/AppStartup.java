package tech.codegrant.server;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.config.AuthServerConfig;
import tech.codegrant.server.store.StoreConfig;

/**
 * Codegrant server startup handler.
 */
@ApplicationScoped
public class AppStartup {

    private static final Logger LOG = Logger.getLogger(AppStartup.class);

    @Inject
    AuthServerConfig authConfig;

    @Inject
    StoreConfig storeConfig;

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Codegrant server started: issuer=%s, codeStore=%s, codeExpiry=%s, accessTokenExpiry=%s, refreshTokens=%s",
            authConfig.issuer(),
            storeConfig.type(),
            authConfig.authorizationCodeExpiry(),
            authConfig.accessTokenExpiry(),
            authConfig.refreshTokens().enabled());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Codegrant server shutdown");
    }
}
