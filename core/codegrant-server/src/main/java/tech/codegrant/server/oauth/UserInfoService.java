package tech.codegrant.server.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.codegrant.server.principal.UserAccount;
import tech.codegrant.server.principal.UserDirectory;
import tech.codegrant.server.token.AccessToken;
import tech.codegrant.server.token.SecureTokens;
import tech.codegrant.server.token.TokenStore;

import java.time.Clock;
import java.util.Optional;

/**
 * Resolves bearer access tokens to the claims of the user they were issued for.
 */
@ApplicationScoped
public class UserInfoService {

    private final TokenStore tokenStore;
    private final UserDirectory userDirectory;
    private final Clock clock;

    @Inject
    public UserInfoService(TokenStore tokenStore, UserDirectory userDirectory, Clock clock) {
        this.tokenStore = tokenStore;
        this.userDirectory = userDirectory;
        this.clock = clock;
    }

    /**
     * @return empty when the token is unknown or expired, or its user no longer exists or is inactive
     */
    public Optional<UserInfo> resolve(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return Optional.empty();
        }

        Optional<AccessToken> token = tokenStore.findAccessToken(SecureTokens.hash(accessToken))
            .filter(t -> !t.isExpired(clock.instant()));
        if (token.isEmpty()) {
            return Optional.empty();
        }

        Optional<UserAccount> user = userDirectory.findById(token.get().userId);
        return user.map(u -> new UserInfo(u.id, u.username, u.email, u.fullName, token.get().scope));
    }
}
