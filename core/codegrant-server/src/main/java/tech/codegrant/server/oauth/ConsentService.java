package tech.codegrant.server.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.principal.UserAccount;
import tech.codegrant.server.principal.UserDirectory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Handles the user's approval of an authorization request.
 *
 * Flow:
 * 1. Re-validate the echoed request (client, redirect URI, PKCE, scope)
 * 2. Authenticate the user
 * 3. Issue a code bound to the grant
 * 4. Redirect to redirect_uri with code and the untouched state
 */
@ApplicationScoped
public class ConsentService {

    private static final Logger LOG = Logger.getLogger(ConsentService.class);

    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final AuthorizationRequestValidator validator;
    private final UserDirectory userDirectory;
    private final AuthorizationCodeStore codeStore;

    @Inject
    public ConsentService(AuthorizationRequestValidator validator, UserDirectory userDirectory,
                          AuthorizationCodeStore codeStore) {
        this.validator = validator;
        this.userDirectory = userDirectory;
        this.codeStore = codeStore;
    }

    public ConsentOutcome approve(AuthorizationRequest request, String username, String password) {
        ConsentContext context = validator.revalidate(request);

        Optional<UserAccount> user = userDirectory.authenticate(username, password);
        if (user.isEmpty()) {
            return new ConsentOutcome.Rejected(context.withError(INVALID_CREDENTIALS));
        }

        String code = codeStore.issue(
            context.client_id(),
            user.get().id,
            context.redirect_uri(),
            context.scope(),
            context.code_challenge(),
            context.code_challenge_method());

        LOG.infof("User %s approved client %s for scope [%s]", user.get().id, context.client_id(), context.scope());
        return new ConsentOutcome.Redirect(buildRedirect(context.redirect_uri(), code, request.state()));
    }

    static URI buildRedirect(String redirectUri, String code, String state) {
        StringBuilder url = new StringBuilder(redirectUri);
        url.append(redirectUri.contains("?") ? '&' : '?');
        url.append("code=").append(urlEncode(code));
        if (state != null) {
            url.append("&state=").append(urlEncode(state));
        }
        return URI.create(url.toString());
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
