package tech.codegrant.server.oauth;

import java.net.URI;

/**
 * Result of submitting the consent form.
 *
 * <ul>
 *   <li>{@link Redirect} - a code was issued, send the user agent back to the client</li>
 *   <li>{@link Rejected} - credentials were wrong, show the consent page again</li>
 * </ul>
 */
public sealed interface ConsentOutcome permits ConsentOutcome.Redirect, ConsentOutcome.Rejected {

    record Redirect(URI location) implements ConsentOutcome {
    }

    record Rejected(ConsentContext context) implements ConsentOutcome {
    }
}
