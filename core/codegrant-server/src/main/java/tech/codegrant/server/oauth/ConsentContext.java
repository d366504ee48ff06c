package tech.codegrant.server.oauth;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * What the consent page needs to render, and to post back to /approve.
 *
 * scope holds the resolved scopes joined with spaces; error is only set when
 * the user's credentials were rejected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsentContext(
    String client_id,
    String client_name,
    String redirect_uri,
    String scope,
    List<String> scopes,
    String state,
    String code_challenge,
    String code_challenge_method,
    String error
) {
    public ConsentContext withError(String message) {
        return new ConsentContext(client_id, client_name, redirect_uri, scope, scopes,
            state, code_challenge, code_challenge_method, message);
    }
}
