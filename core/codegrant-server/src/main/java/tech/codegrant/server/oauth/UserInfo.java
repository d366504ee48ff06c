package tech.codegrant.server.oauth;

/**
 * Claims returned by the userinfo endpoint.
 */
public record UserInfo(
    String sub,
    String username,
    String email,
    String name,
    String scope
) {
}
