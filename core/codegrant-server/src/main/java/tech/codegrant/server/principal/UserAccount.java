package tech.codegrant.server.principal;

/**
 * A user who can approve authorization requests.
 */
public class UserAccount {

    /**
     * Stable subject identifier, returned as "sub".
     */
    public String id;

    public String username;

    public String email;

    public String fullName;

    /**
     * Argon2id hash of the password (PHC format).
     */
    public String passwordHash;

    public boolean active = true;

    public UserAccount() {
    }

    public UserAccount(String id, String username, String email, String fullName, String passwordHash) {
        this.id = id;
        this.username = username;
        this.email = email;
        this.fullName = fullName;
        this.passwordHash = passwordHash;
    }
}
