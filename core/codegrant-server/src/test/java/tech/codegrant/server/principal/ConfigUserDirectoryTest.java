package tech.codegrant.server.principal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.codegrant.server.test.TestRegistry;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigUserDirectory.
 */
class ConfigUserDirectoryTest {

    private final PasswordService passwordService = new PasswordService(1, 1024, 1);

    private ConfigUserDirectory directory(TestRegistry registry) {
        return new ConfigUserDirectory(registry, passwordService);
    }

    @Test
    @DisplayName("authenticate should return the user when the password matches")
    void authenticate_shouldReturnUser_whenPasswordCorrect() {
        ConfigUserDirectory directory = directory(TestRegistry.empty().withUser("demo", "1", "demo123"));

        Optional<UserAccount> user = directory.authenticate("demo", "demo123");

        assertThat(user).isPresent();
        assertThat(user.get().id).isEqualTo("1");
        assertThat(user.get().username).isEqualTo("demo");
        assertThat(user.get().email).isEqualTo("demo@example.com");
        assertThat(user.get().passwordHash).startsWith("$argon2id$");
    }

    @Test
    @DisplayName("authenticate should return empty for a wrong password or unknown user")
    void authenticate_shouldReturnEmpty_whenCredentialsWrong() {
        ConfigUserDirectory directory = directory(TestRegistry.empty().withUser("demo", "1", "demo123"));

        assertThat(directory.authenticate("demo", "wrong")).isEmpty();
        assertThat(directory.authenticate("nobody", "demo123")).isEmpty();
        assertThat(directory.authenticate(null, null)).isEmpty();
    }

    @Test
    @DisplayName("authenticate and findById should ignore inactive users")
    void authenticate_shouldReturnEmpty_whenUserInactive() {
        TestRegistry registry = TestRegistry.empty().withUser("former", new TestRegistry.User(
            Optional.of("7"), "former@example.com", Optional.empty(),
            Optional.of("secret"), Optional.empty(), false));
        ConfigUserDirectory directory = directory(registry);

        assertThat(directory.authenticate("former", "secret")).isEmpty();
        assertThat(directory.findById("7")).isEmpty();
    }

    @Test
    @DisplayName("findById should default the id to the username and the name to the username")
    void findById_shouldUseUsername_whenIdNotConfigured() {
        TestRegistry registry = TestRegistry.empty().withUser("alice", new TestRegistry.User(
            Optional.empty(), "alice@example.com", Optional.empty(),
            Optional.empty(), Optional.of(passwordService.hashPassword("pw")), true));
        ConfigUserDirectory directory = directory(registry);

        UserAccount user = directory.findById("alice").orElseThrow();

        assertThat(user.fullName).isEqualTo("alice");
        assertThat(directory.authenticate("alice", "pw")).isPresent();
    }

    @Test
    @DisplayName("constructor should fail when a user has neither password nor password-hash")
    void constructor_shouldThrow_whenUserHasNoPassword() {
        TestRegistry registry = TestRegistry.empty().withUser("broken", new TestRegistry.User(
            Optional.empty(), "broken@example.com", Optional.empty(),
            Optional.empty(), Optional.empty(), true));

        assertThatThrownBy(() -> directory(registry))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("broken");
    }
}
