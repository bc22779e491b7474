package io.teamgate.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TeamBindingTests {

    @Test
    @DisplayName("Bind a session to a team")
    void bindToTeam() {
        TeamBinding binding = TeamBinding.forTeam("acme", "infra");
        assertFalse(binding.isOrgOnly());
        assertEquals(Optional.of("infra"), binding.getTeam());
        assertEquals(Optional.of("acme/infra"), binding.getTeamName());
        assertEquals("acme/infra", binding.toString());
        assertTrue(binding.isBoundTo("acme", "infra"));
        assertFalse(binding.isBoundTo("acme", "docs"));
        assertFalse(binding.isBoundTo("globex", "infra"));
    }

    @Test
    @DisplayName("Bind a session to an organization alone")
    void bindToOrg() {
        TeamBinding binding = TeamBinding.forOrg("acme");
        assertTrue(binding.isOrgOnly());
        assertTrue(binding.getTeam().isEmpty());
        assertTrue(binding.getTeamName().isEmpty());
        assertEquals("acme", binding.toString());
        assertFalse(binding.isBoundTo("acme", null));
        assertNotEquals(TeamBinding.forTeam("acme", "acme"), binding);
    }

    @Test
    @DisplayName("Bindings are compared by value")
    void compareBindings() {
        assertEquals(TeamBinding.forTeam("acme", "infra"), TeamBinding.forTeam("acme", "infra"));
        assertEquals(TeamBinding.forOrg("acme").hashCode(), TeamBinding.forOrg("acme").hashCode());
    }

    @Test
    @DisplayName("Access levels round-trip through their session value")
    void accessLevelValues() {
        assertEquals(AccessLevel.READ_WRITE, AccessLevel.fromValue("rw"));
        assertEquals(AccessLevel.READ_ONLY, AccessLevel.fromValue("ro"));
        assertEquals(AccessLevel.NONE, AccessLevel.fromValue(null));
        assertEquals(AccessLevel.NONE, AccessLevel.fromValue("admin"));
    }

    @Test
    @DisplayName("A team match must grant access")
    void teamMatchGrantsAccess() {
        assertThrows(IllegalArgumentException.class, () -> TeamMatch.of(AccessLevel.NONE, TeamBinding.forOrg("acme")));
        assertTrue(TeamMatch.of(AccessLevel.READ_ONLY, TeamBinding.forOrg("acme")).isAuthorized());
    }

}
