package io.teamgate.authentication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TeamMatcherTests {

    private TeamMatcher matcher;
    @Mock
    private PagedResults<GitHubTeam> failingTeams;
    @Mock
    private PagedResults<String> untouchedOrganizations;

    @BeforeEach
    void beforeEach() {
        matcher = new TeamMatcher(List.of("acme/infra", "globex"), List.of("acme/docs", "acme"));
    }

    private static GitHubTeam team(String org, String name) { return new GitHubTeam(name, org); }

    @Test
    @DisplayName("Read-write team wins when listed after a read-only team")
    void readWriteAfterReadOnly() throws GateAuthenticationException {
        TeamMatch match = matcher.match(new ListPages<>(List.of(team("acme", "docs"), team("acme", "infra"))), ListPages.empty());
        assertEquals(AccessLevel.READ_WRITE, match.getAccessLevel());
        assertEquals(TeamBinding.forTeam("acme", "infra"), match.getBinding());
    }

    @Test
    @DisplayName("Read-write team wins when listed before a read-only team")
    void readWriteBeforeReadOnly() throws GateAuthenticationException {
        ListPages<GitHubTeam> teams = new ListPages<>(List.of(team("acme", "infra")), List.of(team("acme", "docs")));
        TeamMatch match = matcher.match(teams, ListPages.empty());
        assertEquals(AccessLevel.READ_WRITE, match.getAccessLevel());
        assertEquals(TeamBinding.forTeam("acme", "infra"), match.getBinding());
        // The scan stops at the read-write match
        assertEquals(1, teams.getFetched());
    }

    @Test
    @DisplayName("Organizations are not fetched once a team grants read-write access")
    void skipOrganizationsOnReadWriteTeam() throws GateAuthenticationException {
        TeamMatch match = matcher.match(new ListPages<>(List.of(team("acme", "infra"))), untouchedOrganizations);
        assertTrue(match.isAuthorized());
        verifyNoInteractions(untouchedOrganizations);
    }

    @Test
    @DisplayName("First read-only match is kept")
    void keepFirstReadOnly() throws GateAuthenticationException {
        TeamMatch match = matcher.match(new ListPages<>(List.of(team("acme", "docs"))), new ListPages<>(List.of("acme")));
        assertEquals(AccessLevel.READ_ONLY, match.getAccessLevel());
        assertEquals(TeamBinding.forTeam("acme", "docs"), match.getBinding());
    }

    @Test
    @DisplayName("Read-write organization beats a read-only team")
    void readWriteOrganization() throws GateAuthenticationException {
        TeamMatch match = matcher.match(new ListPages<>(List.of(team("acme", "docs"))), new ListPages<>(List.of("initech"), List.of("globex")));
        assertEquals(AccessLevel.READ_WRITE, match.getAccessLevel());
        assertEquals(TeamBinding.forOrg("globex"), match.getBinding());
        assertTrue(match.getBinding().isOrgOnly());
    }

    @Test
    @DisplayName("Read-only access through organization membership")
    void readOnlyOrganization() throws GateAuthenticationException {
        TeamMatch match = matcher.match(new ListPages<>(List.of(team("acme", "marketing"))), new ListPages<>(List.of("acme")));
        assertEquals(AccessLevel.READ_ONLY, match.getAccessLevel());
        assertEquals(TeamBinding.forOrg("acme"), match.getBinding());
    }

    @Test
    @DisplayName("No match across several pages")
    void noMatch() throws GateAuthenticationException {
        ListPages<GitHubTeam> teams = new ListPages<>(List.of(team("initech", "a")), List.of(team("initech", "b")), List.of(team("initech", "c")));
        ListPages<String> organizations = new ListPages<>(List.of("initech"), List.of("hooli"));
        TeamMatch match = matcher.match(teams, organizations);
        assertEquals(TeamMatch.NONE, match);
        assertFalse(match.isAuthorized());
        assertNull(match.getBinding());
        assertEquals(3, teams.getFetched());
        assertEquals(2, organizations.getFetched());
    }

    @Test
    @DisplayName("Teams and organizations without a name are skipped")
    void skipUnnamed() throws GateAuthenticationException {
        ListPages<GitHubTeam> teams = new ListPages<>(List.of(team("acme", null), team(null, "infra"), team("acme", "docs")));
        ListPages<String> organizations = new ListPages<>(Arrays.asList(null, "globex"));
        TeamMatch match = matcher.match(teams, organizations);
        assertEquals(AccessLevel.READ_WRITE, match.getAccessLevel());
        assertEquals(TeamBinding.forOrg("globex"), match.getBinding());
    }

    @Test
    @DisplayName("Team names are matched case-sensitively")
    void caseSensitive() throws GateAuthenticationException {
        TeamMatch match = matcher.match(new ListPages<>(List.of(team("Acme", "Infra"))), new ListPages<>(List.of("Globex")));
        assertEquals(TeamMatch.NONE, match);
    }

    @Test
    @DisplayName("Propagate a failure to fetch a page")
    void propagatePageFailure() throws GateAuthenticationException {
        when(failingTeams.hasNext()).thenReturn(true);
        when(failingTeams.next()).thenThrow(new GateAuthenticationException("boom"));
        assertThrows(GateAuthenticationException.class, () -> matcher.match(failingTeams, ListPages.empty()));
    }

    @Test
    @DisplayName("Recognize read-write teams")
    void isReadWriteTeam() {
        assertTrue(matcher.isReadWriteTeam("acme", "infra"));
        assertFalse(matcher.isReadWriteTeam("acme", "docs"));
        assertFalse(matcher.isReadWriteTeam("globex", "infra"));
    }

}
