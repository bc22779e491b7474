package io.teamgate.authentication;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides the access level of a GitHub user from their team and organization memberships.
 * Configured entries are either <code>org/team</code> or a bare <code>org</code>, the latter
 * matching organization membership.
 * <p>
 * Teams are scanned before organizations. A read-write match ends the scan at once; the first
 * read-only match is kept while the scan goes on looking for a read-write one.
 */
@Slf4j
public class TeamMatcher {

    private final Set<String> readWriteTeams;
    private final Set<String> readOnlyTeams;

    public TeamMatcher(List<String> readWriteTeams, List<String> readOnlyTeams) {
        Objects.requireNonNull(readWriteTeams, "Must provide read-write teams to match against");
        Objects.requireNonNull(readOnlyTeams, "Must provide read-only teams to match against");
        this.readWriteTeams = Set.copyOf(readWriteTeams);
        this.readOnlyTeams = Set.copyOf(readOnlyTeams);
    }

    /**
     * Matches the memberships of a user. Organizations are only fetched when no team granted
     * read-write access.
     * @param teams Pages of the user's teams
     * @param organizations Pages of the user's organization logins
     * @return {@link TeamMatch}
     * @throws GateAuthenticationException when fetching a page fails
     */
    public TeamMatch match(PagedResults<GitHubTeam> teams, PagedResults<String> organizations) throws GateAuthenticationException {
        Objects.requireNonNull(teams, "Must provide the teams of the user to match");
        Objects.requireNonNull(organizations, "Must provide the organizations of the user to match");
        TeamMatch best = TeamMatch.NONE;
        while (teams.hasNext()) {
            for (GitHubTeam team : teams.next()) {
                best = consider(best, toBinding(team));
                if (best.getAccessLevel() == AccessLevel.READ_WRITE) { return best; }
            }
        }
        log.debug("No matching read-write team found, trying organizations");
        while (organizations.hasNext()) {
            for (String org : organizations.next()) {
                if (org == null) {
                    log.debug("Skipping unnamed GitHub organization");
                    continue;
                }
                best = consider(best, TeamBinding.forOrg(org));
                if (best.getAccessLevel() == AccessLevel.READ_WRITE) { return best; }
            }
        }
        return best;
    }

    /**
     * @return true if <code>org/team</code> is configured for read-write access
     */
    public boolean isReadWriteTeam(String org, String team) {
        return this.readWriteTeams.contains(TeamBinding.makeTeamName(org, team));
    }

    private TeamMatch consider(TeamMatch best, TeamBinding candidate) {
        if (candidate == null) { return best; }
        String name = candidate.toString();
        log.debug("Trying to find a matching read-only or read-write entry for {}", name);
        if (this.readWriteTeams.contains(name)) {
            log.debug("Found matching read-write entry {}", name);
            return TeamMatch.of(AccessLevel.READ_WRITE, candidate);
        }
        if (best.getAccessLevel() == AccessLevel.NONE && this.readOnlyTeams.contains(name)) {
            log.debug("Found matching read-only entry {}", name);
            return TeamMatch.of(AccessLevel.READ_ONLY, candidate);
        }
        return best;
    }

    private static TeamBinding toBinding(GitHubTeam team) {
        if (team.getName() == null) {
            log.debug("Skipping unnamed GitHub team");
            return null;
        }
        if (team.getOrgLogin() == null) {
            log.debug("Skipping GitHub team {} with no organization", team.getName());
            return null;
        }
        return TeamBinding.forTeam(team.getOrgLogin(), team.getName());
    }

}
