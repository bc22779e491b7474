package io.teamgate.authentication;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * The GitHub membership that justified the access level of a session: an organization
 * and, unless the access came from organization membership alone, a team within it.
 */
@Getter
@EqualsAndHashCode
public class TeamBinding implements Serializable {

    private final String org;
    private final String team;

    private TeamBinding(String org, String team) {
        Objects.requireNonNull(org, "Must provide an organization for a team binding");
        this.org = org;
        this.team = team;
    }

    public static TeamBinding forTeam(String org, String team) {
        Objects.requireNonNull(team, "Must provide a team for a team binding");
        return new TeamBinding(org, team);
    }

    public static TeamBinding forOrg(String org) { return new TeamBinding(org, null); }

    public Optional<String> getTeam() { return Optional.ofNullable(this.team); }

    public boolean isOrgOnly() { return this.team == null; }

    /**
     * @return full team name in <code>org/team</code> form, or empty for org-only bindings
     */
    public Optional<String> getTeamName() {
        return getTeam().map(name -> makeTeamName(this.org, name));
    }

    public boolean isBoundTo(String org, String team) {
        return this.org.equals(org) && team != null && team.equals(this.team);
    }

    public static String makeTeamName(String org, String team) { return org + "/" + team; }

    @Override
    public String toString() {
        return this.team == null ? this.org : makeTeamName(this.org, this.team);
    }

}
