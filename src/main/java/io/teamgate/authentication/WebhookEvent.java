package io.teamgate.authentication;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A GitHub webhook delivery reduced to the change it reports about a user's standing.
 * The set of variants is closed; consumers handle them through a {@link Visitor}.
 */
public abstract class WebhookEvent {

    private WebhookEvent() { }

    public abstract <T> T accept(Visitor<T> visitor);

    public interface Visitor<T> {
        T visit(AppAuthorizationRevoked event);
        T visit(OrganizationMemberRemoved event);
        T visit(TeamMembershipChanged event);
        T visit(TeamRenamedOrDeleted event);
    }

    /**
     * The user revoked the authorization of the OAuth application
     */
    @Getter @EqualsAndHashCode(callSuper = false) @ToString
    public static final class AppAuthorizationRevoked extends WebhookEvent {

        private final String username;

        public AppAuthorizationRevoked(String username) {
            this.username = Objects.requireNonNull(username, "Must provide the user who revoked the authorization");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) { return visitor.visit(this); }

    }

    /**
     * The user was removed from an organization
     */
    @Getter @EqualsAndHashCode(callSuper = false) @ToString
    public static final class OrganizationMemberRemoved extends WebhookEvent {

        private final String username;
        private final String org;

        public OrganizationMemberRemoved(String username, String org) {
            this.username = Objects.requireNonNull(username, "Must provide the removed member");
            this.org = Objects.requireNonNull(org, "Must provide the organization of the removed member");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) { return visitor.visit(this); }

    }

    /**
     * The user was added to or removed from a team
     */
    @Getter @EqualsAndHashCode(callSuper = false) @ToString
    public static final class TeamMembershipChanged extends WebhookEvent {

        public enum Action { ADDED, REMOVED }

        private final Action action;
        private final String username;
        private final String org;
        private final String team;

        public TeamMembershipChanged(Action action, String username, String org, String team) {
            this.action = Objects.requireNonNull(action, "Must provide the membership action");
            this.username = Objects.requireNonNull(username, "Must provide the member");
            this.org = Objects.requireNonNull(org, "Must provide the organization of the team");
            this.team = Objects.requireNonNull(team, "Must provide the team");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) { return visitor.visit(this); }

    }

    /**
     * A team was deleted or renamed. <code>oldTeamName</code> is the name sessions were
     * bound under.
     */
    @Getter @EqualsAndHashCode(callSuper = false) @ToString
    public static final class TeamRenamedOrDeleted extends WebhookEvent {

        private final String org;
        private final String oldTeamName;

        public TeamRenamedOrDeleted(String org, String oldTeamName) {
            this.org = Objects.requireNonNull(org, "Must provide the organization of the team");
            this.oldTeamName = Objects.requireNonNull(oldTeamName, "Must provide the former team name");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) { return visitor.visit(this); }

    }

}
