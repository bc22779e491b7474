package io.teamgate.authentication;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Outcome of {@link TeamMatcher}: the access level the caller qualifies for and the
 * membership that justified it (null when the level is {@link AccessLevel#NONE}).
 */
@Getter
@EqualsAndHashCode
@ToString
public class TeamMatch {

    public static final TeamMatch NONE = new TeamMatch(AccessLevel.NONE, null);

    private final AccessLevel accessLevel;
    private final TeamBinding binding;

    private TeamMatch(AccessLevel accessLevel, TeamBinding binding) {
        this.accessLevel = accessLevel;
        this.binding = binding;
    }

    public static TeamMatch of(AccessLevel accessLevel, TeamBinding binding) {
        Objects.requireNonNull(accessLevel, "Must provide an access level for a team match");
        Objects.requireNonNull(binding, "Must provide a team binding for a team match");
        if (accessLevel == AccessLevel.NONE) { throw new IllegalArgumentException("A team match must grant access"); }
        return new TeamMatch(accessLevel, binding);
    }

    public boolean isAuthorized() { return this.accessLevel != AccessLevel.NONE; }

}
