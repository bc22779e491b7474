package io.teamgate.authentication;

import lombok.Getter;

/**
 * A team the authenticated user belongs to, as reported by GitHub. Either value may
 * be missing from the provider's response.
 */
@Getter
public class GitHubTeam {

    private final String name;
    private final String orgLogin;

    public GitHubTeam(String name, String orgLogin) {
        this.name = name;
        this.orgLogin = orgLogin;
    }

}
