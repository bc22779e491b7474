package io.teamgate.authentication;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory index of the sessions issued by the gate. Tracks which sessions each GitHub
 * user holds (and the {@link TeamBinding} each one was granted through), and which users
 * hold sessions through each GitHub team, so that webhook notifications can select the
 * sessions to invalidate.
 * <p>
 * Both maps are only touched while holding a single lock. Outside of it:
 * <ul>
 *     <li>no user or team key maps to an empty collection</li>
 *     <li>a session bound to a team implies its user is in that team's user set, and every
 *     user in a team's user set has at least one session bound to that team</li>
 *     <li>sessions granted through organization membership alone never appear in the team map</li>
 * </ul>
 * The index never talks to the session store: removals return the affected session
 * identifiers and the caller destroys them.
 */
@Slf4j
public class SessionIndex {

    private final Object lock = new Object();
    private final Map<String, Map<String, TeamBinding>> userSessions;
    private final Map<String, Set<String>> teamUsers;

    public SessionIndex() {
        this.userSessions = new HashMap<>();
        this.teamUsers = new HashMap<>();
    }

    /**
     * Records a session established by a successful login
     * @param username GitHub login of the session owner
     * @param sessionId Opaque identifier of the session
     * @param binding Team binding that granted the session its access level
     */
    public void add(String username, String sessionId, TeamBinding binding) {
        Objects.requireNonNull(username, "Must provide a username to index a session");
        Objects.requireNonNull(sessionId, "Must provide a session identifier to index a session");
        Objects.requireNonNull(binding, "Must provide a team binding to index a session");
        synchronized (this.lock) {
            TeamBinding previous = this.userSessions.computeIfAbsent(username, key -> new HashMap<>()).put(sessionId, binding);
            // Re-login on the same session may move it to another team
            if (previous != null && !previous.equals(binding)) { unlinkTeam(username, previous); }
            binding.getTeamName().ifPresent(teamName -> this.teamUsers.computeIfAbsent(teamName, key -> new HashSet<>()).add(username));
        }
    }

    /**
     * Removes a single session of a user, typically on cleanup of the caller's own session
     * @param username GitHub login of the session owner
     * @param sessionId Identifier of the session to remove
     * @return true if the session was indexed
     */
    public boolean remove(String username, String sessionId) {
        Objects.requireNonNull(username, "Must provide a username to remove a session");
        Objects.requireNonNull(sessionId, "Must provide a session identifier to remove a session");
        synchronized (this.lock) {
            return !removeMatching(username, (id, binding) -> id.equals(sessionId)).isEmpty();
        }
    }

    /**
     * Removes every session of a user
     * @param username GitHub login of the user
     * @return identifiers of the removed sessions
     */
    public List<String> removeAllForUser(String username) {
        Objects.requireNonNull(username, "Must provide a username to remove sessions");
        synchronized (this.lock) {
            return removeMatching(username, (id, binding) -> true);
        }
    }

    /**
     * Removes the sessions of a user that were granted through membership of
     * <code>org</code> alone. Sessions bound to one of the organization's teams are kept.
     * @param username GitHub login of the user
     * @param org Organization login
     * @return identifiers of the removed sessions
     */
    public List<String> removeForUserInOrg(String username, String org) {
        Objects.requireNonNull(username, "Must provide a username to remove sessions");
        Objects.requireNonNull(org, "Must provide an organization to remove sessions");
        synchronized (this.lock) {
            return removeMatching(username, (id, binding) -> binding.isOrgOnly() && binding.getOrg().equals(org));
        }
    }

    /**
     * Removes the sessions of a user bound to exactly <code>org/team</code>
     * @param username GitHub login of the user
     * @param org Organization login
     * @param team Team name
     * @return identifiers of the removed sessions
     */
    public List<String> removeForUserInOrgTeam(String username, String org, String team) {
        Objects.requireNonNull(username, "Must provide a username to remove sessions");
        Objects.requireNonNull(org, "Must provide an organization to remove sessions");
        Objects.requireNonNull(team, "Must provide a team to remove sessions");
        synchronized (this.lock) {
            return removeMatching(username, (id, binding) -> binding.isBoundTo(org, team));
        }
    }

    /**
     * Removes every session bound to <code>org/team</code>, whoever holds it. Only the users
     * recorded for the team are visited.
     * @param org Organization login
     * @param team Team name
     * @return identifiers of the removed sessions
     */
    public List<String> removeForOrgTeam(String org, String team) {
        Objects.requireNonNull(org, "Must provide an organization to remove sessions");
        Objects.requireNonNull(team, "Must provide a team to remove sessions");
        String teamName = TeamBinding.makeTeamName(org, team);
        synchronized (this.lock) {
            Set<String> users = this.teamUsers.get(teamName);
            if (users == null) { return List.of(); }
            List<String> removed = new ArrayList<>();
            for (String username : new ArrayList<>(users)) {
                removed.addAll(removeMatching(username, (id, binding) -> binding.isBoundTo(org, team)));
            }
            this.teamUsers.remove(teamName);
            return removed;
        }
    }

    public Set<String> getSessionIds(String username) {
        synchronized (this.lock) {
            Map<String, TeamBinding> sessions = this.userSessions.get(username);
            return sessions == null ? Set.of() : Set.copyOf(sessions.keySet());
        }
    }

    public TeamBinding getBinding(String username, String sessionId) {
        synchronized (this.lock) {
            Map<String, TeamBinding> sessions = this.userSessions.get(username);
            return sessions == null ? null : sessions.get(sessionId);
        }
    }

    public Set<String> getTeamMembers(String org, String team) {
        synchronized (this.lock) {
            Set<String> users = this.teamUsers.get(TeamBinding.makeTeamName(org, team));
            return users == null ? Set.of() : Set.copyOf(users);
        }
    }

    public Set<String> getUsernames() {
        synchronized (this.lock) { return Set.copyOf(this.userSessions.keySet()); }
    }

    public Set<String> getTeamNames() {
        synchronized (this.lock) { return Set.copyOf(this.teamUsers.keySet()); }
    }

    public boolean isEmpty() {
        synchronized (this.lock) { return this.userSessions.isEmpty() && this.teamUsers.isEmpty(); }
    }

    /**
     * Removes the sessions of <code>username</code> accepted by <code>filter</code>, pruning
     * team memberships that no longer have a backing session. Must be called with the lock held.
     */
    private List<String> removeMatching(String username, SessionFilter filter) {
        Map<String, TeamBinding> sessions = this.userSessions.get(username);
        if (sessions == null) { return List.of(); }
        List<String> removed = new ArrayList<>();
        Iterator<Map.Entry<String, TeamBinding>> iterator = sessions.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, TeamBinding> entry = iterator.next();
            if (filter.test(entry.getKey(), entry.getValue())) {
                iterator.remove();
                removed.add(entry.getKey());
                unlinkTeam(username, entry.getValue());
            }
        }
        if (sessions.isEmpty()) {
            log.debug("Dropped all the sessions of user {}", username);
            this.userSessions.remove(username);
        }
        return removed;
    }

    /**
     * Drops <code>username</code> from the team of <code>binding</code> unless another of
     * their sessions is still bound to it. Must be called with the lock held.
     */
    private void unlinkTeam(String username, TeamBinding binding) {
        if (binding.isOrgOnly()) { return; }
        Map<String, TeamBinding> sessions = this.userSessions.get(username);
        if (sessions != null && sessions.containsValue(binding)) { return; }
        String teamName = binding.getTeamName().orElseThrow();
        Set<String> users = this.teamUsers.get(teamName);
        if (users == null) { return; }
        users.remove(username);
        if (users.isEmpty()) { this.teamUsers.remove(teamName); }
    }

    @FunctionalInterface
    private interface SessionFilter {
        boolean test(String sessionId, TeamBinding binding);
    }

}
