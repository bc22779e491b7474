package io.teamgate.authentication;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

import static io.teamgate.authentication.GitHubAuthHelper.getString;

/**
 * Decodes GitHub webhook payloads into {@link WebhookEvent}s. Only the fields needed to
 * select sessions are read. Event types and actions that cannot affect a session decode
 * to null.
 */
@Slf4j
public class WebhookEventDecoder {

    public static final String APP_AUTHORIZATION = "github_app_authorization";
    public static final String ORGANIZATION = "organization";
    public static final String MEMBERSHIP = "membership";
    public static final String TEAM = "team";

    /**
     * Decodes the payload of a webhook delivery
     * @param eventType Value of the X-GitHub-Event header
     * @param payload Raw request body
     * @return {@link WebhookEvent} or null if the delivery is of no interest
     * @throws MalformedInputException if the payload of a handled event type can't be decoded
     */
    public WebhookEvent decode(String eventType, byte[] payload) throws MalformedInputException {
        Objects.requireNonNull(payload, "Must provide a payload to decode");
        if (eventType == null) {
            log.debug("Ignoring webhook without an event type");
            return null;
        }
        switch (eventType) {
            case APP_AUTHORIZATION: return decodeAppAuthorization(parse(eventType, payload));
            case ORGANIZATION: return decodeOrganization(parse(eventType, payload));
            case MEMBERSHIP: return decodeMembership(parse(eventType, payload));
            case TEAM: return decodeTeam(parse(eventType, payload));
            default:
                log.debug("Ignoring event {}", eventType);
                return null;
        }
    }

    private WebhookEvent decodeAppAuthorization(Map<String, Object> json) throws MalformedInputException {
        String action = getString(json, "action");
        log.debug("Got {} event with action {}", APP_AUTHORIZATION, action);
        if (!"revoked".equals(action)) { return ignored(APP_AUTHORIZATION, action); }
        return new WebhookEvent.AppAuthorizationRevoked(required(json, APP_AUTHORIZATION, "sender", "login"));
    }

    private WebhookEvent decodeOrganization(Map<String, Object> json) throws MalformedInputException {
        String action = getString(json, "action");
        log.debug("Got {} event with action {}", ORGANIZATION, action);
        if (!"member_removed".equals(action)) { return ignored(ORGANIZATION, action); }
        return new WebhookEvent.OrganizationMemberRemoved(required(json, ORGANIZATION, "membership", "user", "login"),
                                                          required(json, ORGANIZATION, "organization", "login"));
    }

    private WebhookEvent decodeMembership(Map<String, Object> json) throws MalformedInputException {
        String action = getString(json, "action");
        String scope = getString(json, "scope");
        log.debug("Got {} event with action {} and scope {}", MEMBERSHIP, action, scope);
        if (!TEAM.equals(scope)) {
            log.debug("Ignoring {} event with scope {}", MEMBERSHIP, scope);
            return null;
        }
        WebhookEvent.TeamMembershipChanged.Action membershipAction;
        if ("added".equals(action)) {
            membershipAction = WebhookEvent.TeamMembershipChanged.Action.ADDED;
        } else if ("removed".equals(action)) {
            membershipAction = WebhookEvent.TeamMembershipChanged.Action.REMOVED;
        } else {
            return ignored(MEMBERSHIP, action);
        }
        return new WebhookEvent.TeamMembershipChanged(membershipAction,
                                                      required(json, MEMBERSHIP, "member", "login"),
                                                      required(json, MEMBERSHIP, "organization", "login"),
                                                      required(json, MEMBERSHIP, "team", "name"));
    }

    private WebhookEvent decodeTeam(Map<String, Object> json) throws MalformedInputException {
        String action = getString(json, "action");
        log.debug("Got {} event with action {}", TEAM, action);
        if ("deleted".equals(action)) {
            return new WebhookEvent.TeamRenamedOrDeleted(required(json, TEAM, "organization", "login"),
                                                         required(json, TEAM, "team", "name"));
        }
        if ("edited".equals(action)) {
            String previousName = getString(json, "changes", "name", "from");
            if (previousName == null || previousName.isEmpty()) {
                log.debug("Ignoring edited team event that does not rename the team");
                return null;
            }
            return new WebhookEvent.TeamRenamedOrDeleted(required(json, TEAM, "organization", "login"), previousName);
        }
        return ignored(TEAM, action);
    }

    private static Map<String, Object> parse(String eventType, byte[] payload) throws MalformedInputException {
        try {
            return JSONObjectUtils.parse(new String(payload, StandardCharsets.UTF_8));
        } catch (ParseException ex) {
            throw new MalformedInputException("Error unmarshalling " + eventType + " payload", ex);
        }
    }

    private static String required(Map<String, Object> json, String eventType, String... path) throws MalformedInputException {
        String value = getString(json, path);
        if (value == null || value.isEmpty()) {
            throw new MalformedInputException(eventType + " payload is missing " + String.join(".", path));
        }
        return value;
    }

    private static WebhookEvent ignored(String eventType, String action) {
        log.debug("Ignoring {} event with action {}", eventType, action);
        return null;
    }

}
