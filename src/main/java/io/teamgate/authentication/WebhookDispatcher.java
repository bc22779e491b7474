package io.teamgate.authentication;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Handles GitHub webhook deliveries: verifies their signature, decodes them into a
 * {@link WebhookEvent}, removes the sessions the event invalidates from the
 * {@link SessionIndex} and has the {@link SessionStore} destroy them.
 */
@Slf4j
public class WebhookDispatcher {

    public static final String SIGNATURE_HEADER = "X-Hub-Signature";
    public static final String EVENT_HEADER = "X-GitHub-Event";

    private final WebhookSignatureVerifier verifier;
    private final WebhookEventDecoder decoder;
    private final SessionIndex sessionIndex;
    private final SessionStore sessionStore;
    private final TeamMatcher teamMatcher;

    public WebhookDispatcher(WebhookSignatureVerifier verifier, WebhookEventDecoder decoder, SessionIndex sessionIndex,
                             SessionStore sessionStore, TeamMatcher teamMatcher) {
        Objects.requireNonNull(verifier, "Must provide a signature verifier to dispatch webhooks");
        Objects.requireNonNull(decoder, "Must provide an event decoder to dispatch webhooks");
        Objects.requireNonNull(sessionIndex, "Must provide a session index to dispatch webhooks");
        Objects.requireNonNull(sessionStore, "Must provide a session store to dispatch webhooks");
        Objects.requireNonNull(teamMatcher, "Must provide a team matcher to dispatch webhooks");
        this.verifier = verifier;
        this.decoder = decoder;
        this.sessionIndex = sessionIndex;
        this.sessionStore = sessionStore;
        this.teamMatcher = teamMatcher;
    }

    /**
     * Handles one webhook delivery
     * @param request Webhook request (headers and raw body)
     * @return {@link WebhookResult}
     */
    public WebhookResult dispatch(GateRequest request) {
        Objects.requireNonNull(request, "Must provide a webhook request to dispatch");
        String signature = request.getHeader(SIGNATURE_HEADER);
        if (signature == null || signature.isEmpty()) {
            log.debug("Request with missing signature, ignoring it");
            return WebhookResult.IGNORED;
        }
        String eventType = request.getHeader(EVENT_HEADER);
        byte[] payload = request.getBody();
        if (payload == null) {
            log.debug("Failed to read the contents of the {} message", eventType);
            return WebhookResult.IGNORED;
        }
        try {
            if (!this.verifier.verify(signature, payload)) {
                log.debug("Message validation failed");
                return WebhookResult.IGNORED;
            }
        } catch (GateAuthenticationException ex) {
            log.error("Unable to validate webhook message: {}", ex.getMessage(), ex);
            return WebhookResult.IGNORED;
        }
        log.debug("Got event of type {}", eventType);

        WebhookEvent event;
        try {
            event = this.decoder.decode(eventType, payload);
        } catch (MalformedInputException ex) {
            log.error("Dropping webhook: {}", ex.getMessage(), ex);
            return WebhookResult.BAD_REQUEST;
        }
        if (event == null) { return WebhookResult.IGNORED; }
        dropSessions(event, event.accept(new Invalidation()));
        return WebhookResult.PROCESSED;
    }

    private void dropSessions(WebhookEvent event, List<String> sessionIds) {
        for (String sessionId : sessionIds) {
            log.debug("Dropping session {} after {}", sessionId, event);
            this.sessionStore.markOrDestroySessionById(sessionId);
        }
    }

    /**
     * Selects and removes from the index the sessions invalidated by an event
     */
    private class Invalidation implements WebhookEvent.Visitor<List<String>> {

        @Override
        public List<String> visit(WebhookEvent.AppAuthorizationRevoked event) {
            log.debug("Dropping all the sessions of user {}", event.getUsername());
            return sessionIndex.removeAllForUser(event.getUsername());
        }

        @Override
        public List<String> visit(WebhookEvent.OrganizationMemberRemoved event) {
            return sessionIndex.removeForUserInOrg(event.getUsername(), event.getOrg());
        }

        @Override
        public List<String> visit(WebhookEvent.TeamMembershipChanged event) {
            if (event.getAction() == WebhookEvent.TeamMembershipChanged.Action.REMOVED) {
                return sessionIndex.removeForUserInOrgTeam(event.getUsername(), event.getOrg(), event.getTeam());
            }
            // Joining a read-write team forces a new login to pick up the higher access level
            if (teamMatcher.isReadWriteTeam(event.getOrg(), event.getTeam())) {
                log.debug("Dropping all the sessions of user {} added to {}/{}", event.getUsername(), event.getOrg(), event.getTeam());
                return sessionIndex.removeAllForUser(event.getUsername());
            }
            return List.of();
        }

        @Override
        public List<String> visit(WebhookEvent.TeamRenamedOrDeleted event) {
            return sessionIndex.removeForOrgTeam(event.getOrg(), event.getOldTeamName());
        }

    }

}
