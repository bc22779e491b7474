package io.teamgate.authentication;

import lombok.Getter;

/**
 * How a webhook delivery was handled, and the status to answer it with
 */
@Getter
public enum WebhookResult {

    /** Unsigned, unverified or uninteresting delivery, dropped without a response body */
    IGNORED(200),
    /** Sessions were selected and invalidated (possibly none) */
    PROCESSED(200),
    /** Verified delivery with a payload that could not be decoded */
    BAD_REQUEST(400);

    private final int status;

    WebhookResult(int status) { this.status = status; }

}
