package io.teamgate.authentication;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Decision of the gate for a request. Either the request may proceed on behalf of a team
 * ({@link #isReplied()} is false), or the gate has produced the reply the host must send:
 * an error status or a temporary redirect.
 */
@Getter
@ToString
public class GateResponse {

    public static final int TEMPORARY_REDIRECT = 307;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int INTERNAL_SERVER_ERROR = 500;

    private final boolean replied;
    private final int status;
    private final String teamId;
    private final String location;

    private GateResponse(boolean replied, int status, String teamId, String location) {
        this.replied = replied;
        this.status = status;
        this.teamId = teamId;
        this.location = location;
    }

    /**
     * The request may proceed
     * @param teamId Team the caller acts for
     * @return GateResponse
     */
    public static GateResponse proceed(String teamId) {
        Objects.requireNonNull(teamId, "Must provide the team of an authenticated request");
        return new GateResponse(false, 0, teamId, null);
    }

    public static GateResponse redirect(String location) {
        Objects.requireNonNull(location, "Must provide a redirect location");
        return new GateResponse(true, TEMPORARY_REDIRECT, null, location);
    }

    public static GateResponse error(int status) { return new GateResponse(true, status, null, null); }

}
