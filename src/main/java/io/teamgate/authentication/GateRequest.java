package io.teamgate.authentication;

/**
 * The parts of an inbound HTTP request the gate looks at. Implemented by the host
 * application on top of its web framework.
 */
public interface GateRequest {

    /**
     * @return HTTP method, upper case
     */
    String getMethod();

    /**
     * @return URL the caller requested, to return them to after login
     */
    String getUrl();

    /**
     * @param name Header name (case-insensitive)
     * @return first value of the header or null
     */
    String getHeader(String name);

    /**
     * @param name Query or form parameter name
     * @return first value of the parameter or null
     */
    String getParameter(String name);

    /**
     * @return raw, unparsed request body, or null if it could not be read
     */
    byte[] getBody();

}
