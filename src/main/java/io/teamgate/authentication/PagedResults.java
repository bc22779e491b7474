package io.teamgate.authentication;

import java.util.List;

/**
 * Iterator over the pages of a paginated GitHub listing. Each call to {@link #next()}
 * performs at most one request.
 * @param <T> Type of the listed items
 */
public interface PagedResults<T> {

    /**
     * @return true until the provider has reported the last page
     */
    boolean hasNext();

    /**
     * Fetches the next page
     * @return items of the page (possibly empty)
     * @throws GateAuthenticationException when the provider request fails
     */
    List<T> next() throws GateAuthenticationException;

}
