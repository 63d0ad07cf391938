package com.ybds.auth;

/**
 * Read-only view of an incoming upgrade request, independent of the HTTP server.
 */
public interface RequestContext {

    /**
     * First value of the named header, or null.
     */
    String header(String name);

    /**
     * First value of the named query parameter (URL-decoded), or null.
     */
    String queryParam(String name);

    String remoteAddress();
}
