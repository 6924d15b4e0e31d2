package com.golfdraft.web;

public final class CallerHeaders {

    /**
     * Authenticated caller id, set by the session layer in front of this service.
     */
    public static final String USER_ID = "X-User-Id";

    private CallerHeaders() {
    }
}
