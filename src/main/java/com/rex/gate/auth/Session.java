package com.rex.gate.auth;

/**
 * A logged-in browser session
 */
public class Session {
    public final String token;
    public final String username;
    public final long expiresAt; // Epoch millis

    public Session(String token, String username, long expiresAt) {
        this.token = token;
        this.username = username;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(long now) {
        return expiresAt < now;
    }

    @Override
    public String toString() {
        return "<@" + Integer.toHexString(hashCode()) + " username:" + username + " expiresAt:" + expiresAt + ">";
    }
}
