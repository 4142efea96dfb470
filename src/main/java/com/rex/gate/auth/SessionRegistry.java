package com.rex.gate.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * In-memory token to session mapping with TTL expiry
 *
 * Not thread safe, every call must come from the gate event loop.
 * Sessions are never persisted, a restart forces everyone to log in again.
 */
public class SessionRegistry {

    private static final Logger sLogger = LoggerFactory.getLogger(SessionRegistry.class);

    public static final long DEFAULT_TTL_SECONDS = 12 * 60 * 60;
    private static final int TOKEN_BYTES = 32;

    private final Map<String, Session> mSessions = new HashMap<>();
    private final SecureRandom mRandom = new SecureRandom();
    private final long mTtlMillis;
    private final LongSupplier mClock;

    public SessionRegistry() {
        this(DEFAULT_TTL_SECONDS);
    }

    public SessionRegistry(long ttlSeconds) {
        this(ttlSeconds, System::currentTimeMillis);
    }

    public SessionRegistry(long ttlSeconds, LongSupplier clock) {
        sLogger.trace("<init> ttl:{}s", ttlSeconds);
        mTtlMillis = ttlSeconds * 1000L;
        mClock = clock;
    }

    public String create(String username) {
        byte[] bytes = new byte[TOKEN_BYTES];
        mRandom.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        mSessions.put(token, new Session(token, username, mClock.getAsLong() + mTtlMillis));
        sLogger.debug("Session created for <{}> total:{}", username, mSessions.size());
        return token;
    }

    public Session get(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        Session session = mSessions.get(token);
        if (session == null) {
            return null;
        }
        if (session.isExpired(mClock.getAsLong())) {
            mSessions.remove(token);
            sLogger.debug("Session expired for <{}>", session.username);
            return null;
        }
        return session;
    }

    public void delete(String token) {
        if (token != null && mSessions.remove(token) != null) {
            sLogger.debug("Session deleted total:{}", mSessions.size());
        }
    }

    public int size() {
        return mSessions.size();
    }
}
