package com.rex.gate.auth;

import java.io.IOException;

/**
 * Storage of the one operator account, shared by both front doors
 */
public interface CredentialStore {

    /**
     * @return the stored record, or null if nothing usable is stored yet
     */
    CredentialRecord load();

    /**
     * Store the account, always in the salted and hashed form
     */
    void save(String username, String password) throws IOException;

    /**
     * Check the supplied credential, migrating a legacy plaintext record on success
     */
    boolean verify(String username, String password);

    default boolean isConfigured() {
        return load() != null;
    }
}
