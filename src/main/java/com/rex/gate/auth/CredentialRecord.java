package com.rex.gate.auth;

import com.google.gson.annotations.SerializedName;

/**
 * The single account stored on disk
 *
 * Canonical form:  {"username":"admin", "salt":"BASE64", "password_hash":"BASE64"}
 * Legacy form:     {"username":"admin", "password":"plaintext"}
 */
public class CredentialRecord {
    public String username;
    public String salt;
    @SerializedName("password_hash")
    public String passwordHash;
    public String password; // Legacy plaintext, only read for migration

    public boolean isHashed() {
        return passwordHash != null && !passwordHash.isEmpty()
                && salt != null && !salt.isEmpty();
    }

    public boolean isLegacy() {
        return !isHashed() && password != null;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("<@");
        builder.append(Integer.toHexString(hashCode()));
        builder.append(" username:").append(username);
        builder.append(" hashed:").append(isHashed());
        builder.append(" legacy:").append(isLegacy());
        builder.append(">");
        return builder.toString();
    }
}
