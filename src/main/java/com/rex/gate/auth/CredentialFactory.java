package com.rex.gate.auth;

/**
 * Build and parse the Authorization header value for a credential
 */
public interface CredentialFactory {

    String create(String usr, String pwd);

    /**
     * @return {user, password}, or null if the header is not in this scheme
     */
    String[] parse(String authorization);
}
