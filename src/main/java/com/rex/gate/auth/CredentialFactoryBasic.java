package com.rex.gate.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public class CredentialFactoryBasic implements CredentialFactory {

    public static final String SCHEME = "Basic ";

    @Override
    public String create(String usr, String pwd) {
        String credential = usr + ":" + pwd;
        return SCHEME + Base64.getEncoder().encodeToString(credential.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String[] parse(String authorization) {
        if (authorization == null || !authorization.startsWith(SCHEME)) {
            return null;
        }
        String credential;
        try {
            credential = new String(Base64.getDecoder().decode(authorization.substring(SCHEME.length())), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return null;
        }
        int idx = credential.indexOf(':');
        if (idx < 0) {
            return null;
        }
        return new String[] { credential.substring(0, idx), credential.substring(idx + 1) };
    }
}
