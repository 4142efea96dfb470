package com.rex.gate.auth;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.*;

public class CredentialFactoryBasicTest {

    private static final Logger sLogger = LoggerFactory.getLogger(CredentialFactoryBasicTest.class.getSimpleName());

    @Test
    public void testBasicAuth() throws Exception {
        CredentialFactoryBasic factory = new CredentialFactoryBasic();
        String credential = factory.create("account", "password");
        sLogger.trace("credential=<{}>", credential);
        assertEquals("Basic YWNjb3VudDpwYXNzd29yZA==", credential);
    }

    @Test
    public void testParse() {
        CredentialFactoryBasic factory = new CredentialFactoryBasic();
        assertArrayEquals(new String[] { "account", "password" }, factory.parse("Basic YWNjb3VudDpwYXNzd29yZA=="));
        // Password may contain colons
        assertArrayEquals(new String[] { "admin", "a:b" }, factory.parse(factory.create("admin", "a:b")));
    }

    @Test
    public void testParseRejects() {
        CredentialFactoryBasic factory = new CredentialFactoryBasic();
        assertNull(factory.parse(null));
        assertNull(factory.parse("Bearer YWNjb3VudDpwYXNzd29yZA=="));
        assertNull(factory.parse("basic YWNjb3VudDpwYXNzd29yZA=="));
        assertNull(factory.parse("Basic ***"));
        assertNull(factory.parse("Basic YWNjb3VudA==")); // No colon
    }
}
