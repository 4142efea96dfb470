package com.rex.gate.auth;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.junit.Assert.*;

public class FileCredentialStoreTest {

    @Rule
    public TemporaryFolder mFolder = new TemporaryFolder();

    private final Gson mGson = new Gson();

    private Path authFile() {
        return mFolder.getRoot().toPath().resolve("data").resolve("auth.json");
    }

    private JsonObject readJson(Path file) throws Exception {
        return mGson.fromJson(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), JsonObject.class);
    }

    @Test
    public void testMissingFile() {
        FileCredentialStore store = new FileCredentialStore(authFile());
        assertNull(store.load());
        assertFalse(store.isConfigured());
        assertFalse(store.verify("admin", "secret"));
    }

    @Test
    public void testCorruptFile() throws Exception {
        Path file = authFile();
        Files.createDirectories(file.getParent());
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        FileCredentialStore store = new FileCredentialStore(file);
        assertNull(store.load());
        assertFalse(store.isConfigured());
    }

    @Test
    public void testRecordWithoutUsername() throws Exception {
        Path file = authFile();
        Files.createDirectories(file.getParent());
        Files.write(file, "{\"password\":\"secret\"}".getBytes(StandardCharsets.UTF_8));

        assertNull(new FileCredentialStore(file).load());
    }

    @Test
    public void testSaveWritesHashedForm() throws Exception {
        FileCredentialStore store = new FileCredentialStore(authFile());
        store.save("admin", "secret");

        JsonObject json = readJson(authFile());
        assertEquals("admin", json.get("username").getAsString());
        assertFalse(json.has("password"));
        assertEquals(PasswordHasher.SALT_LENGTH, Base64.getDecoder().decode(json.get("salt").getAsString()).length);
        assertEquals(PasswordHasher.KEY_LENGTH, Base64.getDecoder().decode(json.get("password_hash").getAsString()).length);
        assertTrue(store.isConfigured());
    }

    @Test
    public void testVerify() throws Exception {
        FileCredentialStore store = new FileCredentialStore(authFile());
        store.save("admin", "secret");

        assertTrue(store.verify("admin", "secret"));
        assertFalse(store.verify("admin", "wrong"));
        assertFalse(store.verify("root", "secret"));
        assertFalse(store.verify("admin", ""));
        assertFalse(store.verify("", "secret"));
        assertFalse(store.verify(null, null));
    }

    @Test
    public void testSaltDiffersPerSave() throws Exception {
        FileCredentialStore store = new FileCredentialStore(authFile());
        store.save("admin", "secret");
        String salt1 = readJson(authFile()).get("salt").getAsString();
        store.save("admin", "secret");
        String salt2 = readJson(authFile()).get("salt").getAsString();
        assertNotEquals(salt1, salt2);
    }

    @Test
    public void testLegacyMigration() throws Exception {
        Path file = authFile();
        Files.createDirectories(file.getParent());
        Files.write(file, "{\"username\":\"admin\",\"password\":\"secret\"}".getBytes(StandardCharsets.UTF_8));

        FileCredentialStore store = new FileCredentialStore(file);
        assertTrue(store.load().isLegacy());

        // Wrong password leaves the legacy record alone
        assertFalse(store.verify("admin", "wrong"));
        assertTrue(readJson(file).has("password"));

        assertTrue(store.verify("admin", "secret"));
        JsonObject json = readJson(file);
        assertFalse(json.has("password"));
        assertTrue(json.has("salt"));
        assertTrue(json.has("password_hash"));

        // No longer depends on the plaintext field
        assertTrue(store.verify("admin", "secret"));
        assertFalse(store.verify("admin", "wrong"));
    }

    @Test
    public void testHashedFormWinsOverPlaintext() throws Exception {
        PasswordHasher hasher = new PasswordHasher();
        byte[] salt = hasher.newSalt();
        JsonObject json = new JsonObject();
        json.addProperty("username", "admin");
        json.addProperty("salt", Base64.getEncoder().encodeToString(salt));
        json.addProperty("password_hash", hasher.hash64("hashed-secret", salt));
        json.addProperty("password", "plain-secret");

        Path file = authFile();
        Files.createDirectories(file.getParent());
        Files.write(file, mGson.toJson(json).getBytes(StandardCharsets.UTF_8));

        FileCredentialStore store = new FileCredentialStore(file, hasher);
        assertFalse(store.verify("admin", "plain-secret"));
        assertTrue(store.verify("admin", "hashed-secret"));
        // Nothing was migrated
        assertTrue(readJson(file).has("password"));
    }

    @Test
    public void testInvalidSalt() throws Exception {
        Path file = authFile();
        Files.createDirectories(file.getParent());
        Files.write(file, "{\"username\":\"admin\",\"salt\":\"***\",\"password_hash\":\"***\"}".getBytes(StandardCharsets.UTF_8));

        assertFalse(new FileCredentialStore(file).verify("admin", "secret"));
    }
}
