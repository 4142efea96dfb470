package com.rex.gate.auth;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;

/**
 * JSON file backed credential store
 *
 * No lock is held, writes only happen on setup and on the one-time legacy migration,
 * each write goes to a temp file which is then renamed over the target.
 */
public class FileCredentialStore implements CredentialStore {

    private static final Logger sLogger = LoggerFactory.getLogger(FileCredentialStore.class);

    private final Gson mCodec = new Gson();
    private final PasswordHasher mHasher;
    private final Path mFile;

    public FileCredentialStore(Path file) {
        this(file, new PasswordHasher());
    }

    public FileCredentialStore(Path file, PasswordHasher hasher) {
        sLogger.trace("<init> file:{}", file);
        mFile = file;
        mHasher = hasher;
    }

    public Path file() {
        return mFile;
    }

    @Override // CredentialStore
    public CredentialRecord load() {
        if (!Files.isRegularFile(mFile)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(mFile, StandardCharsets.UTF_8)) {
            CredentialRecord record = mCodec.fromJson(reader, CredentialRecord.class);
            if (record == null || record.username == null || record.username.isEmpty()) {
                sLogger.warn("Credential file {} has no account", mFile);
                return null;
            }
            return record;
        } catch (IOException | JsonParseException ex) {
            sLogger.warn("Failed to read credential file {} - {}", mFile, ex.toString());
            return null;
        }
    }

    @Override // CredentialStore
    public void save(String username, String password) throws IOException {
        byte[] salt = mHasher.newSalt();
        CredentialRecord record = new CredentialRecord();
        record.username = username;
        record.salt = Base64.getEncoder().encodeToString(salt);
        record.passwordHash = mHasher.hash64(password, salt);
        write(record);
        sLogger.info("Saved credential for <{}>", username);
    }

    @Override // CredentialStore
    public boolean verify(String username, String password) {
        if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
            return false;
        }
        CredentialRecord record = load();
        if (record == null) {
            return false;
        }
        if (!PasswordHasher.constantTimeEquals(username, record.username)) {
            return false;
        }

        // Hashed form always wins when both are present
        if (record.isHashed()) {
            return mHasher.matches(password, record.salt, record.passwordHash);
        }

        if (record.password != null && PasswordHasher.constantTimeEquals(password, record.password)) {
            try {
                save(username, password);
                sLogger.info("Migrated legacy credential for <{}>", username);
            } catch (IOException ex) {
                sLogger.warn("Failed to migrate legacy credential - {}", ex.toString());
            }
            return true;
        }
        return false;
    }

    private void write(CredentialRecord record) throws IOException {
        Path dir = mFile.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = Files.createTempFile(dir, mFile.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, mCodec.toJson(record).getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(temp, mFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, mFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
