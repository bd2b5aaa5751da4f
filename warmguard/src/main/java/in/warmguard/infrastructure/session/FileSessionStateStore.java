package in.warmguard.infrastructure.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.warmguard.application.port.output.SessionStateStore;
import in.warmguard.domain.session.SessionPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Session state kept as one JSON document per account: {@code <dir>/<accountId>.json}.
 *
 * Documents are checked to be well-formed JSON before they are written or handed out.
 * Writes go to a temp file in the same directory and are moved into place, so a crash
 * mid-write never leaves a truncated checkpoint behind.
 */
public final class FileSessionStateStore implements SessionStateStore {
    private static final Logger log = LoggerFactory.getLogger(FileSessionStateStore.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public FileSessionStateStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public Optional<String> load(long accountId) {
        Path file = pathFor(accountId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String document = Files.readString(file, StandardCharsets.UTF_8);
            validate(accountId, document);
            return Optional.of(document);
        } catch (IOException e) {
            throw new SessionPersistenceException(accountId, "Cannot read session state " + file, e);
        }
    }

    @Override
    public void save(long accountId, String storageState) {
        validate(accountId, storageState);
        Path file = pathFor(accountId);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, accountId + "-", ".json.tmp");
            Files.writeString(temp, storageState, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[SESSION-STORE] Saved session state for account {} ({} bytes)", accountId, storageState.length());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new SessionPersistenceException(accountId, "Cannot write session state " + file, e);
        }
    }

    @Override
    public boolean exists(long accountId) {
        return Files.exists(pathFor(accountId));
    }

    @Override
    public void delete(long accountId) {
        try {
            if (Files.deleteIfExists(pathFor(accountId))) {
                log.info("[SESSION-STORE] Deleted session state for account {}", accountId);
            }
        } catch (IOException e) {
            throw new SessionPersistenceException(accountId, "Cannot delete session state", e);
        }
    }

    Path pathFor(long accountId) {
        return directory.resolve(accountId + ".json");
    }

    private void validate(long accountId, String document) {
        if (document == null || document.isBlank()) {
            throw new SessionPersistenceException(accountId, "Session state is empty");
        }
        try {
            mapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new SessionPersistenceException(accountId, "Session state is not valid JSON", e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[SESSION-STORE] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
