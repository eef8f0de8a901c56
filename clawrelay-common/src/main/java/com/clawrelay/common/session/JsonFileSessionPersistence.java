package com.clawrelay.common.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * File-system backed session persistence.
 * Manages a {@code sessions.json} file that maps sessionKey to
 * {@link SessionEntry}.
 *
 * <p>
 * Writes go to a sibling {@code .tmp} file which is then moved over the
 * store, so readers never observe a half-written file. A store file that
 * cannot be parsed is reported as an {@link IOException} rather than treated
 * as empty, so a save never overwrites other sessions' entries with nothing.
 * </p>
 */
@Slf4j
public class JsonFileSessionPersistence implements SessionPersistence {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<LinkedHashMap<String, SessionEntry>> STORE_TYPE = new TypeReference<>() {
    };

    private final Path storePath;

    public JsonFileSessionPersistence(Path storePath) {
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }

    // =========================================================================
    // Load / Save
    // =========================================================================

    @Override
    public synchronized Optional<SessionEntry> load(String sessionKey) throws IOException {
        return Optional.ofNullable(readStore().get(sessionKey));
    }

    @Override
    public synchronized Map<String, SessionEntry> loadAll() throws IOException {
        return readStore();
    }

    @Override
    public synchronized void save(String sessionKey, SessionEntry entry) throws IOException {
        Map<String, SessionEntry> store = readStore();
        store.put(sessionKey, entry);
        writeStore(store);
    }

    private LinkedHashMap<String, SessionEntry> readStore() throws IOException {
        if (!Files.exists(storePath)) {
            return new LinkedHashMap<>();
        }
        String json = Files.readString(storePath, StandardCharsets.UTF_8);
        if (json.isBlank()) {
            return new LinkedHashMap<>();
        }
        LinkedHashMap<String, SessionEntry> store = MAPPER.readValue(json, STORE_TYPE);
        return store != null ? store : new LinkedHashMap<>();
    }

    private void writeStore(Map<String, SessionEntry> store) throws IOException {
        Path parent = storePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = storePath.resolveSibling(storePath.getFileName() + ".tmp");
        Files.writeString(tempFile, MAPPER.writeValueAsString(store), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        Files.move(tempFile, storePath, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Saved session store with {} entries to {}", store.size(), storePath);
    }
}
