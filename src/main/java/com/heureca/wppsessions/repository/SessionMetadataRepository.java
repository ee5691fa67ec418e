package com.heureca.wppsessions.repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.heureca.wppsessions.model.SessionMetadata;

/**
 * Flat JSON file holding {id, webhookUrl, status} for every known session.
 * Rewritten in full on each save. I/O failures are logged and never propagated.
 */
@Repository
public class SessionMetadataRepository {

    private static final Logger logger = LoggerFactory.getLogger(SessionMetadataRepository.class);

    private static final TypeReference<List<SessionMetadata>> ENTRIES = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Path file;

    public SessionMetadataRepository(
            ObjectMapper objectMapper,
            @Value("${sessions.data-dir:./sessions}") Path dataDir,
            @Value("${sessions.metadata-file:sessions.json}") String fileName) {
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.file = dataDir.resolve(fileName);
    }

    public Path getFile() {
        return file;
    }

    public List<SessionMetadata> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<SessionMetadata> entries = mapper.readValue(file.toFile(), ENTRIES);
            List<SessionMetadata> valid = new ArrayList<>();
            for (SessionMetadata entry : entries) {
                if (entry != null && entry.getId() != null && !entry.getId().isBlank()) {
                    valid.add(entry);
                }
            }
            logger.info("SESSIONS METADATA LOADED | file={} | count={}", file, valid.size());
            return valid;
        } catch (IOException e) {
            logger.error("ERROR LOADING SESSIONS METADATA | file={}", file, e);
            return List.of();
        }
    }

    public void save(List<SessionMetadata> sessions) {
        save(() -> sessions);
    }

    /**
     * Takes the snapshot and writes it under one lock, so a snapshot taken earlier can never
     * overwrite one taken later.
     */
    public synchronized void save(Supplier<List<SessionMetadata>> snapshot) {
        List<SessionMetadata> sessions = snapshot.get();
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), sessions);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("SESSIONS METADATA SAVED | count={}", sessions.size());
        } catch (IOException e) {
            logger.error("ERROR SAVING SESSIONS METADATA | file={}", file, e);
        }
    }
}
