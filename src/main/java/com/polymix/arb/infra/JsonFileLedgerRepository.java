package com.polymix.arb.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.polymix.arb.core.LedgerPersistenceException;
import com.polymix.arb.core.LedgerRepository;
import com.polymix.arb.domain.Ledger;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores the ledger as one pretty-printed JSON document. Writes go to a sibling temp file
 * that then replaces the ledger, so a crash never leaves a half-written file.
 */
@Slf4j
public class JsonFileLedgerRepository implements LedgerRepository {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileLedgerRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Optional<Ledger> load() {
        if (!Files.exists(file)) {
            log.info("[LEDGER] No ledger at {}, starting fresh", file);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), Ledger.class));
        } catch (IOException e) {
            throw new LedgerPersistenceException("Ledger file " + file + " is unreadable", e);
        }
    }

    @Override
    public void save(Ledger ledger) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(tmp.toFile(), ledger);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LedgerPersistenceException("Could not write ledger " + file, e);
        }
    }
}
