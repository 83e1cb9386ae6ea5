package com.polymix.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymix.arb.core.OutcomePairAssembler;
import com.polymix.arb.core.OutcomePairSource;
import com.polymix.arb.domain.OutcomePair;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

/**
 * Reads the matched-games snapshot that the market-data fetchers write, either a bare array
 * of games or an object with a {@code games} array. A snapshot is only processed once; an
 * unchanged file yields nothing.
 */
@Slf4j
public class JsonFileOutcomePairSource implements OutcomePairSource {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final OutcomePairAssembler assembler;

    private FileTime lastModified;

    public JsonFileOutcomePairSource(Path file, ObjectMapper objectMapper, OutcomePairAssembler assembler) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.assembler = assembler;
    }

    @Override
    public String name() {
        return "file:" + file;
    }

    @Override
    public synchronized List<OutcomePair> poll() {
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            FileTime modified = Files.getLastModifiedTime(file);
            if (modified.equals(lastModified)) {
                return List.of();
            }
            JsonNode root = objectMapper.readTree(file.toFile());
            lastModified = modified;
            JsonNode games = root.isArray() ? root : root.path("games");
            List<OutcomePair> pairs = assembler.assembleAll(games);
            log.info("[FEED] {} pair(s) from {} ({} record(s))", pairs.size(), file, games.size());
            return pairs;
        } catch (IOException e) {
            log.error("[FEED] Could not read {}", file, e);
            return List.of();
        }
    }
}
