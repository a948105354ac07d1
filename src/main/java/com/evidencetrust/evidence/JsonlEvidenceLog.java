package com.evidencetrust.evidence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Evidence logs stored as one JSON record per line. Relative names resolve against the base
 * directory.
 */
public class JsonlEvidenceLog implements EvidenceLogSource {
    private static final Logger log = LoggerFactory.getLogger(JsonlEvidenceLog.class);

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path baseDirectory;

    public JsonlEvidenceLog(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public EvidenceLog open(String name) {
        Path path = baseDirectory.resolve(name);
        if (!Files.exists(path)) {
            log.debug("Evidence log {} not found at {}", name, path);
            return EvidenceLog.missing(name);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path);
        } catch (IOException e) {
            log.warn("Evidence log {} could not be read: {}", name, e.getMessage());
            return new EvidenceLog(name, true, List.of(), 1);
        }

        List<EvidenceRecord> records = new ArrayList<>();
        int position = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            position++;
            EvidenceRecord record;
            try {
                record = mapper.readValue(line, EvidenceRecord.class);
            } catch (JsonProcessingException e) {
                log.warn("Evidence log {} has an unreadable record at position {}: {}", name, position, e.getOriginalMessage());
                return new EvidenceLog(name, true, records, position);
            }
            if (record == null) {
                log.warn("Evidence log {} has a null record at position {}", name, position);
                return new EvidenceLog(name, true, records, position);
            }
            records.add(record);
        }
        return EvidenceLog.of(name, records);
    }

    public void append(Path logPath, EvidenceRecord record) throws IOException {
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }
        String line = mapper.writeValueAsString(record) + System.lineSeparator();
        Files.writeString(logPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }
}
