package com.agentcollab.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts the session id a tool call used, either from a structured event stream or from the
 * single new entry a call leaves in the tool's state directory.
 */
@Component
public class SessionIdExtractor {

    private static final Pattern UUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Scans a JSON-lines event stream for {@code {"type":"init","session_id":...}} or
     * {@code {"type":"thread.started","thread_id":...}}. Non-JSON lines are ignored.
     */
    public SessionExtraction fromEventLog(String eventLog) {
        if (eventLog == null || eventLog.isBlank()) {
            return SessionExtraction.failed("no event stream captured");
        }
        for (String line : eventLog.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.startsWith("{")) {
                continue;
            }
            JsonNode event;
            try {
                event = objectMapper.readTree(trimmed);
            } catch (IOException e) {
                continue;
            }
            String type = event.path("type").asText("");
            if ("init".equals(type) && event.hasNonNull("session_id")) {
                return SessionExtraction.found(event.get("session_id").asText());
            }
            if ("thread.started".equals(type) && event.hasNonNull("thread_id")) {
                return SessionExtraction.found(event.get("thread_id").asText());
            }
        }
        return SessionExtraction.failed("no init or thread.started event in event stream");
    }

    public StateDirSnapshot snapshot(Path stateDir) {
        if (stateDir == null || !Files.isDirectory(stateDir)) {
            return new StateDirSnapshot(stateDir, Set.of());
        }
        return new StateDirSnapshot(stateDir, listEntries(stateDir));
    }

    /**
     * Exactly one new entry must have appeared since {@code before}; zero or several are
     * ambiguous. The session id is the UUID in the entry's file name, or the bare file name.
     */
    public SessionExtraction fromStateDirDiff(StateDirSnapshot before) {
        if (before.directory() == null) {
            return SessionExtraction.failed("tool has no state directory configured");
        }
        if (!Files.isDirectory(before.directory())) {
            return SessionExtraction.failed("state directory does not exist: " + before.directory());
        }
        Set<Path> added = new HashSet<>(listEntries(before.directory()));
        added.removeAll(before.entries());
        if (added.size() != 1) {
            List<String> names = added.stream().map(Path::toString).sorted().toList();
            return SessionExtraction.failed("expected exactly one new state entry, found "
                    + added.size() + (names.isEmpty() ? "" : " " + names));
        }
        String fileName = added.iterator().next().getFileName().toString();
        Matcher m = UUID.matcher(fileName);
        if (m.find()) {
            return SessionExtraction.found(m.group());
        }
        int dot = fileName.indexOf('.');
        return SessionExtraction.found(dot > 0 ? fileName.substring(0, dot) : fileName);
    }

    private static Set<Path> listEntries(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(dir::relativize)
                    .collect(Collectors.toSet());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list state directory " + dir, e);
        }
    }
}
