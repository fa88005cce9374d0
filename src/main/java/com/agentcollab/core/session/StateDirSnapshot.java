package com.agentcollab.core.session;

import java.nio.file.Path;
import java.util.Set;

/**
 * Files present in a tool's local state directory before a call.
 *
 * @param directory the state directory, null when the tool has none
 * @param entries   regular files found, relative to {@code directory}
 */
public record StateDirSnapshot(Path directory, Set<Path> entries) {

    public StateDirSnapshot {
        entries = entries == null ? Set.of() : Set.copyOf(entries);
    }
}
