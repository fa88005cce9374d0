package com.agentcollab.core.engine;

import com.agentcollab.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Carries the output of context-mutating roles into the inputs of later stages: the
 * numbered sections after {@code ## Updated Context Pack} replace {@code inputs/context_pack.md},
 * and the fenced block under {@code ## Verify Commands} becomes the acceptance command override.
 */
@Component
public class ContextPropagator {

    private static final Logger log = LoggerFactory.getLogger(ContextPropagator.class);

    public static final String CONTEXT_PACK = "inputs/context_pack.md";
    public static final String ACCEPTANCE_OVERRIDE = "state/acceptance.commands.override";

    private static final Set<String> CONTEXT_MUTATING_ROLES = Set.of("brief");

    private static final Pattern UPDATED_CONTEXT_HEADING = Pattern.compile(
            "^##\\s+Updated Context Pack\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern H2 = Pattern.compile("^##\\s+(.+?)\\s*$");
    private static final Pattern NUMBERED_HEADING = Pattern.compile("^\\d+\\.\\s+");

    private final StateStore stateStore;

    public ContextPropagator(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    public boolean mutatesContext(String role) {
        return CONTEXT_MUTATING_ROLES.contains(role);
    }

    public void propagate(String stageId, String artifact) {
        extractContextPack(artifact).ifPresentOrElse(
                pack -> {
                    stateStore.writeDocument(CONTEXT_PACK, pack);
                    log.info("Updated {} from {} output", CONTEXT_PACK, stageId);
                },
                () -> log.warn("{} output has no usable '## Updated Context Pack' section; context not updated", stageId));

        List<String> commands = extractVerifyCommands(artifact);
        if (commands.isEmpty()) {
            stateStore.deleteDocument(ACCEPTANCE_OVERRIDE);
            log.info("No Verify Commands block in {} output; acceptance override cleared", stageId);
        } else {
            stateStore.writeDocument(ACCEPTANCE_OVERRIDE, String.join("\n", commands) + "\n");
            log.info("Updated acceptance command override from {} output ({} commands)", stageId, commands.size());
        }
    }

    static Optional<String> extractContextPack(String artifact) {
        List<String> lines = artifact.lines().toList();
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (UPDATED_CONTEXT_HEADING.matcher(lines.get(i)).matches()) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            return Optional.empty();
        }

        List<String> context = new ArrayList<>();
        boolean inContext = false;
        for (String line : lines.subList(start, lines.size())) {
            Matcher h = H2.matcher(line);
            if (h.matches()) {
                if (NUMBERED_HEADING.matcher(h.group(1).strip()).find()) {
                    inContext = true;
                    context.add(line);
                    continue;
                }
                if (inContext) {
                    break;
                }
            }
            if (inContext) {
                context.add(line);
            }
        }
        while (!context.isEmpty() && context.get(context.size() - 1).isBlank()) {
            context.remove(context.size() - 1);
        }
        if (context.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("\n", context) + "\n");
    }

    static List<String> extractVerifyCommands(String artifact) {
        List<String> commands = new ArrayList<>();
        boolean inSection = false;
        boolean inCode = false;
        for (String line : artifact.lines().toList()) {
            Matcher h = H2.matcher(line);
            if (h.matches()) {
                if (h.group(1).strip().equalsIgnoreCase("verify commands")) {
                    inSection = true;
                    inCode = false;
                    continue;
                }
                if (inSection && !inCode) {
                    break;
                }
            }
            if (!inSection) {
                continue;
            }
            if (line.strip().startsWith("```")) {
                if (!inCode) {
                    inCode = true;
                    continue;
                }
                break;
            }
            if (inCode && !line.isBlank()) {
                commands.add(line.strip());
            }
        }
        return commands;
    }
}
