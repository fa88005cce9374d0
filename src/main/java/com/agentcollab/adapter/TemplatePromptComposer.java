package com.agentcollab.adapter;

import com.agentcollab.core.model.Compaction;
import com.agentcollab.core.model.StageSpec;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Lays the inputs out as markdown sections. Aggressive compaction keeps only the head of the
 * context pack and of each attachment.
 */
@Component
public class TemplatePromptComposer implements PromptComposer {

    static final int AGGRESSIVE_SECTION_BYTES = 8_000;

    @Override
    public String compose(StageSpec stage, PromptInputs inputs, Compaction compaction) {
        var sb = new StringBuilder();
        sb.append("# Stage: ").append(stage.stageId())
                .append(" (").append(stage.tool()).append('/').append(stage.role()).append(")\n\n");

        sb.append("## User Request\n").append(inputs.userRequest().strip()).append("\n\n");

        if (!inputs.contextPack().isBlank()) {
            sb.append("## Context Pack\n")
                    .append(compact(inputs.contextPack().strip(), compaction))
                    .append("\n\n");
        }

        for (Map.Entry<String, String> attachment : inputs.attachments().entrySet()) {
            sb.append("## ").append(attachment.getKey()).append('\n')
                    .append(compact(attachment.getValue().strip(), compaction))
                    .append("\n\n");
        }
        return sb.toString();
    }

    private static String compact(String text, Compaction compaction) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (compaction != Compaction.AGGRESSIVE || bytes.length <= AGGRESSIVE_SECTION_BYTES) {
            return text;
        }
        // may cut a multi-byte character; the decoder replaces the fragment
        String head = new String(bytes, 0, AGGRESSIVE_SECTION_BYTES, StandardCharsets.UTF_8);
        return head + "\n\n... [compacted: " + (bytes.length - AGGRESSIVE_SECTION_BYTES) + " bytes omitted] ...";
    }
}
