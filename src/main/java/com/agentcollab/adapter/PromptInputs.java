package com.agentcollab.adapter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Material a request is composed from.
 *
 * @param userRequest the task's request text
 * @param contextPack the shared context pack, possibly updated by earlier stages
 * @param attachments named extra sections (lens focus, findings, fix action), in order
 */
public record PromptInputs(
    String userRequest,
    String contextPack,
    Map<String, String> attachments
) {

    public PromptInputs {
        userRequest = userRequest == null ? "" : userRequest;
        contextPack = contextPack == null ? "" : contextPack;
        attachments = attachments == null ? Map.of() : new LinkedHashMap<>(attachments);
    }
}
