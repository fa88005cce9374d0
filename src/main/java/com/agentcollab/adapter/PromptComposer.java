package com.agentcollab.adapter;

import com.agentcollab.core.model.Compaction;
import com.agentcollab.core.model.StageSpec;

public interface PromptComposer {

    String compose(StageSpec stage, PromptInputs inputs, Compaction compaction);
}
