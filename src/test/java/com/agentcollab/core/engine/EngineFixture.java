package com.agentcollab.core.engine;

import com.agentcollab.adapter.RequiredSectionsGateValidator;
import com.agentcollab.adapter.ScriptedToolAdapter;
import com.agentcollab.adapter.TemplatePromptComposer;
import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.events.EventBus;
import com.agentcollab.core.metrics.CollabMetrics;
import com.agentcollab.core.model.CapabilityProbe;
import com.agentcollab.core.model.IdSource;
import com.agentcollab.core.review.ReviewStageHandler;
import com.agentcollab.core.session.CapabilityProber;
import com.agentcollab.core.session.SessionContinuityManager;
import com.agentcollab.core.session.SessionIdExtractor;
import com.agentcollab.core.session.SessionLeaseRegistry;
import com.agentcollab.core.state.FileStateStore;
import com.agentcollab.core.triage.ErrorClassifier;
import com.agentcollab.core.triage.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * Real engine components wired over a temporary task directory and a scripted tool.
 */
public class EngineFixture {

    public final FileStateStore store;
    public final CollabProperties properties = new CollabProperties();
    public final ScriptedToolAdapter adapter = new ScriptedToolAdapter();
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final CollabMetrics metrics = new CollabMetrics(registry);
    public final SessionContinuityManager sessions;
    public final StageExecutor executor;
    public final SummaryWriter summaryWriter;

    public EngineFixture(Path taskDir) {
        this(taskDir, tool -> new CapabilityProbe(tool, true, IdSource.STRUCTURED_EVENT, true,
                "/usr/local/bin/" + tool, "test probe", Instant.now()));
    }

    public EngineFixture(Path taskDir, CapabilityProber prober) {
        store = new FileStateStore(taskDir);
        properties.getGate().getRequiredSections().put("brief", List.of("## Updated Context Pack"));
        sessions = new SessionContinuityManager(store, prober, new SessionIdExtractor(),
                new SessionLeaseRegistry(), properties, eventBus, metrics);
        executor = new StageExecutor(store, adapter, new RequiredSectionsGateValidator(properties),
                new TemplatePromptComposer(), new ErrorClassifier(), new RetryPolicy(), sessions,
                new ContextPropagator(store), properties, eventBus, metrics);
        summaryWriter = new SummaryWriter(store, properties);
    }

    /**
     * Orchestrator whose review handler never claims a stage.
     */
    public PipelineOrchestrator orchestrator() {
        return orchestrator(mock(ReviewStageHandler.class));
    }

    public PipelineOrchestrator orchestrator(ReviewStageHandler reviewStageHandler) {
        return new PipelineOrchestrator(executor, reviewStageHandler, summaryWriter, store, sessions,
                properties, eventBus);
    }

    public void usePaidCalls(int count) {
        for (int i = 0; i < count; i++) {
            store.updateStats(s -> s.withPaidCall());
        }
    }
}
