package com.agentcollab.config;

import com.agentcollab.core.model.DeadlineMode;
import com.agentcollab.core.model.SecurityMode;
import com.agentcollab.core.model.SessionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agentcollab")
public class CollabProperties {

    private String taskDir = ".tmp/task/default";
    private Budgets budgets = new Budgets();
    private Dispatch dispatch = new Dispatch();
    private Session session = new Session();
    private Review review = new Review();
    private Gate gate = new Gate();
    private Map<String, Tool> tools = new LinkedHashMap<>();
    private Map<String, Pipeline> pipelines = new LinkedHashMap<>();

    // -- Budget accessors (delegate to nested) --
    public int getPaidCallBudget() { return budgets.paidCallBudget; }
    public int getRetryBudget() { return budgets.retryBudget; }

    // -- Dispatch accessors --
    public Duration getHeartbeatInterval() { return Duration.ofSeconds(dispatch.heartbeatSeconds); }
    public Duration getDefaultDeadline() { return Duration.ofSeconds(dispatch.defaultDeadlineSeconds); }
    public DeadlineMode getDefaultDeadlineMode() { return parseDeadlineMode(dispatch.defaultDeadlineMode); }
    public int getSummaryMaxLines() { return dispatch.summaryMaxLines; }
    public int getMaxOutputBytes() { return dispatch.maxOutputBytes; }

    // -- Session accessors --
    public SessionMode getSessionMode() { return SessionMode.fromLabel(session.mode); }

    // -- Review accessors --
    public Duration getBarrierTimeout() { return Duration.ofSeconds(review.barrierTimeoutSeconds); }
    public Duration getWatchdogGrace() { return Duration.ofSeconds(review.watchdogGraceSeconds); }
    public int getMaxParallelLenses() { return review.maxParallelLenses; }
    public int getSecurityMaxRounds() { return review.securityMaxRounds; }
    public SecurityMode getSecurityMode() { return SecurityMode.fromLabel(review.securityMode); }

    /**
     * Returns the tool settings for the given tool, or defaults that run the tool name as a
     * command with no session support when the tool is not configured.
     */
    public Tool tool(String name) {
        Tool tool = tools.get(name);
        if (tool != null) {
            return tool;
        }
        Tool fallback = new Tool();
        fallback.setCommand(List.of(name));
        return fallback;
    }

    public static DeadlineMode parseDeadlineMode(String value) {
        if (value == null || value.isBlank()) {
            return DeadlineMode.ENFORCE;
        }
        return DeadlineMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public String getTaskDir() { return taskDir; }
    public void setTaskDir(String taskDir) { this.taskDir = taskDir; }
    public Budgets getBudgets() { return budgets; }
    public void setBudgets(Budgets budgets) { this.budgets = budgets; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Review getReview() { return review; }
    public void setReview(Review review) { this.review = review; }
    public Gate getGate() { return gate; }
    public void setGate(Gate gate) { this.gate = gate; }
    public Map<String, Tool> getTools() { return tools; }
    public void setTools(Map<String, Tool> tools) { this.tools = tools; }
    public Map<String, Pipeline> getPipelines() { return pipelines; }
    public void setPipelines(Map<String, Pipeline> pipelines) { this.pipelines = pipelines; }

    public static class Budgets {
        private int paidCallBudget = 10;
        private int retryBudget = 2;

        public int getPaidCallBudget() { return paidCallBudget; }
        public void setPaidCallBudget(int paidCallBudget) { this.paidCallBudget = paidCallBudget; }
        public int getRetryBudget() { return retryBudget; }
        public void setRetryBudget(int retryBudget) { this.retryBudget = retryBudget; }
    }

    public static class Dispatch {
        private int heartbeatSeconds = 10;
        private int defaultDeadlineSeconds = 600;
        private String defaultDeadlineMode = "enforce";
        private int summaryMaxLines = 80;
        private int maxOutputBytes = 10_000;

        public int getHeartbeatSeconds() { return heartbeatSeconds; }
        public void setHeartbeatSeconds(int heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
        public int getDefaultDeadlineSeconds() { return defaultDeadlineSeconds; }
        public void setDefaultDeadlineSeconds(int defaultDeadlineSeconds) { this.defaultDeadlineSeconds = defaultDeadlineSeconds; }
        public String getDefaultDeadlineMode() { return defaultDeadlineMode; }
        public void setDefaultDeadlineMode(String defaultDeadlineMode) { this.defaultDeadlineMode = defaultDeadlineMode; }
        public int getSummaryMaxLines() { return summaryMaxLines; }
        public void setSummaryMaxLines(int summaryMaxLines) { this.summaryMaxLines = summaryMaxLines; }
        public int getMaxOutputBytes() { return maxOutputBytes; }
        public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
    }

    public static class Session {
        private String mode = "forced_within_phase";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
    }

    public static class Review {
        private int barrierTimeoutSeconds = 900;
        private int watchdogGraceSeconds = 5;
        private int maxParallelLenses = 3;
        private String securityMode = "auto";
        private int securityMaxRounds = 3;
        /** Forces the security lens in auto mode regardless of keywords. */
        private boolean securitySensitive = false;
        private String reviewTool = "codex";
        private String fixTool = "codex";
        private String verifyTool = "codex";

        public int getBarrierTimeoutSeconds() { return barrierTimeoutSeconds; }
        public void setBarrierTimeoutSeconds(int barrierTimeoutSeconds) { this.barrierTimeoutSeconds = barrierTimeoutSeconds; }
        public int getWatchdogGraceSeconds() { return watchdogGraceSeconds; }
        public void setWatchdogGraceSeconds(int watchdogGraceSeconds) { this.watchdogGraceSeconds = watchdogGraceSeconds; }
        public int getMaxParallelLenses() { return maxParallelLenses; }
        public void setMaxParallelLenses(int maxParallelLenses) { this.maxParallelLenses = maxParallelLenses; }
        public String getSecurityMode() { return securityMode; }
        public void setSecurityMode(String securityMode) { this.securityMode = securityMode; }
        public int getSecurityMaxRounds() { return securityMaxRounds; }
        public void setSecurityMaxRounds(int securityMaxRounds) { this.securityMaxRounds = securityMaxRounds; }
        public boolean isSecuritySensitive() { return securitySensitive; }
        public void setSecuritySensitive(boolean securitySensitive) { this.securitySensitive = securitySensitive; }
        public String getReviewTool() { return reviewTool; }
        public void setReviewTool(String reviewTool) { this.reviewTool = reviewTool; }
        public String getFixTool() { return fixTool; }
        public void setFixTool(String fixTool) { this.fixTool = fixTool; }
        public String getVerifyTool() { return verifyTool; }
        public void setVerifyTool(String verifyTool) { this.verifyTool = verifyTool; }
    }

    public static class Gate {
        /** Headings an artifact must contain, keyed by role. */
        private Map<String, List<String>> requiredSections = new LinkedHashMap<>();
        /** Phrases that mark an artifact as out of scope. */
        private List<String> scopeViolationMarkers = new ArrayList<>(List.of("scope violation"));

        public Map<String, List<String>> getRequiredSections() { return requiredSections; }
        public void setRequiredSections(Map<String, List<String>> requiredSections) { this.requiredSections = requiredSections; }
        public List<String> getScopeViolationMarkers() { return scopeViolationMarkers; }
        public void setScopeViolationMarkers(List<String> scopeViolationMarkers) { this.scopeViolationMarkers = scopeViolationMarkers; }
    }

    public static class Tool {
        private List<String> command = new ArrayList<>();
        /** Arguments appended when resuming; {@code {session}} is replaced with the session id. */
        private List<String> resumeArgs = new ArrayList<>();
        /** Arguments appended when a model is set; {@code {model}} is replaced with the model name. */
        private List<String> modelArgs = new ArrayList<>();
        private List<String> probeArgs = new ArrayList<>();
        /** Text the probe output must contain, blank to rely on the exit code alone. */
        private String probeMarker = "";
        private String idSource = "none";
        private String stateDir = "";

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public List<String> getResumeArgs() { return resumeArgs; }
        public void setResumeArgs(List<String> resumeArgs) { this.resumeArgs = resumeArgs; }
        public List<String> getModelArgs() { return modelArgs; }
        public void setModelArgs(List<String> modelArgs) { this.modelArgs = modelArgs; }
        public List<String> getProbeArgs() { return probeArgs; }
        public void setProbeArgs(List<String> probeArgs) { this.probeArgs = probeArgs; }
        public String getProbeMarker() { return probeMarker; }
        public void setProbeMarker(String probeMarker) { this.probeMarker = probeMarker; }
        public String getIdSource() { return idSource; }
        public void setIdSource(String idSource) { this.idSource = idSource; }
        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    }

    public static class Pipeline {
        private String phase;
        private List<StageEntry> stages = new ArrayList<>();

        public String getPhase() { return phase; }
        public void setPhase(String phase) { this.phase = phase; }
        public List<StageEntry> getStages() { return stages; }
        public void setStages(List<StageEntry> stages) { this.stages = stages; }
    }

    public static class StageEntry {
        private String tool;
        private String role;
        private String model;
        private String reasoningEffort;
        private Integer deadlineSeconds;
        private String deadlineMode;

        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getReasoningEffort() { return reasoningEffort; }
        public void setReasoningEffort(String reasoningEffort) { this.reasoningEffort = reasoningEffort; }
        public Integer getDeadlineSeconds() { return deadlineSeconds; }
        public void setDeadlineSeconds(Integer deadlineSeconds) { this.deadlineSeconds = deadlineSeconds; }
        public String getDeadlineMode() { return deadlineMode; }
        public void setDeadlineMode(String deadlineMode) { this.deadlineMode = deadlineMode; }
    }
}
