package com.agentcollab.adapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for {@link ToolAdapter}: answers by stage id when an answer is registered for
 * it, otherwise from a queue, otherwise with the default answer.
 */
public class ScriptedToolAdapter implements ToolAdapter {

    @FunctionalInterface
    public interface Answer {
        ToolResponse answer(ToolRequest request) throws InterruptedException;
    }

    private final Deque<Answer> queue = new ArrayDeque<>();
    private final Map<String, Answer> byStage = new ConcurrentHashMap<>();
    private final List<ToolRequest> requests = new CopyOnWriteArrayList<>();
    private volatile Answer fallback = request -> ToolResponse.success("# Output of " + request.stageId() + "\n");

    public ScriptedToolAdapter then(ToolResponse response) {
        return thenAnswer(request -> response);
    }

    public synchronized ScriptedToolAdapter thenAnswer(Answer answer) {
        queue.addLast(answer);
        return this;
    }

    public ScriptedToolAdapter onStage(String stageId, Answer answer) {
        byStage.put(stageId, answer);
        return this;
    }

    public ScriptedToolAdapter otherwise(Answer answer) {
        this.fallback = answer;
        return this;
    }

    @Override
    public ToolResponse invoke(ToolRequest request) throws InterruptedException {
        requests.add(request);
        Answer answer = byStage.get(request.stageId());
        if (answer == null) {
            synchronized (this) {
                answer = queue.pollFirst();
            }
        }
        return (answer != null ? answer : fallback).answer(request);
    }

    public List<ToolRequest> requests() {
        return requests;
    }

    public List<ToolRequest> requestsFor(String stageId) {
        return requests.stream().filter(r -> r.stageId().equals(stageId)).toList();
    }
}
