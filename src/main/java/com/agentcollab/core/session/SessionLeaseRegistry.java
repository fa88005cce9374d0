package com.agentcollab.core.session;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Grants at most one stage at a time the use of a (phase, tool) session.
 */
@Component
public class SessionLeaseRegistry {

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    /**
     * @throws ConcurrentResumeException if another stage holds the lease
     */
    public void acquire(String phase, String tool, String stageId) {
        String holder = holders.putIfAbsent(key(phase, tool), stageId);
        if (holder != null && !holder.equals(stageId)) {
            throw new ConcurrentResumeException(phase, tool, holder, stageId);
        }
    }

    public void release(String phase, String tool, String stageId) {
        holders.remove(key(phase, tool), stageId);
    }

    public boolean isHeld(String phase, String tool) {
        return holders.containsKey(key(phase, tool));
    }

    private static String key(String phase, String tool) {
        return phase + "/" + tool;
    }
}
