package com.agentcollab.adapter;

/**
 * Boundary to an external text-generation tool. Implementations hide the tool's argument
 * dialect and normalize its exit status.
 */
public interface ToolAdapter {

    /**
     * Invokes the tool synchronously. Implementations report failures through the returned
     * {@link ToolResponse} and only throw when the calling thread is interrupted.
     */
    ToolResponse invoke(ToolRequest request) throws InterruptedException;
}
