package com.loom.orchestrator.api.dto;

/**
 * Request body for POST /runs.
 *
 * Required: input (unless validateOnly)
 * Optional: validateOnly, invalidateCache (both default to false)
 */
public record RunSubmitRequest(String input, Boolean validateOnly, Boolean invalidateCache) {

    public RunSubmitRequest {
        if (validateOnly == null) validateOnly = false;
        if (invalidateCache == null) invalidateCache = false;
    }
}
