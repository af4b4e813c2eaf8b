package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

/**
 * Destination for pipeline diagnostics.
 */
public interface ErrorReporter {

    /** Pre-check rejected the request */
    String STATE_CONFLICT = "state-conflict";

    /** Execute or post-react threw */
    String EXECUTION_FAULT = "execution-fault";

    /** A stage got a context payload of the wrong shape */
    String CONTEXT_MISMATCH = "context-mismatch";

    /**
     * @param kind one of the constants above, or a caller-defined kind
     * @param actor source of the offending request
     * @param request the request, for context; may be null
     */
    void report(String kind, String actor, String message, ActionRequest request);
}
