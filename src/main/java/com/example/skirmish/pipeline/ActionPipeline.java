package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one action request through its full lifecycle:
 * 1. Pre-check (validity against the current state)
 * 2. Execute (world-state changes, event announcements)
 * 3. Post-react (cooldowns, follow-ups)
 *
 * Every run is timed. The span is closed on every path, including when
 * execute or post-react throws; such faults are reported and then rethrown
 * to the caller unchanged.
 *
 * The pipeline does not serialize access to {@code state}. Two runs against
 * the same mutable state must be serialized by the caller.
 *
 * @param <S> simulation state handed to every stage
 */
public class ActionPipeline<S> {

    private static final Logger logger = LoggerFactory.getLogger(ActionPipeline.class);

    private final PreCheckStage<S> preCheck;
    private final ExecuteStage<S> execute;
    private final PostReactStage<S> postReact;
    private final PerformanceMonitor performanceMonitor;
    private final ErrorReporter errorReporter;

    public ActionPipeline(PreCheckStage<S> preCheck, ExecuteStage<S> execute, PostReactStage<S> postReact,
                          PerformanceMonitor performanceMonitor, ErrorReporter errorReporter) {
        this.preCheck = Objects.requireNonNull(preCheck, "preCheck");
        this.execute = Objects.requireNonNull(execute, "execute");
        this.postReact = Objects.requireNonNull(postReact, "postReact");
        this.performanceMonitor = Objects.requireNonNull(performanceMonitor, "performanceMonitor");
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
    }

    /**
     * Run a request.
     * @return false if pre-check rejected the request (nothing was executed),
     *         true once execute and post-react have both completed
     * @throws RuntimeException whatever execute or post-react threw
     */
    public boolean run(ActionRequest request, S state) {
        Objects.requireNonNull(request, "request");
        String timingKey = timingKey(request);
        performanceMonitor.startTiming(timingKey);
        try {
            if (!preCheck.preCheck(request, state)) {
                logger.warn("[ActionPipeline] {} blocked by pre-check", request);
                errorReporter.report(ErrorReporter.STATE_CONFLICT, request.getSource(),
                    "Action " + request.getActionKind() + " conflicts with current state", request);
                return false;
            }

            try {
                execute.execute(request, state);
                postReact.postReact(request, state);
            } catch (RuntimeException | Error e) {
                logger.error("[ActionPipeline] {} failed while executing: {}", request, e.getMessage(), e);
                errorReporter.report(ErrorReporter.EXECUTION_FAULT, request.getSource(),
                    "Action " + request.getActionKind() + " failed: " + e.getMessage(), request);
                throw e;
            }

            logger.debug("[ActionPipeline] {} completed", request);
            return true;
        } finally {
            performanceMonitor.stopTiming(timingKey, request.getActionKind());
        }
    }

    static String timingKey(ActionRequest request) {
        return request.getActionKind() + ":" + request.getRequestId();
    }

    public PreCheckStage<S> getPreCheck() { return preCheck; }
    public ExecuteStage<S> getExecute() { return execute; }
    public PostReactStage<S> getPostReact() { return postReact; }
}
