package com.exprgraph.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.exprgraph.api.GraphListener;
import com.exprgraph.api.GraphLogEvent;
import com.exprgraph.engine.MutationResult;
import com.exprgraph.expr.EvaluationFailure;

/**
 * Writes store activity to Log4j: one INFO line per log event, DEBUG per
 * evaluated node, and throttled WARN lines for evaluation failures.
 */
public final class LoggingGraphListener implements GraphListener {
    private static final Logger log = LogManager.getLogger(LoggingGraphListener.class);

    private final ErrorRateLimiter failureLimiter;

    public LoggingGraphListener() {
        this(1000);
    }

    /**
     * @param failureIntervalMillis Minimum gap between two failure lines.
     */
    public LoggingGraphListener(long failureIntervalMillis) {
        this.failureLimiter = new ErrorRateLimiter(log, failureIntervalMillis);
    }

    @Override
    public void onMutationApplied(long revision, String operation, MutationResult result) {
        log.debug("r{} {}: changed={}, {} event(s), {} failure(s)", revision, operation, result.changed(),
                result.events().size(), result.failures().size());
        for (GraphLogEvent e : result.events())
            log.info("r{} {}", revision, e.message());
    }

    @Override
    public void onNodeEvaluated(long revision, int nodeId, String label, double previous, double current) {
        log.debug("r{} evaluated '{}' (#{}): {} -> {}", revision, label, nodeId, previous, current);
    }

    @Override
    public void onNodeFailed(long revision, EvaluationFailure failure) {
        failureLimiter.warn(String.format("r%d evaluation of '%s' (#%d) failed [%s]: %s", revision,
                failure.label(), failure.nodeId(), failure.kind(), failure.message()), null);
    }
}
