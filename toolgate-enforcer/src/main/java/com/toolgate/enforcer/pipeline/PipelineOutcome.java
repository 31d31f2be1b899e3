package com.toolgate.enforcer.pipeline;

import com.toolgate.policy.model.Decision;

/**
 * Terminal result of running one call through the pipeline.
 */
public sealed interface PipelineOutcome permits PipelineOutcome.Allowed, PipelineOutcome.Denied, PipelineOutcome.Failed {

    Decision decision();

    /** The tool ran; {@code result} is already redacted. */
    record Allowed(Object result, Decision decision) implements PipelineOutcome {
    }

    /** A layer rejected the call before execution. */
    record Denied(Decision decision) implements PipelineOutcome {
    }

    /** The call was authorized but the tool or the redactor threw. */
    record Failed(Decision decision, Throwable cause) implements PipelineOutcome {
    }
}
