package com.workstream.core.model;

/**
 * Kinds of work unit a graph node can represent.
 * The executor schedules every kind the same way; only the runner and the
 * failure policy of VALIDATION nodes differ.
 */
public enum NodeKind {
    /**
     * A unit of phase work, e.g. producing code or documents.
     */
    PHASE,

    /**
     * A check over the outputs of earlier nodes.
     * Failure policy is governed by failOnValidationError.
     */
    VALIDATION,

    /**
     * A unit that publishes or evolves a contract for other streams.
     */
    INTERFACE
}
