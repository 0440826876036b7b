package com.durableflow.core.model;

/**
 * The two kinds of work carried by task queues.
 */
public enum TaskKind {
    /** The run has new history and needs a decision cycle. */
    DECISION,
    /** One attempt of a scheduled activity invocation must execute. */
    ACTIVITY
}
