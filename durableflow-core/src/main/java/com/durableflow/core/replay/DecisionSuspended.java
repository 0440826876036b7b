package com.durableflow.core.replay;

/**
 * Unwinds workflow code when it waits on something history cannot answer yet.
 * An Error so that {@code catch (Exception e)} in workflow code does not swallow it.
 */
final class DecisionSuspended extends Error {

    static final DecisionSuspended INSTANCE = new DecisionSuspended();

    private DecisionSuspended() {
        super("Workflow suspended until its history advances", null, false, false);
    }
}
