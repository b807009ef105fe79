package com.authzengine.authorization;

/**
 * How the engine runs the rules of a single authorization.
 */
public enum EvaluationMode {
    /**
     * Rules run one after another on the calling thread.
     */
    SEQUENTIAL,

    /**
     * Rules run concurrently on the engine's executor; the calling thread waits for all of them.
     */
    PARALLEL
}
