package com.nodeflow.dfg.api;

/** Lifecycle status of an engine. */
public enum EngineStatus {
    /** Not reacting to change notifications. Notifications are recorded. */
    STOPPED,
    /** Started and waiting for change notifications. */
    IDLE,
    /** Started and executing a run. */
    RUNNING,
    /** Started but temporarily not reacting to notifications. Notifications are recorded. */
    PAUSED
}
