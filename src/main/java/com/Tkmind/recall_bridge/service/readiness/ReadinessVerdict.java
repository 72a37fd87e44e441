package com.Tkmind.recall_bridge.service.readiness;

public enum ReadinessVerdict {
    READY,
    NOT_READY,
    /** The check cannot tell; the next check in the chain decides. */
    UNKNOWN
}
