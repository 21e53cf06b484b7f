package com.clusterscope.backend.navigation;

public enum FetchOutcome {
    /** Rows landed on the current top frame. */
    APPLIED,
    /** The fetch failed; the stack mutation stays. */
    FAILED,
    /** The response belonged to a frame or request that is no longer current and was dropped. */
    STALE,
    /** Guarded no-op: nothing was pushed and nothing was fetched. */
    SKIPPED,
    /** The stack changed without a fetch (back to idle). */
    NO_FETCH
}
