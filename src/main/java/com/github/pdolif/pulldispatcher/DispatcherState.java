package com.github.pdolif.pulldispatcher;

/**
 * Lifecycle state of an {@link OrderedPullDispatcher}. The only transition is {@code ACTIVE -> STOPPED}.
 */
public enum DispatcherState {
    ACTIVE,
    STOPPED
}
