package io.buslink.plugin;

/**
 * Points in the event flows at which plugins are invoked.
 */
public enum HookPoint {
    BEFORE_EVENT_SENT,
    AFTER_EVENT_SENT,
    BEFORE_EVENT_EXECUTION,
    AFTER_EVENT_EXECUTION
}
