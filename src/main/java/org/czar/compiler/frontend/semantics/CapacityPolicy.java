package org.czar.compiler.frontend.semantics;

/**
 * What a registry does when a configured entry limit is reached.
 */
public enum CapacityPolicy {
    /** Warn once, drop the entry and keep compiling with incomplete tracking. */
    WARN_AND_CONTINUE,
    /** Ignore the configured limit. */
    UNBOUNDED,
    /** Report a hard error. */
    FAIL
}
