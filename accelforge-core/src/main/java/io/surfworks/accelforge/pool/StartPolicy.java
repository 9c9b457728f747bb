package io.surfworks.accelforge.pool;

/**
 * How a pool reacts when some members fail to start.
 */
public enum StartPolicy {
    /** Any failure stops every member and fails the pool start */
    STRICT,

    /** Failed members are stopped and left out; fails only if no member started */
    LENIENT
}
