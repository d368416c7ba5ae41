package io.isolation.lab.harness;

/**
 * Standard SQL isolation levels, weakest first.
 */
public enum IsolationLevel {
    /** PostgreSQL runs this as READ_COMMITTED, so dirty reads stay unreachable */
    READ_UNCOMMITTED,

    /** Prevents dirty reads; non-repeatable and phantom reads remain possible */
    READ_COMMITTED,

    /** Snapshot taken at the first statement; concurrent commits are invisible */
    REPEATABLE_READ,

    /** Snapshot plus conflict detection; a commit may be refused with a serialization failure */
    SERIALIZABLE
}
