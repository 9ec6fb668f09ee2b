package com.architecture.memory.graphexport.config;

/**
 * What to do with the {@code Node(id)} uniqueness constraint when a session factory is opened.
 */
public enum AutoIndexMode {
    /** Leave the schema alone. Without the constraint every merge on id scans the label. */
    NONE,
    /** Fail if the constraint is missing. */
    VALIDATE,
    /** Drop and recreate the constraint. */
    ASSERT,
    /** Create the constraint if it does not exist yet. */
    UPDATE
}
