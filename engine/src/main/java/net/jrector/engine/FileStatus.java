package net.jrector.engine;

public enum FileStatus {
    CHANGED,
    UNCHANGED,
    /**
     * Processing failed; the file is left untouched.
     */
    ERRORED,
    /**
     * The run was cancelled before the file was processed.
     */
    SKIPPED
}
