package io.relayshell.model;

public enum BatchMode {
    /** Each command is submitted only after the previous result arrived. */
    SEQUENTIAL,
    /**
     * All commands are written at once in submission order; results may complete in any order.
     */
    PIPELINED
}
