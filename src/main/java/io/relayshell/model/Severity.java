package io.relayshell.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
