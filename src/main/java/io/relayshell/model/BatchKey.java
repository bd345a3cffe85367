package io.relayshell.model;

/**
 * Identifies one entry of a batch; {@code ordinal} tells duplicate command strings apart.
 */
public record BatchKey(String command, int ordinal) {
    @Override
    public String toString() {
        return "#" + ordinal + " " + command;
    }
}
