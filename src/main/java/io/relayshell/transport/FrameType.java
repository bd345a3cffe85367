package io.relayshell.transport;

public enum FrameType {
    AUTH((byte) 1),
    COMMAND((byte) 2),
    BATCH((byte) 3),
    PING((byte) 4),
    RESPONSE((byte) 5);

    private final byte code;

    FrameType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static FrameType fromCode(byte code) {
        for (FrameType value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }
}
