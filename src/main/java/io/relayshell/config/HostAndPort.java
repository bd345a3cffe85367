package io.relayshell.config;

public record HostAndPort(String host, int port) {
    public HostAndPort {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within 1-65535: " + port);
        }
        host = host.trim();
    }

    public static HostAndPort parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("host:port cannot be empty");
        }
        int sep = raw.lastIndexOf(':');
        if (sep <= 0 || sep == raw.length() - 1) {
            throw new IllegalArgumentException("expected host:port, got " + raw);
        }
        try {
            return new HostAndPort(raw.substring(0, sep), Integer.parseInt(raw.substring(sep + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in " + raw, e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
