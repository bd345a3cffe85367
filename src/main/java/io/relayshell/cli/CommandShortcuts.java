package io.relayshell.cli;

import io.relayshell.model.Command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Named convenience commands such as {@code ls /var/log} or {@code systemctl restart nginx}.
 * Arguments are shell-quoted before being substituted.
 */
public final class CommandShortcuts {
    private static final Pattern SAFE_ARG = Pattern.compile("[A-Za-z0-9_./:=@%+,-]+");
    private static final Map<String, Shortcut> SHORTCUTS = buildTable();

    private CommandShortcuts() {
    }

    public static Map<String, Shortcut> all() {
        return SHORTCUTS;
    }

    public static boolean isKnown(String name) {
        return SHORTCUTS.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException for an unknown shortcut or a wrong number of arguments
     */
    public static Command resolve(String name, List<String> args) {
        Shortcut shortcut = SHORTCUTS.get(name);
        if (shortcut == null) {
            throw new IllegalArgumentException("Unknown shortcut: " + name + " (known: " + SHORTCUTS.keySet() + ")");
        }
        List<String> values = args == null ? List.of() : args;
        if (values.size() < shortcut.minArgs() || values.size() > shortcut.maxArgs()) {
            throw new IllegalArgumentException("Shortcut " + name + " expects " + shortcut.usage());
        }
        String text = shortcut.template().apply(values);
        boolean restart = "systemctl".equals(name) && "restart".equals(values.get(0));
        return restart ? Command.restarting(text) : Command.of(text);
    }

    static String quote(String arg) {
        if (SAFE_ARG.matcher(arg).matches()) {
            return arg;
        }
        return "'" + arg.replace("'", "'\\''") + "'";
    }

    private static Map<String, Shortcut> buildTable() {
        Map<String, Shortcut> table = new LinkedHashMap<>();
        add(table, "ls", 0, 1, "[path]", a -> "ls -la " + (a.isEmpty() ? "." : quote(a.get(0))));
        add(table, "cat", 1, 1, "<file>", a -> "cat " + quote(a.get(0)));
        add(table, "mkdir", 1, 1, "<path>", a -> "mkdir -p " + quote(a.get(0)));
        add(table, "rm", 1, 2, "[-r] <path>", CommandShortcuts::remove);
        add(table, "cp", 2, 2, "<source> <destination>", a -> "cp -r " + quote(a.get(0)) + " " + quote(a.get(1)));
        add(table, "mv", 2, 2, "<source> <destination>", a -> "mv " + quote(a.get(0)) + " " + quote(a.get(1)));
        add(table, "systemctl", 2, 2, "<action> <service>", a -> "sudo systemctl " + quote(a.get(0)) + " " + quote(a.get(1)));
        add(table, "ps", 0, 0, "", a -> "ps aux");
        add(table, "top", 0, 0, "", a -> "top -b -n 1");
        add(table, "free", 0, 0, "", a -> "free -h");
        add(table, "df", 0, 0, "", a -> "df -h");
        add(table, "uptime", 0, 0, "", a -> "uptime");
        add(table, "hostname", 0, 0, "", a -> "hostname");
        add(table, "ip", 0, 0, "", a -> "ip addr");
        add(table, "ping", 1, 2, "<host> [count]", CommandShortcuts::ping);
        return Collections.unmodifiableMap(table);
    }

    private static String remove(List<String> args) {
        if (args.size() == 2) {
            if (!"-r".equals(args.get(0))) {
                throw new IllegalArgumentException("Shortcut rm expects [-r] <path>");
            }
            return "rm -rf " + quote(args.get(1));
        }
        return "rm " + quote(args.get(0));
    }

    private static String ping(List<String> args) {
        int count = 4;
        if (args.size() == 2) {
            try {
                count = Integer.parseInt(args.get(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("ping count must be a number: " + args.get(1), e);
            }
        }
        return "ping -c " + count + " " + quote(args.get(0));
    }

    private static void add(Map<String, Shortcut> table, String name, int minArgs, int maxArgs, String usage, Function<List<String>, String> template) {
        table.put(name, new Shortcut(name, minArgs, maxArgs, usage, template));
    }

    public record Shortcut(String name, int minArgs, int maxArgs, String usage, Function<List<String>, String> template) {
    }
}
