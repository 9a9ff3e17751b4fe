package com.spirecomm.bridge.action;

import com.google.gson.JsonObject;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A command for the bridge: a command name followed by integer or single-token
 * string arguments.
 *
 * <p>The bridge relays the command line verbatim to CommunicationMod, which splits
 * it on whitespace, so string arguments may not contain whitespace.
 */
public final class Action {
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final String command;
    private final List<Object> args;

    private Action(String command, List<Object> args) {
        this.command = command;
        this.args = args;
    }

    public static Action of(String command, Object... args) {
        Objects.requireNonNull(command, "command");
        String trimmed = command.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Action command must not be blank");
        }
        for (Object arg : args) {
            validateArgument(trimmed, arg);
        }
        return new Action(trimmed, List.of(args));
    }

    private static void validateArgument(String command, Object arg) {
        if (arg instanceof Integer) {
            return;
        }
        if (arg instanceof String) {
            String value = (String) arg;
            if (value.isEmpty() || WHITESPACE.matcher(value).find()) {
                throw new IllegalArgumentException(
                        "String argument for '" + command + "' must be a single token: '" + value + "'");
            }
            return;
        }
        throw new IllegalArgumentException("Unsupported argument for '" + command + "': "
                + (arg == null ? "null" : arg.getClass().getSimpleName()));
    }

    public String getCommand() {
        return command;
    }

    public List<Object> getArgs() {
        return args;
    }

    /**
     * The command line CommunicationMod receives, e.g. {@code "play 2 0"}.
     */
    public String toCommandLine() {
        StringBuilder line = new StringBuilder(command);
        for (Object arg : args) {
            line.append(' ').append(arg);
        }
        return line.toString();
    }

    /**
     * Request body for {@code POST /action}.
     */
    public JsonObject toJson() {
        JsonObject body = new JsonObject();
        body.addProperty("command", toCommandLine());
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Action)) return false;
        Action other = (Action) o;
        return command.equals(other.command) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, args);
    }

    @Override
    public String toString() {
        return toCommandLine();
    }
}
