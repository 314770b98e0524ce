package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds typed {@link AgentAction}s from the loosely-typed form accepted over the wire
 * ({@code {"kind": "FILE_OPERATION", "params": {"operation": "write", "path": "..."}}}).
 */
public final class ActionFactory {

    private ActionFactory() {}

    /**
     * @param kind   action kind name, case-insensitive
     * @param params kind-specific parameters; may be null for kinds that take none
     * @throws InvalidActionException if the kind is unknown or a parameter is missing or malformed
     */
    public static AgentAction fromSpec(String kind, Map<String, Object> params) {
        if (kind == null || kind.isBlank()) {
            throw new InvalidActionException("kind is required");
        }
        ActionKind actionKind;
        try {
            actionKind = ActionKind.valueOf(kind.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidActionException("Unknown action kind: " + kind);
        }
        Map<String, Object> p = params != null ? params : Map.of();

        return switch (actionKind) {
            case GENERIC -> new StepAction(string(p, "instruction"));
            case MOUSE_CONTROL -> new MouseAction(string(p, "operation"), integer(p, "x"), integer(p, "y"));
            case KEYBOARD_INPUT -> new KeyboardAction(string(p, "text"));
            case SCREEN_CONTROL -> new ScreenAction(string(p, "operation"));
            case FILE_OPERATION -> new FileAction(fileOperation(string(p, "operation")), string(p, "path"));
            case PROGRAM_EXECUTION -> new ProgramAction(string(p, "program"), stringList(p, "arguments"));
            case SYSTEM_COMMAND -> p.containsKey("name")
                    ? new PrivilegedAction(string(p, "name"), stringMap(p, "parameters"))
                    : new CommandAction(string(p, "command"));
            case NETWORK_ACCESS -> new NetworkAction(string(p, "url"), optionalString(p, "method"));
            case DOWNLOAD_FILE -> new DownloadAction(string(p, "url"), string(p, "fileName"), longValue(p, "sizeBytes"));
            case GAME_INTERACTION -> new GameAction(string(p, "game"), string(p, "action"));
        };
    }

    private static FileOperation fileOperation(String value) {
        try {
            return FileOperation.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidActionException("Unknown file operation: " + value);
        }
    }

    private static String string(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            throw new InvalidActionException(key + " is required");
        }
        return value.toString();
    }

    private static String optionalString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value != null ? value.toString() : null;
    }

    private static int integer(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidActionException(key + " must be an integer: " + s);
            }
        }
        throw new InvalidActionException(key + " is required");
    }

    private static long longValue(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidActionException(key + " must be a number: " + value);
        }
    }

    private static List<String> stringList(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString().trim().split("\\s+"));
    }

    private static Map<String, String> stringMap(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        var result = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        return result;
    }
}
