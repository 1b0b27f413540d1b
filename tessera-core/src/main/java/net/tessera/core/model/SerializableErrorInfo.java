package net.tessera.core.model;

import java.util.ArrayList;
import java.util.List;

public record SerializableErrorInfo(String message, String className, List<String> stack, SerializableErrorInfo cause) {
    public SerializableErrorInfo {
        stack = stack == null ? List.of() : List.copyOf(stack);
    }

    public static SerializableErrorInfo from(Throwable t) {
        if (t == null) return null;
        List<String> frames = new ArrayList<>();
        for (StackTraceElement e : t.getStackTrace()) frames.add(e.toString());
        Throwable cause = t.getCause() == t ? null : t.getCause();
        return new SerializableErrorInfo(String.valueOf(t.getMessage()), t.getClass().getName(), frames, from(cause));
    }
}
