package info.isaksson.erland.ciltocsharp.builder;

/** Helpers for reflection-style metadata names. */
public final class ReflectionNames {

    private ReflectionNames() {}

    /**
     * Removes a generic arity suffix: {@code List`1} becomes {@code List}. Names without a
     * well-formed suffix (backtick followed by one or more digits) are returned unchanged.
     */
    public static String stripTypeParameterCount(String reflectionName) {
        int pos = reflectionName.lastIndexOf('`');
        if (pos < 0 || pos == reflectionName.length() - 1) return reflectionName;
        for (int i = pos + 1; i < reflectionName.length(); i++) {
            char c = reflectionName.charAt(i);
            if (c < '0' || c > '9') return reflectionName;
        }
        return reflectionName.substring(0, pos);
    }
}
