package tree.suffix;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

/**
 * Rejects symbols that cannot key a suffix-link map: null always, and with value equality
 * required, arrays and classes that keep Object's identity equals/hashCode. Enums pass since
 * their constants are singletons. Verdicts are cached per class.
 */
final class SymbolGuard {

    private final boolean requireValueEquality;
    private final ObjectOpenHashSet<Class<?>> accepted = new ObjectOpenHashSet<>();

    SymbolGuard(boolean requireValueEquality) {
        this.requireValueEquality = requireValueEquality;
    }

    void check(Object symbol, int offset) {
        if (symbol == null) {
            throw unsupported("null symbol at offset " + offset);
        }
        if (!requireValueEquality) {
            return;
        }
        Class<?> type = symbol.getClass();
        if (accepted.contains(type)) {
            return;
        }
        if (type.isArray()) {
            throw unsupported("array symbol " + type.getSimpleName() + " at offset " + offset
                    + " compares by identity");
        }
        if (!(symbol instanceof Enum) && !hasValueEquality(type)) {
            throw unsupported("symbol type " + type.getName() + " at offset " + offset
                    + " does not override equals and hashCode");
        }
        accepted.add(type);
    }

    private static boolean hasValueEquality(Class<?> type) {
        try {
            return type.getMethod("equals", Object.class).getDeclaringClass() != Object.class
                    && type.getMethod("hashCode").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            // every class inherits both from Object
            throw new IllegalStateException(e);
        }
    }

    private static SuffixTreeException unsupported(String message) {
        return new SuffixTreeException(SuffixTreeException.Kind.UNSUPPORTED_SYMBOL, message);
    }
}
