package fun.fengwk.smh.core.utils;

/**
 * Coercion helpers for loosely typed tool arguments.
 *
 * @author fengwk
 */
public final class ArgumentUtils {

    private ArgumentUtils() {
    }

    public static String toString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        return String.valueOf(value);
    }

    /**
     * @throws IllegalArgumentException when the value is neither a boolean nor "true"/"false"
     */
    public static Boolean toBoolean(String name, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return false;
            }
        }
        throw new IllegalArgumentException(name + " must be a boolean");
    }

    /**
     * @throws IllegalArgumentException when the value is not an integral number
     */
    public static Integer toInteger(String name, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                throw new IllegalArgumentException(name + " must be an integer");
            }
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(name + " must be an integer", ex);
            }
        }
        throw new IllegalArgumentException(name + " must be an integer");
    }

}
