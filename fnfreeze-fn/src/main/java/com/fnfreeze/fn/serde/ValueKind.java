package com.fnfreeze.fn.serde;

/**
 * Storage kind of a captured field. MessagePack does not keep integer widths,
 * so thawed numbers are narrowed back to the field's kind.
 */
enum ValueKind {
    OBJECT,
    BOOLEAN,
    BYTE,
    SHORT,
    CHAR,
    INT,
    LONG,
    FLOAT,
    DOUBLE;
    
    /**
     * Kind of a field type. Primitive types and their wrappers share a kind.
     *
     * @param type Declared field type
     * @return The kind
     */
    static ValueKind of(Class<?> type) {
        if (type == boolean.class || type == Boolean.class) return BOOLEAN;
        if (type == byte.class || type == Byte.class) return BYTE;
        if (type == short.class || type == Short.class) return SHORT;
        if (type == char.class || type == Character.class) return CHAR;
        if (type == int.class || type == Integer.class) return INT;
        if (type == long.class || type == Long.class) return LONG;
        if (type == float.class || type == Float.class) return FLOAT;
        if (type == double.class || type == Double.class) return DOUBLE;
        return OBJECT;
    }
    
    /**
     * Convert a thawed value to this kind.
     *
     * @param value Thawed value, never null
     * @return The converted value, or null if it does not fit
     */
    Object coerce(Object value) {
        switch (this) {
            case BOOLEAN:
                return value instanceof Boolean ? value : null;
            case CHAR:
                return value instanceof Character ? value : null;
            case BYTE:
                return integral(value, Byte.MIN_VALUE, Byte.MAX_VALUE) ? (Object) ((Number) value).byteValue() : null;
            case SHORT:
                return integral(value, Short.MIN_VALUE, Short.MAX_VALUE) ? (Object) ((Number) value).shortValue() : null;
            case INT:
                return integral(value, Integer.MIN_VALUE, Integer.MAX_VALUE) ? (Object) ((Number) value).intValue() : null;
            case LONG:
                return integral(value, Long.MIN_VALUE, Long.MAX_VALUE) ? (Object) ((Number) value).longValue() : null;
            case FLOAT:
                if (value instanceof Float) {
                    return value;
                }
                if (value instanceof Double) {
                    double d = (Double) value;
                    return Double.isNaN(d) || (double) (float) d == d ? (Object) (float) d : null;
                }
                return null;
            case DOUBLE:
                return value instanceof Double || value instanceof Float ? (Object) ((Number) value).doubleValue() : null;
            default:
                return value;
        }
    }
    
    private static boolean integral(Object value, long min, long max) {
        if (!(value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)) {
            return false;
        }
        long n = ((Number) value).longValue();
        return n >= min && n <= max;
    }
}
