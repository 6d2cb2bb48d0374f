package com.fnfreeze.fn.serde;

import java.lang.invoke.MethodHandle;

/**
 * One captured field of one closure type: its name, declared type and a getter
 * adapted to {@code (Object)Object}.
 */
final class FieldAccessor {
    private final String name;
    private final Class<?> type;
    private final ValueKind kind;
    private final MethodHandle getter;
    
    FieldAccessor(String name, Class<?> type, MethodHandle getter) {
        this.name = name;
        this.type = type;
        this.kind = ValueKind.of(type);
        this.getter = getter;
    }
    
    String name() {
        return name;
    }

    ValueKind kind() {
        return kind;
    }

    /**
     * Read the field from an instance. Primitives come back boxed.
     */
    Object read(Object instance) {
        try {
            return (Object) getter.invokeExact(instance);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Reading field " + name + " failed", t);
        }
    }
    
    /**
     * Convert a thawed value for this field.
     *
     * @param value Thawed value
     * @param className Closure class, for error reporting
     * @return Value ready to pass to the constructor
     * @throws ShapeMismatchException If the value does not fit the field
     */
    Object accept(Object value, String className) {
        if (value == null) {
            if (type.isPrimitive()) {
                throw new ShapeMismatchException(className, "null for primitive field " + name);
            }
            return null;
        }
        Object coerced = kind.coerce(value);
        if (coerced == null || (kind == ValueKind.OBJECT && !type.isInstance(coerced))) {
            throw new ShapeMismatchException(className, "field " + name + " of type " + type.getName()
                    + " cannot hold " + value.getClass().getName());
        }
        return coerced;
    }
    
    @Override
    public String toString() {
        return type.getSimpleName() + " " + name;
    }
}
