package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.serde.SerializationException;

import java.lang.invoke.MethodHandle;
import java.util.List;

/**
 * Captured fields of a closure type in their fixed order, plus the
 * constructor that takes them positionally.
 */
final class CapturedLayout {
    private final Class<?> type;
    private final List<FieldAccessor> fields;
    private final MethodHandle constructor;
    
    /**
     * @param type Closure type
     * @param fields Captured fields in constructor order
     * @param constructor Constructor spread over {@code Object[]}, adapted to {@code (Object[])Object}
     */
    CapturedLayout(Class<?> type, List<FieldAccessor> fields, MethodHandle constructor) {
        this.type = type;
        this.fields = List.copyOf(fields);
        this.constructor = constructor;
    }
    
    Class<?> type() {
        return type;
    }
    
    List<FieldAccessor> fields() {
        return fields;
    }
    
    int arity() {
        return fields.size();
    }
    
    /**
     * Construct an instance from thawed field values.
     *
     * @param values Values in field order
     * @return The new closure
     * @throws ShapeMismatchException If the count or a value does not fit
     */
    Fn construct(Object[] values) {
        if (values.length != fields.size()) {
            throw new ShapeMismatchException(type.getName(),
                    "expected " + fields.size() + " captured values, got " + values.length);
        }
        Object[] args = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            args[i] = fields.get(i).accept(values[i], type.getName());
        }
        try {
            return (Fn) (Object) constructor.invokeExact(args);
        } catch (SerializationException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new SerializationException("Constructing " + type.getName() + " failed", t);
        }
    }
}
