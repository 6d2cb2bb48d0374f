package com.fnfreeze.fn.serde;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the captured fields of closure types.
 *
 * <p>Only non-static fields declared directly on the type are captured.
 * Records are read in component order and rebuilt through their canonical
 * constructor. Other classes are read in declaration order and rebuilt through
 * the constructor whose parameter types equal the field types in that order.
 */
public class FieldIntrospector {
    private static final Logger log = LoggerFactory.getLogger(FieldIntrospector.class);
    
    private final MethodHandles.Lookup lookup = MethodHandles.lookup();
    
    /**
     * Compute the captured layout of a type.
     *
     * @param type Closure type
     * @return The layout
     * @throws IntrospectionFailureException If the type cannot be rebuilt from its fields
     */
    public CapturedLayout layoutOf(Class<?> type) {
        if (type.isHidden()) {
            throw new IntrospectionFailureException(type.getName(),
                    "hidden classes such as lambdas can only be frozen through a static binding");
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new IntrospectionFailureException(type.getName(), "type is not concrete");
        }
        
        List<Field> fields = type.isRecord() ? recordFields(type) : instanceFields(type);
        Class<?>[] parameterTypes = fields.stream().map(Field::getType).toArray(Class<?>[]::new);
        
        try {
            Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            MethodHandle spread = lookup.unreflectConstructor(constructor)
                    .asSpreader(Object[].class, parameterTypes.length)
                    .asType(MethodType.methodType(Object.class, Object[].class));
            
            List<FieldAccessor> accessors = new ArrayList<>(fields.size());
            for (Field field : fields) {
                field.setAccessible(true);
                MethodHandle getter = lookup.unreflectGetter(field)
                        .asType(MethodType.methodType(Object.class, Object.class));
                accessors.add(new FieldAccessor(field.getName(), field.getType(), getter));
            }
            log.debug("Introspected {}: {}", type.getName(), accessors);
            return new CapturedLayout(type, accessors, spread);
        } catch (NoSuchMethodException e) {
            throw new IntrospectionFailureException(type.getName(),
                    "no constructor taking the captured fields " + accessorList(fields), e);
        } catch (IllegalAccessException | InaccessibleObjectException | SecurityException e) {
            throw new IntrospectionFailureException(type.getName(), "captured state is not accessible", e);
        }
    }
    
    private static List<Field> recordFields(Class<?> type) {
        RecordComponent[] components = type.getRecordComponents();
        List<Field> fields = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            try {
                fields.add(type.getDeclaredField(component.getName()));
            } catch (NoSuchFieldException e) {
                throw new IntrospectionFailureException(type.getName(),
                        "no field for record component " + component.getName(), e);
            }
        }
        return fields;
    }
    
    private static List<Field> instanceFields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        for (Field field : type.getDeclaredFields()) {
            if (!Modifier.isStatic(field.getModifiers())) {
                fields.add(field);
            }
        }
        return fields;
    }
    
    private static String accessorList(List<Field> fields) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fields.get(i).getType().getSimpleName());
        }
        return sb.append(')').toString();
    }
}
