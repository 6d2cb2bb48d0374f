package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Looks up global bindings, the static fields of loaded classes.
 * Loading a binding's owner class runs its static initializer.
 */
public class GlobalBindings {
    private static final Logger log = LoggerFactory.getLogger(GlobalBindings.class);
    
    private final MethodHandles.Lookup lookup = MethodHandles.lookup();
    
    /**
     * Resolve a symbol, reporting failures as an empty result.
     *
     * @param symbol Symbol to resolve
     * @param loader Class loader for the owner class
     * @return The binding, if the owner class and its static field exist
     */
    public Optional<Binding> find(Symbol symbol, ClassLoader loader) {
        try {
            return Optional.of(require(symbol, loader));
        } catch (UnresolvableBindingException e) {
            log.trace("No binding for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
    
    /**
     * Resolve a symbol.
     *
     * @param symbol Symbol to resolve
     * @param loader Class loader for the owner class
     * @return The binding
     * @throws UnresolvableBindingException If the class or a static field of that name is missing
     */
    public Binding require(Symbol symbol, ClassLoader loader) {
        Class<?> owner;
        try {
            owner = Class.forName(symbol.getNamespace(), true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new UnresolvableBindingException(symbol, "class " + symbol.getNamespace() + " cannot be loaded", e);
        }
        
        Field field;
        try {
            field = owner.getDeclaredField(symbol.getName());
        } catch (NoSuchFieldException e) {
            throw new UnresolvableBindingException(symbol, "no field " + symbol.getName() + " in " + owner.getName(), e);
        }
        if (!Modifier.isStatic(field.getModifiers())) {
            throw new UnresolvableBindingException(symbol, "field " + symbol.getName() + " is not static");
        }
        
        try {
            field.setAccessible(true);
            MethodHandle getter = lookup.unreflectGetter(field).asType(MethodType.methodType(Object.class));
            return new Binding(symbol, getter);
        } catch (IllegalAccessException | InaccessibleObjectException | SecurityException e) {
            throw new UnresolvableBindingException(symbol, "field is not accessible", e);
        }
    }
    
    /**
     * Find the static field of a class that currently holds exactly the given value.
     *
     * @param ownerName Binary name of the class to search
     * @param value Value to look for, compared by reference
     * @param loader Class loader for the owner class
     * @return Symbol of the first matching field in declaration order
     */
    public Optional<Symbol> findByValue(String ownerName, Object value, ClassLoader loader) {
        Class<?> owner;
        try {
            owner = Class.forName(ownerName, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            log.trace("Owner class {} cannot be loaded: {}", ownerName, e.toString());
            return Optional.empty();
        }
        
        for (Field field : owner.getDeclaredFields()) {
            if (!Modifier.isStatic(field.getModifiers()) || !field.getType().isInstance(value)) {
                continue;
            }
            try {
                field.setAccessible(true);
                if (field.get(null) == value) {
                    return Optional.of(Symbol.of(owner, field.getName()));
                }
            } catch (IllegalAccessException | InaccessibleObjectException | SecurityException e) {
                log.trace("Skipping inaccessible field {}.{}", ownerName, field.getName());
            }
        }
        return Optional.empty();
    }
}
