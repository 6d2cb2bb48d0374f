package com.fnfreeze.fn;

import java.util.Objects;

/**
 * Canonical name of a global binding: the binary name of the class that
 * declares a static field, and the field's name. Written as {@code namespace/name}.
 */
public final class Symbol implements Comparable<Symbol> {
    private final String namespace;
    private final String name;
    
    private Symbol(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }
    
    /**
     * Create a symbol.
     *
     * @param namespace Binary name of the declaring class
     * @param name Field name
     * @return The symbol
     */
    public static Symbol of(String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            throw new IllegalArgumentException("Symbol namespace cannot be null or empty");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name cannot be null or empty");
        }
        if (namespace.indexOf('/') >= 0 || name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Symbol parts cannot contain '/': " + namespace + ", " + name);
        }
        return new Symbol(namespace, name);
    }
    
    /**
     * Create a symbol for a field of a class.
     *
     * @param owner Declaring class
     * @param name Field name
     * @return The symbol
     */
    public static Symbol of(Class<?> owner, String name) {
        return of(owner.getName(), name);
    }
    
    /**
     * Parse the {@code namespace/name} form.
     *
     * @param text Symbol text
     * @return The symbol
     * @throws IllegalArgumentException If the text is not a qualified symbol
     */
    public static Symbol parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Symbol text cannot be null");
        }
        int slash = text.indexOf('/');
        if (slash <= 0 || slash != text.lastIndexOf('/') || slash == text.length() - 1) {
            throw new IllegalArgumentException("Not a qualified symbol: '" + text + "'");
        }
        return of(text.substring(0, slash), text.substring(slash + 1));
    }
    
    public String getNamespace() {
        return namespace;
    }
    
    public String getName() {
        return name;
    }
    
    @Override
    public int compareTo(Symbol other) {
        int byNamespace = namespace.compareTo(other.namespace);
        return byNamespace != 0 ? byNamespace : name.compareTo(other.name);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return namespace.equals(symbol.namespace) && name.equals(symbol.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }
    
    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
