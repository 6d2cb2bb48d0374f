package com.fnfreeze.fn.serde;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Options for {@link SerializableFns#install(com.fnfreeze.serde.ExtensibleSerializer, FnSerdeOptions)}.
 */
public final class FnSerdeOptions {
    private final ClassLoader classLoader;
    private final List<BindingNameStrategy> nameStrategies;
    private final CodecCache cache;
    
    private FnSerdeOptions(Builder builder) {
        this.classLoader = builder.classLoader != null ? builder.classLoader : defaultClassLoader();
        this.nameStrategies = List.copyOf(builder.nameStrategies);
        this.cache = builder.cache;
    }
    
    /**
     * Options with every default: the thread context class loader, the
     * default strategy chain and the shared codec cache.
     *
     * @return Default options
     */
    public static FnSerdeOptions defaults() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Get the class loader used to load binding owners and closure classes on thaw.
     *
     * @return Class loader
     */
    public ClassLoader getClassLoader() {
        return classLoader;
    }
    
    public List<BindingNameStrategy> getNameStrategies() {
        return nameStrategies;
    }
    
    public CodecCache getCache() {
        return cache;
    }
    
    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : FnSerdeOptions.class.getClassLoader();
    }
    
    /**
     * Builder for {@link FnSerdeOptions}.
     */
    public static class Builder {
        private ClassLoader classLoader;
        private List<BindingNameStrategy> nameStrategies = BindingNameStrategies.defaults();
        private CodecCache cache = CodecCache.shared();
        
        private Builder() {
        }
        
        /**
         * Set the class loader used on thaw.
         *
         * @param classLoader Class loader
         * @return This builder
         */
        public Builder setClassLoader(ClassLoader classLoader) {
            this.classLoader = classLoader;
            return this;
        }
        
        /**
         * Set the binding name strategies, in the order they are tried.
         *
         * @param nameStrategies Strategies
         * @return This builder
         */
        public Builder setNameStrategies(Collection<BindingNameStrategy> nameStrategies) {
            if (nameStrategies == null) {
                throw new IllegalArgumentException("Name strategies cannot be null");
            }
            this.nameStrategies = new ArrayList<>(nameStrategies);
            return this;
        }
        
        /**
         * Set the codec cache. Engines sharing a cache should share the other options too.
         *
         * @param cache Codec cache
         * @return This builder
         */
        public Builder setCache(CodecCache cache) {
            if (cache == null) {
                throw new IllegalArgumentException("Cache cannot be null");
            }
            this.cache = cache;
            return this;
        }
        
        public FnSerdeOptions build() {
            return new FnSerdeOptions(this);
        }
    }
}
