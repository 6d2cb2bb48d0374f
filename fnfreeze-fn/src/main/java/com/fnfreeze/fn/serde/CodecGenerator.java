package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.DispatchFn;
import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Builds encoders and decoders. Building does all the reflective work up
 * front so that the codecs themselves only walk pre-resolved handles.
 */
public class CodecGenerator {
    private static final Logger log = LoggerFactory.getLogger(CodecGenerator.class);
    
    private final GlobalBindings bindings;
    private final BindingResolver resolver;
    private final FieldIntrospector introspector;
    private final ClassLoader classLoader;
    
    /**
     * Create a generator.
     *
     * @param bindings Binding lookup
     * @param resolver Resolver used to name callables on freeze
     * @param introspector Introspector for closure types
     * @param classLoader Class loader for owner and closure classes on thaw
     */
    public CodecGenerator(GlobalBindings bindings, BindingResolver resolver, FieldIntrospector introspector,
                          ClassLoader classLoader) {
        if (bindings == null || resolver == null || introspector == null || classLoader == null) {
            throw new IllegalArgumentException("Generator collaborators cannot be null");
        }
        this.bindings = bindings;
        this.resolver = resolver;
        this.introspector = introspector;
        this.classLoader = classLoader;
    }
    
    /**
     * Build the encoder for the runtime type of a sample callable.
     *
     * @param sample First callable of its type to be frozen
     * @return The encoder
     * @throws IntrospectionFailureException If the callable is neither bound nor a closure
     */
    public FnEncoder buildEncoder(Fn sample) {
        Class<?> type = sample.getClass();
        if (sample instanceof DispatchFn) {
            log.debug("Built dispatch encoder for {}", type.getName());
            return new DispatchCodec(resolver, classLoader);
        }
        
        ClassLoader loader = type.getClassLoader() != null ? type.getClassLoader() : classLoader;
        Optional<Binding> binding = resolver.resolve(sample, loader);
        if (binding.isPresent()) {
            FnEncoder fallback = type.isHidden() ? null : closureEncoderOrNull(type);
            log.debug("Built binding encoder for {} as {}", type.getName(), binding.get().getSymbol());
            return new BindingCodec.Encoder(binding.get(), fallback);
        }
        
        // The sample is unbound, but the encoder serves every instance of its type.
        Optional<Binding> typeBinding = resolver.resolveByType(sample, loader);
        if (typeBinding.isPresent()) {
            log.debug("Built binding encoder for {} from an unbound sample, type bound at {}", type.getName(),
                    typeBinding.get().getSymbol());
            return new BindingCodec.Encoder(typeBinding.get(), closureEncoderOrNull(type));
        }
        
        FnEncoder encoder = new ClosureCodec.Encoder(introspector.layoutOf(type));
        log.debug("Built closure encoder for {}", type.getName());
        return encoder;
    }
    
    /**
     * Build the decoder for a global binding.
     *
     * @param symbol Symbol of the binding
     * @return The decoder
     * @throws UnresolvableBindingException If the binding does not exist
     */
    public FnDecoder buildBindingDecoder(Symbol symbol) {
        Binding binding = bindings.require(symbol, classLoader);
        log.debug("Built binding decoder for {}", symbol);
        return new BindingCodec.Decoder(binding);
    }
    
    /**
     * Build the decoder for a closure class.
     *
     * @param className Binary name of the closure class
     * @return The decoder
     * @throws IntrospectionFailureException If the class cannot be loaded or rebuilt
     */
    public FnDecoder buildClosureDecoder(String className) {
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IntrospectionFailureException(className, "class cannot be loaded", e);
        }
        if (!Fn.class.isAssignableFrom(type)) {
            throw new IntrospectionFailureException(className, "class is not a callable");
        }
        FnDecoder decoder = new ClosureCodec.Decoder(introspector.layoutOf(type));
        log.debug("Built closure decoder for {}", className);
        return decoder;
    }
    
    private FnEncoder closureEncoderOrNull(Class<?> type) {
        try {
            return new ClosureCodec.Encoder(introspector.layoutOf(type));
        } catch (IntrospectionFailureException e) {
            log.debug("No closure fallback for bound type {}: {}", type.getName(), e.getMessage());
            return null;
        }
    }
}
