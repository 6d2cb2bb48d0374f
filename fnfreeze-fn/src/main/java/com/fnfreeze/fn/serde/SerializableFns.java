package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.AbstractFn;
import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.MetadataFn;
import com.fnfreeze.fn.Symbol;
import com.fnfreeze.serde.ExtensibleSerializer;
import com.fnfreeze.serde.SerializationException;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Makes callables serializable by a {@link ExtensibleSerializer}.
 *
 * <p>After installation the engine freezes every {@link Fn} it meets. A
 * callable held by a static field is written as that field's symbol and
 * thaws to whatever the field holds at thaw time. Any other callable must be
 * an instance of a concrete class whose non-static fields hold its captured
 * state; it is written as its class name and captured values, and thaws to a
 * fresh instance.
 * <pre>
 * MsgPackSerializer engine = new MsgPackSerializer();
 * SerializableFns.install(engine);
 * Fn adder = (Fn) engine.deserialize(engine.serialize(Adders.makeAdder(2)));
 * </pre>
 *
 * <p>Codecs are cached per type. Call {@link #clearCodecCache()} after
 * reloading code that changes the fields of a callable type.
 */
public final class SerializableFns {
    private static final Logger log = LoggerFactory.getLogger(SerializableFns.class);
    
    public static final String FN_TAG = "fnfreeze/fn";
    public static final String META_TAG = "fnfreeze/fn-meta";
    public static final String APPLIER_TAG = "fnfreeze/fn-applier";
    
    private final CodecCache cache;
    private final CodecGenerator generator;
    
    private SerializableFns(CodecCache cache, CodecGenerator generator) {
        this.cache = cache;
        this.generator = generator;
    }
    
    /**
     * Install the callable hooks with default options.
     *
     * @param engine Engine to extend
     * @return The installed hooks
     */
    public static SerializableFns install(ExtensibleSerializer engine) {
        return install(engine, FnSerdeOptions.defaults());
    }
    
    /**
     * Install the callable hooks.
     *
     * @param engine Engine to extend
     * @param options Class loader, name strategies and cache to use
     * @return The installed hooks
     */
    public static SerializableFns install(ExtensibleSerializer engine, FnSerdeOptions options) {
        GlobalBindings bindings = new GlobalBindings();
        CodecGenerator generator = new CodecGenerator(bindings,
                new BindingResolver(bindings, options.getNameStrategies()),
                new FieldIntrospector(),
                options.getClassLoader());
        return install(engine, options.getCache(), generator);
    }
    
    static SerializableFns install(ExtensibleSerializer engine, CodecCache cache, CodecGenerator generator) {
        if (engine == null) {
            throw new IllegalArgumentException("Engine cannot be null");
        }
        SerializableFns fns = new SerializableFns(cache, generator);
        WrapperCodecs wrappers = new WrapperCodecs(engine);
        
        engine.registerSerializer(Symbol.class, Symbol::toString);
        engine.registerDeserializer(Symbol.class, (text) -> Symbol.parse((String) text));
        
        engine.registerExtension(Fn.class, FN_TAG,
                (out, fn) -> fns.write(engine, out, fn),
                (in) -> fns.read(engine, in));
        engine.registerExtension(MetadataFn.class, META_TAG, wrappers::writeMeta, wrappers::readMeta);
        engine.registerExtension(AbstractFn.Applier.class, APPLIER_TAG, wrappers::writeApplier, wrappers::readApplier);
        
        log.debug("Installed fn serialization on {}", engine.getClass().getName());
        return fns;
    }
    
    /**
     * Drop every codec in the shared cache.
     */
    public static void clearCodecCache() {
        CodecCache.shared().clear();
    }
    
    /**
     * Drop every codec in the cache these hooks use.
     */
    public void clearCache() {
        cache.clear();
    }
    
    public CodecCache getCache() {
        return cache;
    }
    
    /**
     * Tell how a callable would be frozen. Builds and caches its encoder if needed.
     *
     * @param fn Callable to inspect
     * @return The shape
     * @throws SerializationException If the callable cannot be frozen
     */
    public FnShape shapeOf(Fn fn) {
        if (fn instanceof MetadataFn) {
            return FnShape.METADATA_WRAPPER;
        }
        if (fn instanceof AbstractFn.Applier) {
            return FnShape.ENCLOSING_WRAPPER;
        }
        return cache.encoderFor(fn, generator::buildEncoder).shape(fn);
    }
    
    void write(StreamSerializer engine, MessagePacker out, Fn fn) throws IOException {
        cache.encoderFor(fn, generator::buildEncoder).encode(fn, out, engine);
    }
    
    Fn read(StreamSerializer engine, MessageUnpacker in) throws IOException {
        Object head = engine.thawFromIn(in);
        FnDecoder decoder;
        if (head instanceof Symbol) {
            Symbol symbol = (Symbol) head;
            decoder = cache.decoderFor(symbol.toString(), (key) -> generator.buildBindingDecoder(symbol));
        } else if (head instanceof String) {
            decoder = cache.decoderFor((String) head, generator::buildClosureDecoder);
        } else {
            throw new SerializationException("Malformed fn payload: expected a symbol or class name, got "
                    + WrapperCodecs.describe(head));
        }
        return decoder.decode(in, engine);
    }
}
