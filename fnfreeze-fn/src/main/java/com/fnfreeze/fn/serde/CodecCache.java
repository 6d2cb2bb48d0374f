package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Caches generated codecs: encoders by runtime type, decoders by binding
 * symbol text or closure class name.
 *
 * <p>Entries are never replaced. Concurrent misses on one key may each build
 * a codec, but only the first one stored is ever returned; a build that throws
 * stores nothing. {@link #clear()} drops everything at once, which is needed
 * after reloaded code changes the shape of a callable type. Codecs handed out
 * before a clear keep working.
 */
public final class CodecCache {
    private static final Logger log = LoggerFactory.getLogger(CodecCache.class);
    private static final CodecCache SHARED = new CodecCache();
    
    private static final class Tables {
        final Map<Class<?>, FnEncoder> encoders = new ConcurrentHashMap<>();
        final Map<String, FnDecoder> decoders = new ConcurrentHashMap<>();
    }
    
    private volatile Tables tables = new Tables();
    
    /**
     * Get the process-wide cache.
     *
     * @return The shared cache
     */
    public static CodecCache shared() {
        return SHARED;
    }
    
    /**
     * Get the encoder for a callable's runtime type, building it on a miss.
     *
     * @param fn Callable about to be frozen
     * @param builder Builds an encoder from a sample callable
     * @return The cached encoder
     */
    public FnEncoder encoderFor(Fn fn, Function<Fn, FnEncoder> builder) {
        Map<Class<?>, FnEncoder> encoders = tables.encoders;
        Class<?> type = fn.getClass();
        FnEncoder encoder = encoders.get(type);
        if (encoder != null) {
            return encoder;
        }
        FnEncoder built = builder.apply(fn);
        FnEncoder existing = encoders.putIfAbsent(type, built);
        return existing != null ? existing : built;
    }
    
    /**
     * Get the decoder for a binding symbol or closure class name, building it on a miss.
     *
     * @param key Symbol text or binary class name
     * @param builder Builds a decoder from the key
     * @return The cached decoder
     */
    public FnDecoder decoderFor(String key, Function<String, FnDecoder> builder) {
        Map<String, FnDecoder> decoders = tables.decoders;
        FnDecoder decoder = decoders.get(key);
        if (decoder != null) {
            return decoder;
        }
        FnDecoder built = builder.apply(key);
        FnDecoder existing = decoders.putIfAbsent(key, built);
        return existing != null ? existing : built;
    }
    
    /**
     * Drop all cached codecs.
     */
    public void clear() {
        tables = new Tables();
        log.debug("Cleared fn codec cache");
    }
    
    public int encoderCount() {
        return tables.encoders.size();
    }
    
    public int decoderCount() {
        return tables.decoders.size();
    }
}
