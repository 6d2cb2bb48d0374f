package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;

/**
 * Codecs for callables stored in a global binding. Only the binding's symbol
 * is written; thawing reads the binding's current value.
 */
final class BindingCodec {
    
    private BindingCodec() {
        // Prevent instantiation
    }
    
    static final class Encoder implements FnEncoder {
        private final Binding binding;
        private final FnEncoder fallback;
        
        /**
         * @param binding Binding that held the sample instance
         * @param fallback Closure encoder for other instances of the type, or null
         */
        Encoder(Binding binding, FnEncoder fallback) {
            this.binding = binding;
            this.fallback = fallback;
        }
        
        @Override
        public FnShape shape(Fn fn) {
            return binding.currentValue() == fn ? FnShape.NAMED_BINDING : fallbackFor(fn).shape(fn);
        }
        
        @Override
        public void encode(Fn fn, MessagePacker out, StreamSerializer engine) throws IOException {
            if (binding.currentValue() == fn) {
                engine.freezeToOut(out, binding.getSymbol());
                return;
            }
            fallbackFor(fn).encode(fn, out, engine);
        }
        
        private FnEncoder fallbackFor(Fn fn) {
            if (fallback == null) {
                throw new UnresolvableBindingException(binding.getSymbol(), "instance of "
                        + fn.getClass().getName() + " is not the bound value and cannot be captured as a closure");
            }
            return fallback;
        }
    }
    
    static final class Decoder implements FnDecoder {
        private final Binding binding;
        
        Decoder(Binding binding) {
            this.binding = binding;
        }
        
        @Override
        public Fn decode(MessageUnpacker in, StreamSerializer engine) {
            Object value = binding.currentValue();
            if (!(value instanceof Fn)) {
                throw new UnresolvableBindingException(binding.getSymbol(), "binding holds "
                        + (value == null ? "null" : value.getClass().getName()) + ", not a callable");
            }
            return (Fn) value;
        }
    }
}
