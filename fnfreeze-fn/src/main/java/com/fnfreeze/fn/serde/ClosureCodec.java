package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.util.List;

/**
 * Codecs for closures: the class name, then an array of the captured field
 * values in layout order. Field values go through the engine, so captured
 * callables nest.
 */
final class ClosureCodec {
    
    private ClosureCodec() {
        // Prevent instantiation
    }
    
    static final class Encoder implements FnEncoder {
        private final CapturedLayout layout;
        
        Encoder(CapturedLayout layout) {
            this.layout = layout;
        }
        
        @Override
        public FnShape shape(Fn fn) {
            return FnShape.ANONYMOUS_CLOSURE;
        }
        
        @Override
        public void encode(Fn fn, MessagePacker out, StreamSerializer engine) throws IOException {
            List<FieldAccessor> fields = layout.fields();
            engine.freezeToOut(out, layout.type().getName());
            out.packArrayHeader(fields.size());
            for (FieldAccessor field : fields) {
                engine.freezeToOut(out, field.read(fn));
            }
        }
    }
    
    static final class Decoder implements FnDecoder {
        private final CapturedLayout layout;
        
        Decoder(CapturedLayout layout) {
            this.layout = layout;
        }
        
        @Override
        public Fn decode(MessageUnpacker in, StreamSerializer engine) throws IOException {
            String className = layout.type().getName();
            Object[] values;
            try {
                if (!in.hasNext()) {
                    throw new ShapeMismatchException(className, "payload ends before the captured values");
                }
                int count = in.unpackArrayHeader();
                if (count != layout.arity()) {
                    throw new ShapeMismatchException(className,
                            "expected " + layout.arity() + " captured values, found " + count);
                }
                values = new Object[count];
                for (int i = 0; i < count; i++) {
                    if (!in.hasNext()) {
                        throw new ShapeMismatchException(className,
                                "payload ends after " + i + " of " + count + " captured values");
                    }
                    values[i] = engine.thawFromIn(in);
                }
            } catch (MessagePackException e) {
                throw new ShapeMismatchException(className, "captured values are missing or malformed", e);
            }
            return layout.construct(values);
        }
    }
}
