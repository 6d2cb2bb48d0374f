package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;

/**
 * Reconstructs callables for one binding name or closure class. The payload's
 * leading name has already been read when a decoder runs.
 */
@FunctionalInterface
public interface FnDecoder {
    /**
     * Read the rest of the payload and reconstruct the callable.
     *
     * @param in Unpacker positioned after the leading name
     * @param engine Engine used for nested values
     * @return The callable
     * @throws IOException If unpacking fails
     */
    Fn decode(MessageUnpacker in, StreamSerializer engine) throws IOException;
}
