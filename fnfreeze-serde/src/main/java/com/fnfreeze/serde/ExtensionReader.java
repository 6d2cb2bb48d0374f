package com.fnfreeze.serde;

import org.msgpack.core.MessageUnpacker;

import java.io.IOException;

/**
 * Stream hook that reads back the payload written by an {@link ExtensionWriter}
 * registered under the same tag.
 */
@FunctionalInterface
public interface ExtensionReader {
    /**
     * Read a value from the payload.
     *
     * @param in Unpacker positioned after the extension marker
     * @return The reconstructed value
     * @throws IOException If unpacking fails
     */
    Object read(MessageUnpacker in) throws IOException;
}
