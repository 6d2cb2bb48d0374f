package com.fnfreeze.serde;

import org.msgpack.core.MessagePacker;

import java.io.IOException;

/**
 * Stream hook that writes the payload of a registered extension type.
 * The extension marker has already been written when the hook runs.
 *
 * @param <T> Type handled by the hook
 */
@FunctionalInterface
public interface ExtensionWriter<T> {
    /**
     * Write the payload for a value.
     *
     * @param out Packer positioned after the extension marker
     * @param value Value to write
     * @throws IOException If packing fails
     */
    void write(MessagePacker out, T value) throws IOException;
}
