package com.fnfreeze.serde;

import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Freezes values to MessagePack and thaws them back.
 * The stream-level methods let extensions freeze nested values in place.
 *
 * <p>Integers carry no width on the wire. A thawed integer is an {@code Integer}
 * when it fits and a {@code Long} otherwise. Widths are fitted back only where a
 * declared type asks for one (a record component or field of type {@code long},
 * say). Inside an untyped slot such as {@code Object} or a collection element,
 * {@code List.of(2L)} thaws as {@code [2]} holding an {@code Integer}, so it is
 * no longer equal to the frozen list.
 */
public interface StreamSerializer {
    /**
     * Serialize a value to bytes.
     *
     * @param obj The value to serialize
     * @return Serialized bytes
     */
    byte[] serialize(Object obj);
    
    /**
     * Deserialize bytes to a value.
     *
     * @param data The bytes to deserialize
     * @return Deserialized value
     */
    Object deserialize(byte[] data);
    
    /**
     * Freeze a value to an output stream. The stream is flushed but not closed.
     *
     * @param obj The value to freeze
     * @param out Destination stream
     */
    void freeze(Object obj, OutputStream out);
    
    /**
     * Thaw one value from an input stream. The unpacker buffers, so bytes past
     * the value may be consumed.
     *
     * @param in Source stream
     * @return The thawed value
     */
    Object thaw(InputStream in);
    
    /**
     * Freeze a nested value to a packer that is already in use.
     *
     * @param out Packer to write to
     * @param obj The value to freeze
     * @throws IOException If packing fails
     */
    void freezeToOut(MessagePacker out, Object obj) throws IOException;
    
    /**
     * Thaw the next value from an unpacker that is already in use.
     *
     * @param in Unpacker to read from
     * @return The thawed value
     * @throws IOException If unpacking fails
     */
    Object thawFromIn(MessageUnpacker in) throws IOException;
}
