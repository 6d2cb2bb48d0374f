package com.fnfreeze.serde;

import java.util.function.Function;

/**
 * A {@link StreamSerializer} whose handling of specific types can be extended.
 */
public interface ExtensibleSerializer extends StreamSerializer {
    /**
     * Register a converter that turns values of exactly {@code type} into a
     * representation the serializer already understands.
     *
     * @param type Type to register
     * @param converter Conversion to a serializable representation
     * @param <T> Type to register
     */
    <T> void registerSerializer(Class<T> type, Function<? super T, ?> converter);
    
    /**
     * Register the inverse of a converter registered with
     * {@link #registerSerializer(Class, Function)}.
     *
     * @param type Type to register
     * @param converter Conversion from the serialized representation
     * @param <T> Type to register
     */
    <T> void registerDeserializer(Class<T> type, Function<Object, ? extends T> converter);
    
    /**
     * Register a stream extension. Values whose class is {@code type}, or a
     * subtype of it, are written as an extension marker carrying {@code tag}
     * followed by whatever {@code writer} writes. The most specific registered
     * type wins. On thaw the tag selects {@code reader}.
     *
     * @param type Type handled by the extension
     * @param tag Tag written to the stream; must be unique per serializer
     * @param writer Writes the payload
     * @param reader Reads the payload back
     * @param <T> Type handled by the extension
     */
    <T> void registerExtension(Class<T> type, String tag, ExtensionWriter<T> writer, ExtensionReader reader);
}
