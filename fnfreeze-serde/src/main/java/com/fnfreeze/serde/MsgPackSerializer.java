package com.fnfreeze.serde;

import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.reflect.*;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * MessagePack-based serializer that uses reflection to handle arbitrary Java objects.
 * Supports primitive types, collections, maps, enums, records, plain objects with a
 * no-arg constructor, and registered stream extensions.
 *
 * <p>Typed values are written as a two-entry map whose first key is {@code __type__}.
 * Extensions are written as a MessagePack ext value of type {@link #EXTENSION_TYPE}
 * carrying the extension tag, followed inline by the extension's own payload.
 */
public class MsgPackSerializer implements ExtensibleSerializer {
    private static final Logger log = LoggerFactory.getLogger(MsgPackSerializer.class);
    
    /**
     * MessagePack ext type used for registered extension markers.
     */
    public static final byte EXTENSION_TYPE = 0x2A;
    
    private static final String TYPE_KEY = "__type__";
    private static final String VALUE_KEY = "value";
    private static final String FIELDS_KEY = "fields";
    private static final String SET_TYPE = Set.class.getName();
    
    private final Map<Class<?>, Function<Object, ?>> serializers = new ConcurrentHashMap<>();
    private final Map<Class<?>, Function<Object, ?>> deserializers = new ConcurrentHashMap<>();
    private final Map<Class<?>, Extension<?>> extensions = new ConcurrentHashMap<>();
    private final Map<String, ExtensionReader> extensionReaders = new ConcurrentHashMap<>();
    private final Map<Class<?>, Optional<Extension<?>>> extensionLookup = new ConcurrentHashMap<>();
    private final Map<Class<?>, RecordInfo> recordInfoCache = new ConcurrentHashMap<>();
    private final Map<Class<?>, ObjectInfo> objectInfoCache = new ConcurrentHashMap<>();
    private final ClassLoader classLoader;
    
    /**
     * Record component information cache to avoid repeated reflection.
     */
    private static class RecordInfo {
        final RecordComponent[] components;
        final Method[] accessors;
        final Constructor<?> constructor;
        
        RecordInfo(RecordComponent[] components, Method[] accessors, Constructor<?> constructor) {
            this.components = components;
            this.accessors = accessors;
            this.constructor = constructor;
        }
    }
    
    /**
     * Field and constructor information for plain objects.
     */
    private static class ObjectInfo {
        final List<Field> fields;
        final Constructor<?> constructor;
        
        ObjectInfo(List<Field> fields, Constructor<?> constructor) {
            this.fields = fields;
            this.constructor = constructor;
        }
    }
    
    /**
     * A registered stream extension.
     */
    private static class Extension<T> {
        final String tag;
        final byte[] tagBytes;
        final ExtensionWriter<T> writer;
        
        Extension(String tag, ExtensionWriter<T> writer) {
            this.tag = tag;
            this.tagBytes = tag.getBytes(StandardCharsets.UTF_8);
            this.writer = writer;
        }
    }
    
    /**
     * Create a serializer that loads typed values through this library's class loader.
     */
    public MsgPackSerializer() {
        this(MsgPackSerializer.class.getClassLoader());
    }
    
    /**
     * Create a serializer that loads typed values through the given class loader.
     *
     * @param classLoader Class loader used to resolve type names on thaw
     */
    public MsgPackSerializer(ClassLoader classLoader) {
        if (classLoader == null) {
            throw new IllegalArgumentException("Class loader cannot be null");
        }
        this.classLoader = classLoader;
        registerBuiltinTypes();
    }
    
    /**
     * Register built-in serializers for common types.
     */
    private void registerBuiltinTypes() {
        registerSerializer(UUID.class, UUID::toString);
        registerDeserializer(UUID.class, (str) -> UUID.fromString((String) str));
        
        registerSerializer(Character.class, (ch) -> ch.toString());
        registerDeserializer(Character.class, (str) -> ((String) str).charAt(0));
        
        registerSerializer(Date.class, Date::getTime);
        registerDeserializer(Date.class, (millis) -> new Date(((Number) millis).longValue()));
        
        registerSerializer(Instant.class, Instant::toString);
        registerDeserializer(Instant.class, (str) -> Instant.parse((String) str));
        
        registerSerializer(LocalDate.class, LocalDate::toString);
        registerDeserializer(LocalDate.class, (str) -> LocalDate.parse((String) str));
        
        registerSerializer(LocalTime.class, LocalTime::toString);
        registerDeserializer(LocalTime.class, (str) -> LocalTime.parse((String) str));
        
        registerSerializer(LocalDateTime.class, LocalDateTime::toString);
        registerDeserializer(LocalDateTime.class, (str) -> LocalDateTime.parse((String) str));
    }
    
    @Override
    @SuppressWarnings("unchecked")
    public <T> void registerSerializer(Class<T> type, Function<? super T, ?> converter) {
        if (type == null || converter == null) {
            throw new IllegalArgumentException("Type and converter cannot be null");
        }
        serializers.put(type, (Function<Object, ?>) converter);
    }
    
    @Override
    public <T> void registerDeserializer(Class<T> type, Function<Object, ? extends T> converter) {
        if (type == null || converter == null) {
            throw new IllegalArgumentException("Type and converter cannot be null");
        }
        deserializers.put(type, converter);
    }
    
    @Override
    public <T> void registerExtension(Class<T> type, String tag, ExtensionWriter<T> writer, ExtensionReader reader) {
        if (type == null || writer == null || reader == null) {
            throw new IllegalArgumentException("Type, writer and reader cannot be null");
        }
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Extension tag cannot be null or empty");
        }
        Extension<?> existing = extensions.get(type);
        if (extensionReaders.containsKey(tag) && (existing == null || !existing.tag.equals(tag))) {
            throw new IllegalArgumentException("Extension tag '" + tag + "' is already registered for another type");
        }
        extensions.put(type, new Extension<>(tag, writer));
        extensionReaders.put(tag, reader);
        extensionLookup.clear();
        log.debug("Registered extension '{}' for {}", tag, type.getName());
    }
    
    @Override
    public byte[] serialize(Object obj) {
        try {
            MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
            freezeToOut(packer, obj);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize object", e);
        }
    }
    
    @Override
    public Object deserialize(byte[] data) {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(data)) {
            return thawFromIn(unpacker);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize object", e);
        }
    }
    
    @Override
    public void freeze(Object obj, OutputStream out) {
        try {
            MessagePacker packer = MessagePack.newDefaultPacker(out);
            freezeToOut(packer, obj);
            packer.flush();
        } catch (IOException e) {
            throw new SerializationException("Failed to freeze object to stream", e);
        }
    }
    
    @Override
    public Object thaw(InputStream in) {
        try {
            return thawFromIn(MessagePack.newDefaultUnpacker(in));
        } catch (IOException e) {
            throw new SerializationException("Failed to thaw object from stream", e);
        }
    }
    
    /**
     * Serialize an object to the MessagePack packer.
     *
     * @param packer MessagePack packer
     * @param obj Object to serialize
     * @throws IOException If packing fails
     */
    @Override
    @SuppressWarnings("unchecked")
    public void freezeToOut(MessagePacker packer, Object obj) throws IOException {
        if (obj == null) {
            packer.packNil();
            return;
        }
        
        Class<?> type = obj.getClass();
        
        // Check for registered serializer
        Function<Object, ?> serializer = serializers.get(type);
        if (serializer != null) {
            packer.packMapHeader(2);
            packer.packString(TYPE_KEY);
            packer.packString(type.getName());
            packer.packString(VALUE_KEY);
            freezeToOut(packer, serializer.apply(obj));
            return;
        }
        
        // Check for a stream extension on the type or one of its supertypes
        Optional<Extension<?>> extension = findExtension(type);
        if (extension.isPresent()) {
            Extension<Object> ext = (Extension<Object>) extension.get();
            packer.packExtensionTypeHeader(EXTENSION_TYPE, ext.tagBytes.length);
            packer.writePayload(ext.tagBytes);
            ext.writer.write(packer, obj);
            return;
        }
        
        if (obj instanceof String) {
            packer.packString((String) obj);
        } else if (obj instanceof Integer) {
            packer.packInt((Integer) obj);
        } else if (obj instanceof Long) {
            packer.packLong((Long) obj);
        } else if (obj instanceof Short) {
            packer.packShort((Short) obj);
        } else if (obj instanceof Byte) {
            packer.packByte((Byte) obj);
        } else if (obj instanceof Double) {
            packer.packDouble((Double) obj);
        } else if (obj instanceof Float) {
            packer.packFloat((Float) obj);
        } else if (obj instanceof Boolean) {
            packer.packBoolean((Boolean) obj);
        } else if (obj instanceof byte[]) {
            packer.packBinaryHeader(((byte[]) obj).length);
            packer.writePayload((byte[]) obj);
        } else if (obj instanceof List) {
            List<?> list = (List<?>) obj;
            packer.packArrayHeader(list.size());
            for (Object item : list) {
                freezeToOut(packer, item);
            }
        } else if (obj instanceof Set) {
            Set<?> set = (Set<?>) obj;
            packer.packMapHeader(2);
            packer.packString(TYPE_KEY);
            packer.packString(SET_TYPE);
            packer.packString(VALUE_KEY);
            packer.packArrayHeader(set.size());
            for (Object item : set) {
                freezeToOut(packer, item);
            }
        } else if (obj instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) obj;
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                freezeToOut(packer, entry.getKey());
                freezeToOut(packer, entry.getValue());
            }
        } else if (obj instanceof Enum<?>) {
            // Enum constants with bodies are subclasses; name the declaring enum
            packer.packMapHeader(2);
            packer.packString(TYPE_KEY);
            packer.packString(((Enum<?>) obj).getDeclaringClass().getName());
            packer.packString(VALUE_KEY);
            packer.packString(((Enum<?>) obj).name());
        } else if (type.isRecord()) {
            serializeRecord(obj, packer);
        } else {
            serializeCustomObject(obj, packer);
        }
    }
    
    /**
     * Find the extension registered for the most specific supertype of a class:
     * the class itself, then its superclasses, then its interfaces breadth first.
     *
     * @param type Runtime class of the value
     * @return The extension, if any
     */
    private Optional<Extension<?>> findExtension(Class<?> type) {
        if (extensions.isEmpty()) {
            return Optional.empty();
        }
        return extensionLookup.computeIfAbsent(type, this::lookupExtension);
    }
    
    private Optional<Extension<?>> lookupExtension(Class<?> type) {
        Deque<Class<?>> interfaces = new ArrayDeque<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            Extension<?> ext = extensions.get(current);
            if (ext != null) {
                return Optional.of(ext);
            }
            interfaces.addAll(Arrays.asList(current.getInterfaces()));
        }
        Set<Class<?>> seen = new HashSet<>();
        while (!interfaces.isEmpty()) {
            Class<?> candidate = interfaces.removeFirst();
            if (!seen.add(candidate)) {
                continue;
            }
            Extension<?> ext = extensions.get(candidate);
            if (ext != null) {
                return Optional.of(ext);
            }
            interfaces.addAll(Arrays.asList(candidate.getInterfaces()));
        }
        return Optional.empty();
    }
    
    /**
     * Serialize a Record object.
     *
     * @param record The record to serialize
     * @param packer The MessagePack packer
     * @throws IOException If packing fails
     */
    private void serializeRecord(Object record, MessagePacker packer) throws IOException {
        Class<?> recordClass = record.getClass();
        RecordInfo recordInfo = recordInfo(recordClass);
        
        packer.packMapHeader(2);
        packer.packString(TYPE_KEY);
        packer.packString(recordClass.getName());
        packer.packString(FIELDS_KEY);
        packer.packMapHeader(recordInfo.components.length);
        
        for (int i = 0; i < recordInfo.components.length; i++) {
            packer.packString(recordInfo.components[i].getName());
            Object value;
            try {
                value = recordInfo.accessors[i].invoke(record);
            } catch (ReflectiveOperationException e) {
                throw new SerializationException(
                        "Failed to access record component: " + recordInfo.components[i].getName(), e);
            }
            freezeToOut(packer, value);
        }
    }
    
    private RecordInfo recordInfo(Class<?> recordClass) {
        return recordInfoCache.computeIfAbsent(recordClass, cls -> {
            RecordComponent[] components = cls.getRecordComponents();
            Class<?>[] paramTypes = Arrays.stream(components)
                .map(RecordComponent::getType)
                .toArray(Class<?>[]::new);
            try {
                Method[] accessors = new Method[components.length];
                for (int i = 0; i < components.length; i++) {
                    accessors[i] = components[i].getAccessor();
                    accessors[i].setAccessible(true);
                }
                Constructor<?> constructor = cls.getDeclaredConstructor(paramTypes);
                constructor.setAccessible(true);
                return new RecordInfo(components, accessors, constructor);
            } catch (NoSuchMethodException e) {
                throw new SerializationException("Failed to get constructor for record: " + cls.getName(), e);
            } catch (InaccessibleObjectException e) {
                throw new UnfreezableValueException(cls, "record is not open to reflection", e);
            }
        });
    }
    
    /**
     * Serialize a custom object using reflection.
     *
     * @param obj The object to serialize
     * @param packer The MessagePack packer
     * @throws IOException If packing fails
     */
    private void serializeCustomObject(Object obj, MessagePacker packer) throws IOException {
        Class<?> objClass = obj.getClass();
        ObjectInfo objectInfo = objectInfo(objClass);
        
        packer.packMapHeader(2);
        packer.packString(TYPE_KEY);
        packer.packString(objClass.getName());
        packer.packString(FIELDS_KEY);
        packer.packMapHeader(objectInfo.fields.size());
        
        for (Field field : objectInfo.fields) {
            packer.packString(field.getName());
            try {
                freezeToOut(packer, field.get(obj));
            } catch (IllegalAccessException e) {
                throw new SerializationException("Failed to access field: " + field.getName(), e);
            }
        }
    }
    
    private ObjectInfo objectInfo(Class<?> objClass) {
        return objectInfoCache.computeIfAbsent(objClass, cls -> {
            if (cls.isHidden()) {
                throw new UnfreezableValueException(cls, "lambdas and other hidden classes cannot be reconstructed");
            }
            if (cls.isAnonymousClass() || cls.isLocalClass()) {
                throw new UnfreezableValueException(cls, "anonymous and local classes cannot be reconstructed");
            }
            Constructor<?> constructor;
            try {
                constructor = cls.getDeclaredConstructor();
            } catch (NoSuchMethodException e) {
                throw new UnfreezableValueException(cls, "no no-arg constructor", e);
            }
            
            // Get all fields including inherited ones, skipping transient and static fields
            List<Field> serializableFields = getAllFields(cls).stream()
                .filter(field -> !Modifier.isTransient(field.getModifiers()) &&
                                !Modifier.isStatic(field.getModifiers()))
                .toList();
            try {
                constructor.setAccessible(true);
                serializableFields.forEach(field -> field.setAccessible(true));
            } catch (InaccessibleObjectException e) {
                throw new UnfreezableValueException(cls, "class is not open to reflection", e);
            }
            return new ObjectInfo(serializableFields, constructor);
        });
    }
    
    /**
     * Get all fields for a class including inherited fields.
     *
     * @param clazz The class to get fields for
     * @return List of all fields
     */
    private List<Field> getAllFields(Class<?> clazz) {
        List<Field> fields = new ArrayList<>();
        Class<?> currentClass = clazz;
        
        while (currentClass != null && currentClass != Object.class) {
            fields.addAll(Arrays.asList(currentClass.getDeclaredFields()));
            currentClass = currentClass.getSuperclass();
        }
        
        return fields;
    }
    
    /**
     * Deserialize an object from the MessagePack unpacker.
     *
     * @param unpacker MessagePack unpacker
     * @return Deserialized object
     * @throws IOException If unpacking fails
     */
    @Override
    public Object thawFromIn(MessageUnpacker unpacker) throws IOException {
        if (!unpacker.hasNext()) {
            throw new SerializationException("Unexpected end of data");
        }
        
        if (unpacker.tryUnpackNil()) {
            return null;
        }
        
        MessageFormat format = unpacker.getNextFormat();
        switch (format.getValueType()) {
            case STRING:
                return unpacker.unpackString();
            case INTEGER:
                long number = unpacker.unpackLong();
                if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                    return (int) number;
                }
                return number;
            case FLOAT:
                if (format == MessageFormat.FLOAT32) {
                    return unpacker.unpackFloat();
                }
                return unpacker.unpackDouble();
            case BOOLEAN:
                return unpacker.unpackBoolean();
            case BINARY:
                int binaryLength = unpacker.unpackBinaryHeader();
                byte[] binary = new byte[binaryLength];
                unpacker.readPayload(binary);
                return binary;
            case ARRAY:
                int arraySize = unpacker.unpackArrayHeader();
                List<Object> list = new ArrayList<>(arraySize);
                for (int i = 0; i < arraySize; i++) {
                    list.add(thawFromIn(unpacker));
                }
                return list;
            case MAP:
                return deserializeMap(unpacker);
            case EXTENSION:
                return deserializeExtension(unpacker);
            default:
                throw new SerializationException("Unsupported MessagePack format: " + format);
        }
    }
    
    private Object deserializeExtension(MessageUnpacker unpacker) throws IOException {
        ExtensionTypeHeader header = unpacker.unpackExtensionTypeHeader();
        if (header.getType() != EXTENSION_TYPE) {
            throw new SerializationException("Unsupported MessagePack extension type: " + header.getType());
        }
        String tag = new String(unpacker.readPayload(header.getLength()), StandardCharsets.UTF_8);
        ExtensionReader reader = extensionReaders.get(tag);
        if (reader == null) {
            throw new SerializationException("No extension registered for tag '" + tag + "'");
        }
        return reader.read(unpacker);
    }
    
    @SuppressWarnings({"unchecked", "rawtypes"})
    private Object deserializeMap(MessageUnpacker unpacker) throws IOException {
        int mapSize = unpacker.unpackMapHeader();
        
        // Handle empty map
        if (mapSize == 0) {
            return new HashMap<>();
        }
        
        // Check for special type marker
        Object firstKey = thawFromIn(unpacker);
        if (mapSize == 2 && TYPE_KEY.equals(firstKey)) {
            String typeName = (String) thawFromIn(unpacker);
            Object secondKey = thawFromIn(unpacker);
            
            if (VALUE_KEY.equals(secondKey) && SET_TYPE.equals(typeName)) {
                return new LinkedHashSet<>((List<Object>) thawFromIn(unpacker));
            }
            
            if (secondKey instanceof String) {
                String secondKeyStr = (String) secondKey;
                
                try {
                    Class<?> type = Class.forName(typeName, true, classLoader);
                    
                    // Check for registered deserializer
                    Function<Object, ?> deserializer = deserializers.get(type);
                    if (VALUE_KEY.equals(secondKeyStr) && deserializer != null) {
                        return deserializer.apply(thawFromIn(unpacker));
                    }
                    
                    if (VALUE_KEY.equals(secondKeyStr) && type.isEnum()) {
                        String enumValue = (String) thawFromIn(unpacker);
                        return Enum.valueOf((Class<Enum>) type, enumValue);
                    }
                    
                    if (FIELDS_KEY.equals(secondKeyStr) && type.isRecord()) {
                        return deserializeRecord(type, unpacker);
                    }
                    
                    if (FIELDS_KEY.equals(secondKeyStr)) {
                        return deserializeCustomObject(type, unpacker);
                    }
                } catch (ClassNotFoundException e) {
                    log.debug("Type {} is not loadable, thawing it as a plain map", typeName);
                } catch (ReflectiveOperationException e) {
                    throw new SerializationException("Failed to deserialize object of type " + typeName, e);
                }
                
                // If special type handling failed, read the value to keep unpacker consistent
                Object secondValue = thawFromIn(unpacker);
                Map<Object, Object> fallbackMap = new HashMap<>();
                fallbackMap.put(firstKey, typeName);
                fallbackMap.put(secondKey, secondValue);
                return fallbackMap;
            }
            
            // The second key was not a string, so this is a regular map
            Map<Object, Object> map = new HashMap<>(mapSize);
            map.put(firstKey, typeName);
            map.put(secondKey, thawFromIn(unpacker));
            return map;
        }
        
        // Regular map - we already read the first key
        Map<Object, Object> map = new HashMap<>(mapSize);
        map.put(firstKey, thawFromIn(unpacker));
        for (int i = 1; i < mapSize; i++) {
            Object key = thawFromIn(unpacker);
            Object value = thawFromIn(unpacker);
            map.put(key, value);
        }
        return map;
    }
    
    /**
     * Deserialize a record.
     *
     * @param recordClass The record class
     * @param unpacker The unpacker containing the fields map
     * @return The deserialized record
     * @throws IOException If unpacking fails
     * @throws ReflectiveOperationException If reflection operations fail
     */
    private Object deserializeRecord(Class<?> recordClass, MessageUnpacker unpacker)
            throws IOException, ReflectiveOperationException {
        RecordInfo recordInfo = recordInfo(recordClass);
        
        int fieldCount = unpacker.unpackMapHeader();
        Map<String, Object> fieldValues = new HashMap<>(fieldCount);
        for (int i = 0; i < fieldCount; i++) {
            String fieldName = (String) thawFromIn(unpacker);
            fieldValues.put(fieldName, thawFromIn(unpacker));
        }
        
        // Prepare constructor arguments in component order
        Object[] constructorArgs = new Object[recordInfo.components.length];
        for (int i = 0; i < recordInfo.components.length; i++) {
            RecordComponent component = recordInfo.components[i];
            constructorArgs[i] = fitToType(component.getType(), fieldValues.get(component.getName()));
        }
        
        return recordInfo.constructor.newInstance(constructorArgs);
    }
    
    /**
     * Deserialize a custom object.
     *
     * @param objectClass The object class
     * @param unpacker The unpacker containing the fields map
     * @return The deserialized object
     * @throws IOException If unpacking fails
     * @throws ReflectiveOperationException If reflection operations fail
     */
    private Object deserializeCustomObject(Class<?> objectClass, MessageUnpacker unpacker)
            throws IOException, ReflectiveOperationException {
        ObjectInfo objectInfo;
        try {
            objectInfo = objectInfo(objectClass);
        } catch (UnfreezableValueException e) {
            throw new SerializationException("Cannot reconstruct " + objectClass.getName(), e);
        }
        
        Object instance = objectInfo.constructor.newInstance();
        
        int fieldCount = unpacker.unpackMapHeader();
        for (int i = 0; i < fieldCount; i++) {
            String fieldName = (String) thawFromIn(unpacker);
            Object fieldValue = thawFromIn(unpacker);
            
            // Skip fields that don't exist in the current class version
            Optional<Field> field = objectInfo.fields.stream()
                .filter(f -> f.getName().equals(fieldName))
                .findFirst();
            if (field.isPresent()) {
                field.get().set(instance, fitToType(field.get().getType(), fieldValue));
            }
        }
        
        return instance;
    }
    
    /**
     * Narrow a thawed number to the width a field or component declares.
     * MessagePack does not keep integer widths, so a {@code long} 5 reads back as an Integer.
     */
    private static Object fitToType(Class<?> type, Object value) {
        if (!(value instanceof Number)) {
            return value;
        }
        Number number = (Number) value;
        if (type == long.class || type == Long.class) {
            return number.longValue();
        } else if (type == int.class || type == Integer.class) {
            return number.intValue();
        } else if (type == short.class || type == Short.class) {
            return number.shortValue();
        } else if (type == byte.class || type == Byte.class) {
            return number.byteValue();
        } else if (type == double.class || type == Double.class) {
            return number.doubleValue();
        } else if (type == float.class || type == Float.class) {
            return number.floatValue();
        }
        return value;
    }
}
