package com.fnfreeze.serde;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.*;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class MsgPackSerializerTest {
    
    private MsgPackSerializer serializer;
    
    @BeforeEach
    public void setUp() {
        serializer = new MsgPackSerializer();
    }
    
    @Test
    public void testSerializeDeserializePrimitives() {
        assertRoundTrip("Test string");
        assertRoundTrip(123);
        assertRoundTrip(123456789L);
        assertRoundTrip(123.45);
        assertRoundTrip(123.45f);
        assertRoundTrip((short) 7);
        assertRoundTrip((byte) -3);
        assertRoundTrip(true);
        assertRoundTrip(false);
        assertRoundTrip(null);
    }
    
    @Test
    public void testFloatKeepsItsWidth() {
        Object deserialized = serializer.deserialize(serializer.serialize(1.5f));
        
        assertThat(deserialized).isInstanceOf(Float.class).isEqualTo(1.5f);
    }
    
    @Test
    public void testLargeLongStaysLong() {
        Object deserialized = serializer.deserialize(serializer.serialize(Long.MAX_VALUE));
        
        assertThat(deserialized).isEqualTo(Long.MAX_VALUE);
    }
    
    @Test
    public void testSmallLongInUntypedSlotThawsAsInteger() {
        List<?> deserialized = (List<?>) serializer.deserialize(serializer.serialize(List.of(2L)));
        
        assertThat(deserialized.get(0)).isInstanceOf(Integer.class).isEqualTo(2);
        assertThat(deserialized).isNotEqualTo(List.of(2L));
    }
    
    @Test
    public void testSerializeDeserializeCollections() {
        assertRoundTrip(new byte[] {1, 2, 3, 4, 5});
        assertRoundTrip(Arrays.asList("one", "two", "three"));
        assertRoundTrip(Arrays.asList(1, 2, 3, 4, 5));
        assertRoundTrip(new LinkedHashSet<>(List.of("a", "b")));
        assertRoundTrip('x');
    }
    
    @Test
    public void testSerializeDeserializeMaps() {
        Map<String, Object> map = new HashMap<>();
        map.put("string", "value");
        map.put("int", 123);
        map.put("boolean", true);
        
        assertRoundTrip(map);
        assertRoundTrip(new HashMap<>());
    }
    
    @Test
    public void testSerializeDeserializeNestedStructures() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("list", Arrays.asList(1, 2, 3));
        nested.put("map", Map.of("key", "value"));
        
        assertRoundTrip(nested);
    }
    
    @Test
    public void testSerializeDeserializeEnums() {
        assertRoundTrip(TestEnum.VALUE1);
        assertRoundTrip(TestEnum.VALUE2);
        assertRoundTrip(TestEnum.VALUE3);
    }
    
    @Test
    public void testSerializeDeserializeRecord() {
        TestRecord record = new TestRecord("test", 123, Arrays.asList("a", "b", "c"));
        
        Object deserialized = serializer.deserialize(serializer.serialize(record));
        
        assertThat(deserialized).isEqualTo(record);
    }
    
    @Test
    public void testRecordComponentsKeepTheirWidth() {
        WideRecord record = new WideRecord(5L, (short) 2, 0.5f);
        
        Object deserialized = serializer.deserialize(serializer.serialize(record));
        
        assertThat(deserialized).isEqualTo(record);
    }
    
    @Test
    public void testSerializeDeserializeNestedRecord() {
        NestedTestRecord record = new NestedTestRecord(
            "parent",
            new TestRecord("child", 456, Arrays.asList("x", "y", "z"))
        );
        
        Object deserialized = serializer.deserialize(serializer.serialize(record));
        
        assertThat(deserialized).isInstanceOf(NestedTestRecord.class);
        NestedTestRecord deserializedRecord = (NestedTestRecord) deserialized;
        assertThat(deserializedRecord.name()).isEqualTo("parent");
        assertThat(deserializedRecord.child().name()).isEqualTo("child");
        assertThat(deserializedRecord.child().value()).isEqualTo(456);
        assertThat(deserializedRecord.child().tags()).containsExactly("x", "y", "z");
    }
    
    @Test
    public void testSerializeDeserializeCustomObject() {
        TestObject obj = new TestObject();
        obj.setName("test");
        obj.setValue(123);
        obj.setActive(true);
        
        Object deserialized = serializer.deserialize(serializer.serialize(obj));
        
        assertThat(deserialized).isInstanceOf(TestObject.class);
        TestObject deserializedObj = (TestObject) deserialized;
        assertThat(deserializedObj.getName()).isEqualTo("test");
        assertThat(deserializedObj.getValue()).isEqualTo(123);
        assertThat(deserializedObj.isActive()).isTrue();
    }
    
    @Test
    public void testSerializeDeserializeInheritance() {
        ChildTestObject obj = new ChildTestObject();
        obj.setName("parent");
        obj.setValue(123);
        obj.setActive(true);
        obj.setChildProperty("child");
        
        Object deserialized = serializer.deserialize(serializer.serialize(obj));
        
        assertThat(deserialized).isInstanceOf(ChildTestObject.class);
        ChildTestObject deserializedObj = (ChildTestObject) deserialized;
        assertThat(deserializedObj.getName()).isEqualTo("parent");
        assertThat(deserializedObj.getValue()).isEqualTo(123);
        assertThat(deserializedObj.getChildProperty()).isEqualTo("child");
    }
    
    @Test
    public void testTransientFieldsAreSkipped() {
        ObjectWithTransient obj = new ObjectWithTransient();
        obj.setPersistent("saved");
        obj.setTransientField("not-saved");
        
        ObjectWithTransient deserializedObj = (ObjectWithTransient) serializer.deserialize(serializer.serialize(obj));
        
        assertThat(deserializedObj.getPersistent()).isEqualTo("saved");
        assertThat(deserializedObj.getTransientField()).isNull();
    }
    
    @Test
    public void testSerializeDeserializeWithCustomSerializer() {
        serializer.registerSerializer(UUID.class, (uuid) -> uuid.toString().replace("-", ""));
        serializer.registerDeserializer(UUID.class, (str) -> UUID.fromString(((String) str).replaceFirst(
                "(\\p{XDigit}{8})(\\p{XDigit}{4})(\\p{XDigit}{4})(\\p{XDigit}{4})(\\p{XDigit}+)",
                "$1-$2-$3-$4-$5")));
        UUID uuid = UUID.randomUUID();
        
        Object deserialized = serializer.deserialize(serializer.serialize(uuid));
        
        assertThat(deserialized).isEqualTo(uuid);
    }
    
    @Test
    public void testSerializeDeserializeDateTypes() {
        assertRoundTrip(new Date());
        assertRoundTrip(Instant.now());
        assertRoundTrip(LocalDate.now());
        assertRoundTrip(LocalTime.now());
        assertRoundTrip(LocalDateTime.now());
    }
    
    @Test
    public void testExtensionWritesPayloadAfterMarker() {
        serializer.registerExtension(Point.class, "test/point",
            (out, point) -> {
                out.packInt(point.x);
                out.packInt(point.y);
            },
            (in) -> new Point(in.unpackInt(), in.unpackInt()));
        
        Object deserialized = serializer.deserialize(serializer.serialize(List.of(new Point(3, 4), "after")));
        
        assertThat(deserialized).isEqualTo(List.of(new Point(3, 4), "after"));
    }
    
    @Test
    public void testExtensionMatchesSubtypesAndMostSpecificWins() {
        serializer.registerExtension(Shape.class, "test/shape",
            (out, shape) -> serializer.freezeToOut(out, shape.name()),
            (in) -> "shape:" + serializer.thawFromIn(in));
        serializer.registerExtension(Circle.class, "test/circle",
            (out, circle) -> serializer.freezeToOut(out, circle.radius),
            (in) -> "circle:" + serializer.thawFromIn(in));
        
        assertThat(serializer.deserialize(serializer.serialize(new Square()))).isEqualTo("shape:square");
        assertThat(serializer.deserialize(serializer.serialize(new Circle(2)))).isEqualTo("circle:2");
    }
    
    @Test
    public void testExtensionTagMustBeUnique() {
        serializer.registerExtension(Point.class, "test/dup", (out, p) -> out.packNil(), (in) -> null);
        
        assertThatThrownBy(() -> serializer.registerExtension(
                Circle.class, "test/dup", (out, c) -> out.packNil(), (in) -> null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("test/dup");
    }
    
    @Test
    public void testUnknownExtensionTagFailsOnThaw() {
        MsgPackSerializer writer = new MsgPackSerializer();
        writer.registerExtension(Point.class, "test/point", (out, p) -> out.packNil(), (in) -> null);
        byte[] frozen = writer.serialize(new Point(1, 2));
        
        assertThatThrownBy(() -> serializer.deserialize(frozen))
            .isInstanceOf(SerializationException.class)
            .hasMessageContaining("test/point");
    }
    
    @Test
    public void testObjectWithoutNoArgConstructorIsUnfreezable() {
        assertThatThrownBy(() -> serializer.serialize(new Point(1, 2)))
            .isExactlyInstanceOf(UnfreezableValueException.class)
            .hasMessageContaining(Point.class.getName());
    }
    
    @Test
    public void testLambdaIsUnfreezable() {
        Supplier<String> supplier = () -> "value";
        
        assertThatThrownBy(() -> serializer.serialize(List.of(supplier)))
            .isInstanceOfSatisfying(UnfreezableValueException.class,
                e -> assertThat(e.getValueType()).isEqualTo(supplier.getClass()));
    }
    
    @Test
    public void testStreamFreezeAndThaw() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        
        serializer.freeze(Map.of("k", List.of(1, 2)), out);
        Object thawed = serializer.thaw(new ByteArrayInputStream(out.toByteArray()));
        
        assertThat(thawed).isEqualTo(Map.of("k", List.of(1, 2)));
    }
    
    @Test
    public void testTruncatedDataFails() {
        assertThatThrownBy(() -> serializer.deserialize(new byte[0]))
            .isInstanceOf(SerializationException.class);
    }
    
    /**
     * Helper method to assert that an object survives a round trip through serialization.
     *
     * @param obj Object to test
     */
    private void assertRoundTrip(Object obj) {
        Object deserialized = serializer.deserialize(serializer.serialize(obj));
        
        if (obj instanceof byte[]) {
            assertThat((byte[]) deserialized).isEqualTo((byte[]) obj);
        } else if (obj instanceof Number) {
            // MessagePack does not keep integer widths; compare by value
            assertThat(deserialized).isInstanceOf(Number.class);
            assertThat(((Number) deserialized).doubleValue())
                .isCloseTo(((Number) obj).doubleValue(), within(0.0001));
        } else {
            assertThat(deserialized).isEqualTo(obj);
        }
    }
    
    public enum TestEnum {
        VALUE1, VALUE2, VALUE3
    }
    
    public record TestRecord(String name, int value, List<String> tags) {
    }
    
    public record NestedTestRecord(String name, TestRecord child) {
    }
    
    public record WideRecord(long id, short flags, float ratio) {
    }
    
    /**
     * Value type without a no-arg constructor.
     */
    public static final class Point {
        final int x;
        final int y;
        
        public Point(int x, int y) {
            this.x = x;
            this.y = y;
        }
        
        @Override
        public boolean equals(Object o) {
            return o instanceof Point && ((Point) o).x == x && ((Point) o).y == y;
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(x, y);
        }
    }
    
    public interface Shape {
        String name();
    }
    
    public static final class Square implements Shape {
        @Override
        public String name() {
            return "square";
        }
    }
    
    public static final class Circle implements Shape {
        final int radius;
        
        public Circle(int radius) {
            this.radius = radius;
        }
        
        @Override
        public String name() {
            return "circle";
        }
    }
    
    public static class TestObject {
        private String name;
        private int value;
        private boolean active;
        
        public String getName() {
            return name;
        }
        
        public void setName(String name) {
            this.name = name;
        }
        
        public int getValue() {
            return value;
        }
        
        public void setValue(int value) {
            this.value = value;
        }
        
        public boolean isActive() {
            return active;
        }
        
        public void setActive(boolean active) {
            this.active = active;
        }
    }
    
    public static class ChildTestObject extends TestObject {
        private String childProperty;
        
        public String getChildProperty() {
            return childProperty;
        }
        
        public void setChildProperty(String childProperty) {
            this.childProperty = childProperty;
        }
    }
    
    public static class ObjectWithTransient {
        private String persistent;
        private transient String transientField;
        
        public String getPersistent() {
            return persistent;
        }
        
        public void setPersistent(String persistent) {
            this.persistent = persistent;
        }
        
        public String getTransientField() {
            return transientField;
        }
        
        public void setTransientField(String transientField) {
            this.transientField = transientField;
        }
    }
}
