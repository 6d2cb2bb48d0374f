package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.AbstractFn;
import com.fnfreeze.fn.DispatchFn;
import com.fnfreeze.fn.Fn;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Callables of every shape used across the serde tests. The class must keep
 * exactly one anonymous class ({@link #NEGATE}) so that it is named
 * {@code SampleFns$1}.
 */
public final class SampleFns {
    public static final long OFFSET = 10L;
    
    public static final Fn SQUARE = new Square();
    
    public static final Fn COUNTER = new Counter();
    
    public static final Fn INCREMENT = (args) -> ((Number) args[0]).longValue() + 1;
    
    public static final Fn NEGATE = new AbstractFn() {
        @Override
        public Object invoke1(Object x) {
            return -((Number) x).longValue();
        }
    };
    
    public static final DispatchFn METHOD1 = DispatchFn.declare(SampleFns.class, "METHOD1")
            .extend(String.class, (args) -> "string:" + args[0])
            .extend(Number.class, (args) -> "number:" + args[0]);
    
    public static final DispatchFn METHOD2 = DispatchFn.declare(SampleFns.class, "METHOD2")
            .extend(Object.class, (args) -> "object:" + args[0]);
    
    public static Fn selected = (args) -> "first";
    
    private SampleFns() {
    }
    
    public static Fn makeAdder(long y) {
        return new Adder(y);
    }
    
    /**
     * Squares a number. Bound to {@link #SQUARE}.
     */
    public static final class Square extends AbstractFn {
        @Override
        public Object invoke1(Object x) {
            long n = ((Number) x).longValue();
            return n * n;
        }
    }
    
    /**
     * Counts its calls. Its state is not constructor-settable, so only the bound
     * instance can be frozen.
     */
    public static final class Counter extends AbstractFn {
        private final AtomicLong calls = new AtomicLong();
        
        @Override
        public Object invoke0() {
            return calls.incrementAndGet();
        }
    }
    
    public record Adder(long y) implements Fn {
        @Override
        public Object invoke(Object... args) {
            return ((Number) args[0]).longValue() + y;
        }
    }
    
    /**
     * Captures nothing; reads a static constant instead.
     */
    public static final class Offset extends AbstractFn {
        @Override
        public Object invoke1(Object x) {
            return ((Number) x).longValue() + OFFSET;
        }
    }
    
    public static final class Greeter extends AbstractFn {
        private final String greeting;
        private final int times;
        private final char punctuation;
        private final boolean shout;
        
        public Greeter(String greeting, int times, char punctuation, boolean shout) {
            this.greeting = greeting;
            this.times = times;
            this.punctuation = punctuation;
            this.shout = shout;
        }
        
        @Override
        public Object invoke1(Object name) {
            String text = (greeting + " " + name).repeat(times) + punctuation;
            return shout ? text.toUpperCase() : text;
        }
        
        @Override
        public Object invoke2(Object first, Object second) {
            return invoke1(first + " and " + second);
        }
    }
    
    public record Joiner(String separator, List<String> parts) implements Fn {
        @Override
        public Object invoke(Object... args) {
            return String.join(separator, parts) + separator + args[0];
        }
    }
    
    public record Compose(Fn outer, Fn inner) implements Fn {
        @Override
        public Object invoke(Object... args) {
            return outer.invoke(inner.invoke(args));
        }
    }
    
    /**
     * A value the engine cannot freeze: it has no no-arg constructor.
     */
    public static final class Handle {
        private final String name;
        
        public Handle(String name) {
            this.name = name;
        }
        
        public String getName() {
            return name;
        }
    }
    
    public record UsesHandle(Handle handle) implements Fn {
        @Override
        public Object invoke(Object... args) {
            return handle.getName();
        }
    }
}
