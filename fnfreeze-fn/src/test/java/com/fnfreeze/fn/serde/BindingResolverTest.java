package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.Symbol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class BindingResolverTest {
    
    @Mock
    private BindingNameStrategy first;
    
    @Mock
    private BindingNameStrategy second;
    
    private final GlobalBindings bindings = new GlobalBindings();
    private final ClassLoader loader = BindingResolverTest.class.getClassLoader();
    
    private Optional<Symbol> resolve(BindingResolver resolver, Fn fn) {
        return resolver.resolve(fn, loader).map(Binding::getSymbol);
    }
    
    @Test
    void testDefaultChainResolvesEveryNamedShape() {
        BindingResolver resolver = new BindingResolver(bindings);
        
        assertThat(resolve(resolver, SampleFns.SQUARE)).contains(Symbol.of(SampleFns.class, "SQUARE"));
        assertThat(resolve(resolver, SampleFns.METHOD2)).contains(Symbol.of(SampleFns.class, "METHOD2"));
        assertThat(resolve(resolver, SampleFns.NEGATE)).contains(Symbol.of(SampleFns.class, "NEGATE"));
        assertThat(resolve(resolver, SampleFns.INCREMENT)).contains(Symbol.of(SampleFns.class, "INCREMENT"));
    }
    
    @Test
    void testUnboundCallablesDoNotResolve() {
        BindingResolver resolver = new BindingResolver(bindings);
        
        assertThat(resolve(resolver, new SampleFns.Square())).isEmpty();
        assertThat(resolve(resolver, SampleFns.makeAdder(1))).isEmpty();
        assertThat(resolve(resolver, new SampleFns.Offset())).isEmpty();
        assertThat(resolve(resolver, (args) -> null)).isEmpty();
    }
    
    @Test
    void testResolveByTypeFindsBindingOfAnotherInstance() {
        BindingResolver resolver = new BindingResolver(bindings);
        
        assertThat(resolver.resolveByType(new SampleFns.Square(), loader).map(Binding::getSymbol))
                .contains(Symbol.of(SampleFns.class, "SQUARE"));
        assertThat(resolver.resolveByType(new SampleFns.Counter(), loader).map(Binding::getSymbol))
                .contains(Symbol.of(SampleFns.class, "COUNTER"));
        assertThat(resolver.resolveByType(SampleFns.makeAdder(1), loader)).isEmpty();
        assertThat(resolver.resolveByType(new SampleFns.Offset(), loader)).isEmpty();
    }
    
    @Test
    void testCandidateMustHoldTheSameInstance() {
        BindingResolver resolver = new BindingResolver(bindings, List.of(first));
        when(first.candidates(any(), any(), any())).thenReturn(List.of(
                Symbol.of(SampleFns.class, "NEGATE"),
                Symbol.of(SampleFns.class, "NO_SUCH_FIELD"),
                Symbol.of("com.example.Missing", "SQUARE"),
                Symbol.of(SampleFns.class, "SQUARE")));
        
        assertThat(resolve(resolver, SampleFns.SQUARE)).contains(Symbol.of(SampleFns.class, "SQUARE"));
    }
    
    @Test
    void testFirstMatchingStrategyWins() {
        BindingResolver resolver = new BindingResolver(bindings, List.of(first, second));
        when(first.candidates(any(), any(), any())).thenReturn(List.of(Symbol.of(SampleFns.class, "SQUARE")));
        
        assertThat(resolve(resolver, SampleFns.SQUARE)).isPresent();
        verify(second, never()).candidates(any(), any(), any());
    }
    
    @Test
    void testFailingStrategyIsSkipped() {
        BindingResolver resolver = new BindingResolver(bindings, List.of(first, BindingNameStrategies.demangled()));
        when(first.candidates(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        
        assertThat(resolve(resolver, SampleFns.SQUARE)).contains(Symbol.of(SampleFns.class, "SQUARE"));
    }
    
    @Test
    void testStrategyOrderIsRespected() {
        BindingResolver dispatchOnly = new BindingResolver(bindings, List.of(BindingNameStrategies.dispatchTable()));
        
        assertThat(resolve(dispatchOnly, SampleFns.SQUARE)).isEmpty();
        assertThat(resolve(dispatchOnly, SampleFns.METHOD1)).contains(Symbol.of(SampleFns.class, "METHOD1"));
        assertThat(dispatchOnly.getStrategies()).hasSize(1);
    }
}
