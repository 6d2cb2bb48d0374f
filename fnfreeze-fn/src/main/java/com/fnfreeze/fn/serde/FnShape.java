package com.fnfreeze.fn.serde;

/**
 * Structural category of a callable, as seen by the codecs.
 */
public enum FnShape {
    /** Stored in a static field; frozen as that field's symbol. */
    NAMED_BINDING,
    /** Interface-dispatch function; frozen as the symbol it declares. */
    DISPATCH,
    /** Concrete class whose fields hold captured values; frozen as class name plus field values. */
    ANONYMOUS_CLOSURE,
    /** {@link com.fnfreeze.fn.MetadataFn}: metadata plus the wrapped callable. */
    METADATA_WRAPPER,
    /** {@link com.fnfreeze.fn.AbstractFn.Applier}: the enclosing callable. */
    ENCLOSING_WRAPPER
}
