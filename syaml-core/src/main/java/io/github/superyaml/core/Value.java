package io.github.superyaml.core;

/// A JSON-like document value: null, boolean, number, string, array or object.
///
/// Instances are immutable and thread safe. A document is edited by replacing
/// values along a path, see {@link DocumentTree}.
///
/// `toString()` renders JSON text; {@link #toDisplayString()} renders the form
/// used by string concatenation and interpolation.
public sealed interface Value
        permits NullValue, BoolValue, NumberValue, StringValue, ArrayValue, ObjectValue {

    /// {@return the kind name used in diagnostics}
    /// One of `null`, `boolean`, `number`, `string`, `array` or `object`.
    String kindName();

    /// {@return the display form of this value}
    /// Strings are returned verbatim, every other kind as compact JSON text.
    default String toDisplayString() {
        if (this instanceof StringValue s) {
            return s.value();
        }
        return toString();
    }

    /// {@return the JSON text of this value}
    @Override
    String toString();
}
