package io.github.superyaml.resolve;

/// A string leaf that needs evaluation: a `=` derived value or a `${...}` interpolation.
///
/// @param path absolute path of the leaf
/// @param raw  the original string
record ExpressionNode(String path, String raw) {

    static final String DERIVED_PREFIX = "=";
    static final String INTERPOLATION_OPEN = "${";

    static boolean isExpression(String text) {
        final var trimmed = text.trim();
        return trimmed.startsWith(DERIVED_PREFIX) || trimmed.contains(INTERPOLATION_OPEN);
    }
}
