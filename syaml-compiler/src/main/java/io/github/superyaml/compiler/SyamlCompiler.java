package io.github.superyaml.compiler;

import io.github.superyaml.constraints.ConstraintValidator;
import io.github.superyaml.core.DocumentTree;
import io.github.superyaml.core.Value;
import io.github.superyaml.core.ValueJson;
import io.github.superyaml.resolve.EnvBinding;
import io.github.superyaml.resolve.EnvBindings;
import io.github.superyaml.resolve.EnvProvider;
import io.github.superyaml.resolve.ExpressionResolver;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs a parsed document through the whole pipeline.
///
/// The stages run in order and the first failure propagates unchanged:
///
/// 1. environment bindings are read from the {@link EnvProvider};
/// 2. derived values and interpolations are resolved to a fixed point;
/// 3. constraints are checked against the resolved document.
///
/// The input value is never modified.
public final class SyamlCompiler {

    private static final Logger LOG = Logger.getLogger(SyamlCompiler.class.getName());

    private SyamlCompiler() {}

    /// Compiles a document.
    ///
    /// @param data        the document, with expression strings still in place
    /// @param envBindings symbol to binding; `null` means no bindings
    /// @param envProvider where binding keys are looked up
    /// @param constraints path to constraint sources; `null` means none
    /// @return the resolved document
    /// @throws io.github.superyaml.core.SyamlException from whichever stage fails
    public static Value compile(
            Value data,
            Map<String, EnvBinding> envBindings,
            EnvProvider envProvider,
            Map<String, List<String>> constraints) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(envProvider, "envProvider must not be null");

        final var env = EnvBindings.resolve(envBindings, envProvider);

        final var tree = new DocumentTree(data);
        ExpressionResolver.resolveExpressions(tree, env);

        if (constraints != null && !constraints.isEmpty()) {
            ConstraintValidator.validate(tree.root(), env, constraints);
        }
        LOG.fine(() -> "Compiled document with " + env.size() + " env binding(s)");
        return tree.root();
    }

    /// Compiles a document and renders the result as JSON.
    /// @see #compile(Value, Map, EnvProvider, Map)
    public static String compileToJson(
            Value data,
            Map<String, EnvBinding> envBindings,
            EnvProvider envProvider,
            Map<String, List<String>> constraints,
            boolean pretty) {
        return ValueJson.write(compile(data, envBindings, envProvider, constraints), pretty);
    }
}
