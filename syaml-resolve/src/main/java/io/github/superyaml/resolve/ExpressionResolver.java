package io.github.superyaml.resolve;

import io.github.superyaml.core.ArrayValue;
import io.github.superyaml.core.DocumentTree;
import io.github.superyaml.core.ObjectValue;
import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.Value;
import io.github.superyaml.core.ValuePath;
import io.github.superyaml.expr.EvalContext;
import io.github.superyaml.expr.EvalResult;
import io.github.superyaml.expr.ExpressionEvaluator;
import io.github.superyaml.expr.ExpressionException;
import io.github.superyaml.expr.Expressions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Replaces derived values and interpolations in a document with their results.
///
/// Resolution runs to a fixed point without computing a dependency order up
/// front. Each pass evaluates every pending node; a node that references
/// another pending node reports {@link EvalResult.Unresolved} and waits for a
/// later pass. A pass that resolves nothing while nodes remain means a cycle.
///
/// The order in which independent nodes resolve is unspecified. Only the
/// final document is guaranteed.
public final class ExpressionResolver {

    private static final Logger LOG = Logger.getLogger(ExpressionResolver.class.getName());

    static final int MAX_DERIVED_EXPRESSIONS = 1024;
    static final int MAX_INTERPOLATIONS_PER_STRING = 128;
    static final int MAX_EXPRESSION_SOURCE_LENGTH = 4096;

    private static final Pattern INTERPOLATION = Pattern.compile("\\$\\{([^}]+)}");

    private ExpressionResolver() {}

    /// Resolves a document held outside a tree and returns the result.
    /// @see #resolveExpressions(DocumentTree, Map)
    public static Value resolve(Value data, Map<String, Value> env) {
        final var tree = new DocumentTree(data);
        resolveExpressions(tree, env);
        return tree.root();
    }

    /// Resolves every derived value and interpolation in `tree`, writing results in place.
    ///
    /// @param tree the document; it is left partially resolved when an error is thrown
    /// @param env  resolved environment bindings
    /// @throws ExpressionException on the first evaluation failure, or when limits are exceeded
    /// @throws CycleException if the remaining nodes depend on each other
    public static void resolveExpressions(DocumentTree tree, Map<String, Value> env) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(env, "env must not be null");

        final var nodes = new ArrayList<ExpressionNode>();
        collect(tree.root(), ValuePath.ROOT, nodes);
        if (nodes.isEmpty()) {
            LOG.fine(() -> "No derived values to resolve");
            return;
        }
        if (nodes.size() > MAX_DERIVED_EXPRESSIONS) {
            throw new ExpressionException("too many derived expressions/interpolations: " + nodes.size()
                    + " (max " + MAX_DERIVED_EXPRESSIONS + ")");
        }
        LOG.fine(() -> "Resolving " + nodes.size() + " derived value(s)");

        final Set<String> unresolved = new LinkedHashSet<>();
        for (final var node : nodes) {
            unresolved.add(node.path());
        }

        final int maxPasses = nodes.size() + 1;
        for (int pass = 1; pass <= maxPasses; pass++) {
            if (unresolved.isEmpty()) {
                return;
            }
            boolean progress = false;
            for (final var node : nodes) {
                if (!unresolved.contains(node.path())) {
                    continue;
                }
                final var ctx = EvalContext.forResolution(tree.root(), env, Collections.unmodifiableSet(unresolved));
                final var result = evaluateNode(node, ctx);
                if (result instanceof EvalResult.Success s) {
                    tree.set(node.path(), s.value());
                    unresolved.remove(node.path());
                    progress = true;
                } else if (result instanceof EvalResult.Fatal f) {
                    LOG.fine(() -> "Resolution failed at " + node.path() + ": " + f.error().getMessage());
                    throw f.error();
                }
            }
            final int finishedPass = pass;
            LOG.finer(() -> "Pass " + finishedPass + " done, " + unresolved.size() + " pending");
            if (!progress) {
                final var stuck = new ArrayList<>(unresolved);
                Collections.sort(stuck);
                throw new CycleException(stuck);
            }
        }
        if (!unresolved.isEmpty()) {
            throw new CycleException("expression resolution exceeded max passes");
        }
    }

    private static void collect(Value value, String path, List<ExpressionNode> out) {
        if (value instanceof ObjectValue o) {
            for (final var entry : o.members().entrySet()) {
                collect(entry.getValue(), ValuePath.child(path, entry.getKey()), out);
            }
        } else if (value instanceof ArrayValue a) {
            for (int i = 0; i < a.elements().size(); i++) {
                collect(a.elements().get(i), ValuePath.index(path, i), out);
            }
        } else if (value instanceof StringValue s && ExpressionNode.isExpression(s.value())) {
            out.add(new ExpressionNode(path, s.value()));
        }
    }

    private static EvalResult evaluateNode(ExpressionNode node, EvalContext ctx) {
        final var raw = node.raw().trim();
        if (raw.startsWith(ExpressionNode.DERIVED_PREFIX)) {
            return evaluateSource(raw.substring(ExpressionNode.DERIVED_PREFIX.length()), ctx);
        }
        return interpolate(raw, ctx);
    }

    private static EvalResult interpolate(String raw, EvalContext ctx) {
        final var segments = new ArrayList<Segment>();
        final Matcher m = INTERPOLATION.matcher(raw);
        while (m.find()) {
            if (segments.size() >= MAX_INTERPOLATIONS_PER_STRING) {
                return fatal("too many interpolation segments in one string (max "
                        + MAX_INTERPOLATIONS_PER_STRING + ")");
            }
            segments.add(new Segment(m.start(), m.end(), m.group(1)));
        }

        // a lone whole-string segment keeps the native type of its result
        if (segments.size() == 1 && segments.get(0).start() == 0 && segments.get(0).end() == raw.length()) {
            return evaluateSource(segments.get(0).source(), ctx);
        }

        final var out = new StringBuilder();
        int last = 0;
        for (final var segment : segments) {
            out.append(raw, last, segment.start());
            final var result = evaluateSource(segment.source(), ctx);
            if (!(result instanceof EvalResult.Success s)) {
                return result;
            }
            out.append(s.value().toDisplayString());
            last = segment.end();
        }
        out.append(raw, last, raw.length());
        return new EvalResult.Success(StringValue.of(out.toString()));
    }

    private static EvalResult evaluateSource(String source, EvalContext ctx) {
        final var trimmed = source.trim();
        if (trimmed.length() > MAX_EXPRESSION_SOURCE_LENGTH) {
            return fatal("expression exceeds max length (" + MAX_EXPRESSION_SOURCE_LENGTH + ")");
        }
        try {
            return ExpressionEvaluator.evaluate(Expressions.parse(trimmed), ctx);
        } catch (ExpressionException ex) {
            return new EvalResult.Fatal(ex);
        }
    }

    private static EvalResult fatal(String message) {
        return new EvalResult.Fatal(new ExpressionException(message));
    }

    private record Segment(int start, int end, String source) {}
}
