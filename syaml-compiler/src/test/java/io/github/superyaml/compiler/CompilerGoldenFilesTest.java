package io.github.superyaml.compiler;

import io.github.superyaml.core.ArrayValue;
import io.github.superyaml.core.BoolValue;
import io.github.superyaml.core.ObjectValue;
import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.SyamlException;
import io.github.superyaml.core.Value;
import io.github.superyaml.core.ValueJson;
import io.github.superyaml.resolve.EnvBinding;
import io.github.superyaml.resolve.MapEnvProvider;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Runs every case under `cases/` on the test classpath.
///
/// A case holds `data` and optionally `env` (symbol to binding), `environment`
/// (the variables visible to the provider) and `constraints`. It expects either
/// an `expected` document or an `error` message fragment.
class CompilerGoldenFilesTest extends CompilerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(CompilerGoldenFilesTest.class.getName());

    @ParameterizedTest(name = "{0}")
    @MethodSource("cases")
    void goldenFiles(String caseName) throws IOException, URISyntaxException {
        LOG.info(() -> "TEST: goldenFiles case=" + caseName);

        final var testCase = (ObjectValue) ValueJson.parse(Files.readString(casesDir().resolve(caseName), StandardCharsets.UTF_8));
        final var data = Objects.requireNonNull(testCase.get("data"), "case has no data");
        final var bindings = bindings(testCase.get("env"));
        final var provider = MapEnvProvider.of(environment(testCase.get("environment")));
        final var constraints = constraints(testCase.get("constraints"));

        final var expected = testCase.get("expected");
        if (expected != null) {
            final var actual = SyamlCompiler.compile(data, bindings, provider, constraints);
            assertThat(actual).isEqualTo(expected);
        } else {
            final var error = ((StringValue) testCase.get("error")).value();
            assertThatThrownBy(() -> SyamlCompiler.compile(data, bindings, provider, constraints))
                    .isInstanceOf(SyamlException.class)
                    .hasMessageContaining(error);
        }
    }

    static Stream<String> cases() throws IOException, URISyntaxException {
        try (var stream = Files.list(casesDir())) {
            return stream.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList())
                    .stream();
        }
    }

    private static Path casesDir() throws URISyntaxException {
        final var url = Objects.requireNonNull(CompilerGoldenFilesTest.class.getClassLoader().getResource("cases"),
                "cases directory missing from test classpath");
        return Path.of(url.toURI());
    }

    private static Map<String, EnvBinding> bindings(Value env) {
        final var out = new LinkedHashMap<String, EnvBinding>();
        if (env instanceof ObjectValue obj) {
            obj.members().forEach((symbol, raw) -> {
                final var binding = (ObjectValue) raw;
                final var required = binding.get("required") instanceof BoolValue b && b.value();
                out.put(symbol, new EnvBinding(((StringValue) binding.get("key")).value(), required, binding.get("default")));
            });
        }
        return out;
    }

    private static Map<String, String> environment(Value environment) {
        final var out = new LinkedHashMap<String, String>();
        if (environment instanceof ObjectValue obj) {
            obj.members().forEach((key, value) -> out.put(key, value.toDisplayString()));
        }
        return out;
    }

    private static Map<String, List<String>> constraints(Value constraints) {
        final var out = new LinkedHashMap<String, List<String>>();
        if (constraints instanceof ObjectValue obj) {
            obj.members().forEach((path, list) -> {
                final var sources = new ArrayList<String>();
                for (final var item : ((ArrayValue) list).elements()) {
                    sources.add(((StringValue) item).value());
                }
                out.put(path, sources);
            });
        }
        return out;
    }
}
