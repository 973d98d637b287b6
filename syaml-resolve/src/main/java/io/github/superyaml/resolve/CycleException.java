package io.github.superyaml.resolve;

import io.github.superyaml.core.ErrorKind;
import io.github.superyaml.core.SyamlException;

import java.util.List;

/// Thrown when derived values stop making progress while some remain unresolved.
public final class CycleException extends SyamlException {

    private static final long serialVersionUID = 1L;

    private final List<String> paths;

    /// @param paths the stuck paths, already sorted
    public CycleException(List<String> paths) {
        super(ErrorKind.CYCLE, "could not resolve derived values; possible dependency cycle among: "
                + String.join(", ", paths));
        this.paths = List.copyOf(paths);
    }

    CycleException(String detail) {
        super(ErrorKind.CYCLE, detail);
        this.paths = List.of();
    }

    /// {@return the unresolved paths in lexicographic order}
    public List<String> paths() {
        return paths;
    }
}
