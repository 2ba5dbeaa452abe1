package org.shellgo.compiler.backend.emit.process;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Looks up process backends by their configuration name.
 */
public final class ProcessBackends {

    private static final Map<String, Supplier<ProcessBackend>> BACKENDS = Map.of(
            OsExecProcessBackend.NAME, OsExecProcessBackend::new);

    private ProcessBackends() {}

    /**
     * @param name The configured backend name.
     * @return A new backend instance.
     * @throws IllegalArgumentException if no backend has that name.
     */
    public static ProcessBackend byName(String name) {
        Supplier<ProcessBackend> supplier = BACKENDS.get(name);
        if (supplier == null) {
            throw new IllegalArgumentException("Unknown process backend '" + name + "', known: " + BACKENDS.keySet());
        }
        return supplier.get();
    }

    /**
     * @return The backend used when nothing is configured.
     */
    public static ProcessBackend defaultBackend() {
        return new OsExecProcessBackend();
    }
}
