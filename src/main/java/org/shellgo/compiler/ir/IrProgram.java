package org.shellgo.compiler.ir;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Program container produced by the IR builder. The order of statements and of
 * the function table is the emission order and is preserved by the backend.
 * All collections are unmodifiable copies.
 *
 * @param programName The script name.
 * @param statements The top-level statements.
 * @param functions Function name to function, in declaration order.
 * @param variables Program variable name to last literal value.
 * @param capabilities The runtime facilities the program requires.
 */
public record IrProgram(
        String programName,
        List<IrStatement> statements,
        Map<String, IrFunction> functions,
        Map<String, String> variables,
        Set<Capability> capabilities
) {

    public IrProgram {
        statements = List.copyOf(statements);
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        capabilities = Collections.unmodifiableSet(capabilities.isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(capabilities));
    }

    /**
     * @param capability The capability to check.
     * @return {@code true} if the program requires it.
     */
    public boolean requires(Capability capability) {
        return capabilities.contains(capability);
    }
}
