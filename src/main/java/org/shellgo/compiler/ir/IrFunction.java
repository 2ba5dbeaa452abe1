package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A script function.
 *
 * @param name The function name.
 * @param body The body statements.
 * @param parameters Declared positional parameter names ({@code "1"}, {@code "2"}, ...).
 * @param locals Local variable name to last literal value.
 * @param source The script position of the definition.
 */
public record IrFunction(String name, List<IrStatement> body, List<String> parameters, Map<String, String> locals, SourceInfo source) {

    public IrFunction {
        body = List.copyOf(body);
        parameters = List.copyOf(parameters);
        locals = Collections.unmodifiableMap(new LinkedHashMap<>(locals));
    }
}
