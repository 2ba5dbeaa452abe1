package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.ir.IrCommand;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry of builtin lowerings keyed by command name.
 */
public final class BuiltinLoweringRegistry {

    private final Map<String, IBuiltinLowering> byName = new HashMap<>();

    /**
     * Registers the lowering of a builtin.
     * @param name The command name.
     * @param lowering The lowering.
     */
    public void register(String name, IBuiltinLowering lowering) {
        byName.put(name, lowering);
    }

    /**
     * @param command A builtin invocation.
     * @return Its lowering.
     * @throws UnsupportedConstructException if the builtin has no lowering, as {@code source} has none.
     */
    public IBuiltinLowering resolve(IrCommand command) throws UnsupportedConstructException {
        IBuiltinLowering lowering = byName.get(command.name());
        if (lowering == null) {
            throw new UnsupportedConstructException("builtin '" + command.name() + "'", command.source());
        }
        return lowering;
    }

    /**
     * Initializes a new registry with all builtin lowerings.
     * @return A new registry.
     */
    public static BuiltinLoweringRegistry initializeWithDefaults() {
        BuiltinLoweringRegistry reg = new BuiltinLoweringRegistry();
        reg.register("echo", new EchoLowering());
        reg.register("cd", new CdLowering());
        reg.register("pwd", new PwdLowering());
        reg.register("mkdir", new MkdirLowering());
        reg.register("rm", new RmLowering());
        reg.register("cp", new CpLowering());
        TestLowering test = new TestLowering();
        reg.register("test", test);
        reg.register("[", test);
        reg.register("exit", new ExitLowering());
        reg.register("export", new ExportLowering());
        reg.register("read", new ReadLowering());
        reg.register("true", new StatusLowering(true));
        reg.register("false", new StatusLowering(false));
        reg.register("wait", new WaitLowering());
        return reg;
    }
}
