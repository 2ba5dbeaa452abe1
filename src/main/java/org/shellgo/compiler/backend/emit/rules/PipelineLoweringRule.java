package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.backend.emit.process.ProcessBackend;
import org.shellgo.compiler.ir.CommandClass;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrPipeline;

import java.util.List;
import java.util.Set;

/**
 * Lowers a pipeline to a chain of processes: every stage is created and wired
 * first, then all stages are started, then all are waited for. The parent closes
 * its copy of each pipe as soon as the reading stage runs. Any failing stage
 * fails the pipeline with the first error seen.
 */
public final class PipelineLoweringRule implements IStatementLoweringRule<IrPipeline> {

    /** Builtins that exist as programs of the same name. */
    private static final Set<String> SPAWNABLE_BUILTINS = Set.of("echo", "pwd", "test", "[", "true", "false", "mkdir", "rm", "cp");

    @Override
    public void lower(IrPipeline pipeline, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        ctx.propagate(out, expression(pipeline, ctx));
    }

    /**
     * @param pipeline The pipeline.
     * @param ctx The emit context.
     * @return An immediately invoked {@code func() error} running the pipeline.
     * @throws UnsupportedConstructException if a stage cannot run as a process.
     */
    public static GoExpr expression(IrPipeline pipeline, EmitContext ctx) throws UnsupportedConstructException {
        ProcessBackend processes = ctx.processes();
        processes.pipelineImports().forEach(ctx::importPackage);
        List<IrCommand> stages = pipeline.commands();
        int last = stages.size() - 1;
        CodeBuilder body = new CodeBuilder(1);

        for (int i = 0; i <= last; i++) {
            IrCommand stage = stages.get(i);
            checkSpawnable(stage);
            body.line(processes.spawn(handle(i), ctx.value(stage.name()), ctx.values(stage.args())));
        }
        body.line(processes.bindInput(handle(0), "os.Stdin"));
        for (int i = 0; i < last; i++) {
            String pipe = "pipe" + i;
            body.line(processes.openPipe(handle(i), pipe));
            body.open("if err != nil {").line("return err").close("}");
            body.line(processes.bindInput(handle(i + 1), pipe));
        }
        body.line(processes.bindOutput(handle(last), "os.Stdout"));
        for (int i = 0; i <= last; i++) {
            body.line(processes.bindErrors(handle(i), "os.Stderr"));
        }
        for (int i = 0; i <= last; i++) {
            body.open("if err := " + processes.start(handle(i)) + "; err != nil {").line("return err").close("}");
            if (i > 0) {
                body.line(processes.closePipe("pipe" + (i - 1)));
            }
        }
        body.line("var first error");
        for (int i = 0; i <= last; i++) {
            body.open("if err := " + processes.await(handle(i)) + "; err != nil && first == nil {")
                    .line("first = err")
                    .close("}");
        }
        body.line("return first");
        return GoExpr.closure("func() error {", body.lines(), "}()");
    }

    private static String handle(int index) {
        return "stage" + index;
    }

    private static void checkSpawnable(IrCommand stage) throws UnsupportedConstructException {
        if (stage.commandClass() == CommandClass.FUNCTION) {
            throw new UnsupportedConstructException("function call '" + stage.name() + "' in a pipeline", stage.source());
        }
        if (stage.isBuiltin() && !SPAWNABLE_BUILTINS.contains(stage.name())) {
            throw new UnsupportedConstructException("builtin '" + stage.name() + "' in a pipeline", stage.source());
        }
    }
}
