package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.BlockNode;
import org.shellgo.compiler.frontend.parser.ast.RedirectNode;
import org.shellgo.compiler.frontend.parser.ast.StatementNode;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.IrBackground;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrPipeline;
import org.shellgo.compiler.ir.IrRedirection;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.RedirectOperator;

import java.util.List;

/**
 * Converts a statement: its command, wrapped in redirections and a background
 * marker where the statement carries them.
 */
public final class StatementNodeConverter implements IAstNodeToIrConverter<StatementNode> {

    @Override
    public void convert(StatementNode node, IrGenContext ctx) throws UnsupportedConstructException {
        if (node.negated()) {
            throw new UnsupportedConstructException("negated command '!'", node.source());
        }
        if (node.redirects().isEmpty() && !node.background()) {
            ctx.convert(node.command());
            return;
        }
        if (node.command() instanceof BlockNode) {
            throw new UnsupportedConstructException(
                    node.background() ? "background command group" : "redirected command group", node.source());
        }
        if (node.background() && !node.redirects().isEmpty()) {
            throw new UnsupportedConstructException("redirected background command", node.source());
        }

        List<IrStatement> converted = ctx.collect(node.command());
        if (converted.isEmpty()) {
            throw new UnsupportedConstructException("redirection without a command", node.source());
        }
        // Leading assignments run before the wrapped statement.
        for (int i = 0; i < converted.size() - 1; i++) {
            ctx.emit(converted.get(i));
        }
        IrStatement statement = converted.get(converted.size() - 1);

        if (node.background()) {
            if (!(statement instanceof IrCommand) && !(statement instanceof IrPipeline)) {
                throw new UnsupportedConstructException("background " + statement.kind().name().toLowerCase(), node.source());
            }
            ctx.require(Capability.BACKGROUND_JOBS);
            ctx.emit(new IrBackground(statement, node.source()));
            return;
        }

        for (int i = node.redirects().size() - 1; i >= 0; i--) {
            RedirectNode redirect = node.redirects().get(i);
            statement = new IrRedirection(operatorOf(redirect), ctx.value(redirect.target()), statement, redirect.source());
        }
        ctx.require(Capability.FILESYSTEM);
        ctx.emit(statement);
    }

    private static RedirectOperator operatorOf(RedirectNode redirect) throws UnsupportedConstructException {
        RedirectOperator operator = switch (redirect.op()) {
            case OUTPUT, CLOBBER -> RedirectOperator.TRUNCATE_WRITE;
            case APPEND -> RedirectOperator.APPEND_WRITE;
            case INPUT -> RedirectOperator.READ;
            case HEREDOC -> throw new UnsupportedConstructException("here-document", redirect.source());
            case HERESTRING -> throw new UnsupportedConstructException("here-string '<<<'", redirect.source());
            default -> throw new UnsupportedConstructException(
                    "descriptor redirection '" + redirect.op().symbol() + "'", redirect.source());
        };
        Integer fd = redirect.fd();
        int expected = operator == RedirectOperator.READ ? 0 : 1;
        if (fd != null && fd != expected) {
            throw new UnsupportedConstructException(
                    "descriptor redirection '" + fd + redirect.op().symbol() + "'", redirect.source());
        }
        return operator;
    }
}
