package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.ForNode;
import org.shellgo.compiler.ir.IrLoop;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.IrValues;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Converts {@code for NAME [in WORDS]} loops. A single brace range {@code {A..B}}
 * becomes a counted loop; without {@code in} the positional parameters are iterated.
 */
public final class ForNodeConverter implements IAstNodeToIrConverter<ForNode> {

    private static final Pattern BRACE_RANGE = Pattern.compile("\\{(-?\\d{1,9})\\.\\.(-?\\d{1,9})}");

    @Override
    public void convert(ForNode node, IrGenContext ctx) throws UnsupportedConstructException {
        String variable = node.variable();
        ctx.recordVariable(variable, "", false);
        List<IrStatement> body = ctx.collect(node.body());

        if (!node.hasInClause()) {
            ctx.emit(IrLoop.iterateList(variable, IrValues.reference("@"), body, node.source()));
            return;
        }
        if (node.items().size() == 1 && node.items().get(0).plainLiteral() != null) {
            Matcher range = BRACE_RANGE.matcher(node.items().get(0).plainLiteral());
            if (range.matches()) {
                int from = Integer.parseInt(range.group(1));
                int to = Integer.parseInt(range.group(2));
                if (from <= to) {
                    ctx.emit(IrLoop.countedRange(variable, from, to, body, node.source()));
                } else {
                    // descending ranges are spelled out
                    String items = IntStream.rangeClosed(to, from)
                            .map(i -> from - (i - to))
                            .mapToObj(String::valueOf)
                            .collect(Collectors.joining(" "));
                    ctx.emit(IrLoop.iterateList(variable, items, body, node.source()));
                }
                return;
            }
        }
        String items = String.join(" ", ctx.values(node.items()));
        ctx.emit(IrLoop.iterateList(variable, items, body, node.source()));
    }
}
