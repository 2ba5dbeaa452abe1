package org.shellgo.compiler.frontend.irgen;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.parser.ast.WordNode;
import org.shellgo.compiler.frontend.parser.ast.WordPart;
import org.shellgo.compiler.ir.IrValues;

import java.util.List;

/**
 * Turns words into IR values. Literal and single-quoted text is copied verbatim,
 * double quotes are interpolating, parameters become references and command
 * substitutions become the opaque marker.
 */
final class WordValueExtractor {

    /** Highest positional parameter a function may read; the function records every parameter up to it. */
    static final int MAX_POSITIONAL = 255;

    private final IrGenContext ctx;

    WordValueExtractor(IrGenContext ctx) {
        this.ctx = ctx;
    }

    String extract(WordNode word) throws UnsupportedConstructException {
        StringBuilder value = new StringBuilder();
        List<WordPart> parts = word.parts();
        for (int i = 0; i < parts.size(); i++) {
            WordPart part = parts.get(i);
            if (i == 0 && part instanceof WordPart.Literal literal && isTilde(literal.text())) {
                value.append(IrValues.reference("HOME")).append(IrValues.literal(literal.text().substring(1)));
                continue;
            }
            append(part, word, value);
        }
        return value.toString();
    }

    private void append(WordPart part, WordNode word, StringBuilder value) throws UnsupportedConstructException {
        if (part instanceof WordPart.Literal literal) {
            value.append(IrValues.literal(literal.text()));
        } else if (part instanceof WordPart.SingleQuoted quoted) {
            value.append(IrValues.literal(quoted.text()));
        } else if (part instanceof WordPart.DoubleQuoted quoted) {
            for (WordPart inner : quoted.parts()) {
                append(inner, word, value);
            }
        } else if (part instanceof WordPart.Parameter parameter) {
            value.append(parameter(parameter, word));
        } else if (part instanceof WordPart.CommandSubstitution) {
            value.append(IrValues.COMMAND_SUBSTITUTION);
        } else if (part instanceof WordPart.Arithmetic arithmetic) {
            throw new UnsupportedConstructException("arithmetic expansion $((" + arithmetic.expression() + "))", word.source());
        }
    }

    private String parameter(WordPart.Parameter parameter, WordNode word) throws UnsupportedConstructException {
        String name = parameter.name();
        if (!parameter.operator().isEmpty()) {
            throw new UnsupportedConstructException("parameter expansion ${" + name + parameter.operator() + "}", word.source());
        }
        if (parameter.isSpecial()) {
            if (!name.equals("@") && !name.equals("*") && !name.equals("#")) {
                throw new UnsupportedConstructException("special parameter $" + name, word.source());
            }
        } else if (parameter.isPositional()) {
            if (name.length() > 9 || Integer.parseInt(name) > MAX_POSITIONAL) {
                throw new UnsupportedConstructException("positional parameter ${" + name + "}", word.source());
            }
            ctx.usePositional(Integer.parseInt(name));
        }
        return IrValues.reference(name);
    }

    private static boolean isTilde(String text) {
        return text.equals("~") || text.startsWith("~/");
    }
}
