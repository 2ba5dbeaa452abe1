package org.shellgo.compiler.frontend.lexer;

import org.shellgo.compiler.api.SourceInfo;
import org.shellgo.compiler.diagnostics.DiagnosticsEngine;
import org.shellgo.compiler.frontend.parser.ast.WordNode;
import org.shellgo.compiler.frontend.parser.ast.WordPart;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the text of a shell
 * script into a sequence of tokens.
 * <p>
 * Words are split into their parts (literals, quotes, expansions) here, because
 * quoting decides where a word ends. Here-document bodies are read after the
 * line that introduced them and attached to the operator token.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private final List<PendingHereDocument> pendingHereDocuments = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int tokenLine;
    private int tokenColumn;

    private record PendingHereDocument(int tokenIndex, boolean stripTabs) {}

    /**
     * Creates a new Lexer.
     * @param source The script text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The script text.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the script, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire script.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = column;
            scanToken();
        }
        if (!pendingHereDocuments.isEmpty()) {
            diagnostics.reportError("Here-document is missing its body.", logicalFileName, line);
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = peek();
        switch (c) {
            case ' ', '\t', '\r' -> advance();
            case '\n' -> {
                advance();
                addToken(TokenType.NEWLINE);
                readHereDocumentBodies();
            }
            case '#' -> {
                while (peek() != '\n' && !isAtEnd()) advance();
            }
            case '\\' -> {
                if (peekNext() == '\n') {
                    advance();
                    advance();
                } else {
                    word();
                }
            }
            case '|' -> {
                advance();
                addToken(match('|') ? TokenType.OR_IF : TokenType.PIPE);
            }
            case '&' -> {
                advance();
                if (match('&')) {
                    addToken(TokenType.AND_IF);
                } else if (match('>')) {
                    addToken(match('>') ? TokenType.AND_DGREAT : TokenType.AND_GREAT);
                } else {
                    addToken(TokenType.AMP);
                }
            }
            case ';' -> {
                advance();
                addToken(match(';') ? TokenType.DSEMI : TokenType.SEMI);
            }
            case '(' -> {
                advance();
                if (peek() == '(') {
                    advance();
                    arithmeticCommand();
                } else {
                    addToken(TokenType.LPAREN);
                }
            }
            case ')' -> {
                advance();
                addToken(TokenType.RPAREN);
            }
            case '<' -> {
                advance();
                if (match('<')) {
                    if (match('<')) {
                        addToken(TokenType.TLESS);
                    } else if (match('-')) {
                        hereDocumentOperator(TokenType.DLESSDASH, true);
                    } else {
                        hereDocumentOperator(TokenType.DLESS, false);
                    }
                } else if (match('&')) {
                    addToken(TokenType.LESSAND);
                } else if (match('>')) {
                    addToken(TokenType.LESSGREAT);
                } else {
                    addToken(TokenType.LESS);
                }
            }
            case '>' -> {
                advance();
                if (match('>')) {
                    addToken(TokenType.DGREAT);
                } else if (match('&')) {
                    addToken(TokenType.GREATAND);
                } else if (match('|')) {
                    addToken(TokenType.CLOBBER);
                } else {
                    addToken(TokenType.GREAT);
                }
            }
            default -> word();
        }
    }

    private void hereDocumentOperator(TokenType type, boolean stripTabs) {
        addToken(type);
        pendingHereDocuments.add(new PendingHereDocument(tokens.size() - 1, stripTabs));
    }

    /**
     * Reads the bodies of all here-documents opened on the line that just ended.
     * The delimiter is the word following each operator.
     */
    private void readHereDocumentBodies() {
        for (PendingHereDocument pending : pendingHereDocuments) {
            int delimiterIndex = pending.tokenIndex() + 1;
            if (delimiterIndex >= tokens.size() || tokens.get(delimiterIndex).type() != TokenType.WORD) {
                diagnostics.reportError("Here-document operator needs a delimiter word.", logicalFileName, line - 1);
                continue;
            }
            String delimiter = unquotedText((WordNode) tokens.get(delimiterIndex).value());
            StringBuilder body = new StringBuilder();
            boolean terminated = false;
            while (!isAtEnd()) {
                int lineStart = current;
                while (peek() != '\n' && !isAtEnd()) advance();
                String text = source.substring(lineStart, current);
                if (!isAtEnd()) advance();
                if (pending.stripTabs()) {
                    text = text.replaceFirst("^\t+", "");
                }
                if (text.equals(delimiter)) {
                    terminated = true;
                    break;
                }
                body.append(text).append('\n');
            }
            if (!terminated) {
                diagnostics.reportError("Here-document delimited by '" + delimiter + "' is not terminated.", logicalFileName, line);
            }
            Token operator = tokens.get(pending.tokenIndex());
            tokens.set(pending.tokenIndex(), operator.withValue(body.toString()));
        }
        pendingHereDocuments.clear();
    }

    private void arithmeticCommand() {
        int depth = 0;
        int exprStart = current;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0 && peekNext() == ')') {
                    String expression = source.substring(exprStart, current);
                    advance();
                    advance();
                    addToken(TokenType.ARITH_COMMAND, expression.trim());
                    return;
                }
                depth--;
            }
            advance();
        }
        diagnostics.reportError("Unterminated '(('.", logicalFileName, tokenLine);
    }

    private void word() {
        SourceInfo position = new SourceInfo(logicalFileName, tokenLine, tokenColumn);
        List<WordPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        while (!isAtEnd() && !isWordBreak(peek())) {
            char c = peek();
            if (c == '\\') {
                advance();
                if (isAtEnd()) {
                    literal.append('\\');
                } else {
                    char escaped = advance();
                    if (escaped != '\n') {
                        literal.append(escaped);
                    }
                }
            } else if (c == '\'') {
                flush(literal, parts);
                advance();
                parts.add(singleQuoted());
            } else if (c == '"') {
                flush(literal, parts);
                advance();
                parts.add(doubleQuoted());
            } else if (c == '`') {
                flush(literal, parts);
                advance();
                parts.add(backquoted());
            } else if (c == '$') {
                advance();
                WordPart expansion = dollar();
                if (expansion == null) {
                    literal.append('$');
                } else {
                    flush(literal, parts);
                    parts.add(expansion);
                }
            } else {
                literal.append(advance());
            }
        }
        flush(literal, parts);

        String text = source.substring(start, current);
        if ((peek() == '<' || peek() == '>') && !text.isEmpty() && text.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            addToken(TokenType.IO_NUMBER, Integer.parseInt(text));
            return;
        }
        addToken(TokenType.WORD, new WordNode(parts, position));
    }

    private WordPart singleQuoted() {
        int contentStart = current;
        while (peek() != '\'' && !isAtEnd()) advance();
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated single-quoted string.", logicalFileName, tokenLine);
            return new WordPart.SingleQuoted(source.substring(contentStart));
        }
        String text = source.substring(contentStart, current);
        advance();
        return new WordPart.SingleQuoted(text);
    }

    private WordPart doubleQuoted() {
        List<WordPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = peek();
            if (c == '\\') {
                advance();
                char next = peek();
                if (next == '$' || next == '`' || next == '"' || next == '\\') {
                    literal.append(advance());
                } else if (next == '\n') {
                    advance();
                } else {
                    literal.append('\\');
                }
            } else if (c == '`') {
                flush(literal, parts);
                advance();
                parts.add(backquoted());
            } else if (c == '$') {
                advance();
                WordPart expansion = dollar();
                if (expansion == null) {
                    literal.append('$');
                } else {
                    flush(literal, parts);
                    parts.add(expansion);
                }
            } else {
                literal.append(advance());
            }
        }
        flush(literal, parts);
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated double-quoted string.", logicalFileName, tokenLine);
        } else {
            advance();
        }
        return new WordPart.DoubleQuoted(parts);
    }

    private WordPart backquoted() {
        StringBuilder command = new StringBuilder();
        while (!isAtEnd() && peek() != '`') {
            char c = advance();
            if (c == '\\' && (peek() == '`' || peek() == '\\' || peek() == '$')) {
                command.append(advance());
            } else {
                command.append(c);
            }
        }
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated backquoted command.", logicalFileName, tokenLine);
        } else {
            advance();
        }
        return new WordPart.CommandSubstitution(command.toString().trim());
    }

    /**
     * Scans an expansion after a consumed {@code $}.
     * @return The expansion, or {@code null} if the dollar sign is literal.
     */
    private WordPart dollar() {
        char c = peek();
        if (c == '{') {
            advance();
            return bracedParameter();
        }
        if (c == '(') {
            advance();
            if (peek() == '(') {
                advance();
                return new WordPart.Arithmetic(balanced(2, "$((").trim());
            }
            return new WordPart.CommandSubstitution(balanced(1, "$(").trim());
        }
        if (isNameStart(c)) {
            int nameStart = current;
            while (isNameChar(peek())) advance();
            return new WordPart.Parameter(source.substring(nameStart, current), false, "");
        }
        if (isDigit(c) || "@*#?$!-".indexOf(c) >= 0) {
            advance();
            return new WordPart.Parameter(String.valueOf(c), false, "");
        }
        return null;
    }

    private WordPart bracedParameter() {
        int contentStart = current;
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) break;
                depth--;
            }
            advance();
        }
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated '${'.", logicalFileName, tokenLine);
            return new WordPart.Parameter("", true, source.substring(contentStart));
        }
        String content = source.substring(contentStart, current);
        advance();

        int nameEnd;
        if (!content.isEmpty() && isNameStart(content.charAt(0))) {
            nameEnd = 1;
            while (nameEnd < content.length() && isNameChar(content.charAt(nameEnd))) nameEnd++;
        } else if (!content.isEmpty() && isDigit(content.charAt(0))) {
            nameEnd = 1;
            while (nameEnd < content.length() && isDigit(content.charAt(nameEnd))) nameEnd++;
        } else if (!content.isEmpty() && "@*#?$!-".indexOf(content.charAt(0)) >= 0) {
            nameEnd = 1;
        } else {
            diagnostics.reportError("Bad substitution: ${" + content + "}", logicalFileName, tokenLine);
            return new WordPart.Parameter("", true, content);
        }
        return new WordPart.Parameter(content.substring(0, nameEnd), true, content.substring(nameEnd));
    }

    /**
     * Reads up to the closing parentheses of {@code $(} or {@code $((}, skipping
     * over quoted text.
     */
    private String balanced(int closing, String opener) {
        int contentStart = current;
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'' || c == '"') {
                advance();
                while (!isAtEnd() && peek() != c) {
                    if (c == '"' && peek() == '\\') advance();
                    if (!isAtEnd()) advance();
                }
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    String content = source.substring(contentStart, current);
                    advance();
                    if (closing == 2 && !match(')')) {
                        diagnostics.reportError("Expected '))' to close '" + opener + "'.", logicalFileName, tokenLine);
                    }
                    return content;
                }
                depth--;
            }
            if (!isAtEnd()) advance();
        }
        diagnostics.reportError("Unterminated '" + opener + "'.", logicalFileName, tokenLine);
        return source.substring(contentStart);
    }

    private static void flush(StringBuilder literal, List<WordPart> parts) {
        if (literal.length() > 0) {
            parts.add(new WordPart.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * Joins the text of a word ignoring quotes; used for here-document delimiters.
     */
    private static String unquotedText(WordNode word) {
        StringBuilder text = new StringBuilder();
        for (WordPart part : word.parts()) {
            if (part instanceof WordPart.Literal literal) {
                text.append(literal.text());
            } else if (part instanceof WordPart.SingleQuoted quoted) {
                text.append(quoted.text());
            } else if (part instanceof WordPart.DoubleQuoted quoted) {
                for (WordPart inner : quoted.parts()) {
                    if (inner instanceof WordPart.Literal literal) {
                        text.append(literal.text());
                    }
                }
            }
        }
        return text.toString();
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, tokenLine, tokenColumn, logicalFileName));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isWordBreak(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n'
                || c == '|' || c == '&' || c == ';' || c == '(' || c == ')' || c == '<' || c == '>';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c);
    }
}
