package org.shellgo.compiler.frontend.parser;

import org.shellgo.compiler.api.SourceInfo;
import org.shellgo.compiler.diagnostics.DiagnosticsEngine;
import org.shellgo.compiler.frontend.lexer.Token;
import org.shellgo.compiler.frontend.lexer.TokenType;
import org.shellgo.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A recursive-descent parser for the supported shell grammar. It consumes the
 * tokens produced by the {@link org.shellgo.compiler.frontend.lexer.Lexer} and
 * produces a {@link ScriptNode}.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine}; after an error the parser
 * skips to the next line and continues, so one run reports as many problems as
 * possible.
 */
public class Parser {

    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=(.*)$", Pattern.DOTALL);
    private static final Set<String> DECLARATION_KEYWORDS = Set.of("local", "export", "readonly", "declare", "typeset");
    private static final Set<String> CLOSING_WORDS = Set.of("then", "do", "done", "fi", "elif", "else", "esac", "}");

    private static final Set<String> THEN = Set.of("then");
    private static final Set<String> IF_BODY_END = Set.of("elif", "else", "fi");
    private static final Set<String> FI = Set.of("fi");
    private static final Set<String> DO = Set.of("do");
    private static final Set<String> DONE = Set.of("done");
    private static final Set<String> ESAC = Set.of("esac");
    private static final Set<String> CLOSE_BRACE = Set.of("}");

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private int current = 0;

    /**
     * Signals a syntax error that has already been reported; unwinds to the statement level.
     */
    private static final class SyntaxError extends RuntimeException {
        SyntaxError(String message) {
            super(message, null, false, false);
        }
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param fileName The logical name of the script.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Parses the entire token stream.
     * @return The script node; check the diagnostics engine for errors.
     */
    public ScriptNode parse() {
        List<StatementNode> statements = new ArrayList<>();
        while (true) {
            try {
                statements.addAll(statementList(Set.of()));
                if (isAtEnd()) {
                    break;
                }
                Token unexpected = peek();
                throw error(unexpected, "Unexpected '" + unexpected.text() + "'.");
            } catch (SyntaxError e) {
                synchronize();
                if (isAtEnd()) {
                    break;
                }
            }
        }
        return new ScriptNode(fileName, statements);
    }

    /**
     * Parses statements until the end of input, a closing token, or one of the given reserved words
     * in command position.
     */
    private List<StatementNode> statementList(Set<String> stopWords) {
        List<StatementNode> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd() && !check(TokenType.RPAREN) && !check(TokenType.DSEMI) && !checkWord(stopWords)) {
            if (checkWord(CLOSING_WORDS)) {
                throw error(peek(), "Unexpected '" + peek().text() + "'.");
            }
            StatementNode statement = andOr();
            if (match(TokenType.AMP)) {
                statement = statement.asBackground();
            } else if (!match(TokenType.SEMI, TokenType.NEWLINE)) {
                if (!isAtEnd() && !check(TokenType.RPAREN) && !check(TokenType.DSEMI) && !checkWord(stopWords)) {
                    throw error(peek(), "Unexpected '" + peek().text() + "' after command.");
                }
            }
            statements.add(statement);
            skipSeparators();
        }
        return statements;
    }

    private StatementNode andOr() {
        StatementNode left = pipeline();
        while (check(TokenType.AND_IF) || check(TokenType.OR_IF)) {
            BinaryNode.Op op = advance().type() == TokenType.AND_IF ? BinaryNode.Op.AND : BinaryNode.Op.OR;
            skipNewlines();
            StatementNode right = pipeline();
            left = new StatementNode(new BinaryNode(op, left, right, left.source()), List.of(), false, false, left.source());
        }
        return left;
    }

    private StatementNode pipeline() {
        boolean negated = false;
        if (checkWord(Set.of("!"))) {
            advance();
            negated = true;
        }
        StatementNode left = command();
        while (match(TokenType.PIPE)) {
            skipNewlines();
            StatementNode right = command();
            left = new StatementNode(new BinaryNode(BinaryNode.Op.PIPE, left, right, left.source()), List.of(), false, false, left.source());
        }
        if (negated) {
            return new StatementNode(left.command(), left.redirects(), false, true, left.source());
        }
        return left;
    }

    private StatementNode command() {
        Token first = peek();
        SourceInfo position = sourceOf(first);

        if (match(TokenType.LPAREN)) {
            List<StatementNode> body = statementList(Set.of());
            consume(TokenType.RPAREN, "Expected ')' to close subshell.");
            return withRedirects(new SubshellNode(body, position), position);
        }
        if (check(TokenType.ARITH_COMMAND)) {
            String expression = (String) advance().value();
            return withRedirects(new ArithmeticCommandNode(expression, position), position);
        }
        if (first.type() == TokenType.WORD) {
            String keyword = ((WordNode) first.value()).plainLiteral();
            if (keyword != null) {
                switch (keyword) {
                    case "if" -> {
                        advance();
                        return withRedirects(ifClause(position), position);
                    }
                    case "while", "until" -> {
                        advance();
                        return withRedirects(whileClause(keyword.equals("until"), position), position);
                    }
                    case "for" -> {
                        advance();
                        return withRedirects(forClause(position), position);
                    }
                    case "case" -> {
                        advance();
                        return withRedirects(caseClause(position), position);
                    }
                    case "{" -> {
                        advance();
                        List<StatementNode> body = statementList(CLOSE_BRACE);
                        expectWord("}");
                        return withRedirects(new BlockNode(body, position), position);
                    }
                    case "function" -> {
                        advance();
                        return new StatementNode(functionDefinition(true), List.of(), false, false, position);
                    }
                    case "[[" -> {
                        return withRedirects(testExpression(position), position);
                    }
                    default -> {
                        if (checkNext(TokenType.LPAREN) && isFunctionName(keyword)) {
                            return new StatementNode(functionDefinition(false), List.of(), false, false, position);
                        }
                    }
                }
            }
        }
        return simpleCommand(position);
    }

    private IfNode ifClause(SourceInfo position) {
        List<StatementNode> condition = statementList(THEN);
        if (condition.isEmpty()) {
            throw error(peek(), "Expected a condition before 'then'.");
        }
        expectWord("then");
        List<StatementNode> thenBranch = statementList(IF_BODY_END);
        IfNode elseBranch = null;
        if (checkWord(Set.of("elif"))) {
            SourceInfo elifPosition = sourceOf(advance());
            elseBranch = ifClause(elifPosition);
        } else if (checkWord(Set.of("else"))) {
            SourceInfo elsePosition = sourceOf(advance());
            List<StatementNode> body = statementList(FI);
            expectWord("fi");
            elseBranch = new IfNode(List.of(), body, null, elsePosition);
        } else {
            expectWord("fi");
        }
        return new IfNode(condition, thenBranch, elseBranch, position);
    }

    private WhileNode whileClause(boolean until, SourceInfo position) {
        List<StatementNode> condition = statementList(DO);
        if (condition.isEmpty()) {
            throw error(peek(), "Expected a condition before 'do'.");
        }
        List<StatementNode> body = doGroup();
        return new WhileNode(until, condition, body, position);
    }

    private AstNode forClause(SourceInfo position) {
        if (check(TokenType.ARITH_COMMAND)) {
            String header = (String) advance().value();
            match(TokenType.SEMI);
            skipNewlines();
            return new ArithmeticForNode(header, doGroup(), position);
        }
        Token nameToken = consume(TokenType.WORD, "Expected a variable name after 'for'.");
        String name = ((WordNode) nameToken.value()).plainLiteral();
        if (name == null || !isName(name)) {
            throw error(nameToken, "Invalid loop variable '" + nameToken.text() + "'.");
        }
        skipNewlines();
        List<WordNode> items = new ArrayList<>();
        boolean hasInClause = false;
        if (checkWord(Set.of("in"))) {
            advance();
            hasInClause = true;
            while (check(TokenType.WORD)) {
                items.add((WordNode) advance().value());
            }
        }
        match(TokenType.SEMI);
        skipNewlines();
        return new ForNode(name, items, hasInClause, doGroup(), position);
    }

    private List<StatementNode> doGroup() {
        expectWord("do");
        List<StatementNode> body = statementList(DONE);
        expectWord("done");
        return body;
    }

    private CaseNode caseClause(SourceInfo position) {
        Token subject = consume(TokenType.WORD, "Expected a word after 'case'.");
        skipNewlines();
        expectWord("in");
        skipNewlines();
        List<CaseNode.Item> items = new ArrayList<>();
        while (!isAtEnd() && !checkWord(ESAC)) {
            match(TokenType.LPAREN);
            List<WordNode> patterns = new ArrayList<>();
            patterns.add((WordNode) consume(TokenType.WORD, "Expected a case pattern.").value());
            while (match(TokenType.PIPE)) {
                patterns.add((WordNode) consume(TokenType.WORD, "Expected a case pattern after '|'.").value());
            }
            consume(TokenType.RPAREN, "Expected ')' after case pattern.");
            List<StatementNode> body = statementList(ESAC);
            items.add(new CaseNode.Item(patterns, body));
            match(TokenType.DSEMI);
            skipNewlines();
        }
        expectWord("esac");
        return new CaseNode((WordNode) subject.value(), items, position);
    }

    private FunctionNode functionDefinition(boolean keywordForm) {
        Token nameToken = consume(TokenType.WORD, "Expected a function name.");
        String name = ((WordNode) nameToken.value()).plainLiteral();
        if (name == null || !isFunctionName(name)) {
            throw error(nameToken, "Invalid function name '" + nameToken.text() + "'.");
        }
        if (!keywordForm || check(TokenType.LPAREN)) {
            consume(TokenType.LPAREN, "Expected '(' after function name.");
            consume(TokenType.RPAREN, "Expected ')' after '(' in function definition.");
        }
        skipNewlines();
        StatementNode body = command();
        return new FunctionNode(name, body, sourceOf(nameToken));
    }

    /**
     * Reads {@code [[ ... ]]} as a plain command whose words are the operator and operand texts,
     * so that it can be rejected later with a precise message.
     */
    private StatementNode testExpression(SourceInfo position) {
        List<WordNode> words = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = advance();
            WordNode word = token.type() == TokenType.WORD
                    ? (WordNode) token.value()
                    : new WordNode(List.of(new WordPart.Literal(token.text())), sourceOf(token));
            words.add(word);
            if (word.isPlainLiteral("]]")) {
                return new StatementNode(new CallNode(List.of(), words, position), List.of(), false, false, position);
            }
        }
        throw error(peek(), "Expected ']]' to close '[['.");
    }

    private StatementNode simpleCommand(SourceInfo position) {
        List<AssignNode> assigns = new ArrayList<>();
        List<WordNode> args = new ArrayList<>();
        List<RedirectNode> redirects = new ArrayList<>();
        DeclNode declaration = null;

        while (true) {
            if (check(TokenType.IO_NUMBER) || peek().type().isRedirection()) {
                redirects.add(redirect());
            } else if (check(TokenType.WORD)) {
                WordNode word = (WordNode) peek().value();
                if (args.isEmpty() && declaration == null) {
                    AssignNode assign = assignment(word);
                    if (assign != null) {
                        advance();
                        assigns.add(assign);
                        continue;
                    }
                    String literal = word.plainLiteral();
                    if (literal != null && DECLARATION_KEYWORDS.contains(literal)) {
                        Token keyword = advance();
                        if (literal.equals("readonly")) {
                            diagnostics.reportWarning("'readonly' is converted to a plain assignment; later writes are not rejected.",
                                    keyword.fileName(), keyword.line());
                        }
                        declaration = declarationOperands(literal, position);
                        continue;
                    }
                }
                if (declaration != null) {
                    break;
                }
                advance();
                args.add(word);
            } else {
                break;
            }
        }

        if (declaration != null) {
            if (!assigns.isEmpty()) {
                throw error(peek(), "Assignments before '" + declaration.variant() + "' are not allowed.");
            }
            return new StatementNode(declaration, redirects, false, false, position);
        }
        if (assigns.isEmpty() && args.isEmpty() && redirects.isEmpty()) {
            Token unexpected = peek();
            throw error(unexpected, unexpected.type() == TokenType.END_OF_FILE
                    ? "Expected a command."
                    : "Expected a command, found '" + unexpected.text() + "'.");
        }
        return new StatementNode(new CallNode(assigns, args, position), redirects, false, false, position);
    }

    private DeclNode declarationOperands(String variant, SourceInfo position) {
        List<String> flags = new ArrayList<>();
        List<AssignNode> assigns = new ArrayList<>();
        while (check(TokenType.WORD)) {
            Token token = advance();
            WordNode word = (WordNode) token.value();
            AssignNode assign = assignment(word);
            if (assign != null) {
                assigns.add(assign);
                continue;
            }
            String literal = word.plainLiteral();
            if (literal != null && literal.startsWith("-")) {
                flags.add(literal);
            } else if (literal != null && isName(literal)) {
                assigns.add(new AssignNode(literal, null, word.source()));
            } else {
                throw error(token, "Invalid operand '" + token.text() + "' for '" + variant + "'.");
            }
        }
        return new DeclNode(variant, flags, assigns, position);
    }

    /**
     * Splits {@code NAME=value} words. Only an unquoted name followed by {@code =} counts.
     */
    private static AssignNode assignment(WordNode word) {
        if (word.parts().isEmpty() || !(word.parts().get(0) instanceof WordPart.Literal head)) {
            return null;
        }
        Matcher matcher = ASSIGNMENT.matcher(head.text());
        if (!matcher.matches()) {
            return null;
        }
        List<WordPart> valueParts = new ArrayList<>();
        if (!matcher.group(2).isEmpty()) {
            valueParts.add(new WordPart.Literal(matcher.group(2)));
        }
        valueParts.addAll(word.parts().subList(1, word.parts().size()));
        return new AssignNode(matcher.group(1), new WordNode(valueParts, word.source()), word.source());
    }

    private RedirectNode redirect() {
        Integer fd = null;
        if (check(TokenType.IO_NUMBER)) {
            fd = (Integer) advance().value();
        }
        Token operator = advance();
        RedirectNode.Op op = switch (operator.type()) {
            case GREAT -> RedirectNode.Op.OUTPUT;
            case DGREAT -> RedirectNode.Op.APPEND;
            case LESS -> RedirectNode.Op.INPUT;
            case CLOBBER -> RedirectNode.Op.CLOBBER;
            case GREATAND -> RedirectNode.Op.DUP_OUTPUT;
            case LESSAND -> RedirectNode.Op.DUP_INPUT;
            case AND_GREAT -> RedirectNode.Op.OUTPUT_AND_ERROR;
            case AND_DGREAT -> RedirectNode.Op.APPEND_AND_ERROR;
            case DLESS, DLESSDASH -> RedirectNode.Op.HEREDOC;
            case TLESS -> RedirectNode.Op.HERESTRING;
            case LESSGREAT -> RedirectNode.Op.READ_WRITE;
            default -> throw error(operator, "Expected a redirection operator.");
        };
        Token target = consume(TokenType.WORD, "Expected a target after '" + operator.text() + "'.");
        String hereDocument = op == RedirectNode.Op.HEREDOC ? (String) operator.value() : null;
        return new RedirectNode(op, fd, (WordNode) target.value(), hereDocument, sourceOf(operator));
    }

    private StatementNode withRedirects(AstNode command, SourceInfo position) {
        List<RedirectNode> redirects = new ArrayList<>();
        while (check(TokenType.IO_NUMBER) || peek().type().isRedirection()) {
            redirects.add(redirect());
        }
        return new StatementNode(command, redirects, false, false, position);
    }

    private void expectWord(String keyword) {
        if (checkWord(Set.of(keyword))) {
            advance();
            return;
        }
        Token unexpected = peek();
        throw error(unexpected, unexpected.type() == TokenType.END_OF_FILE
                ? "Expected '" + keyword + "' before end of script."
                : "Expected '" + keyword + "', found '" + unexpected.text() + "'.");
    }

    private boolean checkWord(Set<String> words) {
        if (!check(TokenType.WORD)) return false;
        String literal = ((WordNode) peek().value()).plainLiteral();
        return literal != null && words.contains(literal);
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMI)) {
            // skip
        }
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    private void synchronize() {
        while (!isAtEnd()) {
            if (advance().type() == TokenType.NEWLINE) return;
        }
    }

    private SyntaxError error(Token token, String message) {
        diagnostics.reportError(message, token.fileName(), token.line());
        return new SyntaxError(message);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private SourceInfo sourceOf(Token token) {
        return new SourceInfo(token.fileName(), token.line(), token.column());
    }

    private static boolean isName(String text) {
        return text.matches("[A-Za-z_][A-Za-z0-9_]*");
    }

    private static boolean isFunctionName(String text) {
        return text.matches("[A-Za-z_][A-Za-z0-9_.:-]*");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
