package org.shellgo.compiler.frontend;

import org.shellgo.compiler.diagnostics.DiagnosticsEngine;
import org.shellgo.compiler.frontend.lexer.Lexer;
import org.shellgo.compiler.frontend.parser.Parser;
import org.shellgo.compiler.frontend.parser.ast.AssignNode;
import org.shellgo.compiler.frontend.parser.ast.BinaryNode;
import org.shellgo.compiler.frontend.parser.ast.CallNode;
import org.shellgo.compiler.frontend.parser.ast.CaseNode;
import org.shellgo.compiler.frontend.parser.ast.DeclNode;
import org.shellgo.compiler.frontend.parser.ast.ForNode;
import org.shellgo.compiler.frontend.parser.ast.FunctionNode;
import org.shellgo.compiler.frontend.parser.ast.IfNode;
import org.shellgo.compiler.frontend.parser.ast.RedirectNode;
import org.shellgo.compiler.frontend.parser.ast.ScriptNode;
import org.shellgo.compiler.frontend.parser.ast.StatementNode;
import org.shellgo.compiler.frontend.parser.ast.SubshellNode;
import org.shellgo.compiler.frontend.parser.ast.WhileNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify that the token stream is turned into the expected syntax
 * tree for each supported statement form and that errors are reported.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private ScriptNode parse(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, diagnostics, "test.sh").scanTokens(), diagnostics, "test.sh").parse();
    }

    /**
     * Verifies that leading assignments and command words end up in one call node.
     */
    @Test
    @Tag("unit")
    void testSimpleCommandWithAssignment() {
        // Act
        ScriptNode script = parse("NAME=World echo \"Hello\"\n");

        // Assert
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(script.statements()).hasSize(1);
        CallNode call = (CallNode) script.statements().get(0).command();
        assertThat(call.assigns()).extracting(AssignNode::name).containsExactly("NAME");
        assertThat(call.args()).hasSize(2);
        assertThat(call.args().get(0).plainLiteral()).isEqualTo("echo");
    }

    /**
     * Verifies that pipelines nest to the left.
     */
    @Test
    @Tag("unit")
    void testPipelineNestsLeft() {
        // Act
        ScriptNode script = parse("a | b | c");

        // Assert
        BinaryNode outer = (BinaryNode) script.statements().get(0).command();
        assertThat(outer.op()).isEqualTo(BinaryNode.Op.PIPE);
        assertThat(outer.left().command()).isInstanceOf(BinaryNode.class);
        assertThat(((CallNode) outer.right().command()).args().get(0).plainLiteral()).isEqualTo("c");
    }

    /**
     * Verifies that elif and else clauses nest in the else position.
     */
    @Test
    @Tag("unit")
    void testIfElifElse() {
        // Act
        ScriptNode script = parse(String.join("\n",
                "if [ -f a ]; then",
                "  echo a",
                "elif [ -f b ]; then",
                "  echo b",
                "else",
                "  echo c",
                "fi"));

        // Assert
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        IfNode ifNode = (IfNode) script.statements().get(0).command();
        assertThat(ifNode.condition()).hasSize(1);
        assertThat(ifNode.thenBranch()).hasSize(1);
        IfNode elif = ifNode.elseBranch();
        assertThat(elif.isPlainElse()).isFalse();
        assertThat(elif.elseBranch().isPlainElse()).isTrue();
        assertThat(elif.elseBranch().elseBranch()).isNull();
    }

    /**
     * Verifies loops, functions, subshells and declarations.
     */
    @Test
    @Tag("unit")
    void testCompoundCommands() {
        // Act
        ScriptNode script = parse(String.join("\n",
                "for f in *.sh; do echo $f; done",
                "while true; do break; done",
                "greet() { local who=$1; echo $who; }",
                "(cd /tmp && ls)",
                "export PATH"));

        // Assert
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(script.statements()).extracting(StatementNode::command).hasExactlyElementsOfTypes(
                ForNode.class, WhileNode.class, FunctionNode.class, SubshellNode.class, DeclNode.class);
        ForNode loop = (ForNode) script.statements().get(0).command();
        assertThat(loop.variable()).isEqualTo("f");
        assertThat(loop.hasInClause()).isTrue();
        DeclNode export = (DeclNode) script.statements().get(4).command();
        assertThat(export.variant()).isEqualTo("export");
        assertThat(export.assigns()).extracting(AssignNode::value).containsOnlyNulls();
    }

    /**
     * Verifies that case statements are parsed so that they can be rejected later.
     */
    @Test
    @Tag("unit")
    void testCaseStatement() {
        // Act
        ScriptNode script = parse("case $x in\n  a|b) echo ab ;;\n  *) echo other ;;\nesac\n");

        // Assert
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        CaseNode node = (CaseNode) script.statements().get(0).command();
        assertThat(node.items()).hasSize(2);
        assertThat(node.items().get(0).patterns()).hasSize(2);
    }

    /**
     * Verifies that redirections and the background marker are attached to the statement.
     */
    @Test
    @Tag("unit")
    void testRedirectionsAndBackground() {
        // Act
        ScriptNode script = parse("echo hi >> log.txt\nsleep 1 &\n");

        // Assert
        StatementNode redirected = script.statements().get(0);
        assertThat(redirected.redirects()).extracting(RedirectNode::op).containsExactly(RedirectNode.Op.APPEND);
        assertThat(redirected.redirects().get(0).target().plainLiteral()).isEqualTo("log.txt");
        assertThat(script.statements().get(1).background()).isTrue();
    }

    /**
     * Verifies that a missing keyword is reported and that parsing continues on the next line.
     */
    @Test
    @Tag("unit")
    void testMissingFiIsReported() {
        // Act
        parse("if true; then\n  echo yes\n");

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Expected 'fi' before end of script.");
    }

    /**
     * Verifies that a stray closing keyword is an error.
     */
    @Test
    @Tag("unit")
    void testUnexpectedDone() {
        // Act
        parse("echo a\ndone\necho b\n");

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.getDiagnostics().get(0).lineNumber()).isEqualTo(2);
    }
}
