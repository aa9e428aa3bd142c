package com.bashnorm.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SimpleShellParserTest {

    private final SimpleShellParser parser = new SimpleShellParser();

    private SyntaxNode parseOne(String command) {
        List<SyntaxNode> trees = parser.parse(command);
        assertEquals(1, trees.size());
        return trees.get(0);
    }

    @Test
    public void testSimpleCommand() {
        SyntaxNode command = parseOne("ls -la /tmp");

        assertEquals(SyntaxKind.COMMAND, command.kind());
        assertEquals(3, command.parts().size());
        assertEquals("ls", command.parts().get(0).word());
        assertEquals("-la", command.parts().get(1).word());
        assertEquals("/tmp", command.parts().get(2).word());
        assertEquals(3, command.parts().get(1).start());
        assertEquals(6, command.parts().get(1).end());
    }

    @Test
    public void testPipeline() {
        SyntaxNode pipeline = parseOne("ls | grep foo");

        assertEquals(SyntaxKind.PIPELINE, pipeline.kind());
        assertEquals(3, pipeline.parts().size());
        assertEquals(SyntaxKind.COMMAND, pipeline.parts().get(0).kind());
        assertEquals(SyntaxKind.PIPE, pipeline.parts().get(1).kind());
        assertEquals(SyntaxKind.COMMAND, pipeline.parts().get(2).kind());
    }

    @Test
    public void testList() {
        SyntaxNode list = parseOne("cd /tmp && ls");

        assertEquals(SyntaxKind.LIST, list.kind());
        assertEquals(3, list.parts().size());
        assertEquals(SyntaxKind.OPERATOR, list.parts().get(1).kind());
        assertEquals("&&", list.parts().get(1).word());
    }

    @Test
    public void testTrailingSemicolonMakesTwoPartList() {
        SyntaxNode list = parseOne("ls ;");

        assertEquals(SyntaxKind.LIST, list.kind());
        assertEquals(2, list.parts().size());
    }

    @Test
    public void testQuotedWordsKeepSourceSpan() {
        SyntaxNode command = parseOne("echo \"a b\" 'c'");

        SyntaxNode quoted = command.parts().get(1);
        assertEquals("a b", quoted.word());
        assertEquals(5, quoted.start());
        assertEquals(10, quoted.end());
        assertEquals("c", command.parts().get(2).word());
    }

    @Test
    public void testEscapedSemicolonIsAWord() {
        SyntaxNode command = parseOne("find . -exec rm {} \\;");

        assertEquals(SyntaxKind.COMMAND, command.kind());
        assertEquals(6, command.parts().size());
        assertEquals("{}", command.parts().get(4).word());
        assertEquals(";", command.parts().get(5).word());
    }

    @Test
    public void testEscapedParenthesesAreWords() {
        SyntaxNode command = parseOne("find . \\( -name a \\)");

        assertEquals("(", command.parts().get(2).word());
        assertEquals(")", command.parts().get(5).word());
    }

    @Test
    public void testCommandSubstitution() {
        SyntaxNode command = parseOne("echo $(date)");

        SyntaxNode word = command.parts().get(1);
        assertEquals("$(date)", word.word());
        assertTrue(word.hasParts());
        SyntaxNode substitution = word.parts().getFirst();
        assertEquals(SyntaxKind.COMMANDSUBSTITUTION, substitution.kind());
        assertEquals(SyntaxKind.COMMAND, substitution.command().kind());
        assertEquals("date", substitution.command().parts().getFirst().word());
    }

    @Test
    public void testBackquoteSubstitution() {
        SyntaxNode command = parseOne("echo `pwd`");

        SyntaxNode substitution = command.parts().get(1).parts().getFirst();
        assertEquals(SyntaxKind.COMMANDSUBSTITUTION, substitution.kind());
        assertEquals("pwd", substitution.command().parts().getFirst().word());
    }

    @Test
    public void testProcessSubstitution() {
        String source = "diff <(ls a) <(ls b)";
        SyntaxNode command = parseOne(source);

        assertEquals(3, command.parts().size());
        SyntaxNode substitution = command.parts().get(1).parts().getFirst();
        assertEquals(SyntaxKind.PROCESSSUBSTITUTION, substitution.kind());
        assertEquals('<', source.charAt(substitution.start()));
        assertEquals(SyntaxKind.COMMAND, substitution.command().kind());
    }

    @Test
    public void testParameterAndTilde() {
        SyntaxNode command = parseOne("cat ~/notes.txt $HOME");

        SyntaxNode tilde = command.parts().get(1);
        assertEquals("~/notes.txt", tilde.word());
        assertEquals(SyntaxKind.TILDE, tilde.parts().getFirst().kind());
        SyntaxNode parameter = command.parts().get(2).parts().getFirst();
        assertEquals(SyntaxKind.PARAMETER, parameter.kind());
        assertEquals("HOME", parameter.word());
    }

    @Test
    public void testRedirect() {
        SyntaxNode command = parseOne("ls > out.txt");

        assertEquals(2, command.parts().size());
        SyntaxNode redirect = command.parts().get(1);
        assertEquals(SyntaxKind.REDIRECT, redirect.kind());
        assertEquals(">", redirect.word());
        assertEquals("out.txt", redirect.parts().getFirst().word());
    }

    @Test
    public void testHeredoc() {
        SyntaxNode command = parseOne("cat << EOF");

        assertEquals(SyntaxKind.HEREDOC, command.parts().get(1).kind());
    }

    @Test
    public void testAssignment() {
        SyntaxNode command = parseOne("FOO=bar ls");

        assertEquals(SyntaxKind.ASSIGNMENT, command.parts().get(0).kind());
        assertEquals(SyntaxKind.WORD, command.parts().get(1).kind());
    }

    @Test
    public void testCompoundCommand() {
        SyntaxNode loop = parseOne("for f in *; do echo $f; done");

        assertEquals(SyntaxKind.FOR, loop.kind());
    }

    @Test
    public void testNewlineSeparatesStatements() {
        assertEquals(2, parser.parse("ls\npwd").size());
    }

    @Test
    public void testParseErrors() {
        ShellParseException unterminated = assertThrows(ShellParseException.class, () -> parser.parse("echo \"abc"));
        assertEquals(ParseErrorKind.MISMATCHED_DELIMITER, unterminated.kind());

        ShellParseException subshell = assertThrows(ShellParseException.class, () -> parser.parse("(cd /tmp)"));
        assertEquals(ParseErrorKind.UNIMPLEMENTED, subshell.kind());

        ShellParseException danglingPipe = assertThrows(ShellParseException.class, () -> parser.parse("ls |"));
        assertEquals(ParseErrorKind.GRAMMAR, danglingPipe.kind());

        ShellParseException empty = assertThrows(ShellParseException.class, () -> parser.parse("  "));
        assertEquals(ParseErrorKind.EMPTY_INPUT, empty.kind());
    }
}
