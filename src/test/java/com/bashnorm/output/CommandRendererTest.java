package com.bashnorm.output;

import com.bashnorm.ast.ArgType;
import com.bashnorm.ast.ArgumentNode;
import com.bashnorm.ast.BinaryLogicOpNode;
import com.bashnorm.ast.CommandSubstitutionNode;
import com.bashnorm.ast.FlagNode;
import com.bashnorm.ast.HeadCommandNode;
import com.bashnorm.ast.PipelineNode;
import com.bashnorm.ast.RootNode;
import com.bashnorm.ast.UnaryLogicOpNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandRendererTest {

    private final CommandRenderer strict = new CommandRenderer(RenderOptions.STRICT);
    private final CommandRenderer loose = new CommandRenderer(RenderOptions.LOOSE);

    private static RootNode root(HeadCommandNode head) {
        RootNode root = new RootNode();
        root.appendChild(head);
        return root;
    }

    private static HeadCommandNode command(String name, String... flags) {
        HeadCommandNode head = new HeadCommandNode(name);
        for (String flag : flags) {
            head.appendChild(new FlagNode(flag));
        }
        return head;
    }

    @Test
    public void testTokens() {
        HeadCommandNode find = command("find");
        find.appendChild(new ArgumentNode(".", ArgType.FILE));
        FlagNode name = new FlagNode("-name");
        name.appendChild(new ArgumentNode("'*.txt'", ArgType.PATTERN));
        find.appendChild(name);

        RootNode root = root(find);

        assertEquals(List.of("find", ".", "-name", "'*.txt'"), strict.toTokens(root));
        assertEquals("find . -name '*.txt'", strict.toCommand(root));
    }

    @Test
    public void testEmbeddedCommandTerminator() {
        HeadCommandNode find = command("find");
        FlagNode exec = new FlagNode("-exec");
        HeadCommandNode rm = command("rm");
        rm.appendChild(new ArgumentNode("{}", ArgType.RESERVED_WORD));
        exec.appendChild(rm);
        exec.setTerminator(";");
        find.appendChild(exec);

        assertEquals("find -exec rm {} \\;", strict.toCommand(root(find)));
    }

    @Test
    public void testBareSemicolonArgumentIsEscaped() {
        HeadCommandNode echo = command("echo");
        echo.appendChild(new ArgumentNode(";", ArgType.RESERVED_WORD));

        assertEquals("echo \\;", strict.toCommand(root(echo)));
    }

    @Test
    public void testBinaryAndUnaryOperators() {
        HeadCommandNode find = command("find");
        BinaryLogicOpNode or = new BinaryLogicOpNode("-or");
        or.appendChild(new FlagNode("-empty"));
        UnaryLogicOpNode not = new UnaryLogicOpNode("!");
        not.appendChild(new FlagNode("-readable"));
        or.appendChild(not);
        find.appendChild(or);

        assertEquals("find \\( -empty -or ! -readable \\)", strict.toCommand(root(find)));
    }

    @Test
    public void testPipelineAndSubstitution() {
        PipelineNode pipeline = new PipelineNode();
        pipeline.appendChild(command("ls", "-l"));
        HeadCommandNode echo = command("echo");
        CommandSubstitutionNode substitution = new CommandSubstitutionNode();
        substitution.appendChild(command("pwd"));
        echo.appendChild(substitution);
        pipeline.appendChild(echo);
        RootNode root = new RootNode();
        root.appendChild(pipeline);

        assertEquals("ls -l | echo $( pwd )", strict.toCommand(root));
    }

    @Test
    public void testStrictRejectsArityViolations() {
        PipelineNode pipeline = new PipelineNode();
        pipeline.appendChild(command("ls"));
        RootNode root = new RootNode();
        root.appendChild(pipeline);

        MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> strict.toTokens(root));
        assertSame(pipeline, e.node());

        HeadCommandNode find = command("find");
        BinaryLogicOpNode or = new BinaryLogicOpNode("-or");
        or.appendChild(new FlagNode("-empty"));
        find.appendChild(or);
        assertThrows(MalformedTreeException.class, () -> strict.toTokens(root(find)));

        assertThrows(MalformedTreeException.class, () -> strict.toTokens(new RootNode()));
    }

    @Test
    public void testLooseDegrades() {
        PipelineNode pipeline = new PipelineNode();
        pipeline.appendChild(command("ls", "-l"));
        RootNode root = new RootNode();
        root.appendChild(pipeline);
        assertEquals("ls -l", loose.toCommand(root));

        HeadCommandNode find = command("find");
        BinaryLogicOpNode or = new BinaryLogicOpNode("-or");
        or.appendChild(new FlagNode("-empty"));
        find.appendChild(or);
        assertEquals("find -empty", loose.toCommand(root(find)));

        assertEquals("|", loose.toCommand(new PipelineNode()));
        assertEquals("$( )", loose.toCommand(new CommandSubstitutionNode()));
    }

    @Test
    public void testLexicalFlagOrder() {
        CommandRenderer lexical = new CommandRenderer(RenderOptions.STRICT.withFlagOrder(RenderOptions.FlagOrder.LEXICAL));
        HeadCommandNode first = command("ls", "-l", "-a");
        first.appendChild(new ArgumentNode("/tmp", ArgType.FILE));
        HeadCommandNode second = command("ls", "-a", "-l");
        second.appendChild(new ArgumentNode("/tmp", ArgType.FILE));

        assertEquals("ls -a -l /tmp", lexical.toCommand(first));
        assertEquals(lexical.toCommand(first), lexical.toCommand(second));
        assertEquals("ls -l -a /tmp", strict.toCommand(first));
    }

    @Test
    public void testLexicalOrderKeepsArgumentPositions() {
        CommandRenderer lexical = new CommandRenderer(RenderOptions.LOOSE.withFlagOrder(RenderOptions.FlagOrder.LEXICAL));
        HeadCommandNode cp = command("cp");
        cp.appendChild(new FlagNode("-r"));
        cp.appendChild(new ArgumentNode("src", ArgType.FILE));
        cp.appendChild(new FlagNode("-f"));
        cp.appendChild(new ArgumentNode("dst", ArgType.FILE));

        assertEquals("cp -f src -r dst", lexical.toCommand(root(cp)));
    }

    @Test
    public void testTemplate() {
        HeadCommandNode find = command("find");
        find.appendChild(new ArgumentNode(".", ArgType.FILE));
        FlagNode type = new FlagNode("-type");
        type.appendChild(new ArgumentNode("f", ArgType.UNKNOWN));
        FlagNode exec = new FlagNode("-exec");
        HeadCommandNode rm = command("rm");
        rm.appendChild(new ArgumentNode("{}", ArgType.RESERVED_WORD));
        exec.appendChild(rm);
        exec.setTerminator(";");
        find.appendChild(exec);
        find.appendChild(type);

        assertEquals("find File -exec rm {} \\; -type Unknown", CommandRenderer.toTemplate(root(find)));
    }

    @Test
    public void testPrettyPrint() {
        HeadCommandNode ls = command("ls", "-l");
        ls.appendChild(new ArgumentNode("/tmp", ArgType.FILE));

        assertEquals("ROOT()\n    HEADCOMMAND(ls)\n        FLAG(-l)\n        ARGUMENT(/tmp <File>)\n",
            CommandRenderer.prettyPrint(root(ls)));
    }

    @Test
    public void testRejectsTooDeepTree() {
        HeadCommandNode find = new HeadCommandNode("find");
        RootNode root = root(find);
        UnaryLogicOpNode innermost = new UnaryLogicOpNode("!");
        find.appendChild(innermost);
        for (int i = 0; i < 200; i++) {
            UnaryLogicOpNode not = new UnaryLogicOpNode("!");
            innermost.appendChild(not);
            innermost = not;
        }
        innermost.appendChild(new FlagNode("-empty"));

        assertThrows(MalformedTreeException.class, () -> loose.toCommand(root));
        assertThrows(MalformedTreeException.class, () -> CommandRenderer.prettyPrint(root));
        assertEquals(201 + 2, new CommandRenderer(RenderOptions.LOOSE, 250).toTokens(root).size());
    }
}
