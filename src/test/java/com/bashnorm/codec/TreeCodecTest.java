package com.bashnorm.codec;

import com.bashnorm.ast.ArgType;
import com.bashnorm.ast.ArgumentNode;
import com.bashnorm.ast.FlagNode;
import com.bashnorm.ast.HeadCommandNode;
import com.bashnorm.ast.RootNode;
import com.bashnorm.ast.UnaryLogicOpNode;
import com.bashnorm.grammar.UtilityGrammar;
import com.bashnorm.grammar.UtilityGrammarLoader;
import com.bashnorm.normalize.ArgumentTypeResolver;
import com.bashnorm.normalize.CommandNormalizer;
import com.bashnorm.output.CommandRenderer;
import com.bashnorm.output.RenderOptions;
import com.bashnorm.testsupport.LogCaptorAppender;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeCodecTest {

    private static CommandNormalizer normalizer;
    private static ArgumentTypeResolver types;
    private static TreeCodec codec;

    private final CommandRenderer loose = new CommandRenderer(RenderOptions.LOOSE);

    @BeforeAll
    static void setUp() throws IOException {
        UtilityGrammar grammar = new UtilityGrammarLoader().loadDefault();
        normalizer = new CommandNormalizer(grammar);
        types = new ArgumentTypeResolver(grammar);
        codec = new TreeCodec(types);
    }

    private static RootNode normalize(String command) {
        return normalizer.normalize(command).normalizedTree().orElseThrow();
    }

    @Test
    public void testLinearize() {
        ImmutableList<String> symbols = codec.linearize(normalize("ls -l /tmp"));

        assertEquals(Lists.immutable.of(
            "ROOT_", "HEADCOMMAND_ls",
            "FLAG_-l", TreeCodec.NO_EXPAND,
            "ARGUMENT_/tmp", TreeCodec.NO_EXPAND,
            TreeCodec.NO_EXPAND, TreeCodec.NO_EXPAND), symbols);
    }

    @Test
    public void testLinearizeExecTerminator() {
        ImmutableList<String> symbols = codec.linearize(normalize("find . -exec rm {} \\;"));

        assertTrue(symbols.contains("FLAG_-exec::;"));
        assertTrue(symbols.contains("ARGUMENT_{}"));
        assertEquals(TreeCodec.NO_EXPAND, symbols.getLast());
    }

    @Test
    public void testRoundTripRendersTheSame() {
        for (String command : List.of(
            "ls -la /tmp",
            "find . -name \"*.txt\" -o -name '*.md'",
            "find . -type f -exec rm {} \\;",
            "find . -not \\( -name a -o -name b \\) -print",
            "find . -mtime -7 -size +10k",
            "ls -l | grep foo | wc -l",
            "echo $(pwd)",
            "diff <(ls a) <(ls b)",
            "find . -name \"*.tmp\" | xargs rm -f")) {
            RootNode tree = normalize(command);
            RootNode decoded = codec.delinearize(codec.linearize(tree));

            assertEquals(loose.toTokens(tree), loose.toTokens(decoded), command);
            assertTrue(decoded.checkLinks(), command);
        }
    }

    @Test
    public void testArgumentTypesDerivedAgain() {
        RootNode decoded = codec.delinearize(Lists.immutable.of(
            "ROOT_", "HEADCOMMAND_find",
            "ARGUMENT_.", "<NO_EXPAND>",
            "FLAG_-name", "ARGUMENT_*.txt", "<NO_EXPAND>", "<NO_EXPAND>",
            "FLAG_-print", "ARGUMENT_x", "<NO_EXPAND>", "<NO_EXPAND>",
            "<NO_EXPAND>", "<NO_EXPAND>"));

        HeadCommandNode find = (HeadCommandNode) decoded.firstChild();
        assertEquals(ArgType.FILE, ((ArgumentNode) find.child(0)).argType());
        assertEquals(ArgType.PATTERN, ((ArgumentNode) find.child(1).firstChild()).argType());
        // -print takes no argument
        assertEquals(ArgType.UNKNOWN, ((ArgumentNode) find.child(2).firstChild()).argType());
    }

    @Test
    public void testUnresolvableArgumentBecomesUnknown() {
        try (LogCaptorAppender captor = LogCaptorAppender.capture(TreeCodec.class)) {
            RootNode decoded = codec.delinearize(Lists.immutable.of(
                "ROOT_", "HEADCOMMAND_pwd", "ARGUMENT_extra", "<NO_EXPAND>", "<NO_EXPAND>", "<NO_EXPAND>"));

            assertEquals(ArgType.UNKNOWN, ((ArgumentNode) decoded.firstChild().firstChild()).argType());
            assertTrue(captor.hasWarningContaining("Unable to decide type"));
        }
    }

    @Test
    public void testTrailingSymbolsIgnored() {
        RootNode decoded = codec.delinearize(Lists.immutable.of(
            "ROOT_", "HEADCOMMAND_ls", "<NO_EXPAND>", "<NO_EXPAND>", "<NO_EXPAND>", "<NO_EXPAND>"));

        assertEquals(1, decoded.childCount());
        assertEquals("ls", loose.toCommand(decoded));
    }

    @Test
    public void testFlagValueKeepsTerminator() {
        RootNode decoded = codec.delinearize(Lists.immutable.of(
            "ROOT_", "HEADCOMMAND_find", "FLAG_-exec::+", "HEADCOMMAND_rm",
            "<NO_EXPAND>", "<NO_EXPAND>", "<NO_EXPAND>", "<NO_EXPAND>"));

        FlagNode exec = (FlagNode) decoded.firstChild().firstChild();
        assertEquals("+", exec.terminator());
        assertEquals("find -exec rm +", loose.toCommand(decoded));
    }

    @Test
    public void testRejectsMalformedSequences() {
        assertThrows(IllegalArgumentException.class, () -> codec.delinearize(Lists.immutable.of()));
        assertThrows(IllegalArgumentException.class, () -> codec.delinearize(Lists.immutable.of("HEADCOMMAND_ls")));
        assertThrows(IllegalArgumentException.class,
            () -> codec.delinearize(Lists.immutable.of("ROOT_", "NOSUCHKIND_x", "<NO_EXPAND>", "<NO_EXPAND>")));
        assertThrows(IllegalArgumentException.class,
            () -> codec.delinearize(Lists.immutable.of("ROOT_", "nosymbol", "<NO_EXPAND>")));
    }

    @Test
    public void testRejectsTooDeepSequence() {
        MutableList<String> symbols = Lists.mutable.of("ROOT_", "HEADCOMMAND_find");
        for (int i = 0; i < 1000; i++) {
            symbols.add("UNARYLOGICOP_!");
        }

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> codec.delinearize(symbols));
        assertTrue(e.getMessage().contains("deeper than " + codec.maxDepth()));
    }

    @Test
    public void testDepthLimit() {
        TreeCodec shallow = new TreeCodec(types, 2);
        RootNode tree = new RootNode();
        HeadCommandNode find = new HeadCommandNode("find");
        tree.appendChild(find);
        UnaryLogicOpNode not = new UnaryLogicOpNode("-not");
        find.appendChild(not);
        not.appendChild(new FlagNode("-empty"));

        assertThrows(IllegalArgumentException.class, () -> shallow.linearize(tree));
        assertThrows(IllegalArgumentException.class, () -> shallow.delinearize(codec.linearize(tree)));
        assertEquals("find -not -empty", loose.toCommand(codec.delinearize(codec.linearize(tree))));
    }
}
