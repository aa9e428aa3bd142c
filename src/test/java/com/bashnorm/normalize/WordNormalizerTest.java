package com.bashnorm.normalize;

import com.bashnorm.ast.NodeKind;
import com.bashnorm.syntax.SyntaxNode;
import com.bashnorm.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WordNormalizerTest {

    // word of `source` spanning [start, end) with its quotes removed
    private static SyntaxNode word(String source, int start, int end) {
        return SyntaxNode.word(source.substring(start, end).replace("\"", "").replace("'", ""), start, end);
    }

    @Test
    public void testDigitsInArguments() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults());
        String source = "head -n 10 file2.txt";

        assertEquals("_NUM", words.normalize(word(source, 8, 10), NodeKind.ARGUMENT, source));
        assertEquals("file_NUM.txt", words.normalize(word(source, 11, 20), NodeKind.ARGUMENT, source));
    }

    @Test
    public void testDigitsKeptOutsideArguments() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults());
        String source = "gzip -9";

        assertEquals("-9", words.normalize(word(source, 5, 7), NodeKind.FLAG, source));
    }

    @Test
    public void testDigitsKeptWhenDisabled() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults().withNormalizeDigits(false));
        String source = "head -n 10";

        assertEquals("10", words.normalize(word(source, 8, 10), NodeKind.ARGUMENT, source));
    }

    @Test
    public void testQuotesRecovered() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults());
        String source = "find . -name '*.txt'";
        SyntaxNode pattern = word(source, 13, 20);

        assertTrue(words.isQuoted(pattern, source));
        assertEquals("'*.txt'", words.normalize(pattern, NodeKind.ARGUMENT, source));
    }

    @Test
    public void testQuotesDropped() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults().withRecoverQuotation(false));
        String source = "find . -name '*.txt'";

        assertEquals("*.txt", words.normalize(word(source, 13, 20), NodeKind.ARGUMENT, source));
    }

    @Test
    public void testLongPattern() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults());
        String source = "echo \"hello world\"";

        assertEquals(WordNormalizer.LONG_PATTERN, words.normalize(word(source, 5, 18), NodeKind.ARGUMENT, source));
    }

    @Test
    public void testLongPatternKeptWhenDisabled() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults().withNormalizeLongPattern(false));
        String source = "echo \"hello world\"";

        assertEquals("\"hello world\"", words.normalize(word(source, 5, 18), NodeKind.ARGUMENT, source));
    }

    @Test
    public void testWhitespaceInUnquotedWordWarns() {
        WordNormalizer words = new WordNormalizer(NormalizerOptions.defaults().withRecoverQuotation(false));
        String source = "echo \"hello world\"";

        try (LogCaptorAppender captor = LogCaptorAppender.capture(WordNormalizer.class)) {
            assertEquals(WordNormalizer.LONG_PATTERN, words.normalize(word(source, 5, 18), NodeKind.ARGUMENT, source));
            assertTrue(captor.hasWarningContaining("Quotation error"));
        }
    }
}
