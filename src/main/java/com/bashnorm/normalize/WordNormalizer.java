package com.bashnorm.normalize;

import com.bashnorm.ast.NodeKind;
import com.bashnorm.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Computes the value stored in the tree for a single word.
 */
public class WordNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(WordNormalizer.class);

    public static final String NUM = "_NUM";
    public static final String LONG_PATTERN = "_LONG_PATTERN";

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final NormalizerOptions options;

    public WordNormalizer(NormalizerOptions options) {
        this.options = options;
    }

    /**
     * @param word   a word node of the syntax tree
     * @param role   the kind of tree node the word becomes
     * @param source the text the syntax tree was parsed from, used to recover quotes
     */
    public String normalize(SyntaxNode word, NodeKind role, String source) {
        String value = options.recoverQuotation() && isQuoted(word, source)
            ? source.substring(word.start(), word.end())
            : word.word();

        if (role == NodeKind.ARGUMENT) {
            if (WHITESPACE.matcher(value).find()) {
                if (!startsAndEndsWithQuote(value)) {
                    logger.warn("Quotation error: whitespace inside unquoted word [{}]", value);
                }
                if (options.normalizeLongPattern()) {
                    value = LONG_PATTERN;
                }
            }
            if (options.normalizeDigits()) {
                value = DIGITS.matcher(value).replaceAll(NUM);
            }
        }
        return value;
    }

    /**
     * Whether the source text of {@code word} begins or ends with a quote character.
     */
    public boolean isQuoted(SyntaxNode word, String source) {
        if (source == null || word.start() < 0 || word.end() > source.length() || word.start() >= word.end()) {
            return false;
        }
        return isQuote(source.charAt(word.start())) || isQuote(source.charAt(word.end() - 1));
    }

    private static boolean startsAndEndsWithQuote(String value) {
        return value.length() >= 2 && isQuote(value.charAt(0)) && isQuote(value.charAt(value.length() - 1));
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
