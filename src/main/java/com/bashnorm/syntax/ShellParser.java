package com.bashnorm.syntax;

import java.util.List;

/**
 * Turns command text into generic shell syntax trees, one per top-level statement.
 */
public interface ShellParser {
    /**
     * @throws ShellParseException if the text is empty or not valid shell syntax
     */
    List<SyntaxNode> parse(String command);
}
