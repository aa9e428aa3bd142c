package com.bashnorm.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.List;

/**
 * A small shell parser for one-line commands.
 * <p>
 * It understands words with single/double quotes and backslash escapes, pipelines, the list
 * operators {@code ; && || &}, command substitution ({@code $(...)} and backticks), process
 * substitution, parameter and tilde expansion, redirections, heredocs, assignments and the
 * compound-command keywords. Compound commands are recognized but not parsed further.
 */
public class SimpleShellParser implements ShellParser {

    private static final ImmutableMap<String, SyntaxKind> KEYWORDS = Maps.immutable.<String, SyntaxKind>empty()
        .newWithKeyValue("for", SyntaxKind.FOR)
        .newWithKeyValue("select", SyntaxKind.FOR)
        .newWithKeyValue("if", SyntaxKind.IF)
        .newWithKeyValue("while", SyntaxKind.WHILE)
        .newWithKeyValue("until", SyntaxKind.UNTIL)
        .newWithKeyValue("function", SyntaxKind.FUNCTION);

    @Override
    public List<SyntaxNode> parse(String command) {
        if (command == null || command.isBlank()) {
            throw new ShellParseException(ParseErrorKind.EMPTY_INPUT, "Empty command");
        }
        MutableList<SyntaxNode> statements = parseRegion(command, 0, command.length());
        if (statements.isEmpty()) {
            throw new ShellParseException(ParseErrorKind.EMPTY_INPUT, "Command has no statements");
        }
        return statements;
    }

    private MutableList<SyntaxNode> parseRegion(String source, int from, int to) {
        MutableList<Token> tokens = new Lexer(source, from, to).tokenize();
        MutableList<SyntaxNode> statements = Lists.mutable.empty();
        MutableList<Token> current = Lists.mutable.empty();
        for (Token token : tokens) {
            if (token.type() == TokenType.NEWLINE) {
                if (current.notEmpty()) {
                    statements.add(statement(current));
                    current = Lists.mutable.empty();
                }
            } else {
                current.add(token);
            }
        }
        if (current.notEmpty()) {
            statements.add(statement(current));
        }
        return statements;
    }

    private SyntaxNode statement(MutableList<Token> tokens) {
        if (isKeyword(tokens.getFirst())) {
            return compound(tokens);
        }
        if (tokens.noneSatisfy(token -> token.type() == TokenType.OPERATOR)) {
            return pipelineOrCommand(tokens);
        }
        MutableList<SyntaxNode> parts = Lists.mutable.empty();
        MutableList<Token> current = Lists.mutable.empty();
        for (Token token : tokens) {
            if (token.type() == TokenType.OPERATOR) {
                if (current.isEmpty()) {
                    throw new ShellParseException(ParseErrorKind.GRAMMAR,
                        "Unexpected '" + token.text() + "' at position " + token.start());
                }
                parts.add(pipelineOrCommand(current));
                parts.add(SyntaxNode.operator(token.text(), token.start(), token.end()));
                current = Lists.mutable.empty();
            } else {
                current.add(token);
            }
        }
        if (current.notEmpty()) {
            parts.add(pipelineOrCommand(current));
        }
        return SyntaxNode.list(parts.toImmutable());
    }

    private SyntaxNode pipelineOrCommand(MutableList<Token> tokens) {
        if (tokens.noneSatisfy(token -> token.type() == TokenType.PIPE)) {
            return command(tokens);
        }
        MutableList<SyntaxNode> parts = Lists.mutable.empty();
        MutableList<Token> current = Lists.mutable.empty();
        for (Token token : tokens) {
            if (token.type() == TokenType.PIPE) {
                if (current.isEmpty()) {
                    throw new ShellParseException(ParseErrorKind.GRAMMAR,
                        "Unexpected '|' at position " + token.start());
                }
                parts.add(command(current));
                parts.add(SyntaxNode.pipe(token.start(), token.end()));
                current = Lists.mutable.empty();
            } else {
                current.add(token);
            }
        }
        if (current.isEmpty()) {
            throw new ShellParseException(ParseErrorKind.GRAMMAR, "Pipeline ends with '|'");
        }
        parts.add(command(current));
        return SyntaxNode.pipeline(parts.toImmutable());
    }

    private SyntaxNode command(MutableList<Token> tokens) {
        if (isKeyword(tokens.getFirst())) {
            return compound(tokens);
        }
        MutableList<SyntaxNode> parts = tokens.collect(Token::node);
        if (parts.isEmpty()) {
            throw new ShellParseException(ParseErrorKind.MALFORMED_SHAPE, "Command without words");
        }
        return SyntaxNode.command(parts.toImmutable());
    }

    private static boolean isKeyword(Token token) {
        return token.type() == TokenType.WORD && token.unquoted() && KEYWORDS.containsKey(token.text());
    }

    // the whole statement, operators included, becomes one node of the keyword's kind
    private static SyntaxNode compound(MutableList<Token> tokens) {
        Token first = tokens.getFirst();
        return new SyntaxNode(KEYWORDS.get(first.text()), first.text(), first.start(), tokens.getLast().end(),
            tokens.select(token -> token.node() != null).collect(Token::node).toImmutable(), null);
    }

    private enum TokenType {
        WORD, PIPE, OPERATOR, NEWLINE
    }

    private record Token(TokenType type, String text, int start, int end, SyntaxNode node, boolean unquoted) {
    }

    private final class Lexer {
        private final String source;
        private final int limit;
        private int pos;
        private boolean commandStart = true;

        Lexer(String source, int from, int to) {
            this.source = source;
            this.pos = from;
            this.limit = to;
        }

        MutableList<Token> tokenize() {
            MutableList<Token> tokens = Lists.mutable.empty();
            while (true) {
                skipBlanks();
                if (isAtEnd()) {
                    break;
                }
                tokens.add(nextToken());
            }
            return tokens;
        }

        private Token nextToken() {
            int start = pos;
            char c = peek();
            switch (c) {
                case '\n' -> {
                    pos++;
                    commandStart = true;
                    return new Token(TokenType.NEWLINE, "\n", start, pos, null, true);
                }
                case '|' -> {
                    pos++;
                    commandStart = true;
                    if (match('|')) {
                        return new Token(TokenType.OPERATOR, "||", start, pos, null, true);
                    }
                    match('&');
                    return new Token(TokenType.PIPE, "|", start, pos, null, true);
                }
                case '&' -> {
                    if (startsWith("&>")) {
                        return redirect(start);
                    }
                    pos++;
                    commandStart = true;
                    String op = match('&') ? "&&" : "&";
                    return new Token(TokenType.OPERATOR, op, start, pos, null, true);
                }
                case ';' -> {
                    pos++;
                    commandStart = true;
                    String op = match(';') ? ";;" : ";";
                    return new Token(TokenType.OPERATOR, op, start, pos, null, true);
                }
                case '(', ')' -> throw new ShellParseException(ParseErrorKind.UNIMPLEMENTED,
                    "Subshell '" + c + "' at position " + start + " is not supported");
                case '<', '>' -> {
                    if (pos + 1 < limit && source.charAt(pos + 1) == '(') {
                        return word();
                    }
                    return redirect(start);
                }
                default -> {
                    if (Character.isDigit(c) && isRedirectAhead()) {
                        return redirect(start);
                    }
                    return word();
                }
            }
        }

        private boolean isRedirectAhead() {
            int i = pos;
            while (i < limit && Character.isDigit(source.charAt(i))) {
                i++;
            }
            return i < limit && (source.charAt(i) == '<' || source.charAt(i) == '>')
                && !(i + 1 < limit && source.charAt(i + 1) == '(');
        }

        private Token redirect(int start) {
            while (Character.isDigit(peek())) {
                pos++;
            }
            int opStart = pos;
            if (startsWith("<<")) {
                pos += 2;
                match('<');
                match('-');
            } else {
                match('&');
                pos++;
                if (!match('>')) {
                    match('&');
                }
                match('|');
            }
            String op = source.substring(opStart, pos);
            skipBlanks();
            if (isAtEnd() || isMeta(peek())) {
                throw new ShellParseException(ParseErrorKind.GRAMMAR,
                    "Redirection '" + op + "' at position " + start + " has no target");
            }
            Token target = word();
            SyntaxKind kind = op.startsWith("<<") && !op.equals("<<<") ? SyntaxKind.HEREDOC : SyntaxKind.REDIRECT;
            SyntaxNode node = new SyntaxNode(kind, op, start, target.end(), Lists.immutable.of(target.node()), null);
            return new Token(TokenType.WORD, op, start, target.end(), node, true);
        }

        private Token word() {
            int start = pos;
            StringBuilder text = new StringBuilder();
            MutableList<SyntaxNode> parts = Lists.mutable.empty();
            boolean quoted = false;

            if ((peek() == '<' || peek() == '>') && pos + 1 < limit && source.charAt(pos + 1) == '(') {
                int close = findClosing(pos + 2, '(', ')');
                SyntaxNode inner = substitutedCommand(pos + 2, close);
                parts.add(SyntaxNode.processSubstitution(inner, pos, close + 1));
                text.append(source, pos, close + 1);
                pos = close + 1;
            } else if (peek() == '~') {
                int tildeStart = pos;
                pos++;
                while (!isAtEnd() && isNameChar(peek())) {
                    pos++;
                }
                parts.add(SyntaxNode.tilde(source.substring(tildeStart, pos), tildeStart, pos));
                text.append(source, tildeStart, pos);
            }

            while (!isAtEnd() && !isBlank(peek()) && !isMeta(peek())) {
                char c = peek();
                if (c == '\\') {
                    quoted = true;
                    pos++;
                    if (!isAtEnd()) {
                        if (peek() != '\n') {
                            text.append(peek());
                        }
                        pos++;
                    }
                } else if (c == '\'') {
                    quoted = true;
                    int close = source.indexOf('\'', pos + 1);
                    if (close < 0 || close >= limit) {
                        throw new ShellParseException(ParseErrorKind.MISMATCHED_DELIMITER,
                            "Unterminated single quote at position " + pos);
                    }
                    text.append(source, pos + 1, close);
                    pos = close + 1;
                } else if (c == '"') {
                    quoted = true;
                    doubleQuoted(text, parts);
                } else if (c == '$' || c == '`') {
                    expansion(text, parts);
                } else {
                    text.append(c);
                    pos++;
                }
            }

            String value = text.toString();
            SyntaxNode node;
            if (commandStart && !quoted && value.matches("[A-Za-z_][A-Za-z0-9_]*=.*")) {
                node = SyntaxNode.assignment(value, start, pos);
            } else {
                node = SyntaxNode.word(value, start, pos, parts.toImmutable());
                commandStart = false;
            }
            return new Token(TokenType.WORD, value, start, pos, node, !quoted);
        }

        private void doubleQuoted(StringBuilder text, MutableList<SyntaxNode> parts) {
            int open = pos;
            pos++;
            while (true) {
                if (isAtEnd()) {
                    throw new ShellParseException(ParseErrorKind.MISMATCHED_DELIMITER,
                        "Unterminated double quote at position " + open);
                }
                char c = peek();
                if (c == '"') {
                    pos++;
                    return;
                }
                if (c == '\\' && pos + 1 < limit && "\"\\$`".indexOf(source.charAt(pos + 1)) >= 0) {
                    text.append(source.charAt(pos + 1));
                    pos += 2;
                } else if (c == '$' || c == '`') {
                    expansion(text, parts);
                } else {
                    text.append(c);
                    pos++;
                }
            }
        }

        private void expansion(StringBuilder text, MutableList<SyntaxNode> parts) {
            int start = pos;
            if (peek() == '`') {
                int close = pos + 1;
                while (close < limit && source.charAt(close) != '`') {
                    close += source.charAt(close) == '\\' ? 2 : 1;
                }
                if (close >= limit) {
                    throw new ShellParseException(ParseErrorKind.MISMATCHED_DELIMITER,
                        "Unterminated backquote at position " + start);
                }
                parts.add(SyntaxNode.commandSubstitution(substitutedCommand(pos + 1, close), start, close + 1));
                pos = close + 1;
            } else if (startsWith("$(")) {
                int close = findClosing(pos + 2, '(', ')');
                parts.add(SyntaxNode.commandSubstitution(substitutedCommand(pos + 2, close), start, close + 1));
                pos = close + 1;
            } else if (startsWith("${")) {
                int close = findClosing(pos + 2, '{', '}');
                parts.add(SyntaxNode.parameter(source.substring(pos + 2, close), start, close + 1));
                pos = close + 1;
            } else if (pos + 1 < limit && (isNameChar(source.charAt(pos + 1)) || "?#@*!$-".indexOf(source.charAt(pos + 1)) >= 0)) {
                pos++;
                if (isNameChar(peek())) {
                    while (!isAtEnd() && isNameChar(peek())) {
                        pos++;
                    }
                } else {
                    pos++;
                }
                parts.add(SyntaxNode.parameter(source.substring(start + 1, pos), start, pos));
            } else {
                pos++;
            }
            text.append(source, start, pos);
        }

        private SyntaxNode substitutedCommand(int from, int to) {
            MutableList<SyntaxNode> statements = parseRegion(source, from, to);
            if (statements.isEmpty()) {
                throw new ShellParseException(ParseErrorKind.GRAMMAR, "Empty substitution at position " + from);
            }
            if (statements.size() > 1) {
                throw new ShellParseException(ParseErrorKind.UNIMPLEMENTED,
                    "Multi-line substitution at position " + from + " is not supported");
            }
            return statements.getFirst();
        }

        // index of the closing delimiter matching an already consumed opening one
        private int findClosing(int from, char open, char close) {
            int depth = 1;
            int i = from;
            while (i < limit) {
                char c = source.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == '\'' || c == '"') {
                    int end = source.indexOf(c, i + 1);
                    if (end < 0 || end >= limit) {
                        break;
                    }
                    i = end + 1;
                    continue;
                }
                if (c == open) {
                    depth++;
                } else if (c == close && --depth == 0) {
                    return i;
                }
                i++;
            }
            throw new ShellParseException(ParseErrorKind.MISMATCHED_DELIMITER,
                "No matching '" + close + "' for '" + open + "' before position " + limit);
        }

        private void skipBlanks() {
            while (!isAtEnd() && isBlank(peek())) {
                pos++;
            }
        }

        private boolean isAtEnd() {
            return pos >= limit;
        }

        private char peek() {
            return isAtEnd() ? '\0' : source.charAt(pos);
        }

        private boolean match(char expected) {
            if (!isAtEnd() && source.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private boolean startsWith(String prefix) {
            return source.startsWith(prefix, pos) && pos + prefix.length() <= limit;
        }
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    private static boolean isMeta(char c) {
        return c == '|' || c == '&' || c == ';' || c == '<' || c == '>' || c == '(' || c == ')' || c == '\n';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
