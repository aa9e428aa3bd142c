package com.bashnorm.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A node of the generic shell syntax tree.
 *
 * @param kind    node kind
 * @param word    word text with quotes and escapes removed, operator spelling for operators and
 *                redirects, empty otherwise
 * @param start   start offset of the node in the source text
 * @param end     end offset (exclusive) of the node in the source text
 * @param parts   sub-nodes of compound nodes and of words containing expansions
 * @param command embedded command of substitution nodes, null otherwise
 */
public record SyntaxNode(SyntaxKind kind, String word, int start, int end,
                         ImmutableList<SyntaxNode> parts, SyntaxNode command) {

    public SyntaxNode {
        word = word == null ? "" : word;
        parts = parts == null ? Lists.immutable.empty() : parts;
    }

    public static SyntaxNode word(String text, int start, int end) {
        return new SyntaxNode(SyntaxKind.WORD, text, start, end, null, null);
    }

    public static SyntaxNode word(String text, int start, int end, ImmutableList<SyntaxNode> parts) {
        return new SyntaxNode(SyntaxKind.WORD, text, start, end, parts, null);
    }

    public static SyntaxNode command(ImmutableList<SyntaxNode> parts) {
        return compound(SyntaxKind.COMMAND, parts);
    }

    public static SyntaxNode pipeline(ImmutableList<SyntaxNode> parts) {
        return compound(SyntaxKind.PIPELINE, parts);
    }

    public static SyntaxNode list(ImmutableList<SyntaxNode> parts) {
        return compound(SyntaxKind.LIST, parts);
    }

    public static SyntaxNode pipe(int start, int end) {
        return new SyntaxNode(SyntaxKind.PIPE, "|", start, end, null, null);
    }

    public static SyntaxNode operator(String op, int start, int end) {
        return new SyntaxNode(SyntaxKind.OPERATOR, op, start, end, null, null);
    }

    public static SyntaxNode commandSubstitution(SyntaxNode command, int start, int end) {
        return new SyntaxNode(SyntaxKind.COMMANDSUBSTITUTION, "", start, end, null, command);
    }

    public static SyntaxNode processSubstitution(SyntaxNode command, int start, int end) {
        return new SyntaxNode(SyntaxKind.PROCESSSUBSTITUTION, "", start, end, null, command);
    }

    public static SyntaxNode parameter(String value, int start, int end) {
        return new SyntaxNode(SyntaxKind.PARAMETER, value, start, end, null, null);
    }

    public static SyntaxNode tilde(String value, int start, int end) {
        return new SyntaxNode(SyntaxKind.TILDE, value, start, end, null, null);
    }

    public static SyntaxNode assignment(String text, int start, int end) {
        return new SyntaxNode(SyntaxKind.ASSIGNMENT, text, start, end, null, null);
    }

    public static SyntaxNode redirect(String op, int start, int end, ImmutableList<SyntaxNode> target) {
        return new SyntaxNode(SyntaxKind.REDIRECT, op, start, end, target, null);
    }

    public static SyntaxNode of(SyntaxKind kind, String text, int start, int end) {
        return new SyntaxNode(kind, text, start, end, null, null);
    }

    /**
     * A compound node spanning its parts.
     */
    public static SyntaxNode compound(SyntaxKind kind, ImmutableList<SyntaxNode> parts) {
        int start = parts.isEmpty() ? 0 : parts.getFirst().start();
        int end = parts.isEmpty() ? 0 : parts.getLast().end();
        return new SyntaxNode(kind, "", start, end, parts, null);
    }

    public boolean is(SyntaxKind candidate) {
        return kind == candidate;
    }

    public boolean hasParts() {
        return parts.notEmpty();
    }
}
