package com.bashnorm.ast;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A node of the normalized command tree.
 * <p>
 * Children are owned by their parent. Every child also holds a parent reference and left/right
 * sibling references; these are only changed by the mutators of this class, which keep them in
 * agreement with the position of the child in {@link #children()}.
 */
public abstract sealed class CommandNode
    permits RootNode, PipelineNode, HeadCommandNode, FlagNode, ArgumentNode,
            UnaryLogicOpNode, BinaryLogicOpNode, CommandSubstitutionNode, ProcessSubstitutionNode {

    public static final String SYMBOL_SEPARATOR = "_";

    private final NodeKind kind;
    private String value;
    private final MutableList<CommandNode> children = Lists.mutable.empty();

    private CommandNode parent;
    private CommandNode leftSibling;
    private CommandNode rightSibling;

    protected CommandNode(NodeKind kind, String value) {
        this.kind = kind;
        this.value = value == null ? "" : value;
    }

    /**
     * Creates a node of any kind except {@link NodeKind#ARGUMENT}, which needs a type.
     */
    public static CommandNode create(NodeKind kind, String value) {
        return switch (kind) {
            case ROOT -> new RootNode();
            case PIPELINE -> new PipelineNode();
            case HEADCOMMAND -> new HeadCommandNode(value);
            case FLAG -> new FlagNode(value);
            case UNARYLOGICOP -> new UnaryLogicOpNode(value);
            case BINARYLOGICOP -> new BinaryLogicOpNode(value);
            case COMMANDSUBSTITUTION -> new CommandSubstitutionNode();
            case PROCESSSUBSTITUTION -> new ProcessSubstitutionNode(value);
            case ARGUMENT -> throw new IllegalArgumentException("Argument nodes need an argument type");
        };
    }

    public NodeKind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    protected void setValue(String value) {
        this.value = value;
    }

    public CommandNode parent() {
        return parent;
    }

    public CommandNode leftSibling() {
        return leftSibling;
    }

    public CommandNode rightSibling() {
        return rightSibling;
    }

    public ListIterable<CommandNode> children() {
        return children.asUnmodifiable();
    }

    public int childCount() {
        return children.size();
    }

    public CommandNode child(int index) {
        return children.get(index);
    }

    public CommandNode firstChild() {
        return children.isEmpty() ? null : children.getFirst();
    }

    public CommandNode lastChild() {
        return children.isEmpty() ? null : children.getLast();
    }

    public int indexOf(CommandNode child) {
        return children.indexOf(child);
    }

    public String symbol() {
        return kind.symbolName() + SYMBOL_SEPARATOR + value;
    }

    public boolean is(NodeKind candidate) {
        return kind == candidate;
    }

    /**
     * The nearest head command at or above this node, or null.
     */
    public HeadCommandNode headCommand() {
        CommandNode current = this;
        while (current != null && !(current instanceof HeadCommandNode)) {
            current = current.parent;
        }
        return (HeadCommandNode) current;
    }

    public void appendChild(CommandNode child) {
        insertChild(children.size(), child);
    }

    public void insertChild(int index, CommandNode child) {
        if (child.parent != null) {
            throw new IllegalStateException(child.symbol() + " is already attached to " + child.parent.symbol());
        }
        if (child == this || isDescendantOf(child)) {
            throw new IllegalArgumentException("Attaching " + child.symbol() + " would create a cycle");
        }
        children.add(index, child);
        child.parent = this;
        link(index);
        link(index + 1);
    }

    public void removeChild(CommandNode child) {
        int index = children.indexOf(child);
        if (index < 0) {
            throw new IllegalArgumentException(child.symbol() + " is not a child of " + symbol());
        }
        children.remove(index);
        child.parent = null;
        child.leftSibling = null;
        child.rightSibling = null;
        link(index);
    }

    /**
     * Puts {@code replacement} where {@code child} was. The replacement is detached from its
     * current parent first.
     */
    public void replaceChild(CommandNode child, CommandNode replacement) {
        int index = children.indexOf(child);
        if (index < 0) {
            throw new IllegalArgumentException(child.symbol() + " is not a child of " + symbol());
        }
        replacement.detach();
        removeChild(child);
        insertChild(index, replacement);
    }

    /**
     * Removes the children between {@code first} and {@code last} inclusive and puts
     * {@code replacement} in their place.
     *
     * @return the index of the replacement
     */
    public int replaceRange(CommandNode first, CommandNode last, CommandNode replacement) {
        int from = children.indexOf(first);
        int to = children.indexOf(last);
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid child range " + first.symbol() + " .. " + last.symbol());
        }
        for (int i = to; i >= from; i--) {
            removeChild(children.get(i));
        }
        replacement.detach();
        insertChild(from, replacement);
        return from;
    }

    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    /**
     * Verifies that parent and sibling references of the whole subtree agree with the
     * children sequences.
     */
    public boolean checkLinks() {
        for (int i = 0; i < children.size(); i++) {
            CommandNode child = children.get(i);
            CommandNode expectedLeft = i > 0 ? children.get(i - 1) : null;
            CommandNode expectedRight = i + 1 < children.size() ? children.get(i + 1) : null;
            if (child.parent != this || child.leftSibling != expectedLeft || child.rightSibling != expectedRight) {
                return false;
            }
            if (!child.checkLinks()) {
                return false;
            }
        }
        return true;
    }

    private boolean isDescendantOf(CommandNode candidate) {
        for (CommandNode current = parent; current != null; current = current.parent) {
            if (current == candidate) {
                return true;
            }
        }
        return false;
    }

    // links children[index - 1] <-> children[index], either side may be missing
    private void link(int index) {
        CommandNode left = index > 0 && index - 1 < children.size() ? children.get(index - 1) : null;
        CommandNode right = index < children.size() ? children.get(index) : null;
        if (left != null) {
            left.rightSibling = right;
        }
        if (right != null) {
            right.leftSibling = left;
        }
    }

    @Override
    public String toString() {
        return symbol();
    }
}
