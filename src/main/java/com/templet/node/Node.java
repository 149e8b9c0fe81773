package com.templet.node;

import com.templet.name.TagNames;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Template syntax tree. Names are stored as written and resolved on every render,
 * so one tree can be rendered against many scopes.
 * <p>
 * Composite nodes are created without children; the tree builder attaches them once
 * with {@link #withChildren(ImmutableList)}.
 */
public sealed interface Node {
    NodeType type();

    default ImmutableList<Node> children() {
        return Lists.immutable.empty();
    }

    default Node withChildren(ImmutableList<Node> children) {
        throw new UnsupportedOperationException("This node type cannot have children: " + type());
    }

    record Text(String content) implements Node {
        @Override
        public NodeType type() {
            return NodeType.TEXT;
        }
    }

    record Value(String name) implements Node {
        public Value {
            TagNames.requirePath(name, "Variable tag name contains invalid characters");
        }

        @Override
        public NodeType type() {
            return NodeType.VALUE;
        }
    }

    record IfValue(String condition, ImmutableList<Node> children) implements Node {
        public IfValue {
            TagNames.requireNameExpression(condition, "If expression tag name contains invalid characters");
        }

        public IfValue(String condition) {
            this(condition, Lists.immutable.empty());
        }

        @Override
        public NodeType type() {
            return NodeType.IF_VALUE;
        }

        @Override
        public IfValue withChildren(ImmutableList<Node> children) {
            return new IfValue(condition, children);
        }
    }

    record ElifValue(String condition, ImmutableList<Node> children) implements Node {
        public ElifValue {
            TagNames.requireNameExpression(condition, "Elif expression tag name contains invalid characters");
        }

        public ElifValue(String condition) {
            this(condition, Lists.immutable.empty());
        }

        @Override
        public NodeType type() {
            return NodeType.ELIF_VALUE;
        }

        @Override
        public ElifValue withChildren(ImmutableList<Node> children) {
            return new ElifValue(condition, children);
        }
    }

    record ElseValue(ImmutableList<Node> children) implements Node {
        public ElseValue() {
            this(Lists.immutable.empty());
        }

        @Override
        public NodeType type() {
            return NodeType.ELSE_VALUE;
        }

        @Override
        public ElseValue withChildren(ImmutableList<Node> children) {
            return new ElseValue(children);
        }
    }

    record ForValue(String listName, String alias, ImmutableList<Node> children) implements Node {
        public ForValue {
            TagNames.requirePath(listName, "For expression first tag name contains invalid characters");
            TagNames.requireName(alias, "For expression second tag name contains invalid characters");
        }

        public ForValue(String listName, String alias) {
            this(listName, alias, Lists.immutable.empty());
        }

        @Override
        public NodeType type() {
            return NodeType.FOR_VALUE;
        }

        @Override
        public ForValue withChildren(ImmutableList<Node> children) {
            return new ForValue(listName, alias, children);
        }
    }
}
