package com.templet.node;

import com.templet.error.ExpressionSyntaxException;
import com.templet.error.InvalidTagException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Splits template source into text and tags and assembles the nodes into a tree.
 * <p>
 * An {@code elif} or {@code else} is nested inside the branch it follows, so an if block
 * {@code if a / elif b / else} becomes {@code If(a)[.., Elif(b)[.., Else[..]]]}.
 * One {@code endif} closes the whole chain.
 */
public class TemplateParser {
    private final TagParser tagParser;

    public TemplateParser() {
        this(new TagParser());
    }

    public TemplateParser(TagParser tagParser) {
        this.tagParser = tagParser;
    }

    public ImmutableList<Node> parse(String source) {
        Deque<Block> open = new ArrayDeque<>();
        Block root = new Block(null);
        open.push(root);

        int pos = 0;
        while (pos < source.length()) {
            int start = nextTagStart(source, pos);
            if (start < 0) {
                open.peek().children.add(new Node.Text(source.substring(pos)));
                break;
            }
            if (start > pos) {
                open.peek().children.add(new Node.Text(source.substring(pos, start)));
            }

            if (source.startsWith(TagParser.VALUE_OPEN, start)) {
                int end = source.indexOf(TagParser.VALUE_CLOSE, start + TagParser.VALUE_OPEN.length());
                if (end < 0) {
                    throw new InvalidTagException("Unterminated value tag at offset " + start);
                }
                String tag = source.substring(start, end + TagParser.VALUE_CLOSE.length());
                open.peek().children.add(tagParser.parseValueTag(tag));
                pos = end + TagParser.VALUE_CLOSE.length();
            } else {
                int end = source.indexOf(TagParser.DIRECTIVE_CLOSE, start + TagParser.DIRECTIVE_OPEN.length());
                if (end < 0) {
                    throw new InvalidTagException("Unterminated directive tag at offset " + start);
                }
                String tag = source.substring(start, end + TagParser.DIRECTIVE_CLOSE.length());
                directive(tag, open);
                pos = end + TagParser.DIRECTIVE_CLOSE.length();
            }
        }

        if (open.size() > 1) {
            throw new ExpressionSyntaxException("Unclosed block: " + open.peek().node.type());
        }
        return root.children.toImmutable();
    }

    private void directive(String tag, Deque<Block> open) {
        String payload = tagParser.directivePayload(tag);
        String keyword = payload.split("\\s+", 2)[0];

        switch (keyword) {
            case "if" -> open.push(new Block(tagParser.parseIfTag(tag)));
            case "elif" -> {
                requireOpenBranch(open, tag);
                open.push(new Block(tagParser.parseElifTag(tag)));
            }
            case "else" -> {
                requireOpenBranch(open, tag);
                open.push(new Block(tagParser.parseElseTag(tag)));
            }
            case "endif" -> {
                requireBare(payload, keyword, tag);
                while (open.peek().is(NodeType.ELIF_VALUE) || open.peek().is(NodeType.ELSE_VALUE)) {
                    close(open);
                }
                if (!open.peek().is(NodeType.IF_VALUE)) {
                    throw new ExpressionSyntaxException("'endif' without a matching 'if': " + tag);
                }
                close(open);
            }
            case "for" -> open.push(new Block(tagParser.parseForTag(tag)));
            case "endfor" -> {
                requireBare(payload, keyword, tag);
                if (!open.peek().is(NodeType.FOR_VALUE)) {
                    throw new ExpressionSyntaxException("'endfor' without a matching 'for': " + tag);
                }
                close(open);
            }
            default -> throw new InvalidTagException("Unknown directive '" + keyword + "': " + tag);
        }
    }

    private void requireOpenBranch(Deque<Block> open, String tag) {
        if (!open.peek().is(NodeType.IF_VALUE) && !open.peek().is(NodeType.ELIF_VALUE)) {
            throw new ExpressionSyntaxException("Branch tag without an open 'if' or 'elif': " + tag);
        }
    }

    private void requireBare(String payload, String keyword, String tag) {
        if (!payload.equals(keyword)) {
            throw new InvalidTagException("Closing tag takes no arguments: " + tag);
        }
    }

    private void close(Deque<Block> open) {
        Block block = open.pop();
        open.peek().children.add(block.node.withChildren(block.children.toImmutable()));
    }

    private static int nextTagStart(String source, int from) {
        int brace = source.indexOf('{', from);
        while (brace >= 0 && brace + 1 < source.length()) {
            char next = source.charAt(brace + 1);
            if (next == '$' || next == '%') {
                return brace;
            }
            brace = source.indexOf('{', brace + 1);
        }
        return -1;
    }

    private static final class Block {
        private final Node node;
        private final MutableList<Node> children = Lists.mutable.empty();

        private Block(Node node) {
            this.node = node;
        }

        private boolean is(NodeType type) {
            return node != null && node.type() == type;
        }
    }
}
