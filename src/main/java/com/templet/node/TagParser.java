package com.templet.node;

import com.templet.error.ExpressionSyntaxException;
import com.templet.error.InvalidTagException;

public class TagParser {
    static final String VALUE_OPEN = "{$";
    static final String VALUE_CLOSE = "}";
    static final String DIRECTIVE_OPEN = "{%";
    static final String DIRECTIVE_CLOSE = "%}";

    public Node.Value parseValueTag(String tag) {
        if (!tag.startsWith(VALUE_OPEN) || !tag.endsWith(VALUE_CLOSE)) {
            throw new InvalidTagException("Tag must be enclosed with {$ and }: " + tag);
        }
        String payload = tag.substring(VALUE_OPEN.length(), tag.indexOf(VALUE_CLOSE)).trim();
        return new Node.Value(payload);
    }

    public Node.IfValue parseIfTag(String tag) {
        return new Node.IfValue(keywordArgument(directivePayload(tag), "if"));
    }

    public Node.ElifValue parseElifTag(String tag) {
        return new Node.ElifValue(keywordArgument(directivePayload(tag), "elif"));
    }

    public Node.ElseValue parseElseTag(String tag) {
        String payload = directivePayload(tag);
        if (!payload.equals("else")) {
            throw new InvalidTagException("Else tag takes no arguments: " + tag);
        }
        return new Node.ElseValue();
    }

    public Node.ForValue parseForTag(String tag) {
        String[] tokens = directivePayload(tag).split("\\s+");
        if (tokens.length != 4) {
            throw new ExpressionSyntaxException("Unrecognized for expression syntax: " + tag);
        }
        if (!tokens[0].equals("for") || !tokens[2].equals("as")) {
            throw new ExpressionSyntaxException("Unrecognized for expression syntax: " + tag);
        }
        return new Node.ForValue(tokens[1], tokens[3]);
    }

    /**
     * Strips the directive delimiters and surrounding whitespace.
     */
    String directivePayload(String tag) {
        if (!tag.startsWith(DIRECTIVE_OPEN) || !tag.endsWith(DIRECTIVE_CLOSE) || tag.length() < 4) {
            throw new InvalidTagException("Tag must be enclosed with {% and %}: " + tag);
        }
        return tag.substring(DIRECTIVE_OPEN.length(), tag.indexOf(DIRECTIVE_CLOSE, DIRECTIVE_OPEN.length())).trim();
    }

    private String keywordArgument(String payload, String keyword) {
        if (!payload.startsWith(keyword + " ")) {
            throw new InvalidTagException("Tag must be prefixed with '" + keyword + " ': " + payload);
        }
        return payload.substring(keyword.length() + 1).trim();
    }
}
