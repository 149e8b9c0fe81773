package com.templet.node;

import com.templet.error.ExpressionSyntaxException;
import com.templet.error.InvalidTagException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class TagParserTest {
    private final TagParser parser = new TagParser();

    // ============================================================
    // Value tags
    // ============================================================

    @Test
    public void testParseValueTag() {
        assertEquals(new Node.Value("name"), parser.parseValueTag("{$ name }"));
        assertEquals(new Node.Value("name"), parser.parseValueTag("{$name}"));
        assertEquals(new Node.Value("config.servers[1].name"), parser.parseValueTag("{$   config.servers[1].name   }"));
    }

    @Test
    public void testParseValueTagKeepsNameUnresolved() {
        Node.Value value = parser.parseValueTag("{$ a.b[3] }");
        assertEquals("a.b[3]", value.name());
        assertEquals(NodeType.VALUE, value.type());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{$ bad..name }", "{$ a b }", "{$ }", "{$ a! }", "{% name }", "{$ name", "$ name }", "{$ a. }", "{$ a[x] }", "{$ a[-1].b }"})
    public void testParseValueTagRejectsMalformedTags(String tag) {
        assertThrows(InvalidTagException.class, () -> parser.parseValueTag(tag));
    }

    // ============================================================
    // If / elif / else tags
    // ============================================================

    @Test
    public void testParseIfTag() {
        Node.IfValue node = parser.parseIfTag("{% if user %}");
        assertEquals("user", node.condition());
        assertTrue(node.children().isEmpty());
        assertEquals(NodeType.IF_VALUE, node.type());
    }

    @Test
    public void testParseIfTagTrimsCondition() {
        assertEquals("user.name", parser.parseIfTag("{%   if    user.name   %}").condition());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{% if %}", "{% iff x %}", "{% elif x %}", "{% if a..b %}", "{% if a b %}", "{$ if x }", "{% if x }"})
    public void testParseIfTagRejectsMalformedTags(String tag) {
        assertThrows(InvalidTagException.class, () -> parser.parseIfTag(tag));
    }

    @Test
    public void testParseElifTag() {
        Node.ElifValue node = parser.parseElifTag("{% elif other %}");
        assertEquals("other", node.condition());
        assertEquals(NodeType.ELIF_VALUE, node.type());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{% elif %}", "{% if x %}", "{% elif x..y %}", "{% else if x %}"})
    public void testParseElifTagRejectsMalformedTags(String tag) {
        assertThrows(InvalidTagException.class, () -> parser.parseElifTag(tag));
    }

    @Test
    public void testParseElseTag() {
        assertEquals(NodeType.ELSE_VALUE, parser.parseElseTag("{% else %}").type());
        assertEquals(NodeType.ELSE_VALUE, parser.parseElseTag("{%else%}").type());
        assertThrows(InvalidTagException.class, () -> parser.parseElseTag("{% else x %}"));
    }

    // ============================================================
    // For tags
    // ============================================================

    @Test
    public void testParseForTag() {
        Node.ForValue node = parser.parseForTag("{% for config.servers as server %}");
        assertEquals("config.servers", node.listName());
        assertEquals("server", node.alias());
        assertEquals(NodeType.FOR_VALUE, node.type());
    }

    @Test
    public void testParseForTagAllowsExtraWhitespace() {
        Node.ForValue node = parser.parseForTag("{%  for   items \t as  item  %}");
        assertEquals("items", node.listName());
        assertEquals("item", node.alias());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{% for items %}",
        "{% for items as %}",
        "{% for items as item extra %}",
        "{% loop items as item %}",
        "{% for items in item %}",
        "{% %}"
    })
    public void testParseForTagRejectsBadStructure(String tag) {
        assertThrows(ExpressionSyntaxException.class, () -> parser.parseForTag(tag));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{% for items as item.name %}",
        "{% for items as item[0] %}",
        "{% for bad..items as item %}",
        "{% for items as it$em %}",
        "{% for .items as item %}",
        "{% for items[z] as item %}"
    })
    public void testParseForTagRejectsBadNames(String tag) {
        assertThrows(InvalidTagException.class, () -> parser.parseForTag(tag));
    }

    @Test
    public void testParseForTagRejectsBadDelimiters() {
        assertThrows(InvalidTagException.class, () -> parser.parseForTag("{$ for items as item }"));
    }
}
