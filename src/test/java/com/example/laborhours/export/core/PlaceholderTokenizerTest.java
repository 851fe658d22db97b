package com.example.laborhours.export.core;

import com.example.laborhours.export.model.PlaceholderKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PlaceholderTokenizerTest {

    @Test
    public void testScalarEmbeddedInText() {
        String text = "合计：{{total_approved_hours}}学时";
        List<PlaceholderTokenizer.Token> tokens = PlaceholderTokenizer.tokenize(text);

        assertEquals(1, tokens.size());
        PlaceholderTokenizer.Token token = tokens.get(0);
        assertEquals(PlaceholderKind.SCALAR, token.getKind());
        assertEquals("total_approved_hours", token.getFieldKey());
        assertEquals("{{total_approved_hours}}", text.substring(token.getStart(), token.getEnd()));
    }

    @Test
    public void testListHeadTerminatorAndCustomField() {
        assertEquals(PlaceholderKind.LIST_HEAD, PlaceholderTokenizer.tokenize("{{list:contest_name}}").get(0).getKind());
        assertEquals("contest_name", PlaceholderTokenizer.tokenize("{{ list:contest_name }}").get(0).getFieldKey());

        PlaceholderTokenizer.Token terminator = PlaceholderTokenizer.tokenize("{{/list}}").get(0);
        assertEquals(PlaceholderKind.LIST_TERMINATOR, terminator.getKind());
        assertNull(terminator.getFieldKey());

        PlaceholderTokenizer.Token custom = PlaceholderTokenizer.tokenize("{{list:custom.sponsor}}").get(0);
        assertEquals("custom.sponsor", custom.getFieldKey());
    }

    @Test
    public void testSeveralTokensInOneCell() {
        List<PlaceholderTokenizer.Token> tokens = PlaceholderTokenizer.tokenize("{{name}} ({{student_no}})");

        assertEquals(2, tokens.size());
        assertEquals("name", tokens.get(0).getFieldKey());
        assertEquals("student_no", tokens.get(1).getFieldKey());
    }

    @Test
    public void testLiteralTextIsNotAToken() {
        assertTrue(PlaceholderTokenizer.tokenize("plain text").isEmpty());
        assertTrue(PlaceholderTokenizer.tokenize("{{}}").isEmpty(), "Empty braces are literal text");
        assertTrue(PlaceholderTokenizer.tokenize("{{name").isEmpty(), "Unclosed braces are literal text");
        assertTrue(PlaceholderTokenizer.tokenize(null).isEmpty());
    }
}
