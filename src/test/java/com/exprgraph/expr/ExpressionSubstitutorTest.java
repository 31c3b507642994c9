package com.exprgraph.expr;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class ExpressionSubstitutorTest {

    @Test
    public void testReplacesReferencesAndKeepsEverythingElse() {
        String out = ExpressionSubstitutor.substitute("( \"A\" + \"B\" ) * 2", Map.of("A", 1.0, "B", 2.5));
        assertEquals("( 1 + 2.5 ) * 2", out);
    }

    @Test
    public void testSubstitutedTextIsNotRescanned() {
        // Adjacent references: each closing quote ends exactly one reference
        String out = ExpressionSubstitutor.substitute("\"A\"\"B\"", Map.of("A", 1.0, "B", 2.0));
        assertEquals("12", out);
    }

    @Test
    public void testNegativeValues() {
        String out = ExpressionSubstitutor.substitute("2-\"A\"", Map.of("A", -1.0));
        assertEquals("2--1", out);
        assertEquals(3.0, ArithmeticEvaluator.evaluate(out), 0.0);
    }

    @Test
    public void testMissingLabelFails() {
        try {
            ExpressionSubstitutor.substitute("\"A\" + \"Missing\"", Map.of("A", 1.0));
            fail("Expected UnresolvedReferenceException");
        } catch (UnresolvedReferenceException e) {
            assertEquals("Missing", e.label());
        }
    }

    @Test
    public void testDanglingDelimiterCopiedVerbatim() {
        assertEquals("1 + \"B", ExpressionSubstitutor.substitute("\"A\" + \"B", Map.of("A", 1.0)));
    }

    @Test
    public void testFormat() {
        assertEquals("3", ExpressionSubstitutor.format(3.0));
        assertEquals("-7", ExpressionSubstitutor.format(-7.0));
        assertEquals("0", ExpressionSubstitutor.format(-0.0));
        assertEquals("0.1", ExpressionSubstitutor.format(0.1));
        assertEquals("1.0E20", ExpressionSubstitutor.format(1e20));
        assertEquals(1e20, ArithmeticEvaluator.evaluate(ExpressionSubstitutor.format(1e20)), 0.0);
    }
}
