package com.ckdatabase.script;

import static com.ckdatabase.script.ScriptValue.block;
import static com.ckdatabase.script.ScriptValue.list;
import static com.ckdatabase.script.ScriptValue.of;
import static org.junit.jupiter.api.Assertions.*;

import com.ckdatabase.script.ScriptValue.Block;
import com.ckdatabase.script.ScriptValue.CommentMarker;
import com.ckdatabase.script.ScriptValue.FormulaRef;
import com.ckdatabase.script.ScriptValue.ListValue;
import com.ckdatabase.script.ScriptValue.OperatorValue;
import com.ckdatabase.script.ScriptValue.VariableRef;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ScriptParserTest {

  private final VariableTable variables = new VariableTable();
  private final ScriptParser parser = new ScriptParser(variables);

  private Block parse(String text) {
    return parser.parse(text).orElseThrow();
  }

  @Test
  void testScalars() {
    Block doc = parse("a = 1\nb = 2.5\nc = hello\nd = \"Hello World\"\ne = yes\nf = no");
    assertEquals(of(1), doc.get("a"));
    assertEquals(of(2.5), doc.get("b"));
    assertEquals(of("hello"), doc.get("c"));
    assertEquals(of("Hello World"), doc.get("d"));
    assertEquals(of(true), doc.get("e"));
    assertEquals(of(false), doc.get("f"));
    assertEquals(List.of("a", "b", "c", "d", "e", "f"), List.copyOf(doc.keys()));
  }

  @Test
  void testEmptyInput() {
    assertTrue(parse("").isEmpty());
    assertTrue(parse("# only a comment\n\n").isEmpty());
  }

  @Test
  void testDuplicateKeysBecomeList() {
    Block doc = parse("a=1\na=2");
    assertEquals(list(of(1), of(2)), doc.get("a"));

    doc = parse("a=1\na=2\na=3");
    assertEquals(list(of(1), of(2), of(3)), doc.get("a"));
  }

  @Test
  void testIdenticalDuplicateCollapses() {
    assertEquals(of(1), parse("a=1\na=1").get("a"));
    assertEquals(list(of(1), of(2), of(1)), parse("a=1\na=2\na=1").get("a"));
  }

  @Test
  void testDuplicateBlocks() {
    Block doc = parse("unit = { a = 1 }\nunit = { a = 2 }");
    assertEquals(list(block().put("a", of(1)), block().put("a", of(2))), doc.get("unit"));
  }

  @Test
  void testNestedBlocks() {
    Block doc = parse("a={\n b=1\n c=2\n}");
    assertEquals(block().put("b", of(1)).put("c", of(2)), doc.get("a"));

    doc = parse("outer = { inner = { deep = yes } other = 3 }");
    assertEquals(
        block().put("inner", block().put("deep", of(true))).put("other", of(3)), doc.get("outer"));
  }

  @Test
  void testBlockWithoutOperator() {
    Block doc = parse("key { x = 1 }");
    assertEquals(block().put("x", of(1)), doc.get("key"));
  }

  @Test
  void testEmptyBlock() {
    assertEquals(block(), parse("a = { }").get("a"));
  }

  @Test
  void testInlinePairs() {
    Block doc = parse("a = 1 b = 2 c = \"three four\"");
    assertEquals(of(1), doc.get("a"));
    assertEquals(of(2), doc.get("b"));
    assertEquals(of("three four"), doc.get("c"));
  }

  @Test
  void testBareValuesMakeList() {
    Block doc = parse("values = { 1 2.5 -3 word \"quoted item\" }");
    assertEquals(
        list(of(1), of(2.5), of(-3), of("word"), of("quoted item")), doc.get("values"));
  }

  @Test
  void testBareWordsInListsAreBooleans() {
    assertEquals(list(of(true), of(false)), parse("flags = { yes no }").get("flags"));
    assertEquals(list(of("yes"), of("maybe")), parse("words = { \"yes\" maybe }").get("words"));
  }

  @Test
  void testLargeIntegersStayDistinct() {
    Block doc = parse("a = 9007199254740993\na = 9007199254740992");
    assertEquals(list(of(9007199254740993L), of(9007199254740992L)), doc.get("a"));
  }

  @Test
  void testEscapedQuotes() {
    assertEquals(of("x\" # y"), parse("a = \"x\\\" # y\"").get("a"));
    Block doc = parse("quotes = { \"say \\\"hi\\\"\" x }");
    assertEquals(list(of("say \"hi\""), of("x")), doc.get("quotes"));
  }

  @Test
  void testColor() {
    Block doc = parse("color = rgb { 10 20 30 }");
    assertEquals(list(of("rgb"), of(10), of(20), of(30)), doc.get("color"));

    doc = parse("color = hsv360 { 0.5 0.25 1 }");
    assertEquals(list(of("hsv360"), of(0.5), of(0.25), of(1)), doc.get("color"));

    doc = parse("color rgb = { 1 2 3 }");
    assertEquals(list(of("rgb"), of(1), of(2), of(3)), doc.get("color"));
  }

  @Test
  void testListOfBlocks() {
    Block doc = parse("options = {\n {\n a = 1\n }\n {\n a = 2\n }\n}");
    assertEquals(list(block().put("a", of(1)), block().put("a", of(2))), doc.get("options"));
  }

  @Test
  void testKeyValueInsideList() {
    Block doc = parse("events = {\n first\n delay = 5\n}");
    assertEquals(list(of("first"), block().put("delay", of(5))), doc.get("events"));
  }

  @Test
  void testBareValueInFilledBlockIsSkipped() {
    Block doc = parse("a = {\n b = 1\n stray\n}");
    assertEquals(block().put("b", of(1)), doc.get("a"));
  }

  @Test
  void testOperators() {
    Block doc = parse("age >= 16\ngold > 50\nlevel != 3\nmartial < 10");
    assertEquals(new OperatorValue(">=", of(16)), doc.get("age"));
    assertEquals(new OperatorValue(">", of(50)), doc.get("gold"));
    assertEquals(new OperatorValue("!=", of(3)), doc.get("level"));
    assertEquals(new OperatorValue("<", of(10)), doc.get("martial"));
  }

  @Test
  void testOperatorWithBlock() {
    Block doc = parse("count > {\n value = 3\n}");
    assertEquals(new OperatorValue(">", block().put("value", of(3))), doc.get("count"));
  }

  @Test
  void testForcedListKeys() {
    ScriptParser forced =
        new ScriptParser(variables, ParserOptions.defaults().withForcedListKeys("trait"));
    Block doc = forced.parse("trait = brave").orElseThrow();
    assertEquals(list(of("brave")), doc.get("trait"));

    doc = forced.parse("trait = brave\ntrait = brave").orElseThrow();
    assertEquals(list(of("brave"), of("brave")), doc.get("trait"));
  }

  @Test
  void testListKeyword() {
    assertEquals(
        list(of("brave"), of("craven")), parse("traits = list { brave craven }").get("traits"));
    assertEquals(list(of("names_list")), parse("names = list \"names_list\"").get("names"));
  }

  @Test
  void testKeywordGluedToName() {
    Block doc = parse("scripted_trigger my_trigger = yes\nscripted_effect my_effect = { a = 1 }");
    assertEquals(of(true), doc.get("scripted_trigger|my_trigger"));
    assertEquals(block().put("a", of(1)), doc.get("scripted_effect|my_effect"));
  }

  @Test
  void testQuotedKey() {
    assertEquals(of(1), parse("\"quoted_key\" = 1").get("quoted_key"));
  }

  @Test
  void testMultilineString() {
    assertEquals(of("line one line two"), parse("desc = \"line one\nline two\"").get("desc"));
  }

  @Test
  void testHashInsideString() {
    assertEquals(of("x # y"), parse("a = \"x # y\" # real comment").get("a"));
  }

  // ========================================================================
  // Variables
  // ========================================================================

  @Test
  void testVariableRegistration() {
    Block doc = parse("@base = 10\ncost = @base");
    assertEquals(of(10), doc.get("@base"));
    assertEquals(new VariableRef("@base", of(10)), doc.get("cost"));
    assertEquals(of(10), variables.get("base"));
    assertEquals(of(10), variables.get("@base"));
  }

  @Test
  void testVariableKnownWithoutSigil() {
    variables.put("base", of(10));
    assertEquals(new VariableRef("base", of(10)), parse("cost = base").get("cost"));
  }

  @Test
  void testUnknownVariable() {
    assertEquals(new VariableRef("@missing", null), parse("cost = @missing").get("cost"));
  }

  @Test
  void testVariablesInList() {
    variables.put("a", of(1));
    assertEquals(
        list(new VariableRef("@a", of(1)), new VariableRef("@b", null)),
        parse("costs = { @a @b }").get("costs"));
  }

  @Test
  void testFormula() {
    Block doc = parse("@x = @[2+3]");
    assertEquals(new FormulaRef("@[2+3]", 5L), doc.get("@x"));
    assertEquals(of(5), variables.get("x"));
  }

  @Test
  void testFormulaChainsAcrossDocuments() {
    parse("@x = @[2+3]");
    Block doc = parse("@y = @[x*2]\nhalf = @[y / 4]");
    assertEquals(new FormulaRef("@[x*2]", 10L), doc.get("@y"));
    assertEquals(new FormulaRef("@[y / 4]", 2.5), doc.get("half"));
    assertEquals(of(10), variables.get("y"));
  }

  @Test
  void testFormulaThatCannotBeEvaluated() {
    Block doc = parse("@bad = @[nothing * 2]");
    assertEquals(new FormulaRef("@[nothing * 2]", null), doc.get("@bad"));
    assertFalse(variables.contains("bad"));
  }

  // ========================================================================
  // Errors
  // ========================================================================

  @Test
  void testUnbalancedBracketFailsWithoutThrowing() {
    ParseResult result = parser.parse("@a = 1\nb = 2\n}\nc = 3", "broken.txt");
    assertFalse(result.isSuccess());
    assertEquals(3, result.error().lineNumber());
    assertEquals("}", result.error().line());
    assertEquals("broken.txt", result.error().filename());
    assertNull(result.canonicalText());
    assertThrows(IllegalStateException.class, result::document);
    assertThrows(ScriptException.class, result::orElseThrow);
  }

  @Test
  void testFailedDocumentLeavesVariablesUntouched() {
    assertFalse(parser.parse("@a = 1\n}").isSuccess());
    assertFalse(variables.contains("a"));

    // The next document still parses against the same table
    assertEquals(of(2), parse("@b = 2").get("@b"));
    assertTrue(variables.contains("b"));
  }

  @Test
  void testBareValueAtRootFails() {
    ParseResult result = parser.parse("just_a_word");
    assertFalse(result.isSuccess());
    assertEquals(1, result.error().lineNumber());
  }

  @Test
  void testReturnTextOnError() {
    ScriptParser verbose =
        new ScriptParser(variables, ParserOptions.defaults().withReturnTextOnError(true));
    ParseResult result = verbose.parse("a = 1\n}\nc = 3");
    assertFalse(result.isSuccess());
    assertNotNull(result.canonicalText());
    assertTrue(result.canonicalText().contains("c = 3"));
  }

  @Test
  void testUnclosedBlockIsKept() {
    Block doc = parse("a = {\n b = 1");
    assertEquals(block().put("b", of(1)), doc.get("a"));
  }

  // ========================================================================
  // Comments
  // ========================================================================

  @Test
  void testCommentsDroppedByDefault() {
    Block doc = parse("a = 1 # note\nb = 2");
    assertEquals(block().put("a", of(1)).put("b", of(2)), doc);
  }

  @Test
  void testCommentsKept() {
    ScriptParser commented =
        new ScriptParser(variables, ParserOptions.defaults().withComments(true));
    Block doc = commented.parse("# header\na = 1").orElseThrow();
    assertEquals(new CommentMarker("header"), doc.get("&0"));
    assertEquals(of(1), doc.get("a"));
    assertEquals(List.of("&0", "a"), List.copyOf(doc.keys()));
  }

  @Test
  void testCommentInList() {
    ScriptParser commented =
        new ScriptParser(variables, ParserOptions.defaults().withComments(true));
    Block doc = commented.parse("traits = {\n # first\n brave\n}").orElseThrow();
    ListValue traits = (ListValue) doc.get("traits");
    assertEquals(list(new CommentMarker("first"), of("brave")), traits);
  }
}
