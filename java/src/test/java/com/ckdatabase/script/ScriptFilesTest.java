package com.ckdatabase.script;

import static com.ckdatabase.script.ScriptValue.block;
import static com.ckdatabase.script.ScriptValue.of;
import static org.junit.jupiter.api.Assertions.*;

import com.ckdatabase.script.ScriptFiles.BatchResult;
import com.ckdatabase.script.ScriptValue.Block;
import com.ckdatabase.script.ScriptValue.FormulaRef;
import com.ckdatabase.script.ScriptValue.VariableRef;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScriptFilesTest {

  @TempDir Path tempDir;

  private Path root;
  private Path castle;
  private Path broken;

  @BeforeEach
  void createTree() throws IOException {
    root = tempDir.resolve("game");
    Path values = Files.createDirectories(root.resolve("common/script_values"));
    Path buildings = Files.createDirectories(root.resolve("common/buildings"));
    Files.writeString(values.resolve("00_values.txt"), "@tax = 5\n");
    castle = buildings.resolve("castle.txt");
    Files.writeString(castle, "castle = { cost = @tax income = @[tax * 2] }\n");
    broken = root.resolve("common/broken.txt");
    Files.writeString(broken, "@poison = 99\n}\n");
    Files.writeString(root.resolve("common/readme.md"), "not a script");
  }

  @Test
  void testVariablesFirst() throws IOException {
    VariableTable variables = new VariableTable();
    BatchResult result = new ScriptFiles(new ScriptParser(variables)).parseAll(root, true);

    assertEquals(
        List.of("common/script_values/00_values", "common/buildings/castle"),
        List.copyOf(result.documents().keySet()));
    Block expected =
        block()
            .put(
                "castle",
                block()
                    .put("cost", new VariableRef("@tax", of(5)))
                    .put("income", new FormulaRef("@[tax * 2]", 10L)));
    assertEquals(expected, result.documents().get("common/buildings/castle"));

    assertEquals(List.of(broken), result.failures());
    assertTrue(variables.contains("tax"));
    assertFalse(variables.contains("poison"));
  }

  @Test
  void testPathOrder() throws IOException {
    BatchResult result =
        new ScriptFiles(new ScriptParser(new VariableTable())).parseAll(root, false);

    assertEquals(
        List.of("common/buildings/castle", "common/script_values/00_values"),
        List.copyOf(result.documents().keySet()));
    Block castle = (Block) result.documents().get("common/buildings/castle").get("castle");
    assertEquals(new VariableRef("@tax", null), castle.get("cost"));
    assertEquals(new FormulaRef("@[tax * 2]", null), castle.get("income"));
  }

  @Test
  void testOutputTree() throws IOException {
    Path out = tempDir.resolve("out");
    ScriptFiles files = new ScriptFiles(new ScriptParser(new VariableTable()));
    files.parseAll(root, true, out);

    Path json = out.resolve("common/buildings/castle.json");
    assertTrue(Files.exists(json));
    assertTrue(Files.exists(out.resolve("common/script_values/00_values.json")));
    assertTrue(Files.exists(out.resolve("common/broken.error")));

    Path reverted = tempDir.resolve("reverted");
    String text = files.revertFile(json, reverted);
    assertEquals("castle = {\n    cost = @tax\n    income = @[tax * 2]\n}", text);
    assertEquals(text, Files.readString(reverted.resolve("castle.txt")));
  }

  @Test
  void testErrorFileHoldsCanonicalText() throws IOException {
    Path out = tempDir.resolve("out");
    ScriptParser parser =
        new ScriptParser(new VariableTable(), ParserOptions.defaults().withReturnTextOnError(true));
    new ScriptFiles(parser).parseAll(root, false, out);
    assertEquals("@poison = 99\n}\n", Files.readString(out.resolve("common/broken.error")));
  }

  @Test
  void testBlankFile() throws IOException {
    Path blank = tempDir.resolve("blank.txt");
    Files.writeString(blank, "  \n\n");
    ParseResult result = new ScriptFiles(new ScriptParser(new VariableTable())).parseFile(blank);
    assertTrue(result.isSuccess());
    assertTrue(result.document().isEmpty());
  }

  @Test
  void testReadFileDropsByteOrderMark() throws IOException {
    Path file = tempDir.resolve("bom.txt");
    Files.writeString(file, "\uFEFFa = 1", StandardCharsets.UTF_8);
    assertEquals("a = 1", ScriptFiles.readFile(file, StandardCharsets.UTF_8));
  }

  @Test
  void testDocumentName() {
    assertEquals("common/buildings/castle", ScriptFiles.documentName(root, castle));
  }
}
