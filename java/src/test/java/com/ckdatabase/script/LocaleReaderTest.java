package com.ckdatabase.script;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LocaleReaderTest {

  @TempDir Path tempDir;

  private static BufferedReader reader(String text) {
    return new BufferedReader(new StringReader(text));
  }

  @Test
  void testRead() throws IOException {
    Map<String, String> locales =
        LocaleReader.read(
            reader(
                "l_english:\n"
                    + " # a comment\n"
                    + " trait_brave:0 \"Brave\"\n"
                    + " trait_brave_desc:1 \"Fearless in battle\"  \n"
                    + " not a locale line\n"),
            "english");
    assertEquals(Map.of("trait_brave", "Brave", "trait_brave_desc", "Fearless in battle"), locales);
  }

  @Test
  void testOtherLanguage() throws IOException {
    assertTrue(LocaleReader.read(reader("l_french:\n key:0 \"Brave\"\n"), "english").isEmpty());
    assertTrue(LocaleReader.read(reader(""), "english").isEmpty());
  }

  @Test
  void testReadAll() throws IOException {
    Path dir = Files.createDirectories(tempDir.resolve("localization/english"));
    Files.writeString(
        dir.resolve("a_l_english.yml"), "l_english:\n key_a:0 \"A\"\n key:0 \"first\"\n");
    Files.writeString(dir.resolve("b_l_english.yml"), "l_english:\n key:0 \"second\"\n");
    Files.writeString(dir.resolve("c_l_french.yml"), "l_french:\n key_c:0 \"C\"\n");
    Files.writeString(dir.resolve("notes.txt"), "l_english:\n key_d:0 \"D\"\n");

    Map<String, String> locales =
        LocaleReader.readAll(tempDir, "english", StandardCharsets.UTF_8);
    assertEquals(Map.of("key_a", "A", "key", "second"), locales);
  }
}
