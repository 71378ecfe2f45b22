package com.ckdatabase.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads localisation files: a header line naming the language ({@code l_english:}) followed by
 * {@code key:0 "Text"} lines. Anything else in the file is skipped.
 */
public final class LocaleReader {

  private static final Pattern LOCALE_PATTERN =
      Pattern.compile("^\\s*([^:#]+):\\d+\\s\"(.+)\"\\s*$");

  private LocaleReader() {}

  /**
   * Reads one locale file. Returns an empty map when the header line does not mention {@code
   * language}.
   */
  public static Map<String, String> read(BufferedReader reader, String language)
      throws IOException {
    Map<String, String> locales = new LinkedHashMap<>();
    String header = reader.readLine();
    if (header == null || !header.contains(language)) {
      return locales;
    }
    String line;
    while ((line = reader.readLine()) != null) {
      Matcher m = LOCALE_PATTERN.matcher(line);
      if (m.matches()) {
        locales.put(m.group(1), m.group(2));
      }
    }
    return locales;
  }

  /** Reads every {@code .yml} file under {@code root}, in path order; later keys win. */
  public static Map<String, String> readAll(Path root, String language, Charset charset)
      throws IOException {
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".yml"))
              .sorted()
              .collect(Collectors.toList());
    }
    Map<String, String> locales = new LinkedHashMap<>();
    for (Path file : files) {
      try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
        locales.putAll(read(reader, language));
      }
    }
    return locales;
  }
}
