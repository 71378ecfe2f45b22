package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Block;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses and reverts script files on disk.
 *
 * <p>Files of a batch are parsed one after the other against the parser's single {@link
 * VariableTable}, so the order matters: with {@code variablesFirst} the files under {@value
 * #SCRIPT_VALUES} directories, which define the constants other files refer to, go first. A file
 * that fails to parse is reported and skipped; the batch carries on.
 */
public class ScriptFiles {

  private static final Logger LOG = LoggerFactory.getLogger(ScriptFiles.class);

  /** Directory name of the files holding script constants. */
  public static final String SCRIPT_VALUES = "script_values";

  private static final String SCRIPT_SUFFIX = ".txt";
  private static final String JSON_SUFFIX = ".json";
  private static final String ERROR_SUFFIX = ".error";

  private final ScriptParser parser;
  private final ScriptWriter writer;
  private final Charset charset;

  public ScriptFiles(ScriptParser parser) {
    this(parser, new ScriptWriter(), StandardCharsets.UTF_8);
  }

  public ScriptFiles(ScriptParser parser, ScriptWriter writer, Charset charset) {
    this.parser = parser;
    this.writer = writer;
    this.charset = charset;
  }

  /** Reads a text file, dropping a leading byte-order mark. */
  public static String readFile(Path file, Charset charset) throws IOException {
    String text = Files.readString(file, charset);
    return text.startsWith("\uFEFF") ? text.substring(1) : text;
  }

  /** Parses one file. A blank file gives an empty document. */
  public ParseResult parseFile(Path file) throws IOException {
    String text = readFile(file, charset);
    if (text.isBlank()) {
      return ParseResult.success(ScriptValue.block());
    }
    LOG.debug("Parsing {}", file);
    long start = System.nanoTime();
    ParseResult result = parser.parse(text, file.toString());
    LOG.debug("Parsed {} in {} ms", file, (System.nanoTime() - start) / 1_000_000);
    return result;
  }

  public BatchResult parseAll(Path root, boolean variablesFirst) throws IOException {
    return parseAll(root, variablesFirst, null);
  }

  /**
   * Parses every {@code .txt} file under {@code root}. With an {@code outputDir} each document is
   * saved there as JSON (or, for a failed file, as {@code .error} holding its canonical text),
   * mirroring the source tree.
   */
  public BatchResult parseAll(Path root, boolean variablesFirst, Path outputDir)
      throws IOException {
    long start = System.nanoTime();
    List<Path> files = scriptFiles(root);
    if (variablesFirst) {
      List<Path> ordered = new ArrayList<>();
      for (Path file : files) {
        if (isScriptValues(root, file)) {
          ordered.add(file);
        }
      }
      for (Path file : files) {
        if (!isScriptValues(root, file)) {
          ordered.add(file);
        }
      }
      files = ordered;
    }

    Map<String, Block> documents = new LinkedHashMap<>();
    List<Path> failures = new ArrayList<>();
    for (Path file : files) {
      ParseResult result = parseFile(file);
      String name = documentName(root, file);
      if (outputDir != null) {
        save(result, outputDir.resolve(name));
      }
      if (result.isSuccess()) {
        documents.put(name, result.document());
      } else {
        failures.add(file);
      }
    }

    LOG.info(
        "{} parsed file(s) and {} error(s) in {} ms",
        documents.size(),
        failures.size(),
        (System.nanoTime() - start) / 1_000_000);
    for (Path failure : failures) {
      LOG.warn("Error detected in: {}", failure);
    }
    return new BatchResult(documents, failures);
  }

  /** Reads a JSON document and returns it as script text. */
  public String revertFile(Path jsonFile) throws IOException {
    return revertFile(jsonFile, null);
  }

  /** Reverts a JSON document, also writing it to {@code outputDir} as {@code .txt} if given. */
  public String revertFile(Path jsonFile, Path outputDir) throws IOException {
    LOG.debug("Reverting {}", jsonFile);
    ScriptValue document;
    try (Reader reader = Files.newBufferedReader(jsonFile, StandardCharsets.UTF_8)) {
      document = ScriptJson.read(reader);
    }
    String text = writer.revert(document);
    if (outputDir != null) {
      String name = jsonFile.getFileName().toString();
      if (name.endsWith(JSON_SUFFIX)) {
        name = name.substring(0, name.length() - JSON_SUFFIX.length());
      }
      Files.createDirectories(outputDir);
      Files.writeString(outputDir.resolve(name + SCRIPT_SUFFIX), text, charset);
    }
    return text;
  }

  private void save(ParseResult result, Path base) throws IOException {
    Files.createDirectories(base.getParent());
    if (result.isSuccess()) {
      Path target = base.resolveSibling(base.getFileName() + JSON_SUFFIX);
      try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
        ScriptJson.write(result.document(), out);
      }
    } else {
      String text =
          result.canonicalText() != null ? result.canonicalText() : result.error().toString();
      Files.writeString(base.resolveSibling(base.getFileName() + ERROR_SUFFIX), text, charset);
    }
  }

  private static List<Path> scriptFiles(Path root) throws IOException {
    try (Stream<Path> walk = Files.walk(root)) {
      return walk.filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase().endsWith(SCRIPT_SUFFIX))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static boolean isScriptValues(Path root, Path file) {
    for (Path part : root.relativize(file.getParent() == null ? root : file.getParent())) {
      if (part.toString().equals(SCRIPT_VALUES)) {
        return true;
      }
    }
    return false;
  }

  /** Slash-separated path relative to {@code root}, without the {@code .txt} suffix. */
  static String documentName(Path root, Path file) {
    String separator = file.getFileSystem().getSeparator();
    String name = root.relativize(file).toString().replace(separator, "/");
    return name.substring(0, name.length() - SCRIPT_SUFFIX.length());
  }

  // ========================================================================
  // Batch Result
  // ========================================================================

  /** Documents parsed by {@link #parseAll} and the files that failed. */
  public static final class BatchResult {
    private final Map<String, Block> documents;
    private final List<Path> failures;

    BatchResult(Map<String, Block> documents, List<Path> failures) {
      this.documents = Collections.unmodifiableMap(documents);
      this.failures = Collections.unmodifiableList(failures);
    }

    /** Parsed documents by relative name, in parse order. */
    public Map<String, Block> documents() {
      return documents;
    }

    public List<Path> failures() {
      return failures;
    }

    @Override
    public String toString() {
      return "BatchResult[" + documents.size() + " document(s), failures=" + failures + "]";
    }
  }
}
