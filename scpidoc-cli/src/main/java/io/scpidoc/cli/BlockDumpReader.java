package io.scpidoc.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.scpidoc.parser.api.DocumentBlock;
import io.scpidoc.parser.api.TextRun;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a manual block dump: the paragraphs of a rendered document, in reading order.
 *
 * <pre>
 * [
 *   {"text": "ACQuire:STATE", "style": "Heading 4", "bold": true,
 *    "runs": [{"text": "ACQuire:STATE", "font": "Arial Narrow", "bold": true}]},
 *   {"runs": [{"text": "Sets or queries the acquisition state."}]}
 * ]
 * </pre>
 *
 * A block without {@code text} takes the concatenation of its runs.
 */
final class BlockDumpReader {

  private BlockDumpReader() {}

  static List<DocumentBlock> read(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    }
  }

  static List<DocumentBlock> read(Reader reader, String source) throws IOException {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new IOException("Malformed block dump " + source + ": " + e.getMessage(), e);
    }
    if (!root.isJsonArray()) {
      throw new IOException("Block dump " + source + " must be a JSON array");
    }
    JsonArray array = root.getAsJsonArray();
    List<DocumentBlock> blocks = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonElement element = array.get(i);
      if (!element.isJsonObject()) {
        throw new IOException("Block " + i + " of " + source + " is not a JSON object");
      }
      blocks.add(toBlock(element.getAsJsonObject(), i, source));
    }
    return blocks;
  }

  private static DocumentBlock toBlock(JsonObject obj, int position, String source)
      throws IOException {
    String where = "Block " + position + " of " + source;
    List<TextRun> runs = new ArrayList<>();
    JsonElement runsElement = obj.get("runs");
    if (runsElement != null && !runsElement.isJsonNull()) {
      if (!runsElement.isJsonArray()) {
        throw new IOException(where + ": runs must be an array");
      }
      for (JsonElement runElement : runsElement.getAsJsonArray()) {
        if (!runElement.isJsonObject()) {
          throw new IOException(where + ": run is not a JSON object");
        }
        JsonObject run = runElement.getAsJsonObject();
        runs.add(
            new TextRun(
                string(run, "text", where),
                string(run, "font", where),
                bool(run, "bold", where),
                bool(run, "italic", where)));
      }
    }
    return new DocumentBlock(
        string(obj, "text", where), runs, string(obj, "style", where), bool(obj, "bold", where));
  }

  private static String string(JsonObject obj, String name, String where) throws IOException {
    JsonElement e = obj.get(name);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonPrimitive()) {
      throw new IOException(where + ": " + name + " must be a string");
    }
    return e.getAsString();
  }

  private static Boolean bool(JsonObject obj, String name, String where) throws IOException {
    JsonElement e = obj.get(name);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
      throw new IOException(where + ": " + name + " must be true or false");
    }
    return e.getAsBoolean();
  }
}
