package io.scpidoc.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.scpidoc.parser.api.CommandIndex;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the group mapping that backs the Command Index.
 *
 * <pre>
 * {
 *   "Acquisition": {
 *     "description": "Acquisition commands set up the modes and functions ...",
 *     "commands": ["ACQuire:MODe", "ACQuire:STATE"]
 *   }
 * }
 * </pre>
 *
 * A group may also be given as a bare array of mnemonics.
 */
final class CommandIndexLoader {
  private static final Logger log = LoggerFactory.getLogger(CommandIndexLoader.class);

  private CommandIndexLoader() {}

  static CommandIndex load(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader, path.toString());
    }
  }

  static CommandIndex load(Reader reader, String source) throws IOException {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new IOException("Malformed group mapping " + source + ": " + e.getMessage(), e);
    }
    if (!root.isJsonObject()) {
      throw new IOException("Group mapping " + source + " must be a JSON object");
    }

    CommandIndex.Builder builder = CommandIndex.builder();
    JsonObject groups = root.getAsJsonObject();
    for (String group : groups.keySet()) {
      JsonElement value = groups.get(group);
      JsonElement commands;
      if (value.isJsonArray()) {
        commands = value;
      } else if (value.isJsonObject()) {
        JsonObject groupData = value.getAsJsonObject();
        JsonElement description = groupData.get("description");
        if (description != null && !description.isJsonNull() && !description.isJsonPrimitive()) {
          throw new IOException(
              "Description of group '" + group + "' in " + source + " must be a string");
        }
        builder.describe(
            group,
            description == null || description.isJsonNull() ? null : description.getAsString());
        commands = groupData.get("commands");
      } else {
        throw new IOException("Group '" + group + "' in " + source + " must be an object or array");
      }
      if (commands == null || commands.isJsonNull()) {
        log.debug("Group '{}' in {} lists no commands", group, source);
        continue;
      }
      if (!commands.isJsonArray()) {
        throw new IOException("Commands of group '" + group + "' in " + source + " must be an array");
      }
      JsonArray list = commands.getAsJsonArray();
      for (int i = 0; i < list.size(); i++) {
        JsonElement command = list.get(i);
        if (!command.isJsonPrimitive()) {
          throw new IOException(
              "Command " + i + " of group '" + group + "' in " + source + " must be a string");
        }
        builder.add(group, command.getAsString());
      }
    }
    CommandIndex index = builder.build();
    log.info("Loaded {} commands in {} groups from {}", index.size(), index.groups().size(), source);
    return index;
  }
}
