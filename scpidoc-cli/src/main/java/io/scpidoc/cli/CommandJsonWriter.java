package io.scpidoc.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.scpidoc.parser.api.CommandIndex;
import io.scpidoc.parser.api.CommandRecord;
import io.scpidoc.parser.api.Example;
import io.scpidoc.parser.api.ExtractedCommand;
import io.scpidoc.parser.api.ExtractionResult;
import io.scpidoc.parser.api.Parameter;
import io.scpidoc.parser.api.RecordFlag;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link ExtractionResult} as the command library document consumed by the
 * instrument automation front end.
 *
 * <pre>
 * {
 *   "version": "2.0",
 *   "manual": "4/5/6 Series MSO Programmer Manual",
 *   "groups": {"Acquisition": {"name": ..., "description": ..., "commands": [...]}},
 *   "metadata": {"total_commands": 812, "total_groups": 34, "flagged": 3}
 * }
 * </pre>
 */
final class CommandJsonWriter {

  static final String FORMAT_VERSION = "2.0";

  private final Gson gson =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

  JsonObject toJson(ExtractionResult result, CommandIndex index, String manual) {
    JsonObject root = new JsonObject();
    root.addProperty("version", FORMAT_VERSION);
    root.addProperty("manual", manual);

    JsonObject groups = new JsonObject();
    for (Map.Entry<String, List<ExtractedCommand>> entry : result.groups().entrySet()) {
      String name = entry.getKey();
      JsonObject group = new JsonObject();
      group.addProperty("name", name);
      group.addProperty("description", index.groupDescription(name).orElse(""));
      JsonArray commands = new JsonArray();
      for (ExtractedCommand command : entry.getValue()) {
        commands.add(command(command));
      }
      group.add("commands", commands);
      groups.add(name, group);
    }
    root.add("groups", groups);

    JsonObject metadata = new JsonObject();
    metadata.addProperty("total_commands", result.totalCommands());
    metadata.addProperty("total_groups", result.totalGroups());
    metadata.addProperty("flagged", result.flagged().size());
    root.add("metadata", metadata);
    return root;
  }

  void write(JsonObject document, Writer writer) throws IOException {
    gson.toJson(document, writer);
    writer.write(System.lineSeparator());
    writer.flush();
  }

  void write(JsonObject document, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(document, writer);
    }
  }

  private static JsonObject command(ExtractedCommand command) {
    CommandRecord record = command.record();
    JsonObject obj = new JsonObject();
    obj.addProperty("scpi", command.mnemonic());
    obj.addProperty("name", command.name());
    obj.addProperty("group", command.group());
    obj.addProperty("groupSource", lower(command.groupSource().name()));
    obj.addProperty("description", record.description() == null ? "" : record.description());
    obj.addProperty("shortDescription", command.shortDescription());
    obj.addProperty("conditions", record.conditions());
    obj.addProperty("arguments", record.arguments());
    obj.addProperty("returns", record.returns());
    obj.add("syntax", strings(command.syntax()));
    obj.addProperty("setSyntax", command.forms().setForm());
    obj.addProperty("querySyntax", command.forms().queryForm());
    obj.addProperty("commandType", lower(command.commandType().name()));
    obj.addProperty("hasSet", command.forms().hasSet());
    obj.addProperty("hasQuery", command.forms().hasQuery());

    JsonArray params = new JsonArray();
    for (Parameter p : command.parameters()) {
      params.add(parameter(p));
    }
    obj.add("params", params);

    JsonArray examples = new JsonArray();
    for (Example e : command.examples()) {
      JsonObject example = new JsonObject();
      example.addProperty("scpi", e.scpi());
      example.addProperty("description", e.description());
      examples.add(example);
    }
    obj.add("examples", examples);
    obj.addProperty("example", command.example());
    obj.add("relatedCommands", strings(record.related()));
    obj.add("notes", strings(record.notes()));

    JsonArray flags = new JsonArray();
    for (RecordFlag flag : command.flags()) {
      flags.add(flag.name());
    }
    obj.add("flags", flags);
    return obj;
  }

  private static JsonObject parameter(Parameter p) {
    JsonObject obj = new JsonObject();
    obj.addProperty("name", p.name());
    obj.addProperty("type", lower(p.kind().name()));
    obj.addProperty("required", p.required());
    Object value = p.defaultValue();
    if (value instanceof Number) {
      obj.addProperty("default", (Number) value);
    } else if (value != null) {
      obj.addProperty("default", value.toString());
    }
    if (!p.options().isEmpty()) {
      obj.add("options", strings(p.options()));
    }
    if (p.range() != null) {
      obj.addProperty("min", p.range().min());
      obj.addProperty("max", p.range().max());
    }
    if (p.description() != null) {
      obj.addProperty("description", p.description());
    }
    return obj;
  }

  private static JsonArray strings(List<String> values) {
    JsonArray array = new JsonArray(values.size());
    values.forEach(array::add);
    return array;
  }

  private static String lower(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
