package io.github.jbellis.ticketsync.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.issues.IssueSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Renders fields as indented blocks:
 * <pre>
 * summary::
 *
 *     Fix the frobnicator
 *
 * </pre>
 * The parser inverts exactly this shape: a header {@code name::} at column zero, followed by content
 * lines indented by {@link #INDENT}, which run until the next header.
 */
public class IndentedFieldCodec implements FieldCodec {
    private static final Logger logger = LogManager.getLogger(IndentedFieldCodec.class);

    static final String INDENT = "    ";
    private static final Pattern HEADER = Pattern.compile("^(\\S+)::\\s*$");
    private static final List<String> OBJECT_LABELS = List.of("name", "displayName", "value", "key");

    private final List<String> fileFields;
    private final Set<String> noDetailFields;

    public IndentedFieldCodec() {
        this(TicketLayout.FILE_FIELDS, TicketLayout.NO_DETAIL_FIELDS);
    }

    public IndentedFieldCodec(List<String> fileFields, Set<String> noDetailFields) {
        this.fileFields = List.copyOf(fileFields);
        this.noDetailFields = Set.copyOf(noDetailFields);
    }

    @Override
    public List<String> renderedFileNames() {
        var names = ImmutableList.<String>builder()
                .add(TicketLayout.TICKET_DETAILS)
                .add(TicketLayout.TICKET_COMMENTS);
        fileFields.forEach(field -> names.add(TicketLayout.fileFieldName(field)));
        return names.build();
    }

    @Override
    public Map<String, byte[]> render(IssueSnapshot issue) {
        var files = ImmutableMap.<String, byte[]>builder();
        var details = new StringBuilder();

        for (var field : issue.fieldNames()) {
            var value = stringify(issue.field(field).orElse(null));
            if (fileFields.contains(field)) {
                files.put(TicketLayout.fileFieldName(field), utf8(value + "\n"));
            } else if (!noDetailFields.contains(field)) {
                details.append(field).append("::\n\n");
                appendIndented(details, value);
                details.append('\n');
            }
        }
        files.put(TicketLayout.TICKET_DETAILS, utf8(details.toString()));

        var comments = new StringBuilder();
        for (var comment : issue.comments()) {
            comments.append(comment.created()).append(": ").append(comment.author()).append("::\n\n");
            appendIndented(comments, normalizeNewlines(comment.body()));
            comments.append('\n');
        }
        files.put(TicketLayout.TICKET_COMMENTS, utf8(comments.toString()));

        return files.build();
    }

    @Override
    public Map<String, String> parse(FileSource source) throws IOException {
        var fields = new LinkedHashMap<String, String>();
        source.read(TicketLayout.TICKET_DETAILS).ifPresent(text -> fields.putAll(parseBlocks(text)));
        for (var field : fileFields) {
            source.read(TicketLayout.fileFieldName(field))
                    .ifPresent(text -> fields.put(field, normalizeNewlines(text).strip()));
        }
        return fields;
    }

    /**
     * Parses the indented block format back into {@code name -> value}.
     */
    static Map<String, String> parseBlocks(String text) {
        var fields = new LinkedHashMap<String, String>();
        String currentField = null;
        var lines = new ArrayList<String>();

        for (var line : normalizeNewlines(text).split("\n", -1)) {
            var header = HEADER.matcher(line);
            if (header.matches()) {
                if (currentField != null) {
                    fields.put(currentField, String.join("\n", lines).strip());
                }
                currentField = header.group(1);
                lines.clear();
                continue;
            }
            if (currentField == null) {
                if (!line.isBlank()) {
                    logger.debug("Ignoring text before the first field header: {}", line);
                }
                continue;
            }
            lines.add(line.startsWith(INDENT) ? line.substring(INDENT.length()) : line.strip());
        }
        if (currentField != null) {
            fields.put(currentField, String.join("\n", lines).strip());
        }
        return fields;
    }

    /**
     * Flattens a raw field value into the text shown to the user. Missing values render as empty.
     */
    static String stringify(@Nullable JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isTextual()) {
            return normalizeNewlines(value.asText()).strip();
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        if (value.isArray()) {
            return StreamSupport.stream(value.spliterator(), false)
                    .map(IndentedFieldCodec::stringify)
                    .collect(Collectors.joining(", "));
        }
        for (var label : OBJECT_LABELS) {
            var labelNode = value.get(label);
            if (labelNode != null && labelNode.isValueNode() && !labelNode.isNull()) {
                return labelNode.asText();
            }
        }
        return value.toString();
    }

    private static void appendIndented(StringBuilder out, String value) {
        for (var line : value.split("\n", -1)) {
            out.append(INDENT).append(line).append('\n');
        }
    }

    private static String normalizeNewlines(String text) {
        return text.replace("\r\n", "\n");
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
