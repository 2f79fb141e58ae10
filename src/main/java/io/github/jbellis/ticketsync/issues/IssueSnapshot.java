package io.github.jbellis.ticketsync.issues;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a tracker issue backed by its raw REST payload.
 * <p>
 * The raw payload is kept verbatim so that it can be cached to disk and rebuilt
 * later, and so that fields the tracker adds over time need no code changes here.
 */
public record IssueSnapshot(String key, JsonNode raw) {

    public static IssueSnapshot fromRaw(JsonNode raw) {
        var key = raw.path("key").asText(null);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Issue payload has no 'key'");
        }
        return new IssueSnapshot(key, raw);
    }

    public JsonNode fields() {
        return raw.path("fields");
    }

    /**
     * All field names present in the payload, in lexicographic order.
     */
    public List<String> fieldNames() {
        var names = new ArrayList<String>();
        fields().fieldNames().forEachRemaining(names::add);
        names.sort(null);
        return names;
    }

    /**
     * The raw value of a field; empty when absent or JSON null.
     */
    public Optional<JsonNode> field(String name) {
        var node = fields().get(name);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    public ImmutableList<RemoteAttachment> attachments() {
        var builder = ImmutableList.<RemoteAttachment>builder();
        var attachmentsNode = fields().path("attachment");
        if (attachmentsNode.isArray()) {
            for (var node : attachmentsNode) {
                builder.add(new RemoteAttachment(node.path("id").asText(""),
                                                 node.path("filename").asText(""),
                                                 node.path("created").asText(""),
                                                 textOrNull(node.get("content"))));
            }
        }
        return builder.build();
    }

    public ImmutableList<RemoteComment> comments() {
        var builder = ImmutableList.<RemoteComment>builder();
        var commentsNode = fields().path("comment").path("comments");
        if (commentsNode.isArray()) {
            for (var node : commentsNode) {
                var authorNode = node.path("author");
                var author = authorNode.isObject()
                        ? authorNode.path("displayName").asText(authorNode.path("name").asText(""))
                        : authorNode.asText("");
                builder.add(new RemoteComment(author,
                                              node.path("created").asText(""),
                                              node.path("body").asText("")));
            }
        }
        return builder.build();
    }

    @Nullable
    private static String textOrNull(@Nullable JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    @Override
    public String toString() {
        return key;
    }
}
