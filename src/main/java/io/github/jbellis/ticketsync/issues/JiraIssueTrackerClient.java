package io.github.jbellis.ticketsync.issues;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.Map;

/**
 * {@link IssueTrackerClient} over the Jira REST API v2.
 */
public class JiraIssueTrackerClient implements IssueTrackerClient {
    private static final Logger logger = LogManager.getLogger(JiraIssueTrackerClient.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final JiraAuth jiraAuth;
    private final String apiRoot;
    @Nullable
    private OkHttpClient client;

    public JiraIssueTrackerClient(JiraAuth jiraAuth) {
        this.jiraAuth = jiraAuth;
        this.apiRoot = jiraAuth.baseUrl() + "/rest/api/" + ConnectionOptions.DEFAULT_REST_API_VERSION;
    }

    private synchronized OkHttpClient httpClient() throws IOException {
        if (client == null) {
            client = jiraAuth.buildAuthenticatedClient();
        }
        return client;
    }

    @Override
    public ConnectionOptions connectionOptions() {
        return new ConnectionOptions(jiraAuth.baseUrl());
    }

    @Override
    public IssueSnapshot issue(String key) throws IOException {
        logger.debug("Loading Jira issue {}", key);
        var request = new Request.Builder()
                .url(url("issue/" + key))
                .header("Accept", "application/json")
                .get()
                .build();
        var body = execute(request, "load issue " + key);
        var root = objectMapper.readTree(body);
        var fetchedKey = root.path("key").asText(null);
        if (fetchedKey == null || !fetchedKey.equalsIgnoreCase(key)) {
            throw new IOException("Fetched issue key (" + fetchedKey + ") does not match requested key (" + key + ")");
        }
        return IssueSnapshot.fromRaw(root);
    }

    @Override
    public byte[] download(RemoteAttachment attachment) throws IOException {
        var contentUrl = attachment.contentUrl() != null
                ? attachment.contentUrl()
                : url("attachment/content/" + attachment.id()).toString();
        var request = new Request.Builder().url(contentUrl).get().build();
        try (Response response = httpClient().newCall(request).execute()) {
            var responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new IOException("Failed to download attachment " + attachment.filename()
                                      + ": " + response.code() + " " + response.message());
            }
            return responseBody.bytes();
        }
    }

    @Override
    public RemoteAttachment addAttachment(String key, String filename, byte[] content) throws IOException {
        var multipart = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", filename, RequestBody.create(content, OCTET_STREAM))
                .build();
        var request = new Request.Builder()
                .url(url("issue/" + key + "/attachments"))
                .header("Accept", "application/json")
                .header("X-Atlassian-Token", "no-check")
                .post(multipart)
                .build();
        var root = objectMapper.readTree(execute(request, "attach " + filename + " to " + key));
        // Jira answers with an array holding the created attachment
        JsonNode created = root.isArray() && !root.isEmpty() ? root.get(0) : root;
        return new RemoteAttachment(created.path("id").asText(""),
                                    created.path("filename").asText(filename),
                                    created.path("created").asText(""),
                                    created.hasNonNull("content") ? created.get("content").asText() : null);
    }

    @Override
    public void deleteAttachment(RemoteAttachment attachment) throws IOException {
        var request = new Request.Builder()
                .url(url("attachment/" + attachment.id()))
                .delete()
                .build();
        execute(request, "delete attachment " + attachment.filename());
    }

    @Override
    public void update(String key, Map<String, String> fields) throws IOException {
        var payload = objectMapper.createObjectNode();
        var fieldsNode = payload.putObject("fields");
        fields.forEach(fieldsNode::put);
        var request = new Request.Builder()
                .url(url("issue/" + key))
                .header("Accept", "application/json")
                .put(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
        execute(request, "update fields " + fields.keySet() + " of " + key);
    }

    @Override
    public void addComment(String key, String body) throws IOException {
        var payload = objectMapper.createObjectNode().put("body", body);
        var request = new Request.Builder()
                .url(url("issue/" + key + "/comment"))
                .header("Accept", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
        execute(request, "comment on " + key);
    }

    private HttpUrl url(String path) throws IOException {
        var parsed = HttpUrl.parse(apiRoot + "/" + path);
        if (parsed == null) {
            throw new IOException("Invalid Jira URL: " + apiRoot + "/" + path);
        }
        return parsed;
    }

    /**
     * Executes the request once and returns the body text. Any non-2xx status is an IOException.
     */
    private String execute(Request request, String description) throws IOException {
        try (Response response = httpClient().newCall(request).execute()) {
            var responseBody = response.body();
            var text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                logger.error("Failed to {}. URL: {}. HTTP Status: {}. Message: {}. Body: {}",
                             description, request.url(), response.code(), response.message(), text);
                throw new IOException("Failed to " + description + ": " + response.code() + " " + response.message());
            }
            return text;
        }
    }
}
