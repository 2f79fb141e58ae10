package io.github.jbellis.ticketsync.issues;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the Jira binding against a local HTTP server standing in for Jira.
 */
class JiraIssueTrackerClientTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private record ReceivedRequest(String method, String path, String authorization, String atlassianToken,
                                   String contentType, String body) {
    }

    private HttpServer mockServer;
    private String serverUrl;
    private final List<ReceivedRequest> receivedRequests = new CopyOnWriteArrayList<>();

    private int mockResponseCode = 200;
    private String mockResponseBody = "{}";

    @BeforeEach
    void setUp() throws IOException {
        mockServer = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        serverUrl = "http://localhost:" + mockServer.getAddress().getPort();
        mockServer.createContext("/", this::handle);
        mockServer.setExecutor(null);
        mockServer.start();
    }

    @AfterEach
    void tearDown() {
        if (mockServer != null) {
            mockServer.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        var headers = exchange.getRequestHeaders();
        receivedRequests.add(new ReceivedRequest(exchange.getRequestMethod(),
                                                 exchange.getRequestURI().getPath(),
                                                 headers.getFirst("Authorization"),
                                                 headers.getFirst("X-Atlassian-Token"),
                                                 headers.getFirst("Content-Type"),
                                                 new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)));
        var bytes = mockResponseBody.getBytes(StandardCharsets.UTF_8);
        if (mockResponseCode == 204) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(mockResponseCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private JiraIssueTrackerClient client(String username, String token) {
        return new JiraIssueTrackerClient(new JiraAuth(serverUrl, username, token));
    }

    private ReceivedRequest onlyRequest() {
        assertEquals(1, receivedRequests.size(), receivedRequests.toString());
        return receivedRequests.get(0);
    }

    @Test
    void testIssueIsLoadedWithBearerToken() throws Exception {
        mockResponseBody = """
                {"key":"PROJ-1","fields":{"summary":"Hello",
                 "attachment":[{"id":"10","filename":"spec.pdf","created":"T1","content":"http://x/spec.pdf"}]}}
                """;

        var issue = client("", "secret").issue("PROJ-1");

        assertEquals("PROJ-1", issue.key());
        assertEquals("Hello", issue.field("summary").orElseThrow().asText());
        assertEquals(List.of(new RemoteAttachment("10", "spec.pdf", "T1", "http://x/spec.pdf")), issue.attachments());
        var request = onlyRequest();
        assertEquals("GET", request.method());
        assertEquals("/rest/api/2/issue/PROJ-1", request.path());
        assertEquals("Bearer secret", request.authorization());
    }

    @Test
    void testUsernameSwitchesToBasicAuth() throws Exception {
        mockResponseBody = "{\"key\":\"PROJ-1\",\"fields\":{}}";

        client("ada@example.com", "secret").issue("PROJ-1");

        assertTrue(onlyRequest().authorization().startsWith("Basic "));
    }

    @Test
    void testMismatchedKeyIsAnError() {
        mockResponseBody = "{\"key\":\"OTHER-2\",\"fields\":{}}";
        assertThrows(IOException.class, () -> client("", "secret").issue("PROJ-1"));
    }

    @Test
    void testErrorStatusRaisesIOException() {
        mockResponseCode = 404;
        mockResponseBody = "{\"errorMessages\":[\"Issue does not exist\"]}";

        var thrown = assertThrows(IOException.class, () -> client("", "secret").issue("PROJ-404"));
        assertTrue(thrown.getMessage().contains("404"), thrown.getMessage());
        assertEquals(1, receivedRequests.size(), "no retries");
    }

    @Test
    void testMissingServerIsAnError() {
        var unconfigured = new JiraIssueTrackerClient(new JiraAuth("", "", "secret"));
        assertThrows(IOException.class, () -> unconfigured.issue("PROJ-1"));
    }

    @Test
    void testUpdateSendsAllFieldsInOneRequest() throws Exception {
        mockResponseCode = 204;

        client("", "secret").update("PROJ-1", Map.of("summary", "New", "environment", "Linux"));

        var request = onlyRequest();
        assertEquals("PUT", request.method());
        assertEquals("/rest/api/2/issue/PROJ-1", request.path());
        var fields = objectMapper.readTree(request.body()).path("fields");
        assertEquals("New", fields.path("summary").asText());
        assertEquals("Linux", fields.path("environment").asText());
    }

    @Test
    void testAddComment() throws Exception {
        mockResponseCode = 201;
        mockResponseBody = "{\"id\":\"1\"}";

        client("", "secret").addComment("PROJ-1", "looks good");

        var request = onlyRequest();
        assertEquals("POST", request.method());
        assertEquals("/rest/api/2/issue/PROJ-1/comment", request.path());
        assertEquals("looks good", objectMapper.readTree(request.body()).path("body").asText());
    }

    @Test
    void testAddAttachmentIsMultipart() throws Exception {
        mockResponseBody = "[{\"id\":\"77\",\"filename\":\"notes.txt\",\"created\":\"2024-05-01T12:00:00.000+0000\"}]";

        var attachment = client("", "secret")
                .addAttachment("PROJ-1", "notes.txt", "my notes".getBytes(StandardCharsets.UTF_8));

        assertEquals(new RemoteAttachment("77", "notes.txt", "2024-05-01T12:00:00.000+0000", null), attachment);
        var request = onlyRequest();
        assertEquals("POST", request.method());
        assertEquals("/rest/api/2/issue/PROJ-1/attachments", request.path());
        assertEquals("no-check", request.atlassianToken());
        assertTrue(request.contentType().startsWith("multipart/form-data"), request.contentType());
        assertTrue(request.body().contains("filename=\"notes.txt\""), request.body());
        assertTrue(request.body().contains("my notes"));
    }

    @Test
    void testDeleteAttachment() throws Exception {
        mockResponseCode = 204;

        client("", "secret").deleteAttachment(new RemoteAttachment("77", "notes.txt", "T", null));

        var request = onlyRequest();
        assertEquals("DELETE", request.method());
        assertEquals("/rest/api/2/attachment/77", request.path());
    }

    @Test
    void testDownloadPrefersContentUrl() throws Exception {
        mockResponseBody = "pdf bytes";

        var bytes = client("", "secret")
                .download(new RemoteAttachment("10", "spec.pdf", "T1", serverUrl + "/secure/attachment/10/spec.pdf"));

        assertEquals("pdf bytes", new String(bytes, StandardCharsets.UTF_8));
        assertEquals("/secure/attachment/10/spec.pdf", onlyRequest().path());
    }

    @Test
    void testDownloadFallsBackToAttachmentContentEndpoint() throws Exception {
        mockResponseBody = "pdf bytes";

        client("", "secret").download(new RemoteAttachment("10", "spec.pdf", "T1", null));

        assertEquals("/rest/api/2/attachment/content/10", onlyRequest().path());
    }
}
