package io.github.jbellis.ticketsync.issues;

import io.github.jbellis.ticketsync.TicketSyncConfig;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

public class JiraAuth {
    private static final Logger logger = LogManager.getLogger(JiraAuth.class);

    private final String baseUrl;
    private final String username;
    private final String apiToken;

    public JiraAuth(TicketSyncConfig config) {
        this(config.jiraServer(), config.jiraUsername(), config.jiraToken());
    }

    public JiraAuth(String baseUrl, String username, String apiToken) {
        this.baseUrl = baseUrl;
        this.username = username;
        this.apiToken = apiToken;
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Builds an OkHttpClient that authenticates every request. With a username the token is sent as
     * Basic credentials (Jira Cloud), otherwise as a Bearer personal access token (Jira Server/DC).
     */
    public OkHttpClient buildAuthenticatedClient() throws IOException {
        if (baseUrl.isBlank()) {
            String errorMessage = "Jira server not configured. Set " + TicketSyncConfig.JIRA_SERVER + " first.";
            logger.error(errorMessage);
            throw new IOException(errorMessage);
        }

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .writeTimeout(60, TimeUnit.SECONDS)
                .followRedirects(true);

        if (apiToken.isBlank()) {
            logger.warn("Jira API token not configured for {}. Proceeding with unauthenticated client.", baseUrl);
            return builder.build();
        }

        String authorization = username.isBlank()
                ? "Bearer " + apiToken
                : Credentials.basic(username, apiToken);
        builder.addInterceptor(chain -> {
            Request originalRequest = chain.request();
            Request authenticatedRequest = originalRequest.newBuilder()
                    .header("Authorization", authorization)
                    .build();
            return chain.proceed(authenticatedRequest);
        });
        logger.debug("Authenticated OkHttpClient ({}) created for {}", username.isBlank() ? "Bearer" : "Basic", baseUrl);
        return builder.build();
    }
}
