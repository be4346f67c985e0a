package de.bycsitsm.dispatch.fieldservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link FieldServiceClient} talking to the platform's JSON REST API using
 * Java's built-in {@link HttpClient}.
 * <p>
 * Task listing is paginated with {@code limit}/{@code offset} and stops after
 * {@link FieldServiceProperties#maxPages()} pages, since the platform has no
 * reliable server-side date filter and would otherwise be scanned without bound.
 * <p>
 * The scheduling-team endpoint moved between API versions; the known paths are
 * tried in order until one answers.
 */
@Component
class HttpFieldServiceClient implements FieldServiceClient {

    private static final Logger log = LoggerFactory.getLogger(HttpFieldServiceClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private static final String TASKS_PATH = "admin/scheduling/tasks";
    private static final String ADMINISTRATORS_PATH = "admin/administration/administrators";
    private static final List<String> TEAM_PATHS = List.of(
            "admin/config/scheduling-teams",
            "admin/scheduling/teams",
            "admin/config/scheduling/teams");

    private static final String ASSIGNED_TO_ADMINISTRATOR = "assigned_to_administrator";
    private static final String ASSIGNED_TO_TEAM = "assigned_to_team";

    private final FieldServiceProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    HttpFieldServiceClient(FieldServiceProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        var clientBuilder = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (properties.trustAllCertificates()) {
            log.warn("Field-service client is configured to accept all SSL certificates including self-signed. "
                    + "Set fieldservice.trust-all-certificates=false to enforce certificate validation.");
            clientBuilder.sslContext(createTrustAllSslContext());
        }
        this.httpClient = clientBuilder.build();
    }

    @Override
    public List<ExternalTask> listTasks(TaskQuery query) {
        var baseParams = new LinkedHashMap<String, String>();
        if (query.administratorId() != null) {
            baseParams.put("main_attributes[assignee]", query.administratorId().toString());
            baseParams.put("main_attributes[assigned_to]", ASSIGNED_TO_ADMINISTRATOR);
        } else if (query.teamId() != null) {
            baseParams.put("main_attributes[assignee]", query.teamId().toString());
            baseParams.put("main_attributes[assigned_to]", ASSIGNED_TO_TEAM);
        }

        var tasks = new ArrayList<ExternalTask>();
        var pageSize = properties.pageSize();
        for (int page = 0; page < properties.maxPages(); page++) {
            var params = new LinkedHashMap<>(baseParams);
            params.put("limit", Integer.toString(pageSize));
            params.put("offset", Integer.toString(page * pageSize));

            var pageTasks = parseTasks(sendGet(buildUrl(TASKS_PATH, params)));
            tasks.addAll(pageTasks);
            // one task per received element, id or not
            if (pageTasks.size() < pageSize) {
                log.debug("Fetched {} task(s) in {} page(s)", tasks.size(), page + 1);
                return tasks;
            }
        }

        log.warn("Stopped task listing after {} page(s) ({} tasks); results may be incomplete",
                properties.maxPages(), tasks.size());
        return tasks;
    }

    @Override
    public List<ExternalTeam> listTeams() {
        FieldServiceException lastError = null;
        for (var path : TEAM_PATHS) {
            try {
                var teams = parseTeams(sendGet(buildUrl(path, Map.of())));
                log.debug("Found {} team(s) at path {}", teams.size(), path);
                return teams;
            } catch (FieldServiceException e) {
                log.debug("Team path {} failed: {}", path, e.getMessage());
                lastError = e;
            }
        }
        throw new FieldServiceException("Failed to fetch scheduling teams: "
                + (lastError != null ? lastError.getMessage() : "no team endpoint available"), lastError);
    }

    @Override
    public List<ExternalAdministrator> listAdministrators() {
        return parseAdministrators(sendGet(buildUrl(ADMINISTRATORS_PATH, Map.of())));
    }

    // =========================================================================
    // Response parsing
    // =========================================================================

    /**
     * Maps every element of a task response to a task, including elements without
     * an id, so that the number of tasks equals the number of elements received.
     */
    List<ExternalTask> parseTasks(String json) {
        return parseItems(json, "tasks", node -> {
            var id = text(node, "id");

            var durationHours = parseLong(text(node, "scheduled_duration_hours"));
            var durationMinutes = parseLong(text(node, "scheduled_duration_minutes"));
            var duration = (int) ((durationHours != null ? durationHours : 1) * 60
                    + (durationMinutes != null ? durationMinutes : 0));

            var assignedTo = text(node, "assigned_to");
            var assignee = parseLong(text(node, "assignee", "assigned_admin_id"));
            AssigneeKind kind;
            if (assignee == null) {
                kind = AssigneeKind.NONE;
            } else if (ASSIGNED_TO_TEAM.equals(assignedTo)) {
                kind = AssigneeKind.TEAM;
            } else {
                kind = AssigneeKind.ADMINISTRATOR;
            }

            return new ExternalTask(
                    id,
                    text(node, "title"),
                    text(node, "description"),
                    text(node, "scheduled_from"),
                    text(node, "scheduled_date"),
                    text(node, "scheduled_time"),
                    duration,
                    kind,
                    assignee,
                    text(node, "status", "workflow_status_id"),
                    parseLong(text(node, "project_id")),
                    parseLong(text(node, "related_customer_id", "customer_id")),
                    text(node, "location", "address"));
        });
    }

    List<ExternalTeam> parseTeams(String json) {
        return parseItems(json, "teams", node -> {
            var id = parseLong(text(node, "id"));
            if (id == null) {
                return null;
            }
            var title = text(node, "title", "name");
            var members = node.has("admin_ids") ? node.get("admin_ids")
                    : node.has("members") ? node.get("members")
                    : node.get("member_ids");
            return new ExternalTeam(
                    id,
                    title != null ? title : "Team " + id,
                    parseLong(text(node, "partner_id")),
                    parseMemberIds(members),
                    text(node, "color"));
        });
    }

    List<ExternalAdministrator> parseAdministrators(String json) {
        return parseItems(json, "administrators", node -> {
            var id = parseLong(text(node, "id"));
            if (id == null) {
                return null;
            }
            var login = text(node, "login");
            var active = node.get("is_active");
            var isActive = active == null || active.isNull()
                    || !(active.asText().equals("0") || active.asText().equalsIgnoreCase("false"));
            return new ExternalAdministrator(
                    id,
                    login != null ? login : id.toString(),
                    text(node, "name", "full_name"),
                    text(node, "email"),
                    isActive);
        });
    }

    /**
     * Reads a list response. The platform answers with a plain array, an object
     * with an {@code items} array, or an object keyed by record id.
     */
    private <T> List<T> parseItems(String json, String what, Function<JsonNode, @Nullable T> mapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new FieldServiceException("Failed to parse " + what + " response: " + e.getMessage(), e);
        }

        var elements = new ArrayList<JsonNode>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        } else if (root.isArray()) {
            root.forEach(elements::add);
        } else if (root.has("items") && root.get("items").isArray()) {
            root.get("items").forEach(elements::add);
        } else if (root.isObject()) {
            root.forEach(child -> {
                if (child.isObject()) {
                    elements.add(child);
                }
            });
        }

        var result = new ArrayList<T>();
        for (var element : elements) {
            var item = mapper.apply(element);
            if (item != null) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Member ids arrive as an array, a comma-separated string, or an object
     * whose values are the ids.
     */
    private List<Long> parseMemberIds(@Nullable JsonNode members) {
        var ids = new ArrayList<Long>();
        if (members == null || members.isNull()) {
            return ids;
        }
        if (members.isTextual()) {
            for (var part : members.asText().split(",")) {
                var id = parseLong(part);
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids;
        }
        members.forEach(value -> {
            var id = parseLong(value.asText());
            if (id != null) {
                ids.add(id);
            }
        });
        return ids;
    }

    private @Nullable String text(JsonNode node, String... fieldNames) {
        for (var fieldName : fieldNames) {
            var value = node.get(fieldName);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                var text = value.asText();
                if (!text.isBlank()) {
                    return text.strip();
                }
            }
        }
        return null;
    }

    private @Nullable Long parseLong(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // =========================================================================
    // Transport
    // =========================================================================

    String buildUrl(String path, Map<String, String> params) {
        var base = properties.baseUrl().strip();
        if (!base.endsWith("/")) {
            base += "/";
        }
        if (!base.startsWith("http://") && !base.startsWith("https://")) {
            base = "https://" + base;
        }

        var url = new StringBuilder(base).append(path);
        var separator = '?';
        for (var entry : params.entrySet()) {
            url.append(separator)
                    .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return url.toString();
    }

    private String sendGet(String url) {
        if (!properties.isConfigured()) {
            throw new FieldServiceException("Field-service integration is not configured.");
        }

        var request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .GET()
                .header("Accept", "application/json")
                .header("Authorization", properties.authHeader())
                .timeout(REQUEST_TIMEOUT)
                .build();

        log.debug("Sending GET to {}", url);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FieldServiceException("Request to field-service platform failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FieldServiceException("Request to field-service platform was interrupted.", e);
        }

        return switch (response.statusCode()) {
            case 200 -> response.body();
            case 401 -> throw new FieldServiceException("Authentication failed. Please check the API key.");
            case 403 -> throw new FieldServiceException("Access denied. The API key lacks permission for " + url + ".");
            case 404 -> throw new FieldServiceException("Endpoint not found: " + url);
            default -> throw new FieldServiceException("Server returned unexpected status " + response.statusCode() + ".");
        };
    }

    /**
     * Creates an {@link SSLContext} that trusts all certificates, including self-signed ones.
     */
    private SSLContext createTrustAllSslContext() {
        try {
            var trustAllManager = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // Trust all client certificates
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // Trust all server certificates
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };

            var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAllManager}, null);
            return sslContext;
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new FieldServiceException("Failed to create SSL context for trusting all certificates.", e);
        }
    }
}
