package de.bycsitsm.dispatch.fieldservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFieldServiceClientPagingTest {

    private static final int PAGE_SIZE = 2;
    private static final int MAX_PAGES = 3;

    private final Map<Integer, String> pagesByOffset = new HashMap<>();
    private final List<String> requestedQueries = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private HttpFieldServiceClient client;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/api/admin/scheduling/tasks", exchange -> {
            var query = exchange.getRequestURI().getQuery();
            requestedQueries.add(query);
            var body = pagesByOffset.getOrDefault(offsetOf(query), "[]").getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (var out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();

        var baseUrl = "http://localhost:" + server.getAddress().getPort() + "/api";
        client = new HttpFieldServiceClient(
                new FieldServiceProperties(baseUrl, "Basic dGVzdDp0ZXN0", PAGE_SIZE, MAX_PAGES, null, false),
                new ObjectMapper());
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static int offsetOf(String query) {
        for (var part : query.split("&")) {
            if (part.startsWith("offset=")) {
                return Integer.parseInt(part.substring("offset=".length()));
            }
        }
        return 0;
    }

    private static String task(String id) {
        return "{\"id\": \"" + id + "\", \"scheduled_from\": \"2025-01-06 09:00:00\"}";
    }

    private List<Integer> requestedOffsets() {
        return requestedQueries.stream().map(HttpFieldServiceClientPagingTest::offsetOf).toList();
    }

    @Test
    void scan_continues_past_full_pages_and_stops_on_short_page() {
        pagesByOffset.put(0, "[" + task("1") + ", " + task("2") + "]");
        pagesByOffset.put(2, "[" + task("3") + "]");

        var tasks = client.listTasks(TaskQuery.all());

        assertThat(tasks).extracting(ExternalTask::id).containsExactly("1", "2", "3");
        assertThat(requestedOffsets()).containsExactly(0, 2);
        assertThat(requestedQueries).allMatch(query -> query.contains("limit=2"));
    }

    @Test
    void task_without_id_does_not_end_the_scan() {
        pagesByOffset.put(0, "[{\"title\": \"no id\"}, " + task("1") + "]");
        pagesByOffset.put(2, "[" + task("2") + "]");

        var tasks = client.listTasks(TaskQuery.all());

        assertThat(tasks).extracting(ExternalTask::id).containsExactly(null, "1", "2");
        assertThat(requestedOffsets()).containsExactly(0, 2);
    }

    @Test
    void scan_stops_at_page_cap() {
        pagesByOffset.put(0, "[" + task("1") + ", " + task("2") + "]");
        pagesByOffset.put(2, "[" + task("3") + ", " + task("4") + "]");
        pagesByOffset.put(4, "[" + task("5") + ", " + task("6") + "]");
        pagesByOffset.put(6, "[" + task("7") + "]");

        var tasks = client.listTasks(TaskQuery.all());

        assertThat(tasks).extracting(ExternalTask::id).containsExactly("1", "2", "3", "4", "5", "6");
        assertThat(requestedOffsets()).containsExactly(0, 2, 4);
    }

    @Test
    void empty_first_page_ends_the_scan() {
        assertThat(client.listTasks(TaskQuery.all())).isEmpty();
        assertThat(requestedOffsets()).containsExactly(0);
    }

    @Test
    void administrator_hint_is_sent_with_every_page() {
        pagesByOffset.put(0, "[" + task("1") + ", " + task("2") + "]");

        client.listTasks(TaskQuery.forAdministrator(101));

        assertThat(requestedQueries).hasSize(2).allSatisfy(query -> assertThat(query)
                .contains("main_attributes[assignee]=101")
                .contains("main_attributes[assigned_to]=assigned_to_administrator"));
    }

    @Test
    void team_hint_is_sent_as_team_assignment() {
        client.listTasks(TaskQuery.forTeam(4));

        assertThat(requestedQueries).singleElement().satisfies(query -> assertThat(query)
                .contains("main_attributes[assignee]=4")
                .contains("main_attributes[assigned_to]=assigned_to_team"));
    }
}
