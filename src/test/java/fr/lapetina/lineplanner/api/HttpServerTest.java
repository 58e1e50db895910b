package fr.lapetina.lineplanner.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.lineplanner.LinePlannerFactory;
import fr.lapetina.lineplanner.infrastructure.config.LinePlannerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests over a real socket.
 * Configuration is externalized to test-config.yaml.
 */
class HttpServerTest {

    private static final String SHIRT = """
            {
              "operations": [
                {"op_no": "1", "op_name": "Cuff run stitch", "machine_type": "SNLS", "smv": 1.0, "section": "Cuff"},
                {"op_no": "2", "op_name": "Cuff press", "machine_type": "Iron Table", "smv": 0.5, "section": "Cuff"},
                {"op_no": "3", "op_name": "Side seam", "machine_type": "SNEC", "smv": 2.5, "section": "Assembly"},
                {"op_no": "4", "op_name": "Button hole", "machine_type": "Button Hole", "smv": 0.6, "section": "Assembly"}
              ],
              "target_output": 480,
              "working_minutes": 480
            }
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private LinePlannerFactory factory;
    private HttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        factory = LinePlannerFactory.create("test-config.yaml");
        server = new HttpServer(0, 10, 2, factory);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(Duration.ofSeconds(10))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .GET()
                .timeout(Duration.ofSeconds(10))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    @Test
    @DisplayName("should generate a layout with summary and fixtures")
    void shouldGenerateLayout() throws Exception {
        HttpResponse<String> response = post("/v1/layout", SHIRT);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("layout_id").asText()).isNotBlank();
        assertThat(body.get("generated_at").isTextual()).isTrue();
        // 1 + 1 + 3 + 1
        assertThat(body.get("summary").get("totalMachines").asInt()).isEqualTo(6);

        List<String> kinds = new ArrayList<>();
        body.get("entities").forEach(e -> kinds.add(e.get("kind").asText()));
        assertThat(kinds).contains("MACHINE", "SECTION_BOARD", "INSPECTION_TABLE", "TROLLEY",
                "SUPERMARKET_CABINET", "TABLE_AND_CHAIR");

        JsonNode firstMachine = null;
        for (JsonNode entity : body.get("entities")) {
            if ("MACHINE".equals(entity.get("kind").asText())) {
                firstMachine = entity;
                break;
            }
        }
        assertThat(firstMachine).isNotNull();
        assertThat(firstMachine.get("lane").asText()).isEqualTo("A");
        assertThat(firstMachine.get("category").asText()).isEqualTo("SNLS");
        assertThat(firstMachine.get("operation").get("op_no").asText()).isEqualTo("1");
        assertThat(firstMachine.get("is_inspection").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("should balance without placing")
    void shouldBalance() throws Exception {
        HttpResponse<String> response = post("/v1/balance", SHIRT);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("takt_time").asDouble()).isEqualTo(1.0);
        assertThat(body.get("total_machines").asInt()).isEqualTo(6);
        assertThat(body.get("operations").get(2).get("required_machines").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("should use configured demand defaults when the request omits them")
    void shouldApplyDemandDefaults() throws Exception {
        String body = """
                {"operations": [{"op_no": "1", "machine_type": "SNLS", "smv": 2.0, "section": "Cuff"}]}
                """;

        HttpResponse<String> response = post("/v1/balance", body);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("total_machines").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject a non-positive target with INVALID_DEMAND")
    void shouldRejectInvalidDemand() throws Exception {
        String body = """
                {"operations": [], "target_output": 0, "working_minutes": 480}
                """;

        HttpResponse<String> response = post("/v1/layout", body);

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error_type").asText()).isEqualTo("INVALID_DEMAND");
    }

    @Test
    @DisplayName("should reject a malformed operation with MALFORMED_OPERATION")
    void shouldRejectMalformedOperation() throws Exception {
        String body = """
                {"operations": [{"op_no": "1", "smv": 1.0, "section": "Cuff"}],
                 "target_output": 480, "working_minutes": 480}
                """;

        HttpResponse<String> response = post("/v1/layout", body);

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error_type").asText()).isEqualTo("MALFORMED_OPERATION");
    }

    @Test
    @DisplayName("should reject unparsable JSON with INVALID_REQUEST")
    void shouldRejectInvalidJson() throws Exception {
        HttpResponse<String> response = post("/v1/layout", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error_type").asText()).isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("should reject GET on layout endpoint")
    void shouldRejectWrongMethod() throws Exception {
        assertThat(get("/v1/layout").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("should report health")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("transitionFixtures").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("should expose Prometheus metrics after a layout")
    void shouldExposeMetrics() throws Exception {
        post("/v1/layout", SHIRT);

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("line_planner_test_layouts_total");
    }

    @Test
    @DisplayName("should reload configuration on demand")
    void shouldReload() throws Exception {
        HttpResponse<String> response = post("/admin/reload", "");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("message").asText()).isEqualTo("Configuration reloaded");
        assertThat(factory.getGenerator()).isNotNull();
    }

    @Test
    @DisplayName("should refuse a rejected reload and keep the current configuration")
    void shouldRefuseInvalidReload(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "server:\n  port: 0\nspacing:\n  machinePitch: 2.5\n");
        try (LinePlannerFactory fileFactory = LinePlannerFactory.create(file.toString());
             HttpServer fileServer = new HttpServer(0, 10, 2, fileFactory)) {
            fileServer.start();
            LinePlannerConfig before = fileFactory.getConfig();

            Files.writeString(file, "spacing:\n  machinePitch: 0\n");
            HttpRequest request = HttpRequest.newBuilder(
                            URI.create("http://localhost:" + fileServer.getPort() + "/admin/reload"))
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .timeout(Duration.ofSeconds(10))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(422);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("error_type").asText()).isEqualTo("INVALID_REQUEST");
            assertThat(body.get("error").asText()).contains("keeping current");
            assertThat(fileFactory.getConfig()).isSameAs(before);
            assertThat(fileFactory.getGenerator().getSettings().spacing().machinePitch()).isEqualTo(2.5);
        }
    }
}
