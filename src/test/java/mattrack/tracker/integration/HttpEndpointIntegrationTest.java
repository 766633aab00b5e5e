package mattrack.tracker.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mattrack.tracker.batch.CommandResult;
import mattrack.tracker.batch.FakeCommandRunner;
import mattrack.tracker.config.Dependencies;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.Material;
import mattrack.tracker.server.RouterHandler;
import mattrack.tracker.server.TrackerHttpServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP API through a real Netty server backed by an in-memory store
 * and a scripted scheduler command line.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String API_KEY = "test-key";

    @TempDir
    Path dir;

    private Dependencies deps;
    private TrackerHttpServer server;
    private HttpClient httpClient;
    private String baseUrl;
    private CountDownLatch polled;

    @BeforeEach
    void setUp() throws Exception {
        polled = new CountDownLatch(1);
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> {
            if (cmd.get(0).equals("squeue")) {
                polled.countDown();
                return new CommandResult(0, "");
            }
            if (cmd.get(0).equals("sbatch")) {
                return new CommandResult(0, "Submitted batch job 9001\n");
            }
            return new CommandResult(0, "");
        });

        TrackerConfig config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withApiKey(API_KEY)
                .withBaseWorkDir(dir.resolve("work"))
                .withLegacyStatusFile(dir.resolve("crystal_job_status.json"))
                .withCallbackDebounce(Duration.ofMillis(50));
        deps = Dependencies.create(config, runner);
        server = new TrackerHttpServer(deps.routerHandler());
        int port = server.start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + port;

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();

        deps.materialService().register(Material.builder().materialId("mp-149").formula("Si").build());
    }

    @AfterEach
    void tearDown() {
        if (server != null)
            server.stop();
        if (deps != null)
            deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String key) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (key != null) {
            request.header(RouterHandler.KEY_HEADER, key);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private Calculation createRelaxation() {
        return deps.calculationService().create("mp-149", CalculationKind.RELAXATION, null, null, null);
    }

    @Test
    @DisplayName("Health reports store and queue counts")
    void health() throws Exception {
        createRelaxation();

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals(1, body.get("pendingCalculations").asInt());
        assertEquals(0, body.get("activeCalculations").asInt());
        assertFalse(body.get("monitorRunning").asBoolean());
    }

    @Test
    @DisplayName("Calculations can be listed, fetched and cancelled")
    void calculations() throws Exception {
        Calculation calc = createRelaxation();
        createRelaxation();

        JsonNode list = MAPPER.readTree(get("/api/v1/calculations?status=pending&kind=OPT").body());
        assertEquals(2, list.size());
        assertEquals(1, MAPPER.readTree(get("/api/v1/calculations?limit=1").body()).size());

        HttpResponse<String> one = get("/api/v1/calculations/" + calc.calcId());
        assertEquals(200, one.statusCode());
        JsonNode detail = MAPPER.readTree(one.body());
        assertEquals("OPT", detail.get("kind").asText());
        assertEquals("pending", detail.get("status").asText());
        assertEquals(40, detail.get("settings").get("memoryGb").asInt());

        assertEquals(404, get("/api/v1/calculations/nope").statusCode());
        assertEquals(400, get("/api/v1/calculations?limit=0").statusCode());
        assertEquals(400, get("/api/v1/calculations?status=bogus").statusCode());

        HttpResponse<String> cancel = post("/api/v1/calculations/" + calc.calcId() + "/cancel",
                "{\"reason\":\"duplicate\"}", null);
        assertEquals(200, cancel.statusCode(), cancel.body());
        assertEquals("applied", MAPPER.readTree(cancel.body()).get("result").asText());

        HttpResponse<String> again = post("/api/v1/calculations/" + calc.calcId() + "/cancel", "", null);
        assertEquals("unchanged", MAPPER.readTree(again.body()).get("result").asText());

        assertEquals(404, post("/api/v1/calculations/nope/cancel", "", null).statusCode());
    }

    @Test
    @DisplayName("Workflow status, pause and resume")
    void workflow() throws Exception {
        deps.workflowEngine().startWorkflow("mp-149", "full_characterization", dir.resolve("mp-149.d12"));

        JsonNode status = MAPPER.readTree(get("/api/v1/materials/mp-149/workflow").body());
        assertEquals("full_characterization", status.get("templateId").asText());
        assertEquals("active", status.get("status").asText());
        assertEquals(1, status.get("countsByKind").get("OPT").asInt());

        assertEquals(200, post("/api/v1/materials/mp-149/workflow/pause", "", null).statusCode());
        assertEquals(409, post("/api/v1/materials/mp-149/workflow/pause", "", null).statusCode());
        assertEquals(200, post("/api/v1/materials/mp-149/workflow/resume", "", null).statusCode());
    }

    @Test
    @DisplayName("Statistics summarize the store")
    void statistics() throws Exception {
        createRelaxation();

        JsonNode stats = MAPPER.readTree(get("/api/v1/statistics").body());

        assertEquals(1, stats.get("materials").asInt());
        assertEquals(1, stats.get("calculations").asInt());
        assertEquals(1, stats.get("byKind").get("OPT").asInt());
    }

    @Test
    @DisplayName("Callbacks need the key and queue a monitor cycle")
    void callbacks() throws Exception {
        assertEquals(403, post("/internal/v1/callbacks", "{}", null).statusCode());
        assertEquals(403, post("/internal/v1/callbacks", "{}", "wrong").statusCode());
        assertEquals(400, post("/internal/v1/callbacks", "{\"mode\":\"reboot\"}", API_KEY).statusCode());

        HttpResponse<String> accepted = post("/internal/v1/callbacks", "{\"jobId\":\"9001\"}", API_KEY);

        assertEquals(202, accepted.statusCode(), accepted.body());
        assertEquals("completion", MAPPER.readTree(accepted.body()).get("result").asText());
        assertTrue(polled.await(5, TimeUnit.SECONDS), "callback should run a status check");
    }

    @Test
    @DisplayName("Unknown routes return 404")
    void unknownRoute() throws Exception {
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }
}
