package mattrack.tracker.workflow;

import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.WorkflowStep;
import mattrack.tracker.model.WorkflowTemplate;
import mattrack.tracker.store.Database;
import mattrack.tracker.store.JdbcWorkflowRepository;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateLoaderTest {

    private static Database db;
    private static JdbcWorkflowRepository workflows;

    @BeforeAll
    static void setup() {
        TrackerConfig config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-templates;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        workflows = new JdbcWorkflowRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM workflow_templates");
            conn.commit();
        }
    }

    @Test
    void builtInTemplatesDescribeTheStandardChains() {
        List<WorkflowTemplate> templates = TemplateLoader.builtIn();

        WorkflowTemplate full = templates.stream()
                .filter(t -> t.templateId().equals("full_characterization"))
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("OPT", "SP", "BAND", "DOSS"), full.steps().stream().map(WorkflowStep::kind).toList());
        assertEquals(List.of(CalculationKind.SINGLE_POINT),
                full.stepFor(CalculationKind.RELAXATION).orElseThrow().nextKinds());
        assertEquals(List.of(CalculationKind.BAND_STRUCTURE, CalculationKind.DENSITY_OF_STATES),
                full.stepFor(CalculationKind.SINGLE_POINT).orElseThrow().nextKinds());
        assertEquals(40, full.firstStep().orElseThrow().settings().memoryGb());

        assertTrue(templates.stream().anyMatch(t -> t.templateId().equals("electronic_structure")));
    }

    @Test
    void seedInsertsOnlyMissingTemplates() {
        assertEquals(2, TemplateLoader.seed(workflows));
        assertEquals(0, TemplateLoader.seed(workflows));

        WorkflowTemplate stored = workflows.findTemplate("electronic_structure").orElseThrow();
        assertEquals(3, stored.steps().size());
        assertEquals("SP", stored.firstStep().orElseThrow().kind());
    }
}
