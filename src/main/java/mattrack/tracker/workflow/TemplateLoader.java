package mattrack.tracker.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import mattrack.tracker.model.WorkflowTemplate;
import mattrack.tracker.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Seeds the built-in workflow templates into the store.
 */
public final class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private static final String RESOURCE = "/mattrack/workflow-templates.json";
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private TemplateLoader() {
    }

    public static List<WorkflowTemplate> builtIn() {
        try (InputStream in = TemplateLoader.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return MAPPER.readValue(in, new TypeReference<List<WorkflowTemplate>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Save every built-in template that is not stored yet. Stored templates are left as they are.
     *
     * @return number of templates inserted
     */
    public static int seed(WorkflowRepository workflows) {
        int inserted = 0;
        for (WorkflowTemplate template : builtIn()) {
            if (workflows.findTemplate(template.templateId()).isEmpty()) {
                workflows.saveTemplate(template);
                inserted++;
            }
        }
        if (inserted > 0) {
            log.info("Seeded {} workflow template(s)", inserted);
        }
        return inserted;
    }
}
