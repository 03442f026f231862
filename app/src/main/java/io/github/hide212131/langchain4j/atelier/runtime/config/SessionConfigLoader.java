package io.github.hide212131.langchain4j.atelier.runtime.config;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.DraftTreatment;
import io.github.hide212131.langchain4j.atelier.runtime.model.EvaluationCriterion;
import io.github.hide212131.langchain4j.atelier.runtime.model.FlowType;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.TerminationCondition;
import io.github.hide212131.langchain4j.atelier.runtime.roster.WorkflowRole;
import io.github.hide212131.langchain4j.atelier.runtime.roster.WorkflowRoles;
import io.github.hide212131.langchain4j.atelier.runtime.usage.ModelCatalog;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a session definition from YAML or JSON with snake_case keys.
 *
 * <p>An agent entry may name a built-in {@code role}; fields it leaves out are taken from the role
 * catalog. {@code *_file} keys are resolved against the directory of the session file.</p>
 */
public final class SessionConfigLoader {

    private static final Set<String> SESSION_KEYS = Set.of(
            "session_id",
            "title",
            "project_id",
            "user_id",
            "initial_prompt",
            "working_document",
            "working_document_file",
            "reference_documents",
            "reference_files",
            "reference_instructions",
            "project_instructions",
            "draft_treatment",
            "flow_type",
            "termination",
            "agents");
    private static final Set<String> AGENT_KEYS = Set.of(
            "role",
            "agent_id",
            "display_name",
            "provider",
            "model",
            "role_description",
            "phase",
            "active",
            "evaluation_criteria");

    private final Yaml yaml = new Yaml();

    public SessionConfig load(Path sessionFile) {
        Objects.requireNonNull(sessionFile, "sessionFile");
        String content;
        try {
            content = Files.readString(sessionFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SessionConfigurationException("Cannot read session file: " + sessionFile, e);
        }
        Path baseDirectory = sessionFile.toAbsolutePath().getParent();
        String fallbackId = sessionFile.getFileName().toString().replaceFirst("\\.(ya?ml|json)$", "");
        return parse(content, baseDirectory, fallbackId);
    }

    /**
     * @param baseDirectory where {@code *_file} entries are looked up; may be null when none are used
     * @param fallbackId session id used when the document has none
     */
    public SessionConfig parse(String content, Path baseDirectory, String fallbackId) {
        if (content == null || content.isBlank()) {
            throw new SessionConfigurationException("Session definition is empty");
        }
        Map<String, Object> root = asMap(loadYaml(content), "session");
        rejectUnknownKeys(root, SESSION_KEYS, "session");

        SessionConfig.Builder builder = SessionConfig.builder()
                .sessionId(optionalString(root, "session_id").orElse(fallbackId))
                .title(optionalString(root, "title").orElse(null))
                .projectId(optionalString(root, "project_id").orElse(null))
                .userId(optionalString(root, "user_id").orElse(null))
                .initialPrompt(requireString(root, "initial_prompt", "session"))
                .workingDocument(workingDocument(root, baseDirectory))
                .referenceDocuments(referenceDocuments(root, baseDirectory))
                .referenceInstructions(optionalString(root, "reference_instructions").orElse(null))
                .projectInstructions(optionalString(root, "project_instructions").orElse(null))
                .termination(termination(root.get("termination")))
                .agents(agents(root.get("agents")));
        try {
            optionalString(root, "draft_treatment").map(DraftTreatment::from).ifPresent(builder::draftTreatment);
            optionalString(root, "flow_type").map(FlowType::from).ifPresent(builder::flowType);
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SessionConfigurationException("Invalid session definition: " + e.getMessage(), e);
        }
    }

    private Object loadYaml(String content) {
        try {
            return yaml.load(content);
        } catch (RuntimeException e) {
            throw new SessionConfigurationException("Session definition is neither valid YAML nor JSON", e);
        }
    }

    private String workingDocument(Map<String, Object> root, Path baseDirectory) {
        Optional<String> inline = optionalString(root, "working_document");
        Optional<String> file = optionalString(root, "working_document_file");
        if (inline.isPresent() && file.isPresent()) {
            throw new SessionConfigurationException("Use either working_document or working_document_file, not both");
        }
        return file.map(name -> readRelative(baseDirectory, name)).orElse(inline.orElse(""));
    }

    private Map<String, String> referenceDocuments(Map<String, Object> root, Path baseDirectory) {
        Map<String, String> documents = new LinkedHashMap<>();
        Object inline = root.get("reference_documents");
        if (inline != null) {
            asMap(inline, "reference_documents").forEach((name, text) -> documents.put(name, String.valueOf(text)));
        }
        Object files = root.get("reference_files");
        if (files != null) {
            for (Object entry : asList(files, "reference_files")) {
                String name = String.valueOf(entry);
                documents.put(Path.of(name).getFileName().toString(), readRelative(baseDirectory, name));
            }
        }
        return documents;
    }

    private TerminationCondition termination(Object raw) {
        if (raw == null) {
            return TerminationCondition.maxRounds(1);
        }
        Map<String, Object> map = asMap(raw, "termination");
        rejectUnknownKeys(map, Set.of("max_rounds", "score_threshold"), "termination");
        int maxRounds = optionalNumber(map, "max_rounds", "termination").map(Number::intValue).orElse(1);
        Double threshold = optionalNumber(map, "score_threshold", "termination").map(Number::doubleValue).orElse(null);
        try {
            return new TerminationCondition(maxRounds, threshold);
        } catch (IllegalArgumentException e) {
            throw new SessionConfigurationException("Invalid termination: " + e.getMessage(), e);
        }
    }

    private List<AgentConfig> agents(Object raw) {
        if (raw == null) {
            throw new SessionConfigurationException("Session definition has no agents");
        }
        List<AgentConfig> agents = new ArrayList<>();
        List<Object> entries = asList(raw, "agents");
        for (int i = 0; i < entries.size(); i++) {
            agents.add(agent(asMap(entries.get(i), "agents[" + i + "]"), "agents[" + i + "]"));
        }
        return agents;
    }

    private AgentConfig agent(Map<String, Object> map, String location) {
        rejectUnknownKeys(map, AGENT_KEYS, location);
        Optional<WorkflowRole> role = optionalString(map, "role").map(id -> WorkflowRoles.find(id)
                .orElseThrow(() -> new SessionConfigurationException("Unknown role '" + id + "' in " + location)));

        Optional<String> model = optionalString(map, "model");
        ProviderType provider;
        try {
            provider = optionalString(map, "provider")
                    .map(ProviderType::from)
                    .or(() -> model.flatMap(ModelCatalog::provider))
                    .orElse(WorkflowRoles.DEFAULT_PROVIDER);
        } catch (IllegalArgumentException e) {
            throw new SessionConfigurationException(e.getMessage() + " in " + location, e);
        }
        String resolvedModel = model.or(() -> defaultModel(provider)).orElseThrow(
                () -> new SessionConfigurationException("No model given for provider " + provider.id() + " in " + location));

        String agentId = optionalString(map, "agent_id").or(() -> role.map(WorkflowRole::id)).orElseThrow(
                () -> new SessionConfigurationException("An agent needs agent_id or role in " + location));
        String displayName = optionalString(map, "display_name").or(() -> role.map(WorkflowRole::name)).orElse(agentId);
        String description = optionalString(map, "role_description")
                .or(() -> role.map(WorkflowRole::defaultPrompt))
                .orElse("");
        Phase phase = optionalNumber(map, "phase", location)
                .map(number -> phase(number.intValue(), location))
                .or(() -> role.map(WorkflowRole::phase))
                .orElseThrow(() -> new SessionConfigurationException("An agent needs phase or role in " + location));
        boolean active = Optional.ofNullable(map.get("active")).map(value -> Boolean.parseBoolean(value.toString())).orElse(true);
        List<EvaluationCriterion> criteria = map.containsKey("evaluation_criteria")
                ? criteria(map.get("evaluation_criteria"), location)
                : role.map(WorkflowRole::evaluationCriteria).orElse(List.of());
        try {
            return new AgentConfig(agentId, displayName, provider, resolvedModel, description, criteria, active, phase);
        } catch (IllegalArgumentException e) {
            throw new SessionConfigurationException("Invalid agent in " + location + ": " + e.getMessage(), e);
        }
    }

    private static Optional<String> defaultModel(ProviderType provider) {
        if (provider == WorkflowRoles.DEFAULT_PROVIDER) {
            return Optional.of(ModelCatalog.DEFAULT_MODEL);
        }
        return ModelCatalog.cheapestModel(provider);
    }

    private static Phase phase(int number, String location) {
        try {
            return Phase.fromNumber(number);
        } catch (IllegalArgumentException e) {
            throw new SessionConfigurationException(e.getMessage() + " in " + location, e);
        }
    }

    private List<EvaluationCriterion> criteria(Object raw, String location) {
        List<EvaluationCriterion> criteria = new ArrayList<>();
        for (Object entry : asList(raw, location + ".evaluation_criteria")) {
            if (entry instanceof String name) {
                criteria.add(new EvaluationCriterion(name, ""));
                continue;
            }
            Map<String, Object> map = asMap(entry, location + ".evaluation_criteria");
            String name = requireString(map, "name", location + ".evaluation_criteria");
            String description = optionalString(map, "description").orElse("");
            double weight = optionalNumber(map, "weight", location).map(Number::doubleValue).orElse(1.0);
            try {
                criteria.add(new EvaluationCriterion(name, description, weight));
            } catch (IllegalArgumentException e) {
                throw new SessionConfigurationException("Invalid criterion in " + location + ": " + e.getMessage(), e);
            }
        }
        return criteria;
    }

    private static String readRelative(Path baseDirectory, String name) {
        Path path = baseDirectory == null ? Path.of(name) : baseDirectory.resolve(name);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SessionConfigurationException("Cannot read " + path, e);
        }
    }

    private static void rejectUnknownKeys(Map<String, Object> map, Set<String> allowed, String location) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new SessionConfigurationException("Unsupported key '" + key + "' in " + location);
            }
        }
    }

    private static String requireString(Map<String, Object> map, String key, String location) {
        return optionalString(map, key).orElseThrow(
                () -> new SessionConfigurationException("Missing required key '" + key + "' in " + location));
    }

    private static Optional<String> optionalString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    private static Optional<Number> optionalNumber(Map<String, Object> map, String key, String location) {
        Object value = map.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(number);
        }
        try {
            return Optional.of(Double.valueOf(value.toString().trim()));
        } catch (NumberFormatException e) {
            throw new SessionConfigurationException("'" + key + "' must be a number in " + location, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String location) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new SessionConfigurationException(location + " must be a mapping");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) map).forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value, String location) {
        if (!(value instanceof List<?> list)) {
            throw new SessionConfigurationException(location + " must be a list");
        }
        return (List<Object>) list;
    }
}
