package io.flowrules.core.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.flowrules.core.error.FlowLoadException;
import io.flowrules.core.model.Flow;
import io.flowrules.core.model.Option;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a YAML flow catalog:
 *
 * <pre>
 * flows:
 *   welcome:
 *     - qid: w_role
 *       order: "1"
 *       label: Main role
 *       type: single-select
 *       note: Tank, Healer, DPS
 *       required: yes
 *       visibility_rules: ...
 * </pre>
 *
 * <p>
 * Rows use the question sheet's column names and are normalized as the sheet
 * loader does. Rows missing {@code qid}, {@code label}, {@code order} or
 * {@code type} are dropped with a warning; an unrecognised {@code type} keeps
 * the row as {@link QuestionType#OTHER}. Unknown keys fail the whole
 * catalog so typos surface at load time.
 *
 * <p>
 * Thread-safe.
 */
public final class FlowCatalogParser {

    private static final Logger LOG = LoggerFactory.getLogger(FlowCatalogParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("flows");

    private static final Set<String> KNOWN_ROW_KEYS = Set.of(
            "qid",
            "order",
            "label",
            "type",
            "required",
            "note",
            "options",
            "maxlen",
            "validate",
            "help",
            "rules",
            "visibility_rules",
            "nav_rules");

    private static final Set<String> REQUIRED_TRUE = Set.of("1", "true", "yes", "y", "required");

    /**
     * Parses the catalog file at {@code path}.
     *
     * @throws FlowLoadException if the file is unreadable or structurally invalid
     */
    public FlowCatalog parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new FlowLoadException("Flow catalog not found", source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new FlowLoadException("Failed to read flow catalog: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses a catalog from a stream; {@code source} labels errors.
     *
     * @throws FlowLoadException if the YAML is invalid or structurally wrong
     */
    public FlowCatalog parse(InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new FlowLoadException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
        if (root == null || !root.isObject()) {
            throw new FlowLoadException("Flow catalog must be a YAML mapping", source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "catalog root", source);
        JsonNode flowsNode = root.get("flows");
        if (flowsNode == null || !flowsNode.isObject()) {
            throw new FlowLoadException("Missing or invalid 'flows' block", source);
        }

        Map<String, Flow> flows = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = flowsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            if (!entry.getValue().isArray()) {
                throw new FlowLoadException("Flow '" + name + "' must be a list of question rows", source);
            }
            flows.put(name, new Flow(name, buildQuestions(name, entry.getValue(), source)));
        }
        LOG.info("catalog.loaded source={} flows={}", source, flows.keySet());
        return new FlowCatalog(flows, source);
    }

    private List<Question> buildQuestions(String flow, JsonNode rows, String source) {
        List<Question> questions = new ArrayList<>();
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                throw new FlowLoadException("Rows of flow '" + flow + "' must be mappings", source);
            }
            Map<String, JsonNode> cells = normalizeKeys(row);
            rejectUnknownKeys(cells.keySet(), KNOWN_ROW_KEYS, "flow '" + flow + "' row", source);
            Question question = buildQuestion(flow, cells);
            if (question != null) {
                questions.add(question);
            }
        }
        questions.sort(Comparator.comparing((Question question) -> Question.orderKey(question.order())));
        return questions;
    }

    private Question buildQuestion(String flow, Map<String, JsonNode> cells) {
        String qid = text(cells.get("qid"));
        String label = text(cells.get("label"));
        String order = text(cells.get("order"));
        String rawType = text(cells.get("type"));
        if (qid.isEmpty() || label.isEmpty() || order.isEmpty() || rawType.isEmpty()) {
            LOG.warn("catalog.row_dropped flow={} qid={} order={} reason=missing_field", flow, qid, order);
            return null;
        }
        QuestionType type;
        try {
            type = QuestionType.fromSheet(rawType);
        } catch (IllegalArgumentException e) {
            LOG.warn("catalog.unknown_type flow={} qid={} type={}", flow, qid, rawType);
            type = QuestionType.OTHER;
        }
        List<Option> options = type.isSelect() ? parseOptions(cells) : List.of();
        return Question.builder(qid)
                .flow(flow)
                .order(order)
                .label(label)
                .type(type)
                .required(REQUIRED_TRUE.contains(text(cells.get("required")).toLowerCase(Locale.ROOT)))
                .options(options)
                .multiMax(type == QuestionType.MULTI_SELECT ? multiMax(rawType) : null)
                .maxlen(parseInt(text(cells.get("maxlen"))))
                .validate(collapsedOrNull(cells.get("validate")))
                .help(collapsedOrNull(cells.get("help")))
                .rules(text(cells.get("rules")))
                .visibilityRules(text(cells.get("visibility_rules")))
                .navRules(text(cells.get("nav_rules")))
                .build();
    }

    private static Map<String, JsonNode> normalizeKeys(JsonNode row) {
        Map<String, JsonNode> cells = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = row.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey().strip().toLowerCase(Locale.ROOT);
            if (!key.isEmpty()) {
                cells.put(key, entry.getValue());
            }
        }
        return cells;
    }

    /** Options from a YAML list, else from a comma-separated {@code note}. */
    private static List<Option> parseOptions(Map<String, JsonNode> cells) {
        List<String> labels = new ArrayList<>();
        JsonNode listed = cells.get("options");
        if (listed != null && listed.isArray()) {
            listed.forEach(item -> labels.add(item.asText()));
        } else {
            String note = listed != null && !listed.isNull() ? text(listed) : text(cells.get("note"));
            for (String piece : note.split(",")) {
                labels.add(piece);
            }
        }
        List<Option> options = new ArrayList<>();
        for (String label : labels) {
            if (!label.isBlank()) {
                options.add(Option.canonical(label));
            }
        }
        return options;
    }

    /** {@code multi-select-3} yields 3; anything else yields {@code null}. */
    static Integer multiMax(String rawType) {
        String[] parts = rawType.strip().toLowerCase(Locale.ROOT).split("-");
        if (parts.length < 3) {
            return null;
        }
        try {
            return Integer.parseInt(parts[parts.length - 1]);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer parseInt(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText().strip();
    }

    private static String collapsedOrNull(JsonNode node) {
        String collapsed = String.join(" ", text(node).split("\\s+")).strip();
        return collapsed.isEmpty() ? null : collapsed;
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        List<String> keys = new ArrayList<>();
        node.fieldNames().forEachRemaining(keys::add);
        rejectUnknownKeys(keys, knownKeys, blockName, source);
    }

    private static void rejectUnknownKeys(
            Iterable<String> keys, Set<String> knownKeys, String blockName, String source) {
        List<String> unknown = new ArrayList<>();
        for (String key : keys) {
            if (!knownKeys.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new FlowLoadException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + new TreeSet<>(knownKeys),
                    source);
        }
    }
}
