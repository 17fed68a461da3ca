package io.buildeval.standalone.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.evaluation.EvaluatedItem;
import io.buildeval.core.evaluation.EvaluatedMetadata;
import io.buildeval.core.evaluation.EvaluatedProject;
import io.buildeval.core.evaluation.EvaluatedProperty;
import io.buildeval.core.evaluation.EvaluatedTarget;
import io.buildeval.core.evaluation.ResolvedImport;
import io.buildeval.core.spi.EvaluationListener.WarningEvent;
import java.util.List;
import java.util.Map;

/** Renders an {@link EvaluatedProject} as a JSON document. */
public final class EvaluationJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean includeEnvironment;
    private final boolean prettyPrint;

    /**
     * @param includeEnvironment include properties whose value came from the
     *     environment
     * @param prettyPrint indent the output
     */
    public EvaluationJsonWriter(boolean includeEnvironment, boolean prettyPrint) {
        this.includeEnvironment = includeEnvironment;
        this.prettyPrint = prettyPrint;
    }

    /** Serializes the result and the warnings raised while producing it. */
    public String write(EvaluatedProject project, List<WarningEvent> warnings) {
        try {
            return prettyPrint
                    ? MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(toJson(project, warnings))
                    : MAPPER.writeValueAsString(toJson(project, warnings));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize evaluation result", e);
        }
    }

    ObjectNode toJson(EvaluatedProject project, List<WarningEvent> warnings) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("project", project.fullPath().toString());
        root.put("toolsVersion", project.toolset().toolsVersion());

        ObjectNode globals = root.putObject("globalProperties");
        for (Map.Entry<String, String> global : project.globalProperties().entrySet()) {
            globals.put(global.getKey(), global.getValue());
        }

        ObjectNode properties = root.putObject("properties");
        for (EvaluatedProperty property : project.properties()) {
            if (property.isEnvironment() && !includeEnvironment) {
                continue;
            }
            properties.put(property.name(), property.evaluatedValue());
        }

        ArrayNode items = root.putArray("items");
        for (EvaluatedItem item : project.items()) {
            ObjectNode node = items.addObject();
            node.put("itemType", item.itemType());
            node.put("include", item.evaluatedInclude());
            List<EvaluatedMetadata> metadata = item.metadata();
            if (!metadata.isEmpty()) {
                ObjectNode metadataNode = node.putObject("metadata");
                for (EvaluatedMetadata m : metadata) {
                    metadataNode.put(m.name(), m.evaluatedValue());
                }
            }
        }

        ArrayNode imports = root.putArray("imports");
        for (ResolvedImport resolved : project.imports()) {
            ObjectNode node = imports.addObject();
            node.put("file", resolved.path().toString());
            node.put("importedBy", resolved.importingElement().location().toString());
            if (resolved.sdkReference() != null) {
                node.put("sdk", resolved.sdkReference().toString());
            }
        }

        ArrayNode targets = root.putArray("targets");
        for (EvaluatedTarget target : project.targets().values()) {
            targets.add(target.name());
        }
        ArrayNode defaultTargets = root.putArray("defaultTargets");
        project.defaultTargets().forEach(defaultTargets::add);
        ArrayNode initialTargets = root.putArray("initialTargets");
        project.initialTargets().forEach(initialTargets::add);

        ArrayNode warningsNode = root.putArray("warnings");
        for (WarningEvent warning : warnings) {
            ObjectNode node = warningsNode.addObject();
            if (warning.code() != null) {
                node.put("code", warning.code());
            }
            node.put("message", warning.message());
            ElementLocation location = warning.location();
            if (location != null) {
                node.put("location", location.toString());
            }
        }
        return root;
    }
}
