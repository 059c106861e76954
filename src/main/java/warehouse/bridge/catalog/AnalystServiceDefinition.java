package warehouse.bridge.catalog;

import io.vertx.core.json.JsonObject;
import warehouse.bridge.config.ConfigurationException;
import warehouse.bridge.mcp.base.MCPTool;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A Cortex Analyst service answering questions against a semantic model.
 * The model is either a YAML file on a stage or a semantic view; only its format is checked
 * here, whether it exists is discovered on first use.
 */
public final class AnalystServiceDefinition extends ServiceDefinition {

    private static final String IDENTIFIER = "(?:[A-Za-z_][A-Za-z0-9_$]*|\"(?:[^\"]|\"\")+\")";
    private static final Pattern STAGE_FILE = Pattern.compile("^@\\S+/\\S+\\.ya?ml$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEMANTIC_VIEW =
        Pattern.compile("^" + IDENTIFIER + "\\." + IDENTIFIER + "\\." + IDENTIFIER + "$");

    public enum ModelReferenceType {
        STAGE_FILE,
        SEMANTIC_VIEW
    }

    private final String semanticModel;
    private final ModelReferenceType referenceType;

    private AnalystServiceDefinition(String name, String description, String semanticModel,
                                     ModelReferenceType referenceType) {
        super(name, description, ServiceKind.ANALYST);
        this.semanticModel = semanticModel;
        this.referenceType = referenceType;
    }

    /**
     * @throws ConfigurationException if the reference is neither a stage file path nor a
     *         fully qualified semantic view name
     */
    public static AnalystServiceDefinition of(String name, String description, String semanticModel) {
        String reference = semanticModel.trim();
        if (STAGE_FILE.matcher(reference).matches()) {
            return new AnalystServiceDefinition(name, description, reference, ModelReferenceType.STAGE_FILE);
        }
        if (SEMANTIC_VIEW.matcher(reference).matches()) {
            return new AnalystServiceDefinition(name, description, reference, ModelReferenceType.SEMANTIC_VIEW);
        }
        throw new ConfigurationException("Analyst service '" + name + "': semantic_model '" + semanticModel
            + "' must be a stage file (@db.schema.stage/path/model.yaml) or a semantic view (db.schema.view)");
    }

    public String getSemanticModel() {
        return semanticModel;
    }

    public ModelReferenceType getReferenceType() {
        return referenceType;
    }

    @Override
    public List<MCPTool> getTools() {
        JsonObject properties = new JsonObject()
            .put("query", ToolSchemas.string("Question to answer from the semantic model"));
        return List.of(new MCPTool(getName(), getDescription(), ToolSchemas.object(properties, "query")));
    }

    @Override
    public JsonObject toJson() {
        return super.toJson()
            .put("semantic_model", semanticModel)
            .put("reference_type", referenceType.name());
    }
}
