package qctl.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON input of one checking run.
 *
 * Example:
 * {
 *   "network": {
 *     "variables": { "A": 1, "B": 1 },
 *     "regulations": [
 *       { "target": "A", "regulators": [], "contexts": [ { "intervals": [], "target_value": 1 } ] },
 *       { "target": "B", "regulators": [ { "variable": "A", "thresholds": [1] } ],
 *         "contexts": [ { "intervals": [2], "target_value": 1 }, { "intervals": [1], "target_value": 0 } ] }
 *     ]
 *   },
 *   "formula": "EX (A == 1)",
 *   "init_states": [ { "A": [0], "B": [0] } ]
 * }
 *
 * "formula" may also be an array of formulas. Missing or empty "init_states"
 * means every state is initial.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelDescription {

    @JsonProperty("network")
    private NetworkDescription network;

    @JsonProperty("formula")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> formulas = new ArrayList<>();

    // Array of regions or a single region object; each region maps genes to admitted levels
    @JsonProperty("init_states")
    private JsonNode initStates;

    public ModelDescription() {
        // Jackson deserialization
    }

    public ModelDescription(NetworkDescription network, List<String> formulas, JsonNode initStates) {
        this.network = network;
        this.formulas = formulas != null ? new ArrayList<>(formulas) : new ArrayList<>();
        this.initStates = initStates;
    }

    public NetworkDescription getNetwork() { return network; }
    public void setNetwork(NetworkDescription network) { this.network = network; }

    @JsonProperty("formula")
    public List<String> getFormulas() { return formulas; }
    @JsonProperty("formula")
    public void setFormulas(List<String> formulas) { this.formulas = formulas; }

    @JsonProperty("init_states")
    public JsonNode getInitStates() { return initStates; }
    @JsonProperty("init_states")
    public void setInitStates(JsonNode initStates) { this.initStates = initStates; }
}
