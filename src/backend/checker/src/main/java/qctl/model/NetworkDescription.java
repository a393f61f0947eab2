package qctl.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The "network" section: max level per gene (in state-vector order) and the
 * regulation of each regulated gene.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NetworkDescription {

    @JsonProperty("variables")
    private LinkedHashMap<String, Integer> variables;

    @JsonProperty("regulations")
    private List<RegulationDescription> regulations;

    public NetworkDescription() {
        // Jackson deserialization
    }

    public NetworkDescription(Map<String, Integer> variables, List<RegulationDescription> regulations) {
        this.variables = new LinkedHashMap<>(variables);
        this.regulations = new ArrayList<>(regulations);
    }

    public Map<String, Integer> getVariables() { return variables; }
    public List<RegulationDescription> getRegulations() { return regulations; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RegulationDescription {
        @JsonProperty("target")
        public String target;

        @JsonProperty("regulators")
        public List<RegulatorDescription> regulators;

        @JsonProperty("contexts")
        public List<ContextDescription> contexts;

        public RegulationDescription() {}
        public RegulationDescription(String target, List<RegulatorDescription> regulators, List<ContextDescription> contexts) {
            this.target = target;
            this.regulators = regulators;
            this.contexts = contexts;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RegulatorDescription {
        @JsonProperty("variable")
        public String variable;

        @JsonProperty("thresholds")
        public List<Integer> thresholds;

        public RegulatorDescription() {}
        public RegulatorDescription(String variable, List<Integer> thresholds) {
            this.variable = variable;
            this.thresholds = thresholds;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContextDescription {
        @JsonProperty("intervals") // 1-based interval index per regulator, or "*"
        public List<Object> intervals;

        @JsonProperty("target_value")
        public Integer targetValue;

        public ContextDescription() {}
        public ContextDescription(List<Object> intervals, Integer targetValue) {
            this.intervals = intervals;
            this.targetValue = targetValue;
        }
    }
}
