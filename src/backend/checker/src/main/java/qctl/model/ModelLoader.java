package qctl.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.exception.MalformedModelException;
import qctl.graph.Gene;
import qctl.graph.GeneNetwork;
import qctl.graph.RegulationRule;
import qctl.graph.State;
import qctl.graph.StateGraphBuilder;
import qctl.model.NetworkDescription.ContextDescription;
import qctl.model.NetworkDescription.RegulationDescription;
import qctl.model.NetworkDescription.RegulatorDescription;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads and validates the JSON description of a gene network and turns it into
 * a {@link GeneNetwork} plus its initial states.
 */
public class ModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(ModelLoader.class);

    private final ObjectMapper mapper;

    public ModelLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    }

    public ModelDescription load(Path file) throws IOException, MalformedModelException {
        if (!Files.exists(file)) {
            throw new IOException("Model file does not exist: " + file.toAbsolutePath());
        }
        logger.info("Loading model description from {}", file);
        return read(Files.readString(file));
    }

    public ModelDescription read(String json) throws MalformedModelException {
        ModelDescription description;
        try {
            description = mapper.readValue(json, ModelDescription.class);
        } catch (JsonProcessingException e) {
            throw new MalformedModelException(null, "Invalid model description: " + e.getOriginalMessage(), e);
        }
        if (description == null || description.getNetwork() == null) {
            throw new MalformedModelException(null, "Field 'network' must be specified");
        }
        return description;
    }

    /**
     * Validates the network section and builds the network from it.
     */
    public GeneNetwork toNetwork(ModelDescription description) throws MalformedModelException {
        NetworkDescription net = description.getNetwork();
        if (net == null || net.getVariables() == null || net.getRegulations() == null) {
            throw new MalformedModelException(null, "Both 'variables' and 'regulations' fields must be specified");
        }

        GeneNetwork.Builder builder = GeneNetwork.builder();
        for (Map.Entry<String, Integer> variable : net.getVariables().entrySet()) {
            Integer max = variable.getValue();
            if (max == null || max <= 0) {
                throw new MalformedModelException(variable.getKey(),
                        "Invalid max activity value " + max + ", must be an integer > 0");
            }
            builder.gene(variable.getKey(), max);
        }

        Set<String> regulated = new HashSet<>();
        for (RegulationDescription regulation : net.getRegulations()) {
            if (regulation == null || regulation.target == null || regulation.regulators == null || regulation.contexts == null) {
                throw new MalformedModelException(null,
                        "Each regulation must have 'target', 'regulators' and 'contexts' fields");
            }
            String target = regulation.target;
            if (!net.getVariables().containsKey(target)) {
                throw new MalformedModelException(target, "Target gene is not defined in 'variables'");
            }
            if (!regulated.add(target)) {
                throw new MalformedModelException(target, "Gene has more than one regulation");
            }
            builder.rule(target, toRule(regulation, net.getVariables()));
        }
        GeneNetwork network = builder.build();
        logger.debug("Network loaded: {} genes, {} regulations", network.size(), network.getRules().size());
        return network;
    }

    /**
     * Initial states described by the "init_states" regions. Each region constrains
     * some genes to lists of levels and leaves the others free; the result is the
     * union of all regions, without duplicates. No regions means the full level space.
     */
    public List<State> initialStates(ModelDescription description, GeneNetwork network) throws MalformedModelException {
        JsonNode regions = description.getInitStates();
        if (regions == null || regions.isNull() || (regions.isContainerNode() && regions.isEmpty())) {
            return StateGraphBuilder.allStates(network);
        }
        List<JsonNode> regionList = new ArrayList<>();
        if (regions.isArray()) {
            regions.forEach(regionList::add);
        } else if (regions.isObject()) {
            regionList.add(regions);
        } else {
            throw new MalformedModelException(null, "'init_states' must be a JSON array of objects");
        }

        Set<State> result = new LinkedHashSet<>();
        for (JsonNode region : regionList) {
            result.addAll(expandRegion(region, network));
        }
        return new ArrayList<>(result);
    }

    private RegulationRule toRule(RegulationDescription regulation, Map<String, Integer> variables)
            throws MalformedModelException {
        String target = regulation.target;
        List<RegulationRule.Regulator> regulators = new ArrayList<>();
        for (RegulatorDescription r : regulation.regulators) {
            if (r == null || r.variable == null || r.thresholds == null) {
                throw new MalformedModelException(target, "Each regulator must have 'variable' and 'thresholds' fields");
            }
            Integer max = variables.get(r.variable);
            if (max == null) {
                throw new MalformedModelException(r.variable, "Regulator of '" + target + "' is not defined in 'variables'");
            }
            int[] thresholds = new int[r.thresholds.size()];
            for (int i = 0; i < thresholds.length; i++) {
                Integer t = r.thresholds.get(i);
                if (t == null || t < 1 || t > max) {
                    throw new MalformedModelException(r.variable,
                            "Invalid thresholds " + r.thresholds + ", must be within [1, " + max + "]");
                }
                if (i > 0 && t <= thresholds[i - 1]) {
                    throw new MalformedModelException(r.variable,
                            "Invalid thresholds " + r.thresholds + ", must be ascending");
                }
                thresholds[i] = t;
            }
            regulators.add(new RegulationRule.Regulator(r.variable, thresholds));
        }

        int targetMax = variables.get(target);
        List<RegulationRule.Context> contexts = new ArrayList<>();
        for (ContextDescription c : regulation.contexts) {
            if (c == null || c.intervals == null || c.targetValue == null) {
                throw new MalformedModelException(target, "Each context must have 'intervals' and 'target_value' fields");
            }
            if (c.targetValue < 0 || c.targetValue > targetMax) {
                throw new MalformedModelException(target,
                        "Target value " + c.targetValue + " must be in range [0, " + targetMax + "]");
            }
            if (c.intervals.size() != regulators.size()) {
                throw new MalformedModelException(target, "Length of 'intervals' " + c.intervals
                        + " does not match the number of regulators (" + regulators.size() + ")");
            }
            int[] intervals = new int[c.intervals.size()];
            for (int i = 0; i < intervals.length; i++) {
                intervals[i] = toInterval(c.intervals.get(i), regulators.get(i), target);
            }
            contexts.add(new RegulationRule.Context(intervals, c.targetValue));
        }
        return new RegulationRule(target, regulators, contexts);
    }

    private static int toInterval(Object value, RegulationRule.Regulator regulator, String target)
            throws MalformedModelException {
        if ("*".equals(value)) {
            return RegulationRule.Context.ANY;
        }
        if (!(value instanceof Integer)) {
            throw new MalformedModelException(target, "Interval '" + value + "' must be an integer or '*'");
        }
        int interval = (Integer) value;
        if (interval < 1 || interval > regulator.intervalCount()) {
            throw new MalformedModelException(target, "Interval " + interval + " for regulator '"
                    + regulator.getGene() + "' must be within [1, " + regulator.intervalCount() + "]");
        }
        return interval;
    }

    private static List<State> expandRegion(JsonNode region, GeneNetwork network) throws MalformedModelException {
        if (!region.isObject()) {
            throw new MalformedModelException(null, "Initial region must be a JSON object, got " + region);
        }
        List<Gene> genes = network.getGenes();
        List<int[]> domains = new ArrayList<>();
        for (Gene gene : genes) {
            domains.add(fullRange(gene));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = region.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (!network.declares(name)) {
                throw new MalformedModelException(name, "Initial region constrains a gene not found in the network");
            }
            Gene gene = network.gene(name);
            domains.set(gene.getIndex(), levels(field.getValue(), gene));
        }

        List<State> states = new ArrayList<>();
        int[] cursor = new int[genes.size()];
        for (int[] domain : domains) {
            if (domain.length == 0) return states;
        }
        while (true) {
            int[] levels = new int[cursor.length];
            for (int i = 0; i < cursor.length; i++) levels[i] = domains.get(i)[cursor[i]];
            states.add(new State(levels));
            int i = cursor.length - 1;
            while (i >= 0 && cursor[i] == domains.get(i).length - 1) {
                cursor[i] = 0;
                i--;
            }
            if (i < 0) break;
            cursor[i]++;
        }
        return states;
    }

    private static int[] levels(JsonNode node, Gene gene) throws MalformedModelException {
        List<JsonNode> values = new ArrayList<>();
        if (node.isArray()) node.forEach(values::add);
        else values.add(node);
        TreeSet<Integer> levels = new TreeSet<>();
        for (JsonNode v : values) {
            if (!v.isInt()) {
                throw new MalformedModelException(gene.getName(), "Initial level " + v + " is not an integer");
            }
            if (!gene.admits(v.intValue())) {
                throw new MalformedModelException(gene.getName(), "Initial level " + v.intValue()
                        + " is out of bounds, allowed range is [0, " + gene.getMaxLevel() + "]");
            }
            levels.add(v.intValue());
        }
        int[] result = new int[levels.size()];
        int i = 0;
        for (int l : levels) result[i++] = l;
        return result;
    }

    private static int[] fullRange(Gene gene) {
        int[] range = new int[gene.getMaxLevel() + 1];
        for (int i = 0; i < range.length; i++) range[i] = i;
        return range;
    }
}
