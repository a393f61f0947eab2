package qctl.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.api.SatisfactionReport;
import qctl.exception.EmptyStateSpaceException;
import qctl.exception.FormulaSyntaxException;
import qctl.exception.MalformedModelException;
import qctl.exception.QuantitativeCheckException;
import qctl.exception.StateSpaceLimitException;
import qctl.exception.UnsupportedFormulaException;
import qctl.formula.FormulaTranslator;
import qctl.formula.FormulaTree;
import qctl.formula.parse.CtlParser;
import qctl.formula.parse.ParseNode;
import qctl.graph.GeneNetwork;
import qctl.graph.State;
import qctl.graph.StateGraph;
import qctl.graph.StateGraphBuilder;
import qctl.model.ModelDescription;
import qctl.model.ModelLoader;

import java.util.*;

/**
 * Entry point tying the pipeline together: model description to state graph,
 * formula text to formula tree, and both to satisfaction degrees.
 *
 * Usage:
 *   QuantitativeChecker checker = new QuantitativeChecker();
 *   List&lt;SatisfactionReport&gt; reports = checker.check(new ModelLoader().load(path));
 */
public class QuantitativeChecker {
    private static final Logger logger = LoggerFactory.getLogger(QuantitativeChecker.class);

    private final ModelLoader loader = new ModelLoader();
    private final CtlParser parser = new CtlParser();
    private final FormulaTranslator translator = new FormulaTranslator();

    private volatile int stateLimit;
    private volatile int threads;
    private volatile boolean includeDegreeMap;

    public QuantitativeChecker() {
        this(CheckerConfiguration.defaults());
    }

    public QuantitativeChecker(CheckerConfiguration configuration) {
        this.stateLimit = configuration.getStateLimit();
        this.threads = configuration.getThreads();
        this.includeDegreeMap = configuration.isIncludeDegreeMap();
        logger.info("Quantitative checker initialized with {}", configuration);
    }

    /* === Configuration setters === */
    public void setStateLimit(int limit) {
        if (limit <= 0) {
            logger.warn("Invalid state limit {} (keeping {})", limit, this.stateLimit);
            return;
        }
        this.stateLimit = limit;
    }

    public void setThreads(int count) {
        if (count <= 0) {
            logger.warn("Invalid thread count {} (keeping {})", count, this.threads);
            return;
        }
        this.threads = count;
    }

    public void setIncludeDegreeMap(boolean include) {
        this.includeDegreeMap = include;
    }

    public CheckerConfiguration getConfiguration() {
        return new CheckerConfiguration(stateLimit, threads, includeDegreeMap);
    }

    public StateGraph buildStateGraph(GeneNetwork network, Collection<State> initialStates)
            throws MalformedModelException, EmptyStateSpaceException, StateSpaceLimitException {
        return new StateGraphBuilder().withStateLimit(stateLimit).build(network, initialStates);
    }

    public StateGraph buildStateGraph(ModelDescription description)
            throws MalformedModelException, EmptyStateSpaceException, StateSpaceLimitException {
        GeneNetwork network = loader.toNetwork(description);
        return buildStateGraph(network, loader.initialStates(description, network));
    }

    public ParseNode parseFormula(String text) throws FormulaSyntaxException {
        return parser.parse(text);
    }

    public FormulaTree translateFormula(ParseNode parseTree) throws UnsupportedFormulaException {
        return translator.translate(parseTree);
    }

    /** Parses and translates in one step. */
    public FormulaTree formula(String text) throws FormulaSyntaxException, UnsupportedFormulaException {
        return translateFormula(parseFormula(text));
    }

    public EvaluationResult evaluate(FormulaTree formula, StateGraph graph)
            throws UnsupportedFormulaException, EmptyStateSpaceException {
        return new DegreeEvaluator(graph).evaluate(formula);
    }

    /**
     * Builds the description's state graph once and evaluates each of its
     * formulas on it. All formulas are parsed before exploration starts, so a
     * typo fails fast.
     */
    public List<SatisfactionReport> check(ModelDescription description) throws QuantitativeCheckException {
        List<String> texts = description.getFormulas();
        if (texts == null || texts.isEmpty()) {
            throw new MalformedModelException(null, "Field 'formula' must be specified");
        }
        List<FormulaTree> formulas = new ArrayList<>(texts.size());
        for (String text : texts) {
            formulas.add(formula(text));
        }

        StateGraph graph = buildStateGraph(description);
        List<EvaluationResult> results;
        if (formulas.size() == 1 || threads == 1) {
            results = new ArrayList<>(formulas.size());
            for (FormulaTree f : formulas) {
                results.add(evaluate(f, graph));
            }
        } else {
            try (BatchEvaluator batch = new BatchEvaluator(Math.min(threads, formulas.size()))) {
                results = batch.evaluateAll(graph, formulas);
            }
        }

        List<SatisfactionReport> reports = new ArrayList<>(results.size());
        for (EvaluationResult result : results) {
            SatisfactionReport report = SatisfactionReport.from(result, includeDegreeMap);
            logger.info("{}", report);
            reports.add(report);
        }
        return reports;
    }
}
