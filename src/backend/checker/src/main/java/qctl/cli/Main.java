package qctl.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.api.SatisfactionReport;
import qctl.evaluation.CheckerConfiguration;
import qctl.evaluation.QuantitativeChecker;
import qctl.exception.FormulaSyntaxException;
import qctl.exception.QuantitativeCheckException;
import qctl.model.ModelDescription;
import qctl.model.ModelLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Command line entry point.
 *
 * <pre>
 * qctl &lt;model.json&gt; [--formula &lt;text&gt;]... [--degree-map]
 * </pre>
 *
 * Prints one report per formula as a JSON array on stdout. Logging goes to stderr.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE = "Usage: qctl <model.json> [--formula <text>]... [--degree-map]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String modelFile = null;
        List<String> formulas = new ArrayList<>();
        boolean degreeMap = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--degree-map")) {
                degreeMap = true;
            } else if (arg.equals("--formula")) {
                if (i + 1 >= args.length) {
                    err.println("Missing value for --formula");
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                formulas.add(args[++i]);
            } else if (arg.equals("-h") || arg.equals("--help")) {
                out.println(USAGE);
                return EXIT_OK;
            } else if (arg.startsWith("-") || modelFile != null) {
                err.println("Unexpected argument '" + arg + "'");
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                modelFile = arg;
            }
        }
        if (modelFile == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        CheckerConfiguration configuration = CheckerConfiguration.fromEnvironment();
        if (degreeMap) {
            configuration = configuration.withDegreeMap(true);
        }
        QuantitativeChecker checker = new QuantitativeChecker(configuration);
        try {
            Path path = Paths.get(modelFile);
            ModelDescription description = new ModelLoader().load(path);
            if (!formulas.isEmpty()) {
                description.setFormulas(formulas);
            }
            List<SatisfactionReport> reports = checker.check(description);
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(reports));
            return EXIT_OK;
        } catch (FormulaSyntaxException e) {
            e.print(err);
            return EXIT_FAILURE;
        } catch (QuantitativeCheckException e) {
            logger.error("Check failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("Cannot read model '{}': {}", modelFile, e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
