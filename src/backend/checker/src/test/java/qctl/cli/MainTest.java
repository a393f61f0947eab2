package qctl.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Paths;

import static org.junit.Assert.*;

public class MainTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private static String model(String name) throws Exception {
        return Paths.get(MainTest.class.getResource("/models/" + name).toURI()).toString();
    }

    private int run(String... args) {
        return Main.run(args, new PrintStream(out, true), new PrintStream(err, true));
    }

    @Test
    public void printsReportsAsJson() throws Exception {
        assertEquals(Main.EXIT_OK, run(model("delay.json")));

        JsonNode reports = new ObjectMapper().readTree(out.toString());
        assertTrue(reports.isArray());
        assertEquals(1, reports.size());
        assertEquals("EX (A == 1)", reports.get(0).get("formula").asText());
        assertEquals(1.0, reports.get(0).get("worstDegree").asDouble(), 0.0);
        assertFalse(reports.get(0).has("degreeMap"));
    }

    @Test
    public void formulaOptionReplacesModelFormulas() throws Exception {
        assertEquals(Main.EXIT_OK, run(model("delay.json"), "--formula", "AG (B <= 1)", "--formula", "AX (A == 0)", "--degree-map"));

        JsonNode reports = new ObjectMapper().readTree(out.toString());
        assertEquals(2, reports.size());
        assertEquals("AG (B <= 1)", reports.get(0).get("formula").asText());
        assertEquals(3, reports.get(1).get("degreeMap").size());
        assertFalse(reports.get(1).get("satisfied").asBoolean());
    }

    @Test
    public void usageErrors() {
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("a.json", "b.json"));
        assertEquals(Main.EXIT_USAGE, run("a.json", "--formula"));
        assertEquals(Main.EXIT_USAGE, run("--verbose", "a.json"));
        assertTrue(err.toString().contains("Usage"));
    }

    @Test
    public void checkFailuresExitWithTwo() throws Exception {
        assertEquals(Main.EXIT_FAILURE, run(model("unsupported.json")));
        assertTrue(err.toString().contains("EF"));
        assertEquals(Main.EXIT_FAILURE, run(model("malformed.json")));
        assertEquals(Main.EXIT_FAILURE, run("does-not-exist.json"));
        assertEquals("", out.toString());
    }

    @Test
    public void syntaxErrorShowsCaret() throws Exception {
        assertEquals(Main.EXIT_FAILURE, run(model("delay.json"), "--formula", "EX (A == 1"));
        assertTrue(err.toString().contains("^"));
    }
}
