package qctl.evaluation;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class CheckerConfigurationTest {

    @Test
    public void defaultsWithoutVariables() {
        CheckerConfiguration c = CheckerConfiguration.fromMap(new HashMap<>());
        assertEquals(1_000_000, c.getStateLimit());
        assertEquals(1, c.getThreads());
        assertFalse(c.isIncludeDegreeMap());
    }

    @Test
    public void readsOverrides() {
        Map<String, String> env = new HashMap<>();
        env.put(CheckerConfiguration.MAX_STATES, "5000");
        env.put(CheckerConfiguration.THREADS, " 4 ");
        env.put(CheckerConfiguration.INCLUDE_DEGREE_MAP, "TRUE");
        CheckerConfiguration c = CheckerConfiguration.fromMap(env);
        assertEquals(5000, c.getStateLimit());
        assertEquals(4, c.getThreads());
        assertTrue(c.isIncludeDegreeMap());
    }

    @Test
    public void invalidValuesFallBackToDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put(CheckerConfiguration.MAX_STATES, "lots");
        env.put(CheckerConfiguration.THREADS, "-2");
        env.put(CheckerConfiguration.INCLUDE_DEGREE_MAP, "maybe");
        CheckerConfiguration c = CheckerConfiguration.fromMap(env);
        assertEquals(1_000_000, c.getStateLimit());
        assertEquals(1, c.getThreads());
        assertFalse(c.isIncludeDegreeMap());
    }

    @Test
    public void copiesChangeOneSetting() {
        CheckerConfiguration c = CheckerConfiguration.defaults().withThreads(2).withDegreeMap(true);
        assertEquals(2, c.getThreads());
        assertTrue(c.isIncludeDegreeMap());
        assertEquals(10, c.withStateLimit(10).getStateLimit());
    }

    @Test(expected = IllegalArgumentException.class)
    public void constructorRejectsZeroThreads() {
        new CheckerConfiguration(10, 0, false);
    }
}
