package org.utd.cs.langmodel.probability;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogMathTest {

    @Test
    void testAddLogs() {
        assertEquals(-1.0, LogMath.addLogs(-2.0, -2.0), 1e-12);
        assertEquals(0.0, LogMath.addLogs(0.0, LogMath.NINF), 1e-12);
        assertEquals(LogMath.log2(0.75), LogMath.sumLogs(List.of(-2.0, -2.0, -2.0)), 1e-12);
        assertEquals(LogMath.NINF, LogMath.sumLogs(List.of()));
    }

    @Test
    void testEntropyAndLogLikelihood() {
        UniformProbDist<String> uniform = new UniformProbDist<>(List.of("a", "b", "c", "d"));
        assertEquals(2.0, LogMath.entropy(uniform), 1e-12);
        assertEquals(-2.0, LogMath.logLikelihood(uniform, uniform), 1e-12);
    }
}
