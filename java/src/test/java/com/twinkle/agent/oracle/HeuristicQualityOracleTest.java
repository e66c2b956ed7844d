package com.twinkle.agent.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicQualityOracleTest {

    final ObjectMapper mapper = new ObjectMapper();
    final HeuristicQualityOracle oracle = new HeuristicQualityOracle();

    @Test
    void richAnalysisScoresHigh() throws Exception {
        JsonNode delivery = mapper.readTree("{\"analysis\":{"
                + "\"summary\":\"SOL shows strong institutional inflows across three venues this week\","
                + "\"confidence\":0.7,\"dataPoints\":[1,2,3,4,5,6],\"recommendations\":[\"accumulate\"]}}");

        QualityAssessment a = oracle.evaluate(delivery, "DeepAnalyst", 5, "defi-strategy");

        assertEquals(10, a.score, 1e-9);   // 7 + 2.5 + 1, clamped
        assertTrue(a.passed);
        assertTrue(a.reasoning.contains("[defi-strategy]"));
    }

    @Test
    void shallowAnalysisFails() throws Exception {
        JsonNode analysis = mapper.readTree("{\"summary\":\"up\",\"confidence\":0.4,\"dataPoints\":2}");

        QualityAssessment a = oracle.evaluate(analysis, "Lazy", 5, null);

        assertEquals(3, a.score, 1e-9);   // 4 + 1 - 2
        assertFalse(a.passed);
    }

    @Test
    void missingAnalysisScoresZero() throws Exception {
        QualityAssessment a = oracle.evaluate(mapper.readTree("\"nothing\""), "Empty", 0, null);
        assertEquals(0, a.score);
        assertTrue(a.passed);
    }
}
