package com.twinkle.agent.runner;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.twinkle.agent.FakeCommitmentPrimitive;
import com.twinkle.agent.InMemoryEscrowLedger;
import com.twinkle.agent.commitment.PollingPolicy;
import com.twinkle.agent.config.TwinkleSettings;
import com.twinkle.agent.oracle.HeuristicQualityOracle;
import com.twinkle.agent.registry.ReputationRegistry;
import org.junit.jupiter.api.*;
import static com.github.tomakehurst.wiremock.client.WireMock.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/** Runs the orchestrator against real HTTP providers through its default purchase client. */
class ProcurementOrchestratorHttpTest {

    static WireMockServer wm;

    @BeforeAll
    static void startServer() {
        wm = new WireMockServer(0);   // random port
        wm.start();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() {
        wm.resetAll();
    }

    private ProviderConfig provider(String name) {
        return new ProviderConfig(name, "http://localhost:" + wm.port() + "/" + name, new BigDecimal("0.02"),
                List.of("pyth"), "0x" + name);
    }

    @Test
    void buysOverHttpAndSettles() throws Exception {
        wm.stubFor(get(urlPathEqualTo("/solid"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"analysis\":{\"summary\":\"Detailed institutional positioning across venues\","
                    + "\"confidence\":0.6,\"dataPoints\":[1,2],\"recommendations\":[\"hold\"]}}")));
        wm.stubFor(get(urlPathEqualTo("/broken"))
            .willReturn(aResponse()
                .withStatus(500)
                .withBody("{\"error\":\"upstream feed down\"}")));

        ReputationRegistry reputation = mock(ReputationRegistry.class);
        when(reputation.submit(any())).thenReturn("0xfeedback");

        ProcurementOrchestrator orchestrator = ProcurementOrchestrator.builder()
                .commitments(new FakeCommitmentPrimitive())
                .ledger(new InMemoryEscrowLedger())
                .identity(r -> 7L)
                .reputation(reputation)
                .qualityOracle(new HeuristicQualityOracle())
                .settings(TwinkleSettings.builder()
                        .httpTimeout(Duration.ofSeconds(5))
                        .decryptPolling(new PollingPolicy(Duration.ZERO, 3, Duration.ofSeconds(5)))
                        .build())
                .sleeper(d -> { })
                .build();

        ProcurementReceipt r = orchestrator.run(ProcurementRequest.builder()
                .query("SOL outlook")
                .budget("0.10")
                .token("0xUSDC")
                .provider(provider("solid"))
                .provider(provider("broken"))
                .build());

        assertEquals(1, r.providers.size());
        ProviderResult solid = r.providers.get(0);
        assertEquals("solid", solid.name);
        assertTrue(solid.isPaid());
        assertFalse(solid.x402.x402Used);
        assertEquals("0", solid.x402.x402Cost);
        assertEquals("hold", solid.delivery.analysis.path("recommendations").get(0).asText());

        wm.verify(getRequestedFor(urlPathEqualTo("/solid")).withQueryParam("q", equalTo("SOL outlook")));
    }
}
