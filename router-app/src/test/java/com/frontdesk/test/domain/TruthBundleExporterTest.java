package com.frontdesk.test.domain;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontdesk.domain.flow.model.aggregate.FlowTreeDefinition;
import com.frontdesk.domain.truth.adapter.gateway.IWiringReportGenerator;
import com.frontdesk.domain.truth.model.valobj.BundleValidationResult;
import com.frontdesk.domain.truth.model.valobj.PathCheckResult;
import com.frontdesk.domain.truth.model.valobj.RuntimeFlowState;
import com.frontdesk.domain.truth.model.valobj.TruthBundle;
import com.frontdesk.domain.truth.model.valobj.TruthBundleRequest;
import com.frontdesk.domain.truth.service.TruthBundleExporter;
import com.frontdesk.test.support.ScenarioFixtures;
import com.frontdesk.types.enums.BundleIntegrityEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class TruthBundleExporterTest {

    private static final Map<String, Object> COMPANY = Map.of("companyId", "c1", "name", "Acme HVAC");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldValidateFreshlyGeneratedBundle() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);

        TruthBundle bundle = exporter.generate(new TruthBundleRequest("c1", COMPANY, "production", false));

        Assertions.assertFalse(bundle.isEnvelope());
        Assertions.assertEquals(BundleIntegrityEnum.COMPLETE, bundle.meta().getIntegrity());
        Assertions.assertEquals("TRUTH_BUNDLE_V1", bundle.meta().getSchema());
        Assertions.assertEquals(64, bundle.meta().getHash().length());
        Assertions.assertEquals(18, bundle.meta().getNodeCount());
        Assertions.assertEquals(17, bundle.meta().getBindingCount());

        BundleValidationResult typed = exporter.validate(bundle);
        Assertions.assertTrue(typed.valid(), String.valueOf(typed.errors()));
        BundleValidationResult parsed = exporter.validate(toMap(bundle));
        Assertions.assertTrue(parsed.valid(), String.valueOf(parsed.errors()));
        Assertions.assertEquals(List.of(), parsed.errors());
    }

    @Test
    public void shouldDetectTamperedContentButIgnoreMetaChanges() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);
        TruthBundle bundle = exporter.generate(new TruthBundleRequest("c1", COMPANY, "development", null));

        Map<String, Object> metaEdited = toMap(bundle);
        asMap(metaEdited.get("meta")).put("generatedAt", "2030-01-01T00:00:00Z");
        Assertions.assertTrue(exporter.validate(metaEdited).valid());

        Map<String, Object> tampered = toMap(bundle);
        Map<String, Object> firstNode = asMap(asList(asMap(tampered.get("flowTree")).get("nodes")).get(0));
        firstNode.put("label", "Tampered");
        BundleValidationResult result = exporter.validate(tampered);

        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.errors().get(0).startsWith("Hash mismatch: expected " + bundle.meta().getHash()));
    }

    @Test
    public void shouldDetectTamperedWiringReport() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);
        Map<String, Object> tampered = toMap(exporter.generate(new TruthBundleRequest("c1", COMPANY, "development", null)));

        asMap(tampered.get("wiringReport")).put("health", "GREEN");

        Assertions.assertFalse(exporter.validate(tampered).valid());
    }

    @Test
    public void shouldProduceStableHashForSameInput() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);

        String first = exporter.generate(new TruthBundleRequest("c1", COMPANY, "development", null)).meta().getHash();
        String second = exporter.generate(new TruthBundleRequest("c1", COMPANY, "development", null)).meta().getHash();

        Assertions.assertEquals(first, second);
    }

    @Test
    public void shouldReturnInvalidEnvelopeWithoutCompanyId() {
        TruthBundle bundle = exporter(healthyGenerator(), 1000L)
                .generate(new TruthBundleRequest(null, COMPANY, "development", true));

        Assertions.assertTrue(bundle.isEnvelope());
        Assertions.assertEquals(BundleIntegrityEnum.INVALID, bundle.meta().getIntegrity());
        Assertions.assertEquals("companyId is required", bundle.error());
        Map<String, Object> json = toMap(bundle);
        Assertions.assertFalse(json.containsKey("flowTree"));
        Assertions.assertFalse(json.containsKey("runtimeBindings"));
        Assertions.assertEquals("INVALID", asMap(json.get("meta")).get("integrity"));
    }

    @Test
    public void shouldFailProductionExportWithoutCompanyDocument() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);

        TruthBundle failed = exporter.generate(new TruthBundleRequest("c1", null, "production", false));
        Assertions.assertTrue(failed.isEnvelope());
        Assertions.assertEquals(BundleIntegrityEnum.FAILED, failed.meta().getIntegrity());
        Assertions.assertTrue(failed.errors().contains("Company document missing in production environment"));
        Assertions.assertNull(failed.meta().getNodeCount());

        TruthBundle aliased = exporter.generate(new TruthBundleRequest("c1", null, "PROD", null));
        Assertions.assertEquals(BundleIntegrityEnum.FAILED, aliased.meta().getIntegrity());

        TruthBundle degraded = exporter.generate(new TruthBundleRequest("c1", null, "production", true));
        Assertions.assertFalse(degraded.isEnvelope());
        Assertions.assertEquals(BundleIntegrityEnum.DEGRADED, degraded.meta().getIntegrity());
        Assertions.assertTrue(exporter.validate(degraded).valid());

        TruthBundle development = exporter.generate(new TruthBundleRequest("c1", null, "development", false));
        Assertions.assertEquals(BundleIntegrityEnum.COMPLETE, development.meta().getIntegrity());
    }

    @Test
    public void shouldDegradeWhenWiringReportFails() {
        IWiringReportGenerator failing = (companyId, company, environment) -> {
            throw new IllegalStateException("registry offline");
        };
        TruthBundleExporter exporter = exporter(failing, 1000L);

        TruthBundle failed = exporter.generate(new TruthBundleRequest("c1", COMPANY, "development", null));
        Assertions.assertEquals(BundleIntegrityEnum.FAILED, failed.meta().getIntegrity());

        TruthBundle degraded = exporter.generate(new TruthBundleRequest("c1", COMPANY, "staging", true));
        Assertions.assertEquals(BundleIntegrityEnum.DEGRADED, degraded.meta().getIntegrity());
        Map<String, Object> placeholder = asMap(degraded.wiringReport());
        Assertions.assertEquals("UNAVAILABLE", placeholder.get("status"));
        Assertions.assertEquals("Wiring report failed: registry offline", placeholder.get("reason"));
        Assertions.assertNotNull(degraded.flowTree());
    }

    @Test
    public void shouldDegradeWhenWiringReportTimesOut() {
        IWiringReportGenerator slow = (companyId, company, environment) -> {
            try {
                Thread.sleep(5_000L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return Map.of("late", true);
        };
        TruthBundleExporter exporter = exporter(slow, 50L);

        long startedAt = System.currentTimeMillis();
        TruthBundle bundle = exporter.generate(new TruthBundleRequest("c1", COMPANY, "development", true));

        Assertions.assertTrue(System.currentTimeMillis() - startedAt < 4_000L);
        Assertions.assertEquals(BundleIntegrityEnum.DEGRADED, bundle.meta().getIntegrity());
        Assertions.assertEquals("Wiring report timed out after 50ms", asMap(bundle.wiringReport()).get("reason"));
    }

    @Test
    public void shouldDegradeOnNonObjectOrMissingReport() {
        TruthBundleExporter scalar = exporter((companyId, company, environment) -> "ok", 1000L);
        TruthBundle fromScalar = scalar.generate(new TruthBundleRequest("c1", COMPANY, null, true));
        Assertions.assertEquals(BundleIntegrityEnum.DEGRADED, fromScalar.meta().getIntegrity());
        Assertions.assertEquals("development", fromScalar.meta().getEnvironment());

        TruthBundleExporter missing = exporter(null, 1000L);
        TruthBundle withoutGenerator = missing.generate(new TruthBundleRequest("c1", COMPANY, "development", null));
        Assertions.assertEquals(BundleIntegrityEnum.FAILED, withoutGenerator.meta().getIntegrity());
        Assertions.assertEquals("Wiring report generator not configured", withoutGenerator.errors().get(0));
    }

    @Test
    public void shouldRejectMalformedBundles() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);

        Assertions.assertEquals(List.of("Bundle is empty"), exporter.validate(null).errors());
        BundleValidationResult result = exporter.validate(Map.of("meta", Map.of("schema", "OTHER")));
        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.errors().contains("Invalid schema: OTHER"));
        Assertions.assertTrue(result.errors().contains("Missing flowTree"));
        Assertions.assertTrue(result.errors().contains("Missing runtimeBindings"));
        Assertions.assertTrue(result.errors().contains("Missing meta.hash"));
    }

    @Test
    public void shouldResolveRuntimeStateToFlowNode() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);

        Assertions.assertEquals("node.scenarioMatcher",
                exporter.resolveFlowNodeId(new RuntimeFlowState("SCENARIO_MATCH", null, null)));
        Assertions.assertEquals("node.slotExtraction",
                exporter.resolveFlowNodeId(new RuntimeFlowState("UNKNOWN", "CHECKPOINT_8", null)));
        Assertions.assertEquals("node.silenceHandler",
                exporter.resolveFlowNodeId(new RuntimeFlowState(null, null, "SILENCE")));
        Assertions.assertNull(exporter.resolveFlowNodeId(new RuntimeFlowState("X", "Y", "Z")));
        Assertions.assertEquals(6, TruthBundleExporter.branchNodeIds().size());
    }

    @Test
    public void shouldWarnForOutOfTreePath() {
        TruthBundleExporter exporter = exporter(healthyGenerator(), 1000L);

        PathCheckResult inTree = exporter.checkPathInTree(new RuntimeFlowState(null, null, "LLM_FALLBACK"));
        Assertions.assertTrue(inTree.inTree());
        Assertions.assertEquals("node.llmFallback", inTree.flowNodeId());
        Assertions.assertNull(inTree.warning());

        PathCheckResult outOfTree = exporter.checkPathInTree(new RuntimeFlowState("LEGACY_ROUTER", null, "LEGACY"));
        Assertions.assertFalse(outOfTree.inTree());
        Assertions.assertNull(outOfTree.flowNodeId());
        Assertions.assertEquals("OUT_OF_TREE_PATH", outOfTree.warning().type());
        Assertions.assertEquals("LEGACY_ROUTER", outOfTree.warning().matchSource());
        Assertions.assertEquals("LEGACY", outOfTree.warning().branchTaken());
    }

    private TruthBundleExporter exporter(IWiringReportGenerator generator, long timeoutMs) {
        return new TruthBundleExporter(FlowTreeDefinition.graph(), generator, objectMapper, executor, timeoutMs,
                "development", ScenarioFixtures.FIXED_CLOCK);
    }

    private IWiringReportGenerator healthyGenerator() {
        return (companyId, company, environment) -> Map.of(
                "companyId", companyId,
                "environment", environment,
                "health", Map.of("overall", "GREEN", "criticalIssues", List.of(), "warnings", List.of()));
    }

    private Map<String, Object> toMap(TruthBundle bundle) {
        return objectMapper.convertValue(bundle, new TypeReference<Map<String, Object>>() {
        });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return (List<Object>) value;
    }
}
