package com.frontdesk.domain.truth.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontdesk.domain.flow.model.aggregate.FlowGraph;
import com.frontdesk.domain.flow.model.aggregate.FlowTreeDefinition;
import com.frontdesk.domain.flow.model.valobj.FlowNode;
import com.frontdesk.domain.flow.model.valobj.FlowTree;
import com.frontdesk.domain.flow.model.valobj.RuntimeBinding;
import com.frontdesk.domain.truth.adapter.gateway.IWiringReportGenerator;
import com.frontdesk.domain.truth.model.valobj.BundleValidation;
import com.frontdesk.domain.truth.model.valobj.BundleValidationResult;
import com.frontdesk.domain.truth.model.valobj.OutOfTreeWarning;
import com.frontdesk.domain.truth.model.valobj.PathCheckResult;
import com.frontdesk.domain.truth.model.valobj.RuntimeFlowState;
import com.frontdesk.domain.truth.model.valobj.TruthBundle;
import com.frontdesk.domain.truth.model.valobj.TruthBundleMeta;
import com.frontdesk.domain.truth.model.valobj.TruthBundleRequest;
import com.frontdesk.types.common.Constants;
import com.frontdesk.types.enums.BundleIntegrityEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Truth Bundle 导出与运行时路径判定。
 * <p>
 * generate 把流程树、运行时绑定、接线报告与结构校验结果组装成一个以 SHA-256 封签的产物；
 * 只有缺少公司标识才会直接判为 INVALID，其余问题（生产环境缺公司文档、接线报告不可用）只降级，
 * 是否放行降级结果由请求的 allowDegraded 决定。
 * </p>
 * <p>
 * resolveFlowNodeId / checkPathInTree 供对话引擎每回合调用，把自身决策归类到流程图节点。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Service
public class TruthBundleExporter {

    public static final long DEFAULT_WIRING_REPORT_TIMEOUT_MS = 3000L;
    public static final String DEFAULT_ENVIRONMENT = "development";

    private static final String UNAVAILABLE = "UNAVAILABLE";

    /** branchTaken 兜底映射，只在 matchSource 与 checkpoint 都无法定位时使用 */
    private static final Map<String, String> BRANCH_NODE_IDS;

    static {
        Map<String, String> branches = new LinkedHashMap<>();
        branches.put("BOOKING_RUNNER", "node.bookingRunner");
        branches.put("BOOKING_TRIGGER", "node.bookingTrigger");
        branches.put("FAST_PATH_OFFER", "node.fastPathOffer");
        branches.put("SCENARIO_MATCH", "node.scenarioMatcher");
        branches.put("LLM_FALLBACK", "node.llmFallback");
        branches.put("SILENCE", "node.silenceHandler");
        BRANCH_NODE_IDS = Collections.unmodifiableMap(branches);
    }

    private final FlowGraph flowGraph;
    private final IWiringReportGenerator wiringReportGenerator;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final long wiringReportTimeoutMs;
    private final String defaultEnvironment;
    private final Clock clock;

    public TruthBundleExporter(FlowGraph flowGraph,
                               IWiringReportGenerator wiringReportGenerator,
                               ObjectMapper objectMapper,
                               ExecutorService executor,
                               long wiringReportTimeoutMs,
                               String defaultEnvironment,
                               Clock clock) {
        this.flowGraph = flowGraph == null ? FlowTreeDefinition.graph() : flowGraph;
        this.wiringReportGenerator = wiringReportGenerator;
        this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
        this.executor = executor;
        this.wiringReportTimeoutMs = wiringReportTimeoutMs;
        this.defaultEnvironment = StringUtils.defaultIfBlank(defaultEnvironment, DEFAULT_ENVIRONMENT);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Autowired
    public TruthBundleExporter(ObjectProvider<IWiringReportGenerator> wiringReportGenerator,
                               ObjectMapper objectMapper,
                               @Qualifier("commonThreadPoolExecutor") ExecutorService executor,
                               @Value("${truth-bundle.wiring-report.timeout-ms:3000}") long wiringReportTimeoutMs,
                               @Value("${truth-bundle.environment:development}") String defaultEnvironment,
                               Clock clock) {
        this(FlowTreeDefinition.graph(),
                wiringReportGenerator.getIfAvailable(),
                objectMapper,
                executor,
                wiringReportTimeoutMs,
                defaultEnvironment,
                clock);
    }

    // ------------------------------------------------------------------ 导出

    public TruthBundle generate(TruthBundleRequest request) {
        TruthBundleRequest safeRequest = request == null ? new TruthBundleRequest(null, null, null, null) : request;
        String generatedAt = Instant.now(clock).toString();
        String environment = StringUtils.defaultIfBlank(StringUtils.trim(safeRequest.environment()), defaultEnvironment);
        List<String> errors = new ArrayList<>();

        if (StringUtils.isBlank(safeRequest.companyId())) {
            errors.add("companyId is required");
            log.warn("TRUTH_BUNDLE_INVALID environment={}, errors={}", environment, errors);
            return envelope(generatedAt, null, environment, BundleIntegrityEnum.INVALID, errors);
        }
        String companyId = safeRequest.companyId().trim();
        BundleIntegrityEnum integrity = BundleIntegrityEnum.COMPLETE;

        if (isProduction(environment) && (safeRequest.company() == null || safeRequest.company().isEmpty())) {
            integrity = integrity.atLeast(BundleIntegrityEnum.DEGRADED);
            errors.add("Company document missing in production environment");
        }

        int errorsBeforeReport = errors.size();
        Object wiringReport = buildWiringReport(companyId, safeRequest.company(), environment, errors);
        if (errors.size() > errorsBeforeReport) {
            integrity = integrity.atLeast(BundleIntegrityEnum.DEGRADED);
        }

        if (!integrity.isComplete() && !Boolean.TRUE.equals(safeRequest.allowDegraded())) {
            log.warn("TRUTH_BUNDLE_FAILED companyId={}, environment={}, integrity={}, errors={}",
                    companyId, environment, integrity, errors);
            errors.add("Bundle integrity is " + integrity + " and allowDegraded is not set");
            return envelope(generatedAt, companyId, environment, BundleIntegrityEnum.FAILED, errors);
        }

        FlowTree flowTree = flowGraph.exportFlowTree();
        List<RuntimeBinding> bindings = flowGraph.exportRuntimeBindings();
        BundleValidation validation = new BundleValidation(
                flowGraph.findUnreachableNodes(),
                flowGraph.findInvalidEdges(),
                flowGraph.getValidMatchSources());
        String hash = computeHash(sealedContent(wiringReport, flowTree, bindings, validation));

        TruthBundleMeta meta = TruthBundleMeta.builder()
                .schema(Constants.TRUTH_BUNDLE_SCHEMA)
                .generatedAt(generatedAt)
                .companyId(companyId)
                .environment(environment)
                .integrity(integrity)
                .errors(errors.isEmpty() ? null : List.copyOf(errors))
                .hash(hash)
                .flowTreeVersion(flowTree.version())
                .nodeCount(flowTree.nodeCount())
                .edgeCount(flowTree.edgeCount())
                .bindingCount(bindings.size())
                .build();
        log.info("TRUTH_BUNDLE_GENERATED companyId={}, environment={}, integrity={}, hash={}, nodes={}, edges={}, "
                        + "bindings={}, unreachable={}, invalidEdges={}",
                companyId, environment, integrity, hash, flowTree.nodeCount(), flowTree.edgeCount(),
                bindings.size(), validation.unreachableNodes().size(), validation.invalidEdges().size());
        return new TruthBundle(meta, wiringReport, flowTree, bindings, validation, null, null);
    }

    // ------------------------------------------------------------------ 校验

    /**
     * 校验 bundle（类型化对象或解析后的 JSON Map）：schema、必需字段、hash 与结构问题。
     */
    public BundleValidationResult validate(Object bundle) {
        List<String> errors = new ArrayList<>();
        if (bundle == null) {
            errors.add("Bundle is empty");
            return new BundleValidationResult(false, errors);
        }
        Map<String, Object> tree;
        try {
            tree = toObjectMap(bundle);
        } catch (IllegalArgumentException ex) {
            errors.add("Bundle is not a JSON object");
            return new BundleValidationResult(false, errors);
        }
        if (tree == null) {
            errors.add("Bundle is not a JSON object");
            return new BundleValidationResult(false, errors);
        }

        Map<String, Object> meta = asMap(tree.get("meta"));
        if (meta == null) {
            errors.add("Missing meta");
        } else if (!Constants.TRUTH_BUNDLE_SCHEMA.equals(meta.get("schema"))) {
            errors.add("Invalid schema: " + meta.get("schema"));
        }
        if (tree.get("flowTree") == null) {
            errors.add("Missing flowTree");
        }
        if (tree.get("runtimeBindings") == null) {
            errors.add("Missing runtimeBindings");
        }

        Object expectedHash = meta == null ? null : meta.get("hash");
        if (expectedHash == null) {
            errors.add("Missing meta.hash");
        } else {
            String actualHash = computeHash(sealedContent(tree.get("wiringReport"), tree.get("flowTree"),
                    tree.get("runtimeBindings"), tree.get("validation")));
            if (!expectedHash.equals(actualHash)) {
                errors.add("Hash mismatch: expected " + expectedHash + ", computed " + actualHash);
            }
        }

        Map<String, Object> validation = asMap(tree.get("validation"));
        if (validation != null) {
            if (validation.get("unreachableNodes") instanceof List<?> unreachable && !unreachable.isEmpty()) {
                errors.add("Unreachable nodes: " + unreachable);
            }
            if (validation.get("invalidEdges") instanceof List<?> invalidEdges && !invalidEdges.isEmpty()) {
                errors.add("Invalid edges: " + describeEdges(invalidEdges));
            }
        }
        return new BundleValidationResult(errors.isEmpty(), errors);
    }

    // ------------------------------------------------------------------ 运行时判定

    /**
     * matchSource 绑定 -> checkpoint 绑定 -> branchTaken 兜底，都无法定位时返回 null。
     */
    public String resolveFlowNodeId(RuntimeFlowState state) {
        if (state == null) {
            return null;
        }
        FlowNode node = flowGraph.findNodeByMatchSource(StringUtils.trimToNull(state.matchSource()));
        if (node == null) {
            node = flowGraph.findNodeByCheckpoint(StringUtils.trimToNull(state.checkpoint()));
        }
        if (node == null && StringUtils.isNotBlank(state.branchTaken())) {
            node = flowGraph.getNode(BRANCH_NODE_IDS.get(state.branchTaken().trim()));
        }
        return node == null ? null : node.id();
    }

    public PathCheckResult checkPathInTree(RuntimeFlowState state) {
        String flowNodeId = resolveFlowNodeId(state);
        if (flowNodeId != null) {
            return new PathCheckResult(true, flowNodeId, null);
        }
        RuntimeFlowState safeState = state == null ? new RuntimeFlowState(null, null, null) : state;
        OutOfTreeWarning warning = new OutOfTreeWarning(
                Constants.OUT_OF_TREE_PATH,
                safeState.matchSource(),
                safeState.checkpoint(),
                safeState.branchTaken(),
                "Runtime decision cannot be mapped to a flow tree node");
        log.warn("OUT_OF_TREE_PATH matchSource={}, checkpoint={}, branchTaken={}, flowTreeVersion={}",
                safeState.matchSource(), safeState.checkpoint(), safeState.branchTaken(), flowGraph.getVersion());
        return new PathCheckResult(false, null, warning);
    }

    public FlowGraph getFlowGraph() {
        return flowGraph;
    }

    public static Map<String, String> branchNodeIds() {
        return BRANCH_NODE_IDS;
    }

    // ------------------------------------------------------------------ 内部

    private Object buildWiringReport(String companyId,
                                     Map<String, Object> company,
                                     String environment,
                                     List<String> errors) {
        if (wiringReportGenerator == null) {
            return unavailable("Wiring report generator not configured", errors);
        }
        Object report;
        try {
            report = invokeGenerator(companyId, company, environment);
        } catch (TimeoutException ex) {
            log.warn("WIRING_REPORT_TIMEOUT companyId={}, timeoutMs={}", companyId, wiringReportTimeoutMs);
            return unavailable("Wiring report timed out after " + wiringReportTimeoutMs + "ms", errors);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return unavailable("Wiring report interrupted", errors);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("WIRING_REPORT_FAILED companyId={}, error={}", companyId, cause.getMessage(), cause);
            return unavailable("Wiring report failed: " + cause.getMessage(), errors);
        } catch (RuntimeException ex) {
            log.warn("WIRING_REPORT_FAILED companyId={}, error={}", companyId, ex.getMessage(), ex);
            return unavailable("Wiring report failed: " + ex.getMessage(), errors);
        }
        Map<String, Object> asObject;
        try {
            asObject = toObjectMap(report);
        } catch (IllegalArgumentException ex) {
            return unavailable("Wiring report is not serializable: " + ex.getMessage(), errors);
        }
        if (asObject == null) {
            return unavailable("Wiring report is not a JSON object", errors);
        }
        return asObject;
    }

    private Object invokeGenerator(String companyId, Map<String, Object> company, String environment)
            throws TimeoutException, InterruptedException, ExecutionException {
        if (executor == null || wiringReportTimeoutMs <= 0L) {
            return wiringReportGenerator.generate(companyId, company, environment);
        }
        Future<Object> future;
        try {
            future = executor.submit(() -> wiringReportGenerator.generate(companyId, company, environment));
        } catch (RejectedExecutionException ex) {
            throw new ExecutionException("Wiring report task rejected", ex);
        }
        try {
            return future.get(wiringReportTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException ex) {
            future.cancel(true);
            throw ex;
        }
    }

    private static Map<String, Object> unavailable(String reason, List<String> errors) {
        errors.add(reason);
        Map<String, Object> placeholder = new LinkedHashMap<>();
        placeholder.put("status", UNAVAILABLE);
        placeholder.put("reason", reason);
        return placeholder;
    }

    private TruthBundle envelope(String generatedAt,
                                 String companyId,
                                 String environment,
                                 BundleIntegrityEnum integrity,
                                 List<String> errors) {
        List<String> copy = List.copyOf(errors);
        TruthBundleMeta meta = TruthBundleMeta.builder()
                .schema(Constants.TRUTH_BUNDLE_SCHEMA)
                .generatedAt(generatedAt)
                .companyId(companyId)
                .environment(environment)
                .integrity(integrity)
                .errors(copy)
                .build();
        return TruthBundle.envelope(meta, copy.get(copy.size() - 1), copy);
    }

    static boolean isProduction(String environment) {
        return "production".equalsIgnoreCase(environment) || "prod".equalsIgnoreCase(environment);
    }

    private static Map<String, Object> sealedContent(Object wiringReport, Object flowTree,
                                                     Object runtimeBindings, Object validation) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("wiringReport", wiringReport);
        content.put("flowTree", flowTree);
        content.put("runtimeBindings", runtimeBindings);
        content.put("validation", validation);
        return content;
    }

    /**
     * 统一走一次 JSON 树转换再按 key 递归排序，类型化对象与解析后的 Map 得到同一摘要。
     */
    String computeHash(Map<String, Object> content) {
        Object tree = objectMapper.convertValue(content, Object.class);
        try {
            return sha256Hex(objectMapper.writeValueAsString(canonicalize(tree)));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Truth bundle序列化失败: " + ex.getMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toObjectMap(Object value) {
        if (value == null) {
            return null;
        }
        JsonNode node = objectMapper.valueToTree(value);
        if (node == null || !node.isObject()) {
            return null;
        }
        return objectMapper.convertValue(node, Map.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    private static String describeEdges(List<?> edges) {
        List<String> ids = new ArrayList<>();
        for (Object edge : edges) {
            if (edge instanceof Map<?, ?> map) {
                ids.add(map.get("id") + "(" + map.get("from") + "->" + map.get("to") + ")");
            } else {
                ids.add(String.valueOf(edge));
            }
        }
        return String.join(", ", ids);
    }

    private static Object canonicalize(Object source) {
        if (source instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() == null) {
                    continue;
                }
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (source instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object item : list) {
                normalized.add(canonicalize(item));
            }
            return normalized;
        }
        return source;
    }

    private static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
