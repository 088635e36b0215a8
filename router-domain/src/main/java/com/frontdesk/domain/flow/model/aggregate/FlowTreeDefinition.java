package com.frontdesk.domain.flow.model.aggregate;

import com.frontdesk.domain.flow.model.valobj.FlowNode;
import com.frontdesk.domain.flow.model.valobj.RuntimeBinding;

import java.util.List;

import static com.frontdesk.types.enums.FlowNodeTypeEnum.ACTION;
import static com.frontdesk.types.enums.FlowNodeTypeEnum.DECISION;
import static com.frontdesk.types.enums.FlowNodeTypeEnum.DETECTOR;
import static com.frontdesk.types.enums.FlowNodeTypeEnum.ENTRY;
import static com.frontdesk.types.enums.FlowNodeTypeEnum.EXIT;
import static com.frontdesk.types.enums.FlowNodeTypeEnum.GUARD;
import static com.frontdesk.types.enums.FlowNodeTypeEnum.ROUTER;

/**
 * 前台单回合处理流程的声明。
 * <p>
 * 运行时的每个决策都必须落在某个节点上，每次状态转移都必须对应一条边；
 * 无法映射的路径会被判定为 OUT_OF_TREE_PATH。修改流程时同步提升 {@link #VERSION}。
 * </p>
 * <p>
 * 1.0.1：直接预约意图遵守 requireExplicitConsent；快速预约在同意闸门之前执行；
 * 出口节点为 turnEnd（回合结束，不是挂机）。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public final class FlowTreeDefinition {

    public static final String VERSION = "1.0.1";
    public static final String ENTRY_NODE_ID = "node.callStart";
    public static final String EXIT_NODE_ID = "node.turnEnd";

    private static final FlowGraph GRAPH = declare();

    private FlowTreeDefinition() {
    }

    public static FlowGraph graph() {
        return GRAPH;
    }

    private static FlowGraph declare() {
        return FlowGraph.builder()
                .version(VERSION)
                .entryNodeId(ENTRY_NODE_ID)
                .exitNodeId(EXIT_NODE_ID)
                // 入口与守卫
                .node(FlowNode.of(ENTRY_NODE_ID, "Call Start", ENTRY, "Inbound call received", "CHECKPOINT_1"))
                .node(FlowNode.of("node.emptyUtteranceGuard", "Empty Utterance Guard", GUARD,
                                "Routes empty or punctuation-only input to the silence handler",
                                "CHECKPOINT_V92_EMPTY_GUARD")
                        .withConfigPaths("routing.emptyUtteranceGuard.enabled")
                        .withCodeLocation("ConversationEngine.js:4604"))
                .node(FlowNode.of("node.silenceHandler", "Silence Handler", ACTION,
                                "Deterministic silence response (0 tokens)", "SILENCE_HANDLER")
                        .withMatchSource("SILENCE_HANDLER"))
                // 槽位提取
                .node(FlowNode.of("node.slotExtraction", "Slot Extraction", ACTION,
                                "Extract name/phone/address/time from utterance", "CHECKPOINT_8")
                        .withConfigPaths("frontDesk.bookingSlots", "frontDesk.addressValidation.rejectQuestions")
                        .withCodeLocation("ConversationEngine.js:4030"))
                // 预约模式
                .node(FlowNode.of("node.bookingModeCheck", "Booking Mode Check", DECISION,
                                "Is booking mode locked?", "CHECKPOINT_BRANCH_DECISION")
                        .withConfigPaths("frontDesk.bookingBehavior.requireExplicitConsent"))
                .node(FlowNode.of("node.bookingRunner", "Booking Flow Runner", ROUTER,
                                "Deterministic slot collection (no LLM)", "CHECKPOINT_9b")
                        .withMatchSource("BOOKING_SNAP")
                        .withConfigPaths("frontDesk.bookingSlots", "frontDesk.askFullName", "frontDesk.confirmSpelling")
                        .withCodeLocation("BookingFlowRunner.js"))
                // 通用意图
                .node(FlowNode.of("node.metaIntentDetector", "Meta Intent Detector", DETECTOR,
                                "Detect universal intents (human request, cancel, etc.)", "CHECKPOINT_V86_META")
                        .withMatchSource("META_INTENT_TIER1")
                        .withConfigPaths("frontDesk.universalHandlers"))
                // 预约同意
                .node(FlowNode.of("node.directBookingIntentDetector", "Direct Booking Intent Detector", DETECTOR,
                                "Detect direct requests such as \"get somebody out\" or \"schedule\"",
                                "CHECKPOINT_DIRECT_INTENT")
                        .withConfigPaths("booking.directIntentPatterns")
                        .withCodeLocation("DirectBookingIntentDetector.js"))
                .node(FlowNode.of("node.consentGate", "Consent Gate", DECISION,
                                "Check for explicit booking consent", "CHECKPOINT_CONSENT_CHECK")
                        .withConfigPaths("frontDesk.bookingBehavior.requireExplicitConsent",
                                "frontDesk.bookingBehavior.consentPhrases")
                        .withCodeLocation("ConversationEngine.js:5345"))
                .node(FlowNode.of("node.bookingTrigger", "Booking Mode Trigger", ACTION,
                                "Flip bookingModeLocked=true, enter booking", "CHECKPOINT_BOOKING_TRIGGER")
                        .withConfigPaths()
                        .withCodeLocation("ConversationEngine.js:5389"))
                // 快速预约
                .node(FlowNode.of("node.fastPathIntentDetector", "Fast Path Intent Detector", DETECTOR,
                                "Detect urgency keywords (schedule, ASAP, send someone)", "CHECKPOINT_9d_1")
                        .withConfigPaths("frontDesk.fastPathBooking.enabled",
                                "frontDesk.fastPathBooking.triggerKeywords")
                        .withCodeLocation("ConversationEngine.js:11517"))
                .node(FlowNode.of("node.fastPathOffer", "Fast Path Offer", ACTION,
                                "Speak offer script, set bookingConsentPending", "FAST_PATH_OFFER")
                        .withMatchSource("FAST_PATH_BOOKING")
                        .withConfigPaths("frontDesk.fastPathBooking.offerScript")
                        .withCodeLocation("ConversationEngine.js:11673"))
                // 问题澄清
                .node(FlowNode.of("node.discoveryClarification", "Discovery Clarification", DETECTOR,
                                "Ask clarifying questions for vague issues", "CHECKPOINT_V92_CLARIFY")
                        .withConfigPaths("discovery.clarifyingQuestions.enabled",
                                "discovery.clarifyingQuestions.vaguePatterns")
                        .withCodeLocation("ConversationEngine.js:11275"))
                // 场景匹配
                .node(FlowNode.of("node.scenarioMatcher", "Scenario Matcher", ROUTER,
                                "BM25 + regex scenario matching", "CHECKPOINT_SCENARIO_MATCH")
                        .withMatchSource("SCENARIO_MATCH")
                        .withConfigPaths("scenarios.*.triggers", "scenarios.*.negativeTriggers",
                                "scenarios.*.response")
                        .withCodeLocation("HybridScenarioSelector.js"))
                .node(FlowNode.of("node.scenarioResponse", "Scenario Response", ACTION,
                                "Return matched scenario response", "SCENARIO_RESPONSE")
                        .withMatchSource("SCENARIO_MATCHED"))
                // LLM 兜底
                .node(FlowNode.of("node.llmFallback", "LLM Fallback", ROUTER,
                                "Tier-3 LLM when no deterministic match", "CHECKPOINT_9e")
                        .withMatchSource("LLM_FALLBACK")
                        .withTier("tier3")
                        .withCodeLocation("HybridReceptionistLLM.js"))
                // 收尾
                .node(FlowNode.of("node.bookingComplete", "Booking Complete", ACTION,
                                "All slots collected, booking finalized", "BOOKING_COMPLETE")
                        .withMatchSource("BOOKING_COMPLETE")
                        .withConfigPaths("frontDesk.bookingOutcome"))
                .node(FlowNode.of(EXIT_NODE_ID, "Turn End", EXIT,
                                "Response built, TwiML sent - end of this turn (NOT call hangup)", "TURN_END")
                        .withNote("This node means: agent response ready. Call continues after this."))

                .edge("edge.1", ENTRY_NODE_ID, "node.emptyUtteranceGuard", "always")
                .edge("edge.2a", "node.emptyUtteranceGuard", "node.silenceHandler",
                        "isEmpty || isPunctuationOnly || isFillerOnly")
                .edge("edge.2b", "node.emptyUtteranceGuard", "node.slotExtraction", "hasContent")
                .edge("edge.3", "node.slotExtraction", "node.bookingModeCheck", "always")
                .edge("edge.4a", "node.bookingModeCheck", "node.bookingRunner", "bookingModeLocked === true")
                .edge("edge.4b", "node.bookingModeCheck", "node.metaIntentDetector", "bookingModeLocked === false")
                .edge("edge.5a", "node.metaIntentDetector", EXIT_NODE_ID, "humanRequest || cancel")
                .edge("edge.5b", "node.metaIntentDetector", "node.directBookingIntentDetector", "noMetaIntent")
                // 不要求显式同意时直接进入预约，否则先发出快速预约邀请
                .edge("edge.6a", "node.directBookingIntentDetector", "node.bookingTrigger",
                        "hasDirectIntent && confidence >= 0.75 && requireExplicitConsent === false")
                .edge("edge.6b", "node.directBookingIntentDetector", "node.fastPathOffer",
                        "hasDirectIntent && confidence >= 0.75 && requireExplicitConsent === true")
                .edge("edge.6c", "node.directBookingIntentDetector", "node.fastPathIntentDetector", "noDirectIntent")
                .edge("edge.7a", "node.fastPathIntentDetector", "node.fastPathOffer", "fastPathTriggered")
                .edge("edge.7b", "node.fastPathIntentDetector", "node.consentGate",
                        "noFastPath && bookingConsentPending")
                .edge("edge.7c", "node.fastPathIntentDetector", "node.discoveryClarification",
                        "noFastPath && !bookingConsentPending")
                .edge("edge.8a", "node.consentGate", "node.bookingTrigger", "hasConsent")
                .edge("edge.8b", "node.consentGate", "node.discoveryClarification", "noConsent")
                .edge("edge.9", "node.bookingTrigger", "node.bookingRunner", "always")
                .edge("edge.10a", "node.discoveryClarification", "node.scenarioMatcher", "issueClear")
                .edge("edge.10b", "node.discoveryClarification", EXIT_NODE_ID, "askClarifyingQuestion")
                .edge("edge.11a", "node.scenarioMatcher", "node.scenarioResponse", "scenarioMatched")
                .edge("edge.11b", "node.scenarioMatcher", "node.llmFallback", "noScenarioMatch")
                .edge("edge.12a", "node.bookingRunner", "node.bookingComplete", "allSlotsCollected")
                .edge("edge.12b", "node.bookingRunner", EXIT_NODE_ID, "slotQuestionAsked")
                .edge("edge.13", "node.silenceHandler", EXIT_NODE_ID, "always")
                .edge("edge.14", "node.scenarioResponse", EXIT_NODE_ID, "always")
                .edge("edge.15", "node.llmFallback", EXIT_NODE_ID, "always")
                .edge("edge.16", "node.fastPathOffer", EXIT_NODE_ID, "always")
                .edge("edge.17", "node.bookingComplete", EXIT_NODE_ID, "always")

                .binding(ENTRY_NODE_ID, List.of("CHECKPOINT_1", "CALL_START"), List.of(),
                        List.of("Starting processTurn", "CALL_START"), List.of("CALL_START"))
                .binding(new RuntimeBinding(EXIT_NODE_ID,
                        List.of("TURN_END", "TWIML_SENT", "AGENT_RESPONSE_BUILT"), List.of(),
                        List.of("TURN_COMPLETE", "PATH_RESOLVED"),
                        List.of("TWIML_SENT", "TURN_COMPLETE", "AGENT_RESPONSE_BUILT"),
                        "End of turn, not call hangup. Call continues."))
                .binding("node.emptyUtteranceGuard", List.of("CHECKPOINT_V92_EMPTY_GUARD"), List.of(),
                        List.of("shouldTreatAsSilence", "isPunctuationOnly", "isFillerOnly"), null)
                .binding("node.silenceHandler", List.of("SILENCE_HANDLER"), List.of("SILENCE_HANDLER"),
                        List.of("SILENCE_DETERMINISTIC"), null)
                .binding("node.slotExtraction", List.of("CHECKPOINT_8"), List.of(),
                        List.of("Extracting slots", "SLOTS_EXTRACTED"), List.of("SLOTS_EXTRACTED"))
                .binding("node.bookingModeCheck", List.of("CHECKPOINT_BRANCH_DECISION"), List.of(),
                        List.of("bookingModeLocked", "checkpointC_branchDecision"), null)
                .binding("node.bookingRunner", List.of("CHECKPOINT_9b", "checkpointD_bookingRunner"),
                        List.of("BOOKING_SNAP", "BOOKING_FLOW_RUNNER"), List.of("BookingFlowRunner"), null)
                .binding("node.directBookingIntentDetector", List.of("CHECKPOINT_DIRECT_INTENT"), List.of(),
                        List.of("DirectBookingIntentDetector", "hasDirectIntent"), null)
                .binding("node.consentGate", List.of("CHECKPOINT_CONSENT_CHECK"), List.of(),
                        List.of("shouldEnterBooking", "consentCheck.hasConsent"), null)
                .binding("node.bookingTrigger", List.of("CHECKPOINT_BOOKING_TRIGGER"), List.of(),
                        List.of("bookingModeLocked = true", "BOOKING MODE TRIGGERED"), null)
                .binding("node.fastPathIntentDetector", List.of("CHECKPOINT_9d_1"), List.of(),
                        List.of("fastPathTriggered", "fastPathKeywords"), null)
                .binding("node.fastPathOffer", List.of("FAST_PATH_OFFER"), List.of("FAST_PATH_BOOKING"),
                        List.of("FAST-PATH ACTIVATED"), null)
                .binding("node.scenarioMatcher", List.of("CHECKPOINT_SCENARIO_MATCH"), List.of("SCENARIO_MATCH"),
                        List.of("HybridScenarioSelector", "scenarioRetrieval"), null)
                // STATE_MACHINE 表示确定性处理（0 token），包括场景命中
                .binding("node.scenarioResponse", List.of("SCENARIO_RESPONSE"),
                        List.of("SCENARIO_MATCHED", "STATE_MACHINE", "RULE_BASED"),
                        List.of("scenarioMatched", "fromStateMachine"), null)
                .binding("node.llmFallback", List.of("CHECKPOINT_9e"), List.of("LLM_FALLBACK", "TIER3_FALLBACK"),
                        List.of("HybridReceptionistLLM", "tier3"), null)
                .binding("node.metaIntentDetector", List.of("CHECKPOINT_V86_META"), List.of("META_INTENT_TIER1"),
                        List.of("metaIntentCheck", "META_INTENT"), null)
                .binding("node.bookingComplete", List.of("BOOKING_COMPLETE"), List.of("BOOKING_COMPLETE"),
                        List.of("booking finalized", "allSlotsCollected"), List.of("BOOKING_CREATED", "BOOKING_COMPLETE"))
                .build();
    }
}
