package com.frontdesk.domain.flow.model.aggregate;

import com.frontdesk.domain.flow.model.valobj.FlowEdge;
import com.frontdesk.domain.flow.model.valobj.FlowNode;
import com.frontdesk.domain.flow.model.valobj.FlowTree;
import com.frontdesk.domain.flow.model.valobj.RuntimeBinding;
import com.frontdesk.domain.flow.service.FlowPredicateParser;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 流程图：声明所有合法路由决策的静态有向图，以及运行时埋点到节点的绑定表。
 * <p>
 * 构建后不可变，查询无锁。校验方法只报告问题，从不抛异常；边条件只解析，不执行。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public final class FlowGraph {

    private final String version;
    private final String entryNodeId;
    private final String exitNodeId;
    private final ImmutableList<FlowNode> nodes;
    private final ImmutableList<FlowEdge> edges;
    private final ImmutableList<RuntimeBinding> bindings;
    private final ImmutableMap<String, FlowNode> nodeById;
    private final ImmutableListMultimap<String, FlowEdge> edgesFrom;
    private final ImmutableListMultimap<String, FlowEdge> edgesTo;

    private FlowGraph(Builder builder) {
        this.version = builder.version;
        this.entryNodeId = builder.entryNodeId;
        this.exitNodeId = builder.exitNodeId;
        this.nodes = ImmutableList.copyOf(builder.nodes);
        this.edges = ImmutableList.copyOf(builder.edges);
        this.bindings = ImmutableList.copyOf(builder.bindings);

        // 重复 id 时保留第一个声明
        Map<String, FlowNode> index = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            if (node.id() != null) {
                index.putIfAbsent(node.id(), node);
            }
        }
        this.nodeById = ImmutableMap.copyOf(index);

        ImmutableListMultimap.Builder<String, FlowEdge> from = ImmutableListMultimap.builder();
        ImmutableListMultimap.Builder<String, FlowEdge> to = ImmutableListMultimap.builder();
        for (FlowEdge edge : edges) {
            if (edge.from() != null) {
                from.put(edge.from(), edge);
            }
            if (edge.to() != null) {
                to.put(edge.to(), edge);
            }
        }
        this.edgesFrom = from.build();
        this.edgesTo = to.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .version(version)
                .entryNodeId(entryNodeId)
                .exitNodeId(exitNodeId);
        builder.nodes.addAll(nodes);
        builder.edges.addAll(edges);
        builder.bindings.addAll(bindings);
        return builder;
    }

    // ------------------------------------------------------------------ 查询

    public FlowNode getNode(String nodeId) {
        return nodeId == null ? null : nodeById.get(nodeId);
    }

    public List<FlowEdge> getEdgesFrom(String nodeId) {
        return nodeId == null ? ImmutableList.of() : edgesFrom.get(nodeId);
    }

    public List<FlowEdge> getEdgesTo(String nodeId) {
        return nodeId == null ? ImmutableList.of() : edgesTo.get(nodeId);
    }

    /**
     * 按 matchSource 找节点：取第一个声明了该标签的绑定。
     */
    public FlowNode findNodeByMatchSource(String matchSource) {
        if (matchSource == null) {
            return null;
        }
        for (RuntimeBinding binding : bindings) {
            if (binding.matchSources().contains(matchSource)) {
                return getNode(binding.nodeId());
            }
        }
        return null;
    }

    public FlowNode findNodeByCheckpoint(String checkpoint) {
        if (checkpoint == null) {
            return null;
        }
        for (RuntimeBinding binding : bindings) {
            if (binding.checkpoints().contains(checkpoint)) {
                return getNode(binding.nodeId());
            }
        }
        return null;
    }

    public boolean isMatchSourceInTree(String matchSource) {
        if (matchSource == null) {
            return false;
        }
        for (RuntimeBinding binding : bindings) {
            if (binding.matchSources().contains(matchSource)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getValidMatchSources() {
        Set<String> sources = new LinkedHashSet<>();
        for (RuntimeBinding binding : bindings) {
            sources.addAll(binding.matchSources());
        }
        return ImmutableList.copyOf(sources);
    }

    /**
     * 所有边条件引用到的变量名，按字典序。
     */
    public List<String> getConditionVariables() {
        Set<String> variables = new TreeSet<>();
        for (FlowEdge edge : edges) {
            if (edge.condition() != null) {
                edge.condition().collectVariables(variables);
            }
        }
        return ImmutableList.copyOf(variables);
    }

    public FlowTree exportFlowTree() {
        return new FlowTree(version, nodes, edges, entryNodeId, exitNodeId, nodes.size(), edges.size());
    }

    public List<RuntimeBinding> exportRuntimeBindings() {
        return bindings;
    }

    // ------------------------------------------------------------------ 校验

    /**
     * 从入口节点做 BFS，返回未访问到的节点 id（按声明顺序）。
     */
    public List<String> findUnreachableNodes() {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        if (entryNodeId != null) {
            queue.add(entryNodeId);
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (FlowEdge edge : getEdgesFrom(current)) {
                if (edge.to() != null && !visited.contains(edge.to())) {
                    queue.add(edge.to());
                }
            }
        }
        List<String> unreachable = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (!visited.contains(node.id())) {
                unreachable.add(node.id());
            }
        }
        return unreachable;
    }

    /**
     * from 或 to 指向未声明节点的边。
     */
    public List<FlowEdge> findInvalidEdges() {
        List<FlowEdge> invalid = new ArrayList<>();
        for (FlowEdge edge : edges) {
            if (!nodeById.containsKey(nullToEmpty(edge.from())) || !nodeById.containsKey(nullToEmpty(edge.to()))) {
                invalid.add(edge);
            }
        }
        return invalid;
    }

    /**
     * when 无法解析的边。
     */
    public List<FlowEdge> findInvalidPredicates() {
        List<FlowEdge> invalid = new ArrayList<>();
        for (FlowEdge edge : edges) {
            if (edge.condition() == null || !edge.condition().isValid()) {
                invalid.add(edge);
            }
        }
        return invalid;
    }

    /**
     * 没有入边的节点；良构的图中只有入口节点。
     */
    public List<String> findEntryCandidates() {
        List<String> result = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (!edgesTo.containsKey(node.id())) {
                result.add(node.id());
            }
        }
        return result;
    }

    /**
     * 没有出边的节点；良构的图中至少有一个。
     */
    public List<String> findTerminalNodes() {
        List<String> result = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (!edgesFrom.containsKey(node.id())) {
                result.add(node.id());
            }
        }
        return result;
    }

    // ------------------------------------------------------------------ 属性

    public String getVersion() {
        return version;
    }

    public String getEntryNodeId() {
        return entryNodeId;
    }

    public String getExitNodeId() {
        return exitNodeId;
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public List<RuntimeBinding> getBindings() {
        return bindings;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public static final class Builder {

        private String version;
        private String entryNodeId;
        private String exitNodeId;
        private final List<FlowNode> nodes = new ArrayList<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private final List<RuntimeBinding> bindings = new ArrayList<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder entryNodeId(String entryNodeId) {
            this.entryNodeId = entryNodeId;
            return this;
        }

        public Builder exitNodeId(String exitNodeId) {
            this.exitNodeId = exitNodeId;
            return this;
        }

        public Builder node(FlowNode node) {
            nodes.add(node);
            return this;
        }

        /**
         * 添加边，并解析 when 文本。
         */
        public Builder edge(String id, String from, String to, String when) {
            edges.add(new FlowEdge(id, from, to, when, FlowPredicateParser.parse(when)));
            return this;
        }

        public Builder binding(String nodeId, List<String> checkpoints, List<String> matchSources,
                               List<String> codePatterns, List<String> events) {
            return binding(new RuntimeBinding(nodeId, checkpoints, matchSources, codePatterns, events, null));
        }

        public Builder binding(RuntimeBinding binding) {
            bindings.add(binding);
            return this;
        }

        public Builder removeEdge(String edgeId) {
            edges.removeIf(edge -> edge.id() != null && edge.id().equals(edgeId));
            return this;
        }

        public Builder removeNode(String nodeId) {
            nodes.removeIf(node -> node.id() != null && node.id().equals(nodeId));
            return this;
        }

        public FlowGraph build() {
            return new FlowGraph(this);
        }
    }
}
