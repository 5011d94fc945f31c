package com.legalgraph.service.graph;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.dto.internal.ChainResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bounded breadth-first expansion of the forward graph.
 * <p>
 * Each expansion keeps its own visited set, so cycles and self-loops are
 * walked at most once. Expansion stops at the configured depth or node
 * limit, whichever comes first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainDetector {

    private final GraphBuildConfig config;

    /**
     * Complex chains for every source with outbound references, in root id
     * order.
     */
    public List<ChainResult> detect(Map<String, List<String>> adjacency) {
        List<ChainResult> complex = new ArrayList<>();
        for (String root : new TreeSet<>(adjacency.keySet())) {
            ChainResult chain = expand(root, adjacency);
            if (isComplex(chain)) {
                complex.add(chain);
            }
        }
        log.info("Chain detection done | roots={} | complex={}", adjacency.size(), complex.size());
        return complex;
    }

    public ChainResult expand(String root, Map<String, List<String>> adjacency) {
        GraphBuildConfig.ChainSettings limits = config.getChain();
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();

        visited.add(root);
        queue.add(root);
        depths.add(0);
        int deepest = 0;

        expansion:
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int depth = depths.poll();
            if (depth >= limits.getMaxDepth()) {
                continue;
            }
            for (String next : new TreeSet<>(adjacency.getOrDefault(current, List.of()))) {
                if (visited.size() >= limits.getMaxNodes()) {
                    break expansion;
                }
                if (visited.add(next)) {
                    queue.add(next);
                    depths.add(depth + 1);
                    deepest = Math.max(deepest, depth + 1);
                }
            }
        }

        return new ChainResult(root, List.copyOf(visited), deepest);
    }

    public boolean isComplex(ChainResult chain) {
        GraphBuildConfig.ChainSettings limits = config.getChain();
        return chain.depth() >= limits.getComplexMinDepth() || chain.size() >= limits.getComplexMinSize();
    }
}
