package com.legalgraph.service.graph;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.dto.internal.ChainResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChainDetectorTest {

    private ChainDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ChainDetector(new GraphBuildConfig());
    }

    @Nested
    @DisplayName("expand")
    class Expand {

        @Test
        @DisplayName("should report the deepest hop of a linear chain")
        void shouldWalkLinearChain() {
            Map<String, List<String>> adjacency = Map.of(
                    "A", List.of("B"),
                    "B", List.of("C"),
                    "C", List.of("D"));

            ChainResult chain = detector.expand("A", adjacency);

            assertThat(chain.sections()).containsExactly("A", "B", "C", "D");
            assertThat(chain.depth()).isEqualTo(3);
            assertThat(detector.isComplex(chain)).isTrue();
        }

        @Test
        void shouldNotFlagShortChains() {
            ChainResult chain = detector.expand("A", Map.of("A", List.of("B")));

            assertThat(chain.sections()).containsExactly("A", "B");
            assertThat(chain.depth()).isEqualTo(1);
            assertThat(detector.isComplex(chain)).isFalse();
        }

        @Test
        @DisplayName("should visit neighbours in sorted order")
        void shouldVisitNeighboursSorted() {
            ChainResult chain = detector.expand("A", Map.of("A", List.of("C", "B")));

            assertThat(chain.sections()).containsExactly("A", "B", "C");
        }

        @Test
        void shouldFlagWideChainsBySize() {
            Map<String, List<String>> diamond = Map.of(
                    "A", List.of("B", "C"),
                    "B", List.of("D"),
                    "C", List.of("D"));

            ChainResult chain = detector.expand("A", diamond);

            assertThat(chain.sections()).containsExactly("A", "B", "C", "D");
            assertThat(chain.depth()).isEqualTo(2);
            assertThat(detector.isComplex(chain)).isTrue();
        }

        @Test
        @DisplayName("should stop a long cycle at the depth limit")
        void shouldStopAtDepthLimit() {
            Map<String, List<String>> cycle = new HashMap<>();
            for (int i = 0; i < 30; i++) {
                cycle.put(node(i), List.of(node((i + 1) % 30)));
            }

            ChainResult chain = detector.expand(node(0), cycle);

            assertThat(chain.depth()).isEqualTo(5);
            assertThat(chain.sections()).containsExactly(node(0), node(1), node(2), node(3), node(4), node(5));
        }

        @Test
        @DisplayName("should stop a wide fan-out at the node limit")
        void shouldStopAtNodeLimit() {
            List<String> children = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                children.add(node(i));
            }

            ChainResult chain = detector.expand("hub", Map.of("hub", children));

            assertThat(chain.size()).isEqualTo(25);
            assertThat(chain.sections().get(0)).isEqualTo("hub");
            assertThat(chain.sections()).doesNotHaveDuplicates();
            assertThat(chain.depth()).isEqualTo(1);
        }

        @Test
        void shouldTreatSelfLoopAsSingleNode() {
            ChainResult chain = detector.expand("A", Map.of("A", List.of("A")));

            assertThat(chain.sections()).containsExactly("A");
            assertThat(chain.depth()).isZero();
            assertThat(detector.isComplex(chain)).isFalse();
        }

        @Test
        void shouldHonourConfiguredLimits() {
            GraphBuildConfig config = new GraphBuildConfig();
            config.getChain().setMaxDepth(2);
            ChainDetector shallow = new ChainDetector(config);
            Map<String, List<String>> adjacency = Map.of(
                    "A", List.of("B"),
                    "B", List.of("C"),
                    "C", List.of("D"));

            ChainResult chain = shallow.expand("A", adjacency);

            assertThat(chain.sections()).containsExactly("A", "B", "C");
            assertThat(chain.depth()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("should return only complex chains ordered by root")
    void shouldDetectComplexChainsOnly() {
        Map<String, List<String>> adjacency = Map.of(
                "X", List.of("Y"),
                "C", List.of("D"),
                "B", List.of("D"),
                "A", List.of("B", "C"));

        List<ChainResult> chains = detector.detect(adjacency);

        assertThat(chains).extracting(ChainResult::rootId).containsExactly("A");
    }

    @Test
    void shouldReturnNothingForEmptyGraph() {
        assertThat(detector.detect(Map.of())).isEmpty();
    }

    private static String node(int i) {
        return String.format("n%02d", i);
    }
}
