package com.openforge.fleetcore.pipeline;

import com.openforge.fleetcore.citation.CitationEnforcementResult;
import com.openforge.fleetcore.citation.CitationEnforcer;
import com.openforge.fleetcore.classifier.KnowledgeContextBuilder;
import com.openforge.fleetcore.classifier.QueryClassifier;
import com.openforge.fleetcore.classifier.QueryMode;
import com.openforge.fleetcore.classifier.TechnicalDepthScorer;
import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.ConversationMessage;
import com.openforge.fleetcore.memory.InMemoryConversationMemoryStore;
import com.openforge.fleetcore.memory.MaritimeEntityExtractor;
import com.openforge.fleetcore.memory.MemoryAccumulationService;
import com.openforge.fleetcore.memory.MemoryProperties;
import com.openforge.fleetcore.resolver.EntityContextResolver;
import com.openforge.fleetcore.resolver.FollowUpDetector;
import com.openforge.fleetcore.search.Source;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class AssistantPipelineTest {

    private static final String FIRST_QUERY  = "Tell me about MV Ever Given and how fleetcore PMS would work";
    private static final String FIRST_ANSWER = "MV Ever Given is a container ship with IMO 9811000, operated by "
            + "Evergreen Marine. Fleetcore work orders would cover its engine room.";

    private static final List<Source> SOURCES = IntStream.rangeClosed(1, 5)
            .mapToObj(i -> Source.of("Source " + i, "https://s" + i + ".example.com", "content " + i))
            .toList();

    private InMemoryConversationMemoryStore store;
    private AssistantPipeline pipeline;

    @BeforeEach
    void setUp() {
        MaritimeEntityExtractor extractor = new MaritimeEntityExtractor();
        store = new InMemoryConversationMemoryStore();
        pipeline = new AssistantPipeline(
                store,
                new EntityContextResolver(new FollowUpDetector()),
                new QueryClassifier(new TechnicalDepthScorer(extractor), extractor),
                new KnowledgeContextBuilder(),
                new CitationEnforcer(),
                new MemoryAccumulationService(extractor, new MemoryProperties(10)));
    }

    // ── prepare ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("prepare")
    class Prepare {

        @Test
        @DisplayName("a first query is not enriched and creates no memory")
        void firstQuery() {
            QueryPlan plan = pipeline.prepare("s1", "Who owns MV Ever Given?", false);

            assertThat(plan.searchQuery()).isEqualTo("Who owns MV Ever Given?");
            assertThat(plan.knowledgeContext()).isEmpty();
            assertThat(plan.resolvedQuery().hasContext()).isFalse();
            assertThat(pipeline.findMemory("s1")).isEmpty();
        }

        @Test
        @DisplayName("follow-ups are resolved against the recorded turn")
        void followUp() {
            pipeline.finalizeAnswer("s1", FIRST_QUERY, FIRST_ANSWER, List.of(), false);

            QueryPlan plan = pipeline.prepare("s1", "its engines", false);

            assertThat(plan.resolvedQuery().hasContext()).isTrue();
            assertThat(plan.resolvedQuery().effectiveQuery()).contains("Ever Given");
        }

        @Test
        @DisplayName("browsing with discussed features enriches the search query")
        void enriched() {
            pipeline.finalizeAnswer("s1", FIRST_QUERY, FIRST_ANSWER, List.of(), false);

            QueryPlan plan = pipeline.prepare("s1", "Who is the registered owner of MV Ever Given?", true);

            assertThat(plan.classification().mode()).isEqualTo(QueryMode.RESEARCH);
            assertThat(plan.searchQuery())
                    .startsWith("[Context: User is evaluating fleetcore maritime maintenance system")
                    .endsWith("Who is the registered owner of MV Ever Given?");
            assertThat(plan.knowledgeContext()).contains("=== CONVERSATION CONTEXT ===", "Ever Given");
        }
    }

    // ── finalizeAnswer ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("finalizeAnswer")
    class FinalizeAnswer {

        @Test
        @DisplayName("records the enforced answer, not the raw one")
        void recordsEnforcedAnswer() {
            String answer = "Ever Given was built in 2018. It has IMO 9811000.";

            CitationEnforcementResult result = pipeline.finalizeAnswer("s1", "Tell me about MV Ever Given",
                    answer, SOURCES, false);

            assertThat(result.meetsRequirement()).isTrue();
            assertThat(result.wasEnforced()).isTrue();
            ConversationMemory memory = pipeline.findMemory("s1").orElseThrow();
            assertThat(memory.getRecentMessages()).extracting(ConversationMessage::content)
                    .containsExactly("Tell me about MV Ever Given", result.enforcedContent());
            assertThat(result.enforcedContent()).isNotEqualTo(answer).contains("](https://s1.example.com)");
        }

        @Test
        @DisplayName("an answer without sources is recorded unchanged")
        void noSources() {
            CitationEnforcementResult result = pipeline.finalizeAnswer("s1", "q", "plain answer", null, true);

            assertThat(result.enforcedContent()).isEqualTo("plain answer");
            assertThat(result.citationsRequired()).isZero();
            assertThat(store.find("s1")).isPresent();
        }
    }

    // ── Sessions ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("forgetting a session drops its memory")
    void forget() {
        pipeline.finalizeAnswer("s1", FIRST_QUERY, FIRST_ANSWER, List.of(), false);

        pipeline.forget("s1");

        assertThat(pipeline.findMemory("s1")).isEmpty();
        assertThat(pipeline.prepare("s1", "its engines", false).resolvedQuery().hasContext()).isFalse();
    }

    @Test
    @DisplayName("citation validation reports out-of-range markers")
    void validate() {
        assertThat(pipeline.validateCitations("Built in 2018 [7](https://x.example.com).", SOURCES).valid())
                .isFalse();
    }
}
