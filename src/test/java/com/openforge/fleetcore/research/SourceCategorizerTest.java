package com.openforge.fleetcore.research;

import com.openforge.fleetcore.search.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SourceCategorizerTest {

    private final SourceCategorizer categorizer = new SourceCategorizer();

    @Nested
    @DisplayName("categorize")
    class Categorize {

        @ParameterizedTest(name = "{0} → {1}")
        @CsvSource({
                "https://www.vesselfinder.com/vessels/details/9613733,            AIS",
                "https://www.marinetraffic.com/ais/details/ships/imo:9613733,     AIS",
                "https://www.marinetraffic.com/en/ais/details/ships/shipid:5630, AIS",
                "https://www.equasis.org,                                         REGISTRY",
                "https://dnv.com,                                                 CLASS",
                "https://stanfordmarinegroup.com/vessel-chartering,               OWNER",
                "https://directory.marinelink.com/ships/gt-243,                   DIRECTORY_NEWS",
                "https://www.evergreen-shipping.com/fleet,                        OWNER",
                "https://gcaptain.com/forum/thread/123,                           FORUM",
                "https://www.wartsila.com/marine/engines,                         OEM",
                "https://www.example.com/,                                        OTHER"
        })
        void knownSites(String url, SourceCategory expected) {
            assertThat(categorizer.categorize(url)).isEqualTo(expected);
        }

        @Test
        @DisplayName("a fleet page under a news path is not an owner source")
        void newsPathBeatsOwnerPath() {
            assertThat(categorizer.categorize("https://www.someoperator.com/news/fleet-update"))
                    .isEqualTo(SourceCategory.OTHER);
        }

        @Test
        @DisplayName("unparseable URLs fall back to substring matching")
        void rawFallback() {
            assertThat(categorizer.categorize("marinetraffic ship page for ever given"))
                    .isEqualTo(SourceCategory.AIS);
            assertThat(categorizer.categorize("not a url at all")).isEqualTo(SourceCategory.OTHER);
            assertThat(categorizer.categorize(null)).isEqualTo(SourceCategory.OTHER);
        }
    }

    @Nested
    @DisplayName("coverage")
    class Coverage {

        @Test
        @DisplayName("one source per required bucket leaves nothing missing")
        void complete() {
            List<Source> sources = List.of(
                    Source.of("", "https://www.vesselfinder.com/vessels/details/9613733", ""),
                    Source.of("", "https://www.equasis.org", ""),
                    Source.of("", "https://stanfordmarinegroup.com/vessel-chartering", ""),
                    Source.of("", "https://dnv.com", ""),
                    Source.of("", "https://directory.marinelink.com/ships/gt-243", ""));

            Map<SourceCategory, Integer> coverage = categorizer.computeCoverage(sources);

            assertThat(categorizer.missingCoverage(coverage)).isEmpty();
            assertThat(coverage).containsEntry(SourceCategory.FORUM, 0);
        }

        @Test
        @DisplayName("missing buckets are reported in required order")
        void missing() {
            List<Source> sources = List.of(
                    Source.of("", "https://www.vesselfinder.com/vessels/details/9613733", ""),
                    Source.of("", "https://www.marinetraffic.com/ais/details/ships/imo:9613733", ""),
                    Source.of("", "https://stanfordmarinegroup.com/vessel-chartering", ""));

            Map<SourceCategory, Integer> coverage = categorizer.computeCoverage(sources);

            assertThat(coverage).containsEntry(SourceCategory.AIS, 2);
            assertThat(categorizer.missingCoverage(coverage)).containsExactly(
                    SourceCategory.REGISTRY, SourceCategory.CLASS, SourceCategory.DIRECTORY_NEWS);
        }

        @Test
        @DisplayName("no sources means every required bucket is missing")
        void empty() {
            assertThat(categorizer.missingCoverage(categorizer.computeCoverage(null)))
                    .containsExactlyElementsOf(SourceCategorizer.REQUIRED);
        }
    }
}
