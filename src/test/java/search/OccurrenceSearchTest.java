package search;

import datagenerators.SequenceGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tree.suffix.SuffixTree;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static tree.suffix.TestSequences.chars;

class OccurrenceSearchTest {

    @Test
    @DisplayName("should find every occurrence in ascending order")
    void shouldFindOccurrences() {
        SuffixTree<Character> tree = SuffixTree.of("MISSISSIPPI$");

        assertThat(OccurrenceSearch.findOccurrences(tree, "ISS")).containsExactly(1, 4);
        assertThat(OccurrenceSearch.findOccurrences(tree, "I")).containsExactly(1, 4, 7, 10);
        assertThat(OccurrenceSearch.findOccurrences(tree, "SSIP")).containsExactly(5);
        assertThat(OccurrenceSearch.findOccurrences(tree, "MISSISSIPPI$")).containsExactly(0);
        assertThat(OccurrenceSearch.findOccurrences(tree, new StringBuilder("SSI"))).containsExactly(2, 5);
    }

    @Test
    @DisplayName("should return nothing for absent or empty patterns")
    void shouldReturnNothingForAbsentPatterns() {
        SuffixTree<Character> tree = SuffixTree.of("MISSISSIPPI$");

        assertThat(OccurrenceSearch.findOccurrences(tree, "")).isEmpty();
        assertThat(OccurrenceSearch.findOccurrences(tree, "ISSP")).isEmpty();
        assertThat(OccurrenceSearch.findOccurrences(tree, "X")).isEmpty();
        assertThat(OccurrenceSearch.findOccurrences(tree, "MISSISSIPPI$$")).isEmpty();
        assertThat(OccurrenceSearch.contains(tree, chars("PPI"))).isTrue();
        assertThat(OccurrenceSearch.contains(tree, chars("PPP"))).isFalse();
        assertThat(OccurrenceSearch.count(tree, chars("S"))).isEqualTo(4);
    }

    @Test
    @DisplayName("should count suffixes that end inside the tree when there is no terminator")
    void shouldFindOccurrencesWithoutTerminator() {
        assertThat(OccurrenceSearch.findOccurrences(SuffixTree.of("ABAB"), "AB")).containsExactly(0, 2);
        assertThat(OccurrenceSearch.findOccurrences(SuffixTree.of("AAAA"), "AA")).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("should agree with a brute-force scan on generated sequences")
    void shouldAgreeWithBruteForce() {
        for (int seed = 0; seed < 40; seed++) {
            List<Integer> sequence = SequenceGenerator.generateUniform(80, 3, seed);
            SuffixTree<Integer> tree = SuffixTree.of(sequence);
            List<Integer> probes = SequenceGenerator.generateUniform(40, 3, 10_000L + seed);

            for (int len = 1; len <= 6; len++) {
                List<Integer> pattern = probes.subList(0, len);
                assertThat(OccurrenceSearch.findOccurrences(tree, pattern))
                        .as("pattern %s for seed %d", pattern, seed)
                        .isEqualTo(bruteForce(sequence, pattern));
            }
            List<Integer> substring = sequence.subList(seed, seed + 10);
            assertThat(OccurrenceSearch.findOccurrences(tree, substring)).contains(seed);
        }
    }

    private static List<Integer> bruteForce(List<Integer> text, List<Integer> pattern) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i + pattern.size() <= text.size(); i++) {
            if (text.subList(i, i + pattern.size()).equals(pattern)) {
                out.add(i);
            }
        }
        return out;
    }
}
