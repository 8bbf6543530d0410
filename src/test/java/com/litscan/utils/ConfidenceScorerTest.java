package com.litscan.utils;

import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private static ExtractedFields paper(String title, Integer year, String authors, String venue) {
        ExtractedFields fields = new ExtractedFields();
        fields.setTitle(title);
        fields.setYear(year);
        fields.setAuthors(authors);
        fields.setVenue(venue);
        return fields;
    }

    @Test
    void score_shouldReachCapForFullMatch() {
        ExtractedFields paper = paper("Deep Learning for Metadata Extraction", 2020, "Smith, John; Doe, Jane", "Journal of Documentation");
        CandidateRecord candidate = CandidateRecord.builder()
                .title("Deep Learning for Metadata Extraction")
                .year(2020)
                .authors("Smith, John")
                .venue("Journal of Documentation")
                .build();

        assertThat(ConfidenceScorer.score(paper, candidate)).isEqualTo(100.0);
    }

    @Test
    void score_shouldGiveEightyForSameTitleYearAndVenueWithoutAuthors() {
        ExtractedFields paper = paper("Deep Learning for Metadata Extraction", 2020, null, "Journal of Documentation");
        CandidateRecord candidate = CandidateRecord.builder()
                .title("Deep Learning for Metadata Extraction")
                .year(2020)
                .venue("Journal of Documentation")
                .build();

        assertThat(ConfidenceScorer.score(paper, candidate)).isEqualTo(80.0);
    }

    @Test
    void score_shouldGivePartialCreditForNearbyYearAndSurname() {
        ExtractedFields paper = paper("alpha beta gamma delta", 2020, "John Smith", null);
        CandidateRecord candidate = CandidateRecord.builder()
                .title("alpha beta epsilon zeta")
                .year(2021)
                .authors("J. Smith")
                .build();

        // 2/6 * 100 * 0.4 + 10 + 10
        assertThat(ConfidenceScorer.score(paper, candidate)).isCloseTo(33.33, within(0.01));
    }

    @Test
    void score_shouldOnlyUseTitleWhenOtherFieldsMissing() {
        ExtractedFields paper = paper("Same Title Here", null, null, null);
        CandidateRecord candidate = CandidateRecord.builder().title("same title, here!").build();

        assertThat(ConfidenceScorer.score(paper, candidate)).isEqualTo(40.0);
    }

    @Test
    void titleSimilarity_shouldBeZeroForBlankTitles() {
        assertThat(ConfidenceScorer.titleSimilarity("", "anything")).isZero();
        assertThat(ConfidenceScorer.titleSimilarity(null, null)).isZero();
    }

    @Test
    void normalizeTitle_shouldKeepCjkCharacters() {
        assertThat(ConfidenceScorer.normalizeTitle("文献管理：方法 (A)")).isEqualTo("文献管理方法 a");
    }
}
