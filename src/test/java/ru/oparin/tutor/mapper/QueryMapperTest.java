package ru.oparin.tutor.mapper;

import org.junit.jupiter.api.Test;
import ru.oparin.tutor.model.domain.QueryAnswer;
import ru.oparin.tutor.model.domain.RetrievedPassage;
import ru.oparin.tutor.model.dto.query.CitationDTO;
import ru.oparin.tutor.model.dto.query.QueryResponse;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryMapperTest {

    private final QueryMapper mapper = new QueryMapper();

    // ── Helper ────────────────────────────────────────────────────────────────

    private RetrievedPassage passage(String text, String chapter, String section, String url, double score) {
        return RetrievedPassage.builder()
                .passageText(text)
                .sourceChapter(chapter)
                .sourceSection(section)
                .sourceUrl(url)
                .relevanceScore(score)
                .build();
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void repeatedSourceShouldBeCitedOnceKeepingFirstOccurrence() {
        List<CitationDTO> citations = mapper.toCitations(List.of(
                passage("best chunk", "Ch 1", "Intro", "u1", 0.9),
                passage("other chunk", "Ch 1", "Intro", "u1", 0.8),
                passage("no url", "Ch 1", "Intro", null, 0.7)));

        assertEquals(2, citations.size());
        assertEquals("best chunk", citations.get(0).getPreview());
        assertNull(citations.get(1).getUrl());
    }

    @Test
    void longPassageShouldBeTruncatedToPreviewLength() {
        List<CitationDTO> citations = mapper.toCitations(List.of(passage("y".repeat(1000), "Ch", "S", "u", 0.5)));

        String preview = citations.get(0).getPreview();
        assertEquals(QueryMapper.PREVIEW_LENGTH, preview.length());
        assertTrue(preview.endsWith("..."));
    }

    @Test
    void answerShouldMapWithRoundedScores() {
        QueryAnswer answer = QueryAnswer.builder()
                .answer("text")
                .citations(List.of(passage("p", "Ch", "S", "u", 0.123456)))
                .personalizationApplied(true)
                .queryId(11L)
                .retrievalTimeMs(40L)
                .answerTimeMs(900L)
                .totalTimeMs(955L)
                .build();

        QueryResponse response = mapper.toQueryResponse(answer);

        assertEquals("text", response.getAnswer());
        assertTrue(response.isPersonalizationApplied());
        assertEquals(11L, response.getQueryId());
        assertEquals(0.123, response.getCitations().get(0).getScore(), 1e-9);
        assertEquals(40L, response.getRetrievalTimeMs());
        assertEquals(900L, response.getAnswerTimeMs());
        assertEquals(955L, response.getTotalTimeMs());
    }

    @Test
    void noPassagesShouldGiveNoCitations() {
        assertTrue(mapper.toCitations(null).isEmpty());
        assertTrue(mapper.toCitations(List.of()).isEmpty());
    }
}
