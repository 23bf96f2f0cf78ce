package ru.oparin.tutor.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.tutor.model.domain.QueryAnswer;
import ru.oparin.tutor.model.domain.RetrievedPassage;
import ru.oparin.tutor.model.dto.query.CitationDTO;
import ru.oparin.tutor.model.dto.query.QueryResponse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Преобразование результата ответа в DTO. Один источник цитируется один раз.
 */
@Component
public class QueryMapper {

    public static final int PREVIEW_LENGTH = 300;
    private static final String PREVIEW_SUFFIX = "...";

    public QueryResponse toQueryResponse(QueryAnswer answer) {
        return QueryResponse.builder()
                .answer(answer.getAnswer())
                .citations(toCitations(answer.getCitations()))
                .personalizationApplied(answer.isPersonalizationApplied())
                .queryId(answer.getQueryId())
                .retrievalTimeMs(answer.getRetrievalTimeMs())
                .answerTimeMs(answer.getAnswerTimeMs())
                .totalTimeMs(answer.getTotalTimeMs())
                .build();
    }

    /**
     * Цитаты в порядке релевантности, без повторов по (глава, раздел, ссылка).
     */
    public List<CitationDTO> toCitations(List<RetrievedPassage> passages) {
        List<CitationDTO> citations = new ArrayList<>();
        if (passages == null) {
            return citations;
        }
        Set<List<String>> seen = new HashSet<>();
        for (RetrievedPassage passage : passages) {
            List<String> source = Arrays.asList(passage.getSourceChapter(), passage.getSourceSection(), passage.getSourceUrl());
            if (!seen.add(source)) {
                continue;
            }
            citations.add(CitationDTO.builder()
                    .chapter(passage.getSourceChapter())
                    .section(passage.getSourceSection())
                    .url(passage.getSourceUrl())
                    .preview(preview(passage.getPassageText()))
                    .score(Math.round(passage.getRelevanceScore() * 1000.0) / 1000.0)
                    .build());
        }
        return citations;
    }

    private String preview(String text) {
        String value = Objects.requireNonNullElse(text, "");
        if (value.length() <= PREVIEW_LENGTH) {
            return value;
        }
        return value.substring(0, PREVIEW_LENGTH - PREVIEW_SUFFIX.length()) + PREVIEW_SUFFIX;
    }
}
