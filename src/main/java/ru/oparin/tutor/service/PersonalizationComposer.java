package ru.oparin.tutor.service;

import org.springframework.stereotype.Component;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.enums.InstructionLevel;

import java.util.List;

/**
 * Построение системной инструкции для модели генерации по профилю пользователя.
 * Чистая функция: одинаковый профиль всегда дает одинаковый текст, ошибок нет.
 */
@Component
public class PersonalizationComposer {

    public static final String NOT_FOUND_ANSWER = "I could not find this information in the textbook.";

    static final String GROUNDING_PREAMBLE =
            "You are an AI assistant for a university-level textbook on Physical AI and Humanoid Robotics. "
                    + "You must answer questions using ONLY the provided textbook context. "
                    + "Do not use external knowledge. "
                    + "Do not make assumptions. "
                    + "If the answer is not present in the context, you must respond EXACTLY with: "
                    + "'" + NOT_FOUND_ANSWER + "'";

    static final String BEGINNER_TEMPLATE =
            "Provide clear, beginner-friendly explanations. "
                    + "Break down complex concepts into simple, digestible parts. "
                    + "Use analogies and examples that are easy to understand. "
                    + "Explain technical terms when first introduced. "
                    + "Focus on the fundamental concepts and how they work together. "
                    + "Assume the user is learning these concepts for the first time.";

    static final String INTERMEDIATE_TEMPLATE =
            "Provide explanations that are clear but assume some foundational knowledge. "
                    + "Include technical details but explain them in context. "
                    + "Balance between depth and accessibility. "
                    + "Use appropriate technical terminology while remaining understandable. "
                    + "Assume the user has some experience with robotics or AI concepts.";

    static final String ADVANCED_TEMPLATE =
            "Provide detailed, technical explanations. "
                    + "Include advanced concepts, implementation details, and nuanced discussions. "
                    + "Use technical terminology appropriately. "
                    + "Assume the user has significant experience with robotics, AI, or related fields. "
                    + "Include mathematical concepts, algorithmic details, and implementation considerations where relevant.";

    static final String CLOSING_RULES =
            "Your tone must be factual, concise, and appropriate for the user's experience level. "
                    + "Do not mention that you are an AI model, the retrieval process, or any internal systems. "
                    + "Answer ONLY using the provided documents. "
                    + "Do not add information not present in the documents. "
                    + "If multiple documents are relevant, synthesize them into one coherent answer. "
                    + "If the documents do not contain the answer, respond with: '" + NOT_FOUND_ANSWER + "' "
                    + "Use an academic, textbook-style tone appropriate for the user's experience level.";

    static final String DEFAULT_INSTRUCTION = GROUNDING_PREAMBLE + "\n\n"
            + "Your tone must be factual, concise, and academic. "
            + "Do not mention that you are an AI model, the retrieval process, or any internal systems. "
            + "Answer ONLY using the provided documents. "
            + "Do not add information not present in the documents. "
            + "If multiple documents are relevant, synthesize them into one coherent answer. "
            + "If the documents do not contain the answer, respond with: '" + NOT_FOUND_ANSWER + "' "
            + "Use an academic, textbook-style tone.";

    /**
     * Инструкция для профиля. Незаполненные поля считаются минимальным уровнем,
     * пустой список интересов просто не добавляет абзац про интересы.
     */
    public String compose(ProfileSnapshot profile) {
        InstructionLevel level = profile == null
                ? InstructionLevel.BEGINNER
                : InstructionLevel.of(profile.getSoftwareExperience(), profile.getHardwareExperience());

        StringBuilder instruction = new StringBuilder(GROUNDING_PREAMBLE)
                .append("\n\n")
                .append(templateFor(level))
                .append("\n\n");

        List<String> interests = profile == null ? null : profile.getInterests();
        if (interests != null && !interests.isEmpty()) {
            instruction.append("The user has expressed interest in: ")
                    .append(String.join(", ", interests))
                    .append(". When relevant to the question, connect the answer to these interests.")
                    .append("\n\n");
        }

        return instruction.append(CLOSING_RULES).toString();
    }

    /**
     * Инструкция для анонимных пользователей и для случаев, когда профиль получить не удалось.
     */
    public String defaultInstruction() {
        return DEFAULT_INSTRUCTION;
    }

    private String templateFor(InstructionLevel level) {
        return switch (level) {
            case BEGINNER -> BEGINNER_TEMPLATE;
            case INTERMEDIATE -> INTERMEDIATE_TEMPLATE;
            case ADVANCED -> ADVANCED_TEMPLATE;
        };
    }
}
