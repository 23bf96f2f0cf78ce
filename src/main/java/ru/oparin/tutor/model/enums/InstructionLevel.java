package ru.oparin.tutor.model.enums;

/**
 * Шаблон инструкции для модели генерации, выбираемый по профилю пользователя.
 */
public enum InstructionLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    /**
     * ADVANCED в любом измерении дает ADVANCED, BEGINNER/NONE дает BEGINNER, остальное INTERMEDIATE.
     * Незаполненные поля считаются минимальным уровнем.
     */
    public static InstructionLevel of(SoftwareExperience software, HardwareExperience hardware) {
        SoftwareExperience sw = software != null ? software : SoftwareExperience.BEGINNER;
        HardwareExperience hw = hardware != null ? hardware : HardwareExperience.NONE;

        if (sw == SoftwareExperience.ADVANCED || hw == HardwareExperience.ADVANCED) {
            return ADVANCED;
        }
        if (sw == SoftwareExperience.BEGINNER && hw == HardwareExperience.NONE) {
            return BEGINNER;
        }
        return INTERMEDIATE;
    }
}
