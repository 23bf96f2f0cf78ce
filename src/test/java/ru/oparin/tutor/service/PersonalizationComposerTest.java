package ru.oparin.tutor.service;

import org.junit.jupiter.api.Test;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.InstructionLevel;
import ru.oparin.tutor.model.enums.SoftwareExperience;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PersonalizationComposerTest {

    private final PersonalizationComposer composer = new PersonalizationComposer();

    // ── Helper ────────────────────────────────────────────────────────────────

    private ProfileSnapshot profile(SoftwareExperience software, HardwareExperience hardware, List<String> interests) {
        return ProfileSnapshot.builder()
                .softwareExperience(software)
                .hardwareExperience(hardware)
                .interests(interests)
                .build();
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void beginnerProfileShouldGetBeginnerTemplate() {
        String instruction = composer.compose(profile(SoftwareExperience.BEGINNER, HardwareExperience.NONE, List.of()));

        assertTrue(instruction.startsWith(PersonalizationComposer.GROUNDING_PREAMBLE));
        assertTrue(instruction.contains(PersonalizationComposer.BEGINNER_TEMPLATE));
        assertFalse(instruction.contains(PersonalizationComposer.ADVANCED_TEMPLATE));
        assertTrue(instruction.endsWith(PersonalizationComposer.CLOSING_RULES));
    }

    @Test
    void advancedInAnyDimensionShouldGetAdvancedTemplate() {
        String bySoftware = composer.compose(profile(SoftwareExperience.ADVANCED, HardwareExperience.NONE, List.of()));
        String byHardware = composer.compose(profile(SoftwareExperience.BEGINNER, HardwareExperience.ADVANCED, List.of()));

        assertTrue(bySoftware.contains(PersonalizationComposer.ADVANCED_TEMPLATE));
        assertEquals(bySoftware, byHardware);
    }

    @Test
    void mixedLevelsShouldGetIntermediateTemplate() {
        assertEquals(InstructionLevel.INTERMEDIATE, InstructionLevel.of(SoftwareExperience.INTERMEDIATE, HardwareExperience.NONE));
        assertEquals(InstructionLevel.INTERMEDIATE, InstructionLevel.of(SoftwareExperience.BEGINNER, HardwareExperience.BASIC));

        String instruction = composer.compose(profile(SoftwareExperience.BEGINNER, HardwareExperience.BASIC, List.of()));
        assertTrue(instruction.contains(PersonalizationComposer.INTERMEDIATE_TEMPLATE));
    }

    @Test
    void interestsShouldBeListedInOrder() {
        String instruction = composer.compose(profile(SoftwareExperience.INTERMEDIATE, HardwareExperience.BASIC,
                List.of("ROS 2", "computer vision")));

        assertTrue(instruction.contains("The user has expressed interest in: ROS 2, computer vision."));
    }

    @Test
    void missingFieldsShouldFallBackToBeginner() {
        String fromNullProfile = composer.compose(null);
        String fromEmptyProfile = composer.compose(profile(null, null, null));

        assertTrue(fromNullProfile.contains(PersonalizationComposer.BEGINNER_TEMPLATE));
        assertEquals(fromNullProfile, fromEmptyProfile);
        assertFalse(fromEmptyProfile.contains("expressed interest"));
    }

    @Test
    void sameProfileShouldAlwaysGiveSameInstruction() {
        ProfileSnapshot snapshot = profile(SoftwareExperience.ADVANCED, HardwareExperience.BASIC, List.of("SLAM"));

        assertEquals(composer.compose(snapshot), composer.compose(snapshot));
    }

    @Test
    void defaultInstructionShouldKeepGroundingRules() {
        String instruction = composer.defaultInstruction();

        assertTrue(instruction.startsWith(PersonalizationComposer.GROUNDING_PREAMBLE));
        assertTrue(instruction.contains(PersonalizationComposer.NOT_FOUND_ANSWER));
        assertFalse(instruction.contains(PersonalizationComposer.BEGINNER_TEMPLATE));
    }
}
