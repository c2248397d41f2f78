package org.bigcsters.matching.strategy;

import org.bigcsters.matching.core.MatchingException;
import org.bigcsters.matching.profile.MenteeProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HybridConfigTest {

    @Test
    @DisplayName("Defaults: 5% tolerance and 'returning' worth 1.0")
    void testDefaults() {
        HybridConfig config = HybridConfig.defaults();

        assertEquals(0.05, config.getScoreTolerance());
        assertEquals(Map.of("returning", 1.0), config.getPriorityTagWeights());
        assertEquals(HybridConfig.PriorityTieBreak.PRIORITY_WEIGHT, config.getPriorityTieBreak());
        assertEquals(12, config.effectiveMaxRepairMoves(4, 3));
    }

    @Test
    @DisplayName("Priority sums tag weights case-insensitively")
    void testPriorityOf() {
        HybridConfig config = HybridConfig.builder()
                .priorityTagWeights(Map.of("Returning", 1.0, "first-gen", 2.5))
                .build();
        MenteeProfile mentee = MenteeProfile.builder()
                .email("a@uwaterloo.ca")
                .name("A")
                .priorityTag("RETURNING")
                .priorityTag("first-gen")
                .priorityTag("other")
                .build();

        assertEquals(3.5, config.priorityOf(mentee), 1e-9);
    }

    @Test
    @DisplayName("Validation rejects out-of-range tolerance and negative move bounds")
    void testValidation() {
        MatchingException tolerance = assertThrows(MatchingException.class,
                () -> HybridConfig.builder().scoreTolerance(1.5).build().validate());
        assertEquals(MatchingException.REASON_INVALID_CONFIGURATION, tolerance.getReasonCode());

        assertThrows(MatchingException.class,
                () -> HybridConfig.builder().maxRepairMoves(-1).build().validate());
        assertThrows(MatchingException.class,
                () -> HybridConfig.builder().scoreTolerance(Double.NaN).build().validate());
        assertThrows(MatchingException.class,
                () -> HybridConfig.builder().priorityTieBreak(null).build().validate());
    }
}
