package com.example.laborhours.export.service;

import com.example.laborhours.export.config.LaborHourRuleProperties;
import com.example.laborhours.export.model.AwardRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Computes the recommended labor hours of an award record from the configured
 * rule table. Unrecognized categories, levels or roles contribute nothing.
 */
@Component
@RequiredArgsConstructor
public class LaborHourRuleCalculator {
    private final LaborHourRuleProperties rules;

    public int recommendedHours(AwardRecord record) {
        return baseHours(record.getContestCategory()) + bonusHours(record.getContestLevel(), record.getContestRole());
    }

    int baseHours(String category) {
        String normalized = normalize(category);
        if ("A".equals(normalized)) {
            return rules.getBaseHoursA();
        }
        if ("B".equals(normalized)) {
            return rules.getBaseHoursB();
        }
        return 0;
    }

    int bonusHours(String level, String role) {
        Level contestLevel = Level.parse(level);
        Role contestRole = Role.parse(role);
        if (contestLevel == null || contestRole == null) {
            return 0;
        }
        switch (contestLevel) {
            case NATIONAL:
                return contestRole == Role.LEADER ? rules.getNationalLeaderHours() : rules.getNationalMemberHours();
            case PROVINCIAL:
                return contestRole == Role.LEADER ? rules.getProvincialLeaderHours() : rules.getProvincialMemberHours();
            default:
                return contestRole == Role.LEADER ? rules.getSchoolLeaderHours() : rules.getSchoolMemberHours();
        }
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    private enum Level {
        NATIONAL, PROVINCIAL, SCHOOL;

        static Level parse(String value) {
            String normalized = normalize(value);
            switch (normalized) {
                case "国家级":
                case "NATIONAL":
                    return NATIONAL;
                case "省级":
                case "PROVINCIAL":
                    return PROVINCIAL;
                case "校级":
                case "SCHOOL":
                    return SCHOOL;
                default:
                    return null;
            }
        }
    }

    private enum Role {
        LEADER, MEMBER;

        static Role parse(String value) {
            String normalized = normalize(value);
            switch (normalized) {
                case "负责人":
                case "LEADER":
                    return LEADER;
                case "成员":
                case "MEMBER":
                    return MEMBER;
                default:
                    return null;
            }
        }
    }
}
