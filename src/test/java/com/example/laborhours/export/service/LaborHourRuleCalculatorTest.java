package com.example.laborhours.export.service;

import com.example.laborhours.export.config.LaborHourRuleProperties;
import com.example.laborhours.export.model.AwardRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LaborHourRuleCalculatorTest {

    private final LaborHourRuleCalculator calculator = new LaborHourRuleCalculator(new LaborHourRuleProperties());

    @Test
    public void testDefaultRuleTable() {
        assertEquals(6, calculator.recommendedHours(award("A", "国家级", "负责人")));
        assertEquals(4, calculator.recommendedHours(award("B", "国家级", "成员")));
        assertEquals(4, calculator.recommendedHours(award("A", "省级", "负责人")));
        assertEquals(3, calculator.recommendedHours(award("b", "provincial", "member")));
        assertEquals(3, calculator.recommendedHours(award("A", "校级", "成员")));
    }

    @Test
    public void testUnknownValuesContributeNothing() {
        assertEquals(0, calculator.recommendedHours(award("C", "市级", "负责人")));
        assertEquals(2, calculator.recommendedHours(award("A", null, null)));
    }

    @Test
    public void testConfiguredRulesAreUsed() {
        LaborHourRuleProperties rules = new LaborHourRuleProperties();
        rules.setBaseHoursA(10);
        rules.setNationalLeaderHours(20);

        assertEquals(30, new LaborHourRuleCalculator(rules).recommendedHours(award("A", "national", "leader")));
    }

    private static AwardRecord award(String category, String level, String role) {
        return AwardRecord.builder().contestCategory(category).contestLevel(level).contestRole(role).build();
    }
}
