package com.example.laborhours.export.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Rule table for the "recommended hours" of a contest award: a base amount by
 * contest category plus a bonus by contest level and the student's role.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "labor-hours.rules")
public class LaborHourRuleProperties {
    private int baseHoursA = 2;
    private int baseHoursB = 2;
    private int nationalLeaderHours = 4;
    private int nationalMemberHours = 2;
    private int provincialLeaderHours = 2;
    private int provincialMemberHours = 1;
    private int schoolLeaderHours = 1;
    private int schoolMemberHours = 1;
}
