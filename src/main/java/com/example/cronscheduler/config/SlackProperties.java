package com.example.cronscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#cron-alerts";
    private boolean enabled = true;
    /**
     * Base URL used to link an alert to the run history API
     */
    private String dashboardBaseUrl;
}
