package com.dailyprojects.core.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dailyprojects.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private int maxRequests = 60;
    private Duration window = Duration.ofSeconds(60);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getMaxRequests() { return maxRequests; }
    public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }
    public Duration getWindow() { return window; }
    public void setWindow(Duration window) { this.window = window; }
}
