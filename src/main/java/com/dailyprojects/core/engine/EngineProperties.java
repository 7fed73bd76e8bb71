package com.dailyprojects.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "dailyprojects")
public class EngineProperties {

    /** Upper bound for the number of projects in one request. */
    private int maxCount = 10;

    /** Zone that decides which calendar day "today" is. */
    private ZoneId zone = ZoneId.of("UTC");

    public int getMaxCount() { return maxCount; }
    public void setMaxCount(int maxCount) { this.maxCount = maxCount; }
    public ZoneId getZone() { return zone; }
    public void setZone(ZoneId zone) { this.zone = zone; }
}
