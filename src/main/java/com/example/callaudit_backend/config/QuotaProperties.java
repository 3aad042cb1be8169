package com.example.callaudit_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.time.ZoneOffset;

@ConfigurationProperties(prefix = "quota")
public class QuotaProperties {

    private int defaultDailyLimit = 500;
    private ZoneId zone = ZoneOffset.UTC;

    public int getDefaultDailyLimit() {
        return defaultDailyLimit;
    }

    public void setDefaultDailyLimit(int defaultDailyLimit) {
        this.defaultDailyLimit = defaultDailyLimit;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }
}
