package com.aiinpocket.choretrust.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "chore-trust")
public record ChoreTrustProperties(
        String zone,
        JobParams jobs
) {
    public ChoreTrustProperties {
        if (zone == null || zone.isBlank()) {
            zone = "Asia/Taipei";
        }
        if (jobs == null) {
            jobs = new JobParams(null, null);
        }
    }

    public record JobParams(
            String decayCron,
            String expiryCron
    ) {
        public JobParams {
            if (decayCron == null || decayCron.isBlank()) {
                decayCron = "0 15 3 * * ?";
            }
            if (expiryCron == null || expiryCron.isBlank()) {
                expiryCron = "0 5 * * * ?";
            }
        }
    }

    /** 「今天」的計算時區（每日摘要用） */
    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
