package com.truthlens.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock and monitoring time zone. Daily limits and dedupe keys use the local
 * date in this zone.
 */
@Configuration
@Slf4j
public class TimeConfig {

    @Value("${app.monitoring.time-zone:UTC}")
    private String timeZone;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId monitoringZoneId() {
        ZoneId zoneId = ZoneId.of(timeZone);
        log.info("Monitoring time zone: {}", zoneId);
        return zoneId;
    }
}
