package com.gt.curator.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    // Zone used to turn instants into the learner's calendar days
    @Bean
    public ZoneId curatorZoneId(@Value("${curator.zone:UTC}") String zone) {
        ZoneId zoneId = ZoneId.of(zone);
        log.info("Using zone {} for calendar-day calculations", zoneId);

        return zoneId;
    }
}
