package com.easytidal.mirror;

import com.easytidal.mirror.config.MirrorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@EnableConfigurationProperties(MirrorProperties.class)
public class MirrorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MirrorApplication.class, args);
    }

    /**
     * Wall clock used for cache expiry and history timestamps.
     * Tests construct the stores with their own clock instead.
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
