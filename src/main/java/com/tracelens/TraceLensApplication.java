package com.tracelens;

import com.tracelens.config.AnalysisProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * TraceLens - telemetry diff and anomaly analysis engine
 *
 * @author kiransahoo
 */
@SpringBootApplication
@EnableConfigurationProperties(AnalysisProperties.class)
public class TraceLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceLensApplication.class, args);
    }
}
