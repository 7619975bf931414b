package com.causalchain;

import com.causalchain.config.CausalityProperties;
import com.causalchain.core.CausalityTracker;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(CausalityProperties.class)
public class CausalChainApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausalChainApplication.class, args);
    }

    @Bean(destroyMethod = "destroy")
    public CausalityTracker causalityTracker(CausalityProperties properties) {
        CausalityTracker tracker = new CausalityTracker(properties.toOptions());
        Causality.install(tracker);
        return tracker;
    }
}
