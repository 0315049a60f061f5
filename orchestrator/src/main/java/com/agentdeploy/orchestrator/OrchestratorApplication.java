package com.agentdeploy.orchestrator;

import com.agentdeploy.orchestrator.pipeline.Poller;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Deployment orchestrator: takes deployment requests, runs them through the
 * build / deploy / verify pipeline and streams their progress.
 *
 * To run (needs Postgres and a runtime API):
 *   DEPLOYER_RUNTIME_BASE_URL=http://localhost:9090 mvn spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Poller poller(Clock clock) {
        return Poller.system(clock);
    }
}
