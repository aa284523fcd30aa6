package com.loom.orchestrator;

import com.loom.orchestrator.service.RunCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class LoomOrchestratorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(LoomOrchestratorApplication.class, args);
        // One-shot CLI run: shut down and report the run's outcome as the exit code.
        if (context.getBeanProvider(RunCommandLineRunner.class).getIfAvailable() != null) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
