package com.issuepilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class IssuePilotApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(IssuePilotApplication.class, args);

        // The drain CLI is one-shot: exit with the drain's code once it returns.
        if (Arrays.asList(context.getEnvironment().getActiveProfiles()).contains("drain")) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
