package com.warden;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class WardenApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(WardenApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serveMode) {
            // CLI mode: one command, then exit with its code
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }
}
