package com.assetdiffbot;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class AssetDiffBotApplication {

    public static void main(String[] args) {
        // With no arguments, run as a long-lived worker
        if (args.length == 0) {
            args = new String[]{"serve"};
        }

        ApplicationContext ctx = new SpringApplicationBuilder(AssetDiffBotApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        // Every command, serve included, returns once it is done; exit with its code
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
