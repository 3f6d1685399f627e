package com.prioritymind;

import com.prioritymind.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

// The SQLite store builds its own DataSource only when a path is configured.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class PrioritymindApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeCommand(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(PrioritymindApplication.class);
        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
