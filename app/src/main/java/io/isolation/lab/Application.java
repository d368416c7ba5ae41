package io.isolation.lab;

import io.isolation.lab.cli.ScenarioCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {

    static final String SCENARIO_ARGUMENT = "--isolation-lab.scenario";

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        if (isHeadless(args)) {
            System.exit(runHeadless(args));
        }
        SpringApplication.run(Application.class, args);
    }

    static boolean isHeadless(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.startsWith(SCENARIO_ARGUMENT));
    }

    /**
     * Starts without a web server, runs the selected scenarios and closes the context.
     * A context that cannot start, for instance because the store is unreachable, yields
     * {@link ScenarioCommandRunner#ERROR}.
     */
    static int runHeadless(String[] args) {
        try {
            var context = new SpringApplicationBuilder(Application.class)
                .web(WebApplicationType.NONE)
                .run(args);
            return SpringApplication.exit(context);
        } catch (RuntimeException e) {
            log.error("Headless run could not start: {}", e.getMessage());
            return ScenarioCommandRunner.ERROR;
        }
    }
}
