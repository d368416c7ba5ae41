package io.isolation.lab.cli;

import io.isolation.lab.api.scenario.ScenarioService;
import io.isolation.lab.configuration.HarnessProperties;
import io.isolation.lab.harness.Item;
import io.isolation.lab.harness.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@code --isolation-lab.scenario=<name|all>} headless and prints each log and verdict.
 * Exit code 0 when every verdict passes, 1 when any fails, 2 when a run cannot complete.
 */
@Component
@ConditionalOnProperty(prefix = "isolation-lab", name = "scenario")
public class ScenarioCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String ALL = "all";
    public static final int PASSED = 0;
    public static final int FAILED = 1;
    public static final int ERROR = 2;

    private static final Logger log = LoggerFactory.getLogger(ScenarioCommandRunner.class);

    private final ScenarioService scenarioService;
    private final String selector;
    private final PrintStream out;
    private int exitCode = ERROR;

    @Autowired
    public ScenarioCommandRunner(ScenarioService scenarioService, HarnessProperties properties) {
        this(scenarioService, properties.scenario(), System.out);
    }

    ScenarioCommandRunner(ScenarioService scenarioService, String selector, PrintStream out) {
        this.scenarioService = Objects.requireNonNull(scenarioService);
        this.selector = Objects.requireNonNull(selector, "selector cannot be null").trim();
        this.out = Objects.requireNonNull(out);
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            var names = ALL.equalsIgnoreCase(selector) ? scenarioService.names() : List.of(selector);
            var allPassed = true;
            for (var name : names) {
                var verdict = scenarioService.run(name)
                    .orElseThrow(() -> new IllegalArgumentException(
                        "unknown scenario '" + name + "', expected one of " + scenarioService.names() + " or " + ALL));
                print(verdict);
                allPassed &= verdict.pass();
            }
            exitCode = allPassed ? PASSED : FAILED;
        } catch (RuntimeException e) {
            log.error("Scenario run '{}' could not complete", selector, e);
            out.println("ERROR: " + e.getMessage());
            exitCode = ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void print(Verdict verdict) {
        out.println("=== " + verdict.scenario() + " ===");
        out.println(verdict.render());
        for (Item row : verdict.finalRows()) {
            out.println("Final price in DB: item " + row.id() + " '" + row.name() + "' = " + row.price().toPlainString()
                + (row.deleted() ? " (deleted)" : ""));
        }
        out.println();
    }
}
