package io.isolation.lab.api.scenario;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/scenarios")
public class ScenarioController {

    private final ScenarioService scenarioService;

    public ScenarioController(ScenarioService scenarioService) {
        this.scenarioService = scenarioService;
    }

    @GetMapping
    public List<ScenarioSummary> listScenarios() {
        return scenarioService.scenarios().stream()
            .map(ScenarioSummary::from)
            .toList();
    }

    @PostMapping("/{name}/runs")
    public ResponseEntity<ScenarioReport> runScenario(@PathVariable String name) {
        return scenarioService.run(name)
            .map(ScenarioReport::from)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
