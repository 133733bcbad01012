package com.fintech.marketdata.cucumber;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.Task;
import com.fintech.marketdata.domain.TaskStatus;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.ingestion.IngestionService;
import com.fintech.marketdata.ingestion.RunReport;
import com.fintech.marketdata.ingestion.RunRequest;
import com.fintech.marketdata.loader.HistoryLoader;
import com.fintech.marketdata.registry.TaskRegistry;
import com.fintech.marketdata.store.ValidationReport;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Step definitions for the ingestion BDD scenarios, run against the simulated provider.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@TestPropertySource(properties = {
    "spring.jmx.enabled=false",
    "ingestion.storage.base-path=target/test-bdd-${random.uuid}",
    "ingestion.registry.path=target/test-bdd-registry-${random.uuid}.json"
})
public class IngestionSteps {

    @Autowired
    private IngestionService service;

    @Autowired
    private TaskRegistry registry;

    @Autowired
    private HistoryLoader loader;

    private RunReport lastReport;
    private int rememberedBarCount;

    @Given("the ingestion pipeline is running")
    public void theIngestionPipelineIsRunning() {
        assertThat(service).isNotNull();
        assertThat(service.isRunning()).isFalse();
    }

    @Given("I downloaded {string} at {string} with {int} workers")
    @When("I download {string} at {string} with {int} workers")
    public void iDownload(String category, String timeframe, int workers) throws InterruptedException {
        lastReport = service.startAndWait(
            new RunRequest(List.of(category), List.of(timeframe), workers, null, null, null));
    }

    @Given("I remember the bar count of {string} {string} at {string}")
    public void iRememberTheBarCount(String category, String symbol, String timeframe) {
        rememberedBarCount = bars(category, symbol, timeframe).size();
        assertThat(rememberedBarCount).isPositive();
    }

    @Then("the run completes {int} tasks")
    public void theRunCompletesTasks(int expected) {
        assertThat(lastReport).isNotNull();
        assertThat(lastReport.tasksCompleted()).isEqualTo(expected);
        assertThat(lastReport.tasksFailed()).isZero();
        assertThat(lastReport.halted()).isFalse();
    }

    @Then("the registry reports {int} completed tasks for {string}")
    public void theRegistryReportsCompletedTasks(int expected, String category) {
        List<Task> completed = registry.tasks().stream()
            .filter(task -> task.category().equals(category))
            .filter(task -> task.status() == TaskStatus.COMPLETED)
            .toList();
        assertThat(completed).hasSize(expected);
        assertThat(completed).allSatisfy(task -> assertThat(task.recordsWritten()).isPositive());
    }

    @Then("the stored series {string} {string} at {string} is valid")
    public void theStoredSeriesIsValid(String category, String symbol, String timeframe) {
        ValidationReport report = loader.validate(category, symbol, Timeframe.fromCode(timeframe)).orElseThrow();
        assertThat(report.valid()).isTrue();
        assertThat(report.duplicateCount()).isZero();
        assertThat(report.recordCount()).isPositive();
    }

    @Then("the stored series {string} {string} at {string} is sorted without duplicates")
    public void theStoredSeriesIsSorted(String category, String symbol, String timeframe) {
        List<Bar> bars = bars(category, symbol, timeframe);
        for (int i = 1; i < bars.size(); i++) {
            assertThat(bars.get(i).timestamp()).isGreaterThan(bars.get(i - 1).timestamp());
        }
    }

    @Then("the bar count of {string} {string} at {string} is unchanged")
    public void theBarCountIsUnchanged(String category, String symbol, String timeframe) {
        assertThat(bars(category, symbol, timeframe)).hasSize(rememberedBarCount);
    }

    @Then("loading {string} {string} at {string} finds no series")
    public void loadingFindsNoSeries(String category, String symbol, String timeframe) {
        assertThat(loader.load(category, symbol, Timeframe.fromCode(timeframe), null, null)).isEmpty();
    }

    private List<Bar> bars(String category, String symbol, String timeframe) {
        return loader.load(category, symbol, Timeframe.fromCode(timeframe), null, null).orElseThrow();
    }
}
