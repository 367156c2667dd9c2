package com.webtelemetry.steps;

import com.webtelemetry.context.ScenarioContext;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.model.EventType;
import io.cucumber.java.en.Then;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertions shared across features: diagnostics and the session timeline.
 */
public class CommonSteps {

    private final ScenarioContext ctx;

    public CommonSteps(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    @Then("a {string} diagnostic is emitted")
    public void aDiagnosticIsEmitted(String code) {
        assertThat(ctx.getDiagnostics().count(DiagnosticCode.valueOf(code)))
            .as("diagnostics with code %s", code)
            .isGreaterThanOrEqualTo(1);
    }

    @Then("no {string} diagnostic is emitted")
    public void noDiagnosticIsEmitted(String code) {
        assertThat(ctx.getDiagnostics().count(DiagnosticCode.valueOf(code))).isZero();
    }

    @Then("the session timeline contains {int} {string} event(s)")
    public void theSessionTimelineContainsEvents(int count, String type) {
        assertThat(ctx.getSession().getEventLog().ofType(EventType.valueOf(type))).hasSize(count);
    }
}
