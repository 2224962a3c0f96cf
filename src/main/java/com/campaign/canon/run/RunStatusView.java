package com.campaign.canon.run;

import java.util.List;

/**
 * Point-in-time status of a run, readable mid-flight.
 *
 * @param runId         the run
 * @param status        current status
 * @param steps         step snapshots in execution order
 * @param failureReason last failure reason, null when none
 */
public record RunStatusView(String runId, RunStatus status, List<RunStep.StepView> steps, String failureReason) {

    public RunStatusView {
        steps = List.copyOf(steps);
    }

    static RunStatusView of(Run run) {
        return new RunStatusView(run.getId(), run.getStatus(),
                run.getSteps().stream().map(RunStep::view).toList(), run.getFailureReason());
    }
}
