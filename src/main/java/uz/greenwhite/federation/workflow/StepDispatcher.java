package uz.greenwhite.federation.workflow;

import java.util.concurrent.CompletableFuture;

/**
 * Contract with whatever actually runs a step. The returned future completes
 * with the step's outcome or exceptionally with the failure of that one attempt;
 * retries are decided by the caller.
 */
public interface StepDispatcher {

    CompletableFuture<StepOutcome> submit(StepInvocation invocation);
}
