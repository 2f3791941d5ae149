package uz.greenwhite.federation.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ThreadPoolConfig {

    private final WorkflowProperties workflowProperties;

    /**
     * Dedicated pool for workflow step dispatch.
     *
     * The thread running a workflow only schedules steps and waits on them;
     * provider round-trips happen here.
     */
    @Bean("workflowStepExecutor")
    public ThreadPoolTaskExecutor workflowStepExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(workflowProperties.getStepPoolCoreSize());
        executor.setMaxPoolSize(workflowProperties.getStepPoolMaxSize());
        executor.setQueueCapacity(workflowProperties.getStepQueueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("wf-step-");
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging());
        executor.setAllowCoreThreadTimeOut(true);
        executor.initialize();

        log.info("Workflow step pool created: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                workflowProperties.getStepQueueCapacity());

        return executor;
    }

    /**
     * When the queue is full the submitting thread runs the step itself,
     * which throttles the workflow that is producing steps.
     */
    static class CallerRunsWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Workflow step pool exhausted! queue={}, active={}, pool={}. " +
                            "Step will run on caller thread",
                    executor.getQueue().size(),
                    executor.getActiveCount(),
                    executor.getPoolSize());

            if (!executor.isShutdown()) {
                r.run();
            }
        }
    }
}
