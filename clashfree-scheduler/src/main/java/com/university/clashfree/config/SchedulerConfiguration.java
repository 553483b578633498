package com.university.clashfree.config;

import com.university.clashfree.exam.ExamScheduler;
import com.university.clashfree.solver.TimetableSolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfiguration {

    @Bean
    public SolverConfig solverConfig(SchedulerProperties properties) {
        return properties.toSolverConfig();
    }

    @Bean
    public TimetableSolver timetableSolver() {
        return new TimetableSolver();
    }

    @Bean
    public ExamScheduler examScheduler() {
        return new ExamScheduler();
    }

    /** Runs independent planning cycles side by side. */
    @Bean
    public ThreadPoolTaskExecutor planningExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorThreads());
        executor.setMaxPoolSize(properties.getExecutorThreads());
        executor.setThreadNamePrefix("planning-");
        executor.initialize();
        return executor;
    }
}
