package com.standcapacity.planner.config;

import com.standcapacity.engine.run.PlanningEngine;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlannerConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PlanningEngine planningEngine(Clock clock) {
    return new PlanningEngine(clock);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService planningExecutor(PlannerProperties properties) {
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory threadFactory = runnable -> {
      Thread thread = new Thread(runnable, "planning-run-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(Math.max(1, properties.getExecutor().getThreads()), threadFactory);
  }
}
