package io.shopfloor.mes.scheduling.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

  /** Runs availability and work order calls so they can be bounded by the caller's timeout. */
  @Bean(name = "collaboratorExecutor", destroyMethod = "shutdownNow")
  ExecutorService collaboratorExecutor(SchedulingProperties properties) {
    var threadFactory = new CustomizableThreadFactory("scheduling-collaborator-");
    threadFactory.setDaemon(true);
    return Executors.newFixedThreadPool(properties.collaborators().poolSize(), threadFactory);
  }

  /** Runs the dispatches of one batch wave side by side. */
  @Bean(name = "dispatchExecutor", destroyMethod = "shutdownNow")
  ExecutorService dispatchExecutor(SchedulingProperties properties) {
    var threadFactory = new CustomizableThreadFactory("scheduling-dispatch-");
    threadFactory.setDaemon(true);
    return Executors.newFixedThreadPool(properties.dispatch().batchParallelism(), threadFactory);
  }
}
