package com.mk.fx.qa.load.reporter.cfg;

import com.mk.fx.qa.load.reporter.LoadReporter;
import com.mk.fx.qa.load.reporter.ReporterSettings;
import com.mk.fx.qa.load.reporter.context.ThreadLocalExecutionContext;
import com.mk.fx.qa.load.reporter.events.LoadEventBus;
import com.mk.fx.qa.load.reporter.shutdown.ShutdownHookRegistry;
import com.mk.fx.qa.load.reporter.storage.JdbcStorageSink;
import com.mk.fx.qa.load.reporter.storage.StorageSink;
import java.time.Clock;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/** Wires the reporter and its collaborators from {@link ReporterProperties}. */
@Slf4j
@Configuration
@EnableConfigurationProperties(ReporterProperties.class)
public class ReporterCfg {

  @Bean
  public Clock reporterClock() {
    return Clock.systemUTC();
  }

  @Bean
  public LoadEventBus loadEventBus() {
    return new LoadEventBus();
  }

  @Bean
  public ThreadLocalExecutionContext executionContext() {
    return new ThreadLocalExecutionContext();
  }

  /** Closed with the application context, which runs the reporter's exit sequence. */
  @Bean
  public ShutdownHookRegistry shutdownHookRegistry() {
    return new ShutdownHookRegistry();
  }

  /** One shared connection, as the sink serializes all access to it. */
  @Bean
  public DataSource reporterDataSource(ReporterProperties properties) {
    var database = properties.getDatabase();
    var dataSource = new SingleConnectionDataSource();
    dataSource.setUrl(database.jdbcUrl());
    dataSource.setUsername(database.getUser());
    dataSource.setPassword(database.getPassword());
    dataSource.setAutoCommit(true);
    dataSource.setSuppressClose(true);
    return dataSource;
  }

  @Bean
  public StorageSink storageSink(
      DataSource reporterDataSource, ReporterProperties properties, Clock reporterClock) {
    return JdbcStorageSink.connect(
        reporterDataSource, properties.getDatabase().describe(), reporterClock);
  }

  @Bean
  public LoadReporter loadReporter(
      ReporterProperties properties,
      ApplicationArguments arguments,
      StorageSink storageSink,
      LoadEventBus loadEventBus,
      ThreadLocalExecutionContext executionContext,
      ShutdownHookRegistry shutdownHookRegistry,
      Clock reporterClock) {
    var reporter =
        new LoadReporter(
            toSettings(properties, List.of(arguments.getSourceArgs())),
            storageSink,
            loadEventBus,
            executionContext,
            shutdownHookRegistry,
            reporterClock);
    reporter.start();
    return reporter;
  }

  static ReporterSettings toSettings(ReporterProperties properties, List<String> args) {
    return ReporterSettings.builder()
        .testplan(properties.getTestplan())
        .profileName(properties.getProfileName())
        .description(properties.getDescription())
        .targetRps(properties.getTargetRps())
        .dashboardUrl(properties.getDashboardUrl())
        .runId(properties.getRunId())
        .origin(properties.getOrigin())
        .args(args)
        .flushInterval(properties.getFlushInterval())
        .drainTimeout(properties.getDrainTimeout())
        .build();
  }
}
