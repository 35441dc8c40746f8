package com.mk.fx.qa.load.reporter.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "load.reporter")
public class ReporterProperties {

  @NotBlank private String testplan;

  private String profileName = "";

  private String description = "";

  private String targetRps = "0";

  private String dashboardUrl;

  private String runId;

  private String origin;

  @NotNull private Duration flushInterval = Duration.ofMillis(500);

  @NotNull private Duration drainTimeout = Duration.ofSeconds(30);

  @Valid private Database database = new Database();

  @Valid private Demo demo = new Demo();

  /** Connection settings for the time-series store. */
  @Data
  public static class Database {

    @NotBlank private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 5432;

    @NotBlank private String name = "postgres";

    private String user;

    private String password;

    /** Full JDBC URL; when set, host, port and name are ignored. */
    private String url;

    public String jdbcUrl() {
      if (url != null && !url.isBlank()) {
        return url;
      }
      return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    /** Location of the database without credentials, for logs and error messages. */
    public String describe() {
      if (url != null && !url.isBlank()) {
        return url;
      }
      return "PostgreSQL at " + host + ":" + port + "/" + name;
    }
  }

  /** Synthetic load used to exercise the reporter end to end. */
  @Data
  public static class Demo {

    private boolean enabled = false;

    @Positive private int users = 4;

    @Positive private int iterations = 25;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double failureRate = 0.1;
  }
}
