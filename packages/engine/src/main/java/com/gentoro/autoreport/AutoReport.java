package com.gentoro.autoreport;

import com.gentoro.autoreport.config.ConfigurationProvider;
import com.gentoro.autoreport.config.EngineSettings;
import com.gentoro.autoreport.context.BusinessContext;
import com.gentoro.autoreport.exception.StateException;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.orchestrator.PlaceholderOrchestrator;
import com.gentoro.autoreport.orchestrator.ProcessingResult;
import com.gentoro.autoreport.query.DataSourceDescriptor;
import com.gentoro.autoreport.query.JsonSchemaProvider;
import com.gentoro.autoreport.query.SchemaProvider;
import com.gentoro.autoreport.query.jdbc.ConnectionFactory;
import com.gentoro.autoreport.query.jdbc.JdbcQueryExecutor;
import com.gentoro.autoreport.query.jdbc.JdbcSchemaProvider;
import com.gentoro.autoreport.template.MarkdownTemplateContentSource;
import com.gentoro.autoreport.template.TemplateDocument;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Wires configuration, logging and the JDBC collaborators into a {@link PlaceholderOrchestrator}
 * for one command line run.
 */
public class AutoReport implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(AutoReport.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private EngineSettings settings;
  private PlaceholderOrchestrator orchestrator;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public AutoReport(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // apply logging levels before anything else logs
    LoggingService.applyConfiguration(configuration());
    this.settings = withOverrides(EngineSettings.from(configuration()));

    String url = startupParameters.requireParameter("jdbc-url");
    DataSourceDescriptor dataSource =
        new DataSourceDescriptor(
            startupParameters.has("datasource-id")
                ? startupParameters.getParameter("datasource-id")
                : url,
            url,
            startupParameters.getParameter("jdbc-user"),
            startupParameters.getParameter("jdbc-password"),
            Map.of());
    ConnectionFactory connections = ConnectionFactory.driverManager();
    SchemaProvider schemaProvider =
        startupParameters.has("schema-dir")
            ? new JsonSchemaProvider(Path.of(startupParameters.getParameter("schema-dir")))
            : new JdbcSchemaProvider(connections);
    this.orchestrator =
        PlaceholderOrchestrator.builder(settings)
            .schemaProvider(schemaProvider)
            .queryExecutor(new JdbcQueryExecutor(connections, settings.placeholderTimeout()))
            .dataSource(dataSource)
            .build();
    log.info("AutoReport initialized against {}", dataSource);
  }

  /** {@code --max-workers} and {@code --timeout-seconds} take precedence over the YAML values. */
  private EngineSettings withOverrides(EngineSettings loaded) {
    Integer workers = startupParameters.getParameter("max-workers", Integer.class);
    Integer timeoutSeconds = startupParameters.getParameter("timeout-seconds", Integer.class);
    if (workers == null && timeoutSeconds == null) {
      return loaded;
    }
    EngineSettings.Builder b = loaded.toBuilder();
    if (workers != null) {
      b.maxWorkers(workers);
    }
    if (timeoutSeconds != null) {
      b.placeholderTimeout(Duration.ofSeconds(timeoutSeconds));
    }
    return b.build();
  }

  /** Resolve the template named by {@code --template}. */
  public ProcessingResult run() {
    if (orchestrator == null) {
      throw new StateException("AutoReport not initialized. Call initialize() first.");
    }
    TemplateDocument template =
        MarkdownTemplateContentSource.read(Path.of(startupParameters.requireParameter("template")));
    BusinessContext business =
        startupParameters.has("domain")
            ? BusinessContext.ofDomain(startupParameters.getParameter("domain"))
            : BusinessContext.empty();
    return orchestrator.processDocument(template.text(), template.context(), business);
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AutoReport not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public EngineSettings settings() {
    return settings;
  }

  public PlaceholderOrchestrator orchestrator() {
    return orchestrator;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  /** Release worker pools. Safe to call multiple times. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && orchestrator != null) {
      orchestrator.close();
    }
  }
}
