package com.gentoro.medigraph;

import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.exception.StateException;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.graph.GraphStoreFactory;
import com.gentoro.medigraph.guideline.GuidelineCatalog;
import com.gentoro.medigraph.guideline.GuidelineSeeder;
import com.gentoro.medigraph.query.IntentRoutes;
import com.gentoro.medigraph.query.QueryTranslator;
import com.gentoro.medigraph.query.QuestionRouter;
import com.gentoro.medigraph.source.JdbcExtractor;
import com.gentoro.medigraph.source.SourceConnectionFactory;
import com.gentoro.medigraph.sync.SyncOptions;
import com.gentoro.medigraph.sync.SyncPipeline;
import com.gentoro.medigraph.sync.mapping.EntityMappings;
import java.util.Optional;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context. Owns the startup parameters and the loaded configuration and builds the
 * collaborators each mode needs. Nothing connects until a mode asks for it.
 */
public class Medigraph {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(Medigraph.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;

  public Medigraph(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.medigraph.logging.LoggingService.applyConfiguration(configuration());
    log.debug("Medigraph initialized in mode {}", mode().id());
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Medigraph not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Mode mode() {
    return Mode.fromParameter(startupParameters.getParameter("mode", String.class));
  }

  /** New, not yet initialized graph store selected by {@code graph.driver}. */
  public GraphStore createGraphStore() {
    return GraphStoreFactory.create(this);
  }

  public SourceConnectionFactory createSourceConnectionFactory() {
    return SourceConnectionFactory.fromConfiguration(configuration());
  }

  public SyncPipeline createSyncPipeline() {
    return new SyncPipeline(
        createSourceConnectionFactory(),
        connection -> JdbcExtractor.fromConfiguration(connection, configuration()),
        this::createGraphStore,
        EntityMappings.defaults(),
        SyncOptions.fromConfiguration(configuration()));
  }

  public QuestionRouter createQuestionRouter() {
    return new QuestionRouter(
        IntentRoutes.defaults(
            configuration()
                .getString("router.defaultConditionTerm", IntentRoutes.DEFAULT_CONDITION_TERM)));
  }

  /**
   * Translator used for questions no route recognizes. Empty unless {@code
   * router.translator.enabled} is set; an enabled translator must be registered through {@link
   * ServiceLoader}.
   */
  public Optional<QueryTranslator> queryTranslator() {
    if (!configuration().getBoolean("router.translator.enabled", false)) {
      return Optional.empty();
    }
    QueryTranslator translator =
        ServiceLoader.load(QueryTranslator.class)
            .findFirst()
            .orElseThrow(
                () ->
                    new ConfigurationException(
                        "router.translator.enabled is set but no QueryTranslator is registered"));
    log.debug("Using query translator {}", translator.getClass().getName());
    return Optional.of(translator);
  }

  public GuidelineSeeder createGuidelineSeeder() {
    GuidelineCatalog catalog =
        GuidelineSeeder.loadCatalog(configuration().getString("guidelines.catalog", null));
    return new GuidelineSeeder(catalog);
  }
}
