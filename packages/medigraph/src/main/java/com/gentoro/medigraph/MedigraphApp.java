package com.gentoro.medigraph;

import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.exception.ExceptionUtil;
import com.gentoro.medigraph.graph.GraphSchema;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import com.gentoro.medigraph.query.QueryAnswer;
import com.gentoro.medigraph.query.QueryTranslator;
import com.gentoro.medigraph.query.QuestionAnsweringService;
import com.gentoro.medigraph.query.QuestionRouter;
import com.gentoro.medigraph.query.TranslatedQueryService;
import com.gentoro.medigraph.stats.GraphStatistics;
import com.gentoro.medigraph.stats.GraphStatisticsService;
import com.gentoro.medigraph.sync.EntityLoadResult;
import com.gentoro.medigraph.sync.SyncPipeline;
import com.gentoro.medigraph.sync.SyncReport;
import com.gentoro.medigraph.utility.JacksonUtility;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line entry point. {@code --mode=load} (the default) runs the batch job; {@code ask},
 * {@code stats} and {@code seed-guidelines} work against the graph only. Exits with status 1 on
 * any fatal error.
 */
public class MedigraphApp {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(MedigraphApp.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  private final Medigraph medigraph;
  private final PasscodePrompt passcodePrompt;
  private final PrintStream out;
  private final PrintStream err;

  public MedigraphApp(Medigraph medigraph, PasscodePrompt passcodePrompt, PrintStream out) {
    this(medigraph, passcodePrompt, out, System.err);
  }

  /** {@code err} receives the one-line diagnostic of a fatal error. */
  public MedigraphApp(
      Medigraph medigraph, PasscodePrompt passcodePrompt, PrintStream out, PrintStream err) {
    this.medigraph = medigraph;
    this.passcodePrompt = passcodePrompt;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    int status =
        new MedigraphApp(new Medigraph(args), PasscodePrompt.console(), System.out).run();
    System.exit(status);
  }

  /** Run the selected mode and map the outcome to a process exit status. */
  public int run() {
    try {
      medigraph.initialize();
      switch (medigraph.mode()) {
        case LOAD -> load();
        case ASK -> ask();
        case STATS -> stats();
        case SEED_GUIDELINES -> seedGuidelines();
      }
      return EXIT_OK;
    } catch (Exception e) {
      String diagnostic = ExceptionUtil.describe(e);
      err.println("medigraph: " + diagnostic);
      log.error("Run failed: {}", diagnostic);
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e), e);
      return EXIT_FAILURE;
    }
  }

  private void load() {
    SyncPipeline pipeline = medigraph.createSyncPipeline();
    String passcode = medigraph.startupParameters().getParameter("passcode", String.class);
    if (pipeline.requiresPasscode() && (passcode == null || passcode.isBlank())) {
      passcode = passcodePrompt.read("Enter source MFA passcode: ");
    }
    SyncReport report = pipeline.run(passcode);
    for (EntityLoadResult result : report.results()) {
      out.println(
          result.entityType().pluralName()
              + ": "
              + (result.status() == EntityLoadResult.Status.SKIPPED
                  ? "skipped (already loaded)"
                  : result.applied() + "/" + result.extracted() + " rows"));
    }
  }

  private void ask() {
    String question = question();
    try (GraphStore store = medigraph.createGraphStore()) {
      store.initialize();
      QuestionRouter router = medigraph.createQuestionRouter();
      Optional<QueryTranslator> translator = medigraph.queryTranslator();
      QueryAnswer answer =
          router.route(question).isEmpty() && translator.isPresent()
              ? new TranslatedQueryService(store, translator.get()).answer(question)
              : new QuestionAnsweringService(store, router).answer(question);
      if ("json".equalsIgnoreCase(
          medigraph.startupParameters().getParameter("format", String.class, "text"))) {
        out.println(JacksonUtility.toJson(toJsonModel(answer)));
      } else {
        out.println(answer.message());
        answer.table().ifPresent(table -> out.print(table.render()));
      }
    }
  }

  private String question() {
    String question = medigraph.startupParameters().getParameter("question", String.class);
    if (question == null && !medigraph.startupParameters().positionalArguments().isEmpty()) {
      question = String.join(" ", medigraph.startupParameters().positionalArguments());
    }
    if (question == null || question.isBlank()) {
      throw new ConfigurationException("--mode=ask requires --question=<text>");
    }
    return question;
  }

  static Map<String, Object> toJsonModel(QueryAnswer answer) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("message", answer.message());
    json.put("intent", answer.intent().map(Enum::name).orElse(null));
    answer
        .table()
        .ifPresent(
            table -> {
              json.put("columns", table.columns());
              json.put("rows", table.asMaps());
            });
    return json;
  }

  private void stats() {
    try (GraphStore store = medigraph.createGraphStore()) {
      store.initialize();
      GraphStatistics stats = new GraphStatisticsService(store).collect();
      out.println("Nodes:");
      stats.nodeCounts().forEach((label, count) -> out.println("  " + label + ": " + count));
      out.println("Relationships:");
      stats
          .relationshipCounts()
          .forEach((type, count) -> out.println("  " + type + ": " + count));
    }
  }

  private void seedGuidelines() {
    try (GraphStore store = medigraph.createGraphStore()) {
      store.initialize();
      try (GraphSession session = store.openSession()) {
        GraphSchema.ensureConstraints(session);
        int seeded = medigraph.createGuidelineSeeder().seed(session);
        out.println("Seeded " + seeded + " guidelines");
      }
    }
  }
}
