package com.autosort;

import com.autosort.controllers.Controller;
import com.autosort.controllers.ResolutionController;
import com.autosort.oracle.Oracle;
import com.autosort.oracle.OracleFactory;
import com.autosort.resolve.ResolutionOrchestrator;
import com.autosort.storage.SuggestionCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            logger.announce("AutoSort v" + VERSION + (config.isDevMode() ? " (dev)" : "") + " starting");

            SuggestionCache cache = new SuggestionCache(config.getCachePath());
            Oracle oracle = new OracleFactory(objectMapper).create(config.getOracle());
            ResolutionOrchestrator orchestrator = new ResolutionOrchestrator(oracle, objectMapper, config.getWorkers());
            logger.info("Oracle: " + oracle.getKind().getProviderName() + " (" + config.getOracle().getModel()
                + "), workers: " + orchestrator.getWorkerCount());

            List<Controller> controllers = List.of(
                new ResolutionController(orchestrator, cache, objectMapper, config.getDataDirectory(),
                    config.isRefine(), config.isFresh())
            );

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.announce(
                "  api    " + url + "api/resolve",
                "  root   " + config.getRootPath(),
                "  cache  " + config.getCachePath(),
                "  log    " + config.getLogPath(),
                "Ctrl+C cancels running scans and stops the server");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                orchestrator.cancelAll();
                app.stop();
                orchestrator.shutdown();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start AutoSort: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
