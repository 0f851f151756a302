package com.docsearch.service;

import com.docsearch.service.store.ChatSnapshotStore;
import com.docsearch.service.store.CorpusStore;
import com.docsearch.service.web.ChatController;
import com.docsearch.service.web.DocumentController;
import com.docsearch.service.web.SearchController;
import com.google.gson.Gson;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public final class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static Javalin start(ServiceConfig config) {
        ensureDirExists(config.dataDir());

        Gson gson = new Gson();
        ChatSnapshotStore chatStore = new ChatSnapshotStore(config.chatSnapshotPath(), gson);
        CorpusStore corpusStore = new CorpusStore(config.corpusSnapshotPath(), gson);

        EngineGateway gateway;
        try {
            gateway = EngineGateway.open(chatStore, corpusStore, config.workerThreads(), config.callTimeoutMs());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load snapshots from " + config.dataDir(), e);
        }
        return start(config, gson, gateway);
    }

    static Javalin start(ServiceConfig config, Gson gson, EngineGateway gateway) {
        DocumentController documentController = new DocumentController(gson, gateway);
        SearchController searchController = new SearchController(gson, gateway);
        ChatController chatController = new ChatController(gson, gateway);

        Javalin app = Javalin.create(cfg -> cfg.http.defaultContentType = "application/json");

        String origin = config.allowedOrigin();
        app.before(ctx -> {
            ctx.header("Access-Control-Allow-Origin", origin);
            ctx.header("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
            ctx.header("Access-Control-Allow-Headers", "Content-Type");
        });
        app.options("/*", ctx -> ctx.status(200));

        app.get("/status", ctx -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("service", "docsearch");
            status.put("status", gateway.isOpen() ? "running" : "stopping");
            status.put("port", ctx.port());
            ctx.result(gson.toJson(status));
        });

        documentController.registerRoutes(app);
        searchController.registerRoutes(app);
        chatController.registerRoutes(app);

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("success", false);
            error.put("error", "Internal server error");
            ctx.status(500).result(gson.toJson(error));
        });

        app.events(ev -> ev.serverStopping(gateway::close));

        try {
            app.start(config.port());
        } catch (RuntimeException e) {
            // the stopping event never fires for a server that did not start
            gateway.close();
            throw e;
        }
        logger.info("Search service started on port {} ({})", app.port(), config);
        return app;
    }

    private static void ensureDirExists(Path dir) {
        if (Files.exists(dir)) return;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create dir: " + dir, e);
        }
    }

    public static void main(String[] args) {
        start(ServiceConfig.load());
    }
}
