package com.docsearch.service.web;

import com.docsearch.dto.Document;
import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.IngestResult;
import com.docsearch.service.EngineGateway;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class DocumentController {

    static final String DEFAULT_NAME = "untitled.txt";

    private final Gson gson;
    private final EngineGateway gateway;

    public DocumentController(Gson gson, EngineGateway gateway) {
        this.gson = gson;
        this.gateway = gateway;
    }

    public void registerRoutes(Javalin app) {

        app.post("/api/index", ctx -> {
            IndexRequest req;
            try {
                req = gson.fromJson(ctx.body(), IndexRequest.class);
            } catch (JsonParseException e) {
                Responses.error(ctx, gson, 400, "invalid json");
                return;
            }
            if (req == null) {
                Responses.error(ctx, gson, 400, "content missing");
                return;
            }

            String name = req.name() == null || req.name().isBlank() ? DEFAULT_NAME : req.name();
            EngineResponse<IngestResult> resp = gateway.ingest(name, req.content());

            Responses.send(ctx, gson, resp, r -> Responses.body(
                    "success", true,
                    "docId", r.docId(),
                    "name", r.name(),
                    "wordsIndexed", r.wordsIndexed(),
                    "uniqueWords", r.uniqueWords()
            ));
        });

        app.get("/api/documents", ctx -> {
            EngineResponse<List<Document>> resp = gateway.documents();
            Responses.send(ctx, gson, resp, docs -> {
                List<Map<String, Object>> items = new ArrayList<>(docs.size());
                for (Document d : docs) {
                    items.add(Responses.body("id", d.id(), "name", d.name(), "wordCount", d.wordCount()));
                }
                return Responses.body("count", items.size(), "documents", items);
            });
        });

        app.get("/api/stats", ctx -> Responses.send(ctx, gson, gateway.stats(), s -> Responses.body(
                "totalDocs", s.totalDocs(),
                "uniqueWords", s.uniqueWords(),
                "totalIndexed", s.totalIndexed()
        )));
    }

    record IndexRequest(String name, String content) {}
}
