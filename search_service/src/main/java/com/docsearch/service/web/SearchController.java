package com.docsearch.service.web;

import com.docsearch.core.DocumentAnalyzer;
import com.docsearch.dto.KeywordSearchResult;
import com.docsearch.dto.PrefixSearchResult;
import com.docsearch.dto.TopKResult;
import com.docsearch.service.EngineGateway;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.Optional;

public final class SearchController {

    private final Gson gson;
    private final EngineGateway gateway;

    public SearchController(Gson gson, EngineGateway gateway) {
        this.gson = gson;
        this.gateway = gateway;
    }

    public void registerRoutes(Javalin app) {

        // GET /api/search?type=keyword|prefix|multi&query=...
        app.get("/api/search", ctx -> {
            String query = ctx.queryParam("query");
            String type = Optional.ofNullable(ctx.queryParam("type")).orElse("keyword");

            switch (type) {
                case "keyword" -> Responses.send(ctx, gson, gateway.searchKeyword(query), r -> Responses.body(
                        "type", type,
                        "query", r.query(),
                        "results", r.results(),
                        "totalOccurrences", r.totalOccurrences()
                ));
                case "prefix" -> Responses.send(ctx, gson, gateway.searchPrefix(query), r -> Responses.body(
                        "type", type,
                        "query", r.query(),
                        "results", r.results(),
                        "totalMatches", r.results().size()
                ));
                case "multi" -> Responses.send(ctx, gson, gateway.searchMulti(query), r -> Responses.body(
                        "type", type,
                        "query", r.query(),
                        "keywords", r.keywords(),
                        "results", r.results(),
                        "totalMatches", r.results().size()
                ));
                default -> Responses.error(ctx, gson, 400, "Invalid search type: " + type);
            }
        });

        // corpus-wide top-k, or top-k of the posted content when present
        app.post("/api/topk", ctx -> {
            TopKRequest req = parse(ctx, TopKRequest.class);
            if (req == null) return;

            int k = req.k() == null ? DocumentAnalyzer.DEFAULT_TOP_K : req.k();
            if (req.content() == null) {
                Responses.send(ctx, gson, gateway.topK(k), this::topKBody);
            } else {
                Responses.send(ctx, gson, gateway.analyzeTopK(req.content(), k), this::topKBody);
            }
        });

        app.post("/api/replace", ctx -> {
            ReplaceRequest req = parse(ctx, ReplaceRequest.class);
            if (req == null) return;

            Responses.send(ctx, gson, gateway.replace(req.content(), req.find(), req.replace()), r -> Responses.body(
                    "success", true,
                    "originalWord", r.originalWord(),
                    "replacementWord", r.replacementWord(),
                    "modifiedText", r.modifiedText(),
                    "occurrencesReplaced", r.occurrencesReplaced()
            ));
        });

        app.post("/api/analyze", ctx -> {
            AnalyzeRequest req = parse(ctx, AnalyzeRequest.class);
            if (req == null) return;

            Optional<DocumentAnalyzer.Action> action = DocumentAnalyzer.Action.parse(req.action());
            if (action.isEmpty()) {
                Responses.error(ctx, gson, 400, "Invalid action: " + req.action());
                return;
            }

            switch (action.get()) {
                case FREQ, SEARCH -> Responses.send(ctx, gson,
                        gateway.analyzeFrequency(req.content(), req.query()), this::frequencyBody);
                case PREFIX -> Responses.send(ctx, gson,
                        gateway.analyzePrefix(req.content(), req.query()), this::prefixBody);
                case TOPK -> Responses.send(ctx, gson,
                        gateway.analyzeTopK(req.content(), req.k() == null ? DocumentAnalyzer.DEFAULT_TOP_K : req.k()),
                        this::topKBody);
            }
        });
    }

    private Map<String, Object> topKBody(TopKResult r) {
        return Responses.body(
                "k", r.k(),
                "totalUniqueWords", r.totalUniqueWords(),
                "topWords", r.topWords()
        );
    }

    private Map<String, Object> frequencyBody(KeywordSearchResult r) {
        return Responses.body(
                "word", r.term(),
                "found", r.found(),
                "totalFrequency", r.totalOccurrences(),
                "results", r.results()
        );
    }

    private Map<String, Object> prefixBody(PrefixSearchResult r) {
        return Responses.body(
                "prefix", r.prefix(),
                "found", !r.results().isEmpty(),
                "words", r.results()
        );
    }

    private <T> T parse(Context ctx, Class<T> type) {
        T req;
        try {
            req = gson.fromJson(ctx.body(), type);
        } catch (JsonParseException e) {
            Responses.error(ctx, gson, 400, "invalid json");
            return null;
        }
        if (req == null) {
            Responses.error(ctx, gson, 400, "request body missing");
        }
        return req;
    }

    record TopKRequest(Integer k, String content) {}

    record ReplaceRequest(String content, String find, String replace) {}

    record AnalyzeRequest(String content, String action, String query, Integer k) {}
}
