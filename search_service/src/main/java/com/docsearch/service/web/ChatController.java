package com.docsearch.service.web;

import com.docsearch.chat.ChatRecord;
import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.Status;
import com.docsearch.service.EngineGateway;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.time.Instant;

public final class ChatController {

    private final Gson gson;
    private final EngineGateway gateway;

    public ChatController(Gson gson, EngineGateway gateway) {
        this.gson = gson;
        this.gateway = gateway;
    }

    public void registerRoutes(Javalin app) {

        app.get("/api/chats", ctx -> Responses.send(ctx, gson, gateway.chatList(), chats -> Responses.body(
                "success", true,
                "count", chats.size(),
                "chats", chats
        )));

        app.post("/api/chats", ctx -> {
            ChatRequest req;
            try {
                req = gson.fromJson(ctx.body(), ChatRequest.class);
            } catch (JsonParseException e) {
                Responses.error(ctx, gson, 400, "invalid json");
                return;
            }
            if (req == null) {
                Responses.error(ctx, gson, 400, "chat id missing");
                return;
            }

            long timestamp = req.timestamp() == null ? Instant.now().getEpochSecond() : req.timestamp();
            EngineResponse<ChatRecord> resp = gateway.chatAdd(req.id(), req.title(), timestamp);
            Responses.send(ctx, gson, resp, chat -> Responses.body(
                    "success", true,
                    "message", "Chat saved",
                    "chat", chat
            ));
        });

        // registered before /{id} so "clear" is never taken for a chat id
        app.post("/api/chats/clear", ctx -> Responses.send(ctx, gson, gateway.chatClear(), msg -> Responses.body(
                "success", true,
                "message", msg
        )));

        app.post("/api/chats/{id}", ctx -> {
            EngineResponse<ChatRecord> resp = gateway.chatAccess(ctx.pathParam("id"));
            if (resp.status() == Status.NOT_FOUND) {
                notFound(ctx, resp);
                return;
            }
            Responses.send(ctx, gson, resp, chat -> Responses.body(
                    "success", true,
                    "found", true,
                    "chat", chat
            ));
        });

        app.delete("/api/chats/{id}", ctx -> {
            EngineResponse<String> resp = gateway.chatDelete(ctx.pathParam("id"));
            if (resp.status() == Status.NOT_FOUND) {
                notFound(ctx, resp);
                return;
            }
            Responses.send(ctx, gson, resp, msg -> Responses.body(
                    "success", true,
                    "message", msg
            ));
        });
    }

    private void notFound(Context ctx, EngineResponse<?> resp) {
        ctx.status(404).result(gson.toJson(Responses.body(
                "success", false,
                "found", false,
                "error", resp.error()
        )));
    }

    record ChatRequest(String id, String title, Long timestamp) {}
}
