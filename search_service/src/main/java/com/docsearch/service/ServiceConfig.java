package com.docsearch.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Service settings. Defaults come from {@code application.properties} on the
 * classpath; environment variables override them.
 *
 * <pre>
 *  PORT                  server.port
 *  DATA_DIR              data.dir
 *  CHAT_SNAPSHOT_FILE    chat.snapshot.file
 *  CORPUS_SNAPSHOT_FILE  corpus.snapshot.file
 *  CALL_TIMEOUT_MS       call.timeout.ms
 *  WORKER_THREADS        worker.threads
 *  CORS_ORIGIN           cors.allowed.origin
 * </pre>
 */
public final class ServiceConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServiceConfig.class);

    private final int port;
    private final Path dataDir;
    private final String chatSnapshotFile;
    private final String corpusSnapshotFile;
    private final long callTimeoutMs;
    private final int workerThreads;
    private final String allowedOrigin;

    public ServiceConfig(int port,
                         Path dataDir,
                         String chatSnapshotFile,
                         String corpusSnapshotFile,
                         long callTimeoutMs,
                         int workerThreads,
                         String allowedOrigin) {
        if (port < 0) throw new IllegalArgumentException("port must be >= 0");
        if (callTimeoutMs <= 0) throw new IllegalArgumentException("call.timeout.ms must be > 0");
        if (workerThreads <= 0) throw new IllegalArgumentException("worker.threads must be > 0");
        this.port = port;
        this.dataDir = dataDir;
        this.chatSnapshotFile = chatSnapshotFile;
        this.corpusSnapshotFile = corpusSnapshotFile;
        this.callTimeoutMs = callTimeoutMs;
        this.workerThreads = workerThreads;
        this.allowedOrigin = allowedOrigin;
    }

    public static ServiceConfig load() {
        return fromSources(loadProperties("application.properties"), System.getenv());
    }

    static ServiceConfig fromSources(Properties props, Map<String, String> env) {
        return new ServiceConfig(
                Integer.parseInt(setting(env, "PORT", props, "server.port", "8080")),
                Path.of(setting(env, "DATA_DIR", props, "data.dir", "./data_repository")).normalize(),
                setting(env, "CHAT_SNAPSHOT_FILE", props, "chat.snapshot.file", "chat_history.json"),
                setting(env, "CORPUS_SNAPSHOT_FILE", props, "corpus.snapshot.file", "corpus.json"),
                Long.parseLong(setting(env, "CALL_TIMEOUT_MS", props, "call.timeout.ms", "5000")),
                Integer.parseInt(setting(env, "WORKER_THREADS", props, "worker.threads", "4")),
                setting(env, "CORS_ORIGIN", props, "cors.allowed.origin", "*")
        );
    }

    static Properties loadProperties(String resource) {
        Properties props = new Properties();
        try (InputStream input = ServiceConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.warn("{} not found on classpath, using defaults", resource);
            }
        } catch (IOException e) {
            logger.error("Failed to load {}: {}", resource, e.getMessage());
        }
        return props;
    }

    private static String setting(Map<String, String> env, String envKey,
                                  Properties props, String propKey, String fallback) {
        String fromEnv = env.get(envKey);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        return props.getProperty(propKey, fallback).trim();
    }

    public ServiceConfig withPort(int newPort) {
        return new ServiceConfig(newPort, dataDir, chatSnapshotFile, corpusSnapshotFile,
                callTimeoutMs, workerThreads, allowedOrigin);
    }

    public ServiceConfig withDataDir(Path newDataDir) {
        return new ServiceConfig(port, newDataDir, chatSnapshotFile, corpusSnapshotFile,
                callTimeoutMs, workerThreads, allowedOrigin);
    }

    public ServiceConfig withCallTimeoutMs(long newTimeoutMs) {
        return new ServiceConfig(port, dataDir, chatSnapshotFile, corpusSnapshotFile,
                newTimeoutMs, workerThreads, allowedOrigin);
    }

    public int port() {
        return port;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path chatSnapshotPath() {
        return dataDir.resolve(chatSnapshotFile);
    }

    public Path corpusSnapshotPath() {
        return dataDir.resolve(corpusSnapshotFile);
    }

    public long callTimeoutMs() {
        return callTimeoutMs;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public String allowedOrigin() {
        return allowedOrigin;
    }

    @Override
    public String toString() {
        return "ServiceConfig{port=" + port
                + ", dataDir=" + dataDir
                + ", callTimeoutMs=" + callTimeoutMs
                + ", workerThreads=" + workerThreads + "}";
    }
}
