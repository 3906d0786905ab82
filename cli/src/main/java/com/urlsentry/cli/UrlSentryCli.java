package com.urlsentry.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.urlsentry.cli.logging.LogSetup;
import com.urlsentry.core.exception.EntitlementDeniedException;
import com.urlsentry.core.exception.UrlSentryException;
import com.urlsentry.core.model.AuthorizationDecision;
import com.urlsentry.core.model.EngineConfig;
import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.model.RequesterContext;
import com.urlsentry.core.persistence.MigrationReport;
import com.urlsentry.core.service.BatchHandle;
import com.urlsentry.core.service.BatchSummary;
import com.urlsentry.core.service.UrlSentryEngine;
import com.urlsentry.core.util.Json;
import com.urlsentry.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;

/**
 * 명령행 프론트. 결과는 stdout에 JSON, 로그는 stderr/파일.
 *
 * urlsentry [--config urlsentry.yml] &lt;command&gt; ...
 *   analyze &lt;url&gt; --requester ID [--group G]
 *   batch &lt;file|-&gt; --requester ID [--group G] [--timeoutSec 600]
 *   check --requester ID [--group G]
 *   grant &lt;requesterId&gt; --days N
 *   revoke &lt;requesterId&gt;
 *   approve-group &lt;groupId&gt;
 *   revoke-group &lt;groupId&gt;
 *   usage &lt;requesterId&gt;
 *   stats
 *   vacuum
 *   migrate [dir]
 *
 * 종료 코드: 0 성공, 1 오류, 2 사용법 오류, 3 권한 거부
 */
public final class UrlSentryCli {
    private static final Logger LOG = LoggerFactory.getLogger(UrlSentryCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_DENIED = 3;

    /** 테스트에서 엔진 생성 방식을 바꾸기 위한 훅 */
    @FunctionalInterface
    interface EngineFactory {
        UrlSentryEngine open(EngineConfig cfg);
    }

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final EngineFactory factory;
    private final ObjectMapper mapper = Json.newMapper();

    UrlSentryCli(PrintStream out, PrintStream err, InputStream in, EngineFactory factory) {
        this.out = out;
        this.err = err;
        this.in = in;
        this.factory = factory;
    }

    public static void main(String[] args) {
        LogSetup.init();
        int code = new UrlSentryCli(System.out, System.err, System.in, UrlSentryEngine::open).run(args);
        System.exit(code);
    }

    int run(String[] argv) {
        CliArgs args;
        try {
            args = CliArgs.parse(argv);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            usage();
            return EXIT_USAGE;
        }
        if (args.command() == null || args.flag("help")) {
            usage();
            return args.flag("help") ? EXIT_OK : EXIT_USAGE;
        }
        if (args.flag("verbose")) LogSetup.setLevel(Level.FINE);

        EngineConfig cfg;
        try {
            cfg = loadConfig(args);
        } catch (IOException | IllegalArgumentException e) {
            err.println("config error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try (UrlSentryEngine engine = factory.open(cfg)) {
            return dispatch(engine, args);
        } catch (EntitlementDeniedException e) {
            err.println("denied: " + e.getUserMessage() + " [" + e.getErrorCode().code() + "]");
            return EXIT_DENIED;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            usage();
            return EXIT_USAGE;
        } catch (UrlSentryException e) {
            LOG.debug("Command failed", e);
            err.println("error: " + e.getUserMessage() + " [" + e.getErrorCode().code() + "]: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("io error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("interrupted");
            return EXIT_ERROR;
        }
    }

    private int dispatch(UrlSentryEngine engine, CliArgs args) throws IOException, InterruptedException {
        switch (args.command()) {
            case "analyze": {
                print(engine.analyze(args.positional(0, "url"), requester(args)), args);
                return EXIT_OK;
            }
            case "batch":
                return batch(engine, args);
            case "check": {
                AuthorizationDecision d = engine.checkEntitlement(requester(args));
                print(d, args);
                return d.allowed() ? EXIT_OK : EXIT_DENIED;
            }
            case "grant": {
                long days = Long.parseLong(args.requireOption("days"));
                EntitlementRecord r = engine.entitlements()
                        .grantSubscription(args.positional(0, "requesterId"), Duration.ofDays(days));
                print(r, args);
                return EXIT_OK;
            }
            case "revoke":
                print(Map.of("revoked", engine.entitlements().revokeSubscription(args.positional(0, "requesterId"))), args);
                return EXIT_OK;
            case "approve-group":
                print(engine.entitlements().approveGroup(args.positional(0, "groupId")), args);
                return EXIT_OK;
            case "revoke-group":
                print(Map.of("revoked", engine.entitlements().revokeGroup(args.positional(0, "groupId"))), args);
                return EXIT_OK;
            case "usage":
                print(engine.usageOf(args.positional(0, "requesterId")), args);
                return EXIT_OK;
            case "stats": {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("storage", engine.storageStats());
                m.put("catalog", engine.currentCatalog().getVersion());
                m.put("rules", engine.currentCatalog().size());
                print(m, args);
                return EXIT_OK;
            }
            case "vacuum":
                print(Map.of("removed", engine.vacuum()), args);
                return EXIT_OK;
            case "migrate": {
                Path dir = args.positional().isEmpty()
                        ? engine.getConfig().storage().getLocalDir()
                        : Path.of(args.positional().get(0));
                MigrationReport report = engine.migrateFrom(dir);
                print(report, args);
                return EXIT_OK;
            }
            default:
                throw new IllegalArgumentException("unknown command: " + args.command());
        }
    }

    /** 진행 이벤트는 한 줄 JSON으로 즉시 출력, 마지막에 요약 */
    private int batch(UrlSentryEngine engine, CliArgs args) throws IOException, InterruptedException {
        String src = args.positional(0, "file|-");
        List<String> urls = readUrls(src);
        long timeoutSec = Long.parseLong(args.option("timeoutSec").orElse("600"));

        BatchHandle handle = engine.analyzeBatch(urls, requester(args), p -> {
            synchronized (out) {
                out.println(compact(p));
            }
        });
        BatchSummary summary;
        try {
            summary = handle.await(Duration.ofSeconds(timeoutSec));
        } catch (TimeoutException e) {
            handle.cancel();
            err.println("batch timed out after " + timeoutSec + "s; cancelled");
            return EXIT_ERROR;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("batchId", summary.batchId());
        m.put("state", summary.state());
        m.put("total", summary.total());
        m.put("completed", summary.completed());
        m.put("failed", summary.failed());
        m.put("elapsedMs", summary.elapsedMs());
        synchronized (out) {
            print(m, args);
        }
        return EXIT_OK;
    }

    private List<String> readUrls(String src) throws IOException {
        List<String> urls = new ArrayList<>();
        BufferedReader r = "-".equals(src)
                ? new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))
                : Files.newBufferedReader(Path.of(src), StandardCharsets.UTF_8);
        try (r) {
            String line;
            while ((line = r.readLine()) != null) {
                String s = line.trim();
                if (!s.isEmpty() && !s.startsWith("#")) urls.add(s);
            }
        }
        return urls;
    }

    private static RequesterContext requester(CliArgs args) {
        return new RequesterContext(args.requireOption("requester"), args.option("group").orElse(null));
    }

    private static EngineConfig loadConfig(CliArgs args) throws IOException {
        var explicit = args.option("config");
        if (explicit.isPresent()) return YamlConfigLoader.load(Path.of(explicit.get()));
        Path local = Path.of("urlsentry.yml");
        if (Files.exists(local)) return YamlConfigLoader.load(local);
        return YamlConfigLoader.fromSystemProperties();
    }

    private void print(Object value, CliArgs args) throws JsonProcessingException {
        ObjectWriter w = args.flag("pretty") ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        out.println(w.writeValueAsString(value));
    }

    private String compact(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.warn("Cannot serialize progress event: {}", e.getMessage());
            return "{\"error\":\"unserializable event\"}";
        }
    }

    private void usage() {
        err.println("usage: urlsentry [--config urlsentry.yml] [--pretty] [--verbose] <command> ...");
        err.println("  analyze <url> --requester ID [--group G]");
        err.println("  batch <file|-> --requester ID [--group G] [--timeoutSec 600]");
        err.println("  check --requester ID [--group G]");
        err.println("  grant <requesterId> --days N | revoke <requesterId>");
        err.println("  approve-group <groupId> | revoke-group <groupId>");
        err.println("  usage <requesterId> | stats | vacuum | migrate [dir]");
    }
}
