package com.urlsentry.cli;

import com.urlsentry.core.service.UrlSentryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class UrlSentryCliTest {

    @TempDir Path dir;
    private Path config;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void writeConfig() throws IOException {
        config = dir.resolve("urlsentry.yml");
        Files.writeString(config, "storage:\n  preferLocal: true\n  localDir: \""
                + dir.resolve("data").toString().replace("\\", "/") + "\"\nbatch:\n  workers: 2\n");
    }

    private int run(String stdin, String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        String[] full = new String[args.length + 2];
        full[0] = "--config";
        full[1] = config.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return new UrlSentryCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), in, UrlSentryEngine::open).run(full);
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8); }
    private String stderr() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void grant_then_check_then_usage() {
        assertThat(run("", "check", "--requester", "alice")).isEqualTo(UrlSentryCli.EXIT_DENIED);
        assertThat(stdout()).contains("NO_SUBSCRIPTION");

        assertThat(run("", "grant", "alice", "--days", "30")).isEqualTo(UrlSentryCli.EXIT_OK);
        assertThat(stdout()).contains("\"subject\":\"alice\"").contains("INDIVIDUAL_SUBSCRIPTION");

        assertThat(run("", "check", "--requester", "alice")).isEqualTo(UrlSentryCli.EXIT_OK);
        assertThat(stdout()).contains("\"allowed\":true");

        assertThat(run("", "revoke", "alice")).isEqualTo(UrlSentryCli.EXIT_OK);
        assertThat(stdout()).contains("\"revoked\":true");
    }

    @Test
    void analyze_without_entitlement_exits_with_denied() {
        assertThat(run("", "analyze", "https://shop.example/", "--requester", "mallory"))
                .isEqualTo(UrlSentryCli.EXIT_DENIED);
        assertThat(stderr()).contains("denied").contains("U5001");
    }

    @Test
    void malformed_url_is_reported_as_error() {
        run("", "approve-group", "qa");
        assertThat(run("", "analyze", "ftp://files.example/", "--requester", "tester", "--group", "qa"))
                .isEqualTo(UrlSentryCli.EXIT_ERROR);
        assertThat(stderr()).contains("U1001");
    }

    @Test
    void batch_from_stdin_streams_events_then_summary() {
        run("", "grant", "alice", "--days", "1");
        int code = run("# comment\nnot a url\n\nmailto:x@y.z\n", "batch", "-", "--requester", "alice");

        assertThat(code).isEqualTo(UrlSentryCli.EXIT_OK);
        String[] lines = stdout().trim().split("\\R");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).contains("MALFORMED_URL");
        assertThat(lines[1]).contains("MALFORMED_URL");
        assertThat(lines[2]).contains("\"state\":\"PARTIALLY_FAILED\"").contains("\"failed\":2");
    }

    @Test
    void stats_vacuum_and_migrate() throws IOException {
        run("", "grant", "alice", "--days", "1");
        assertThat(run("", "stats")).isEqualTo(UrlSentryCli.EXIT_OK);
        assertThat(stdout()).contains("\"backend\":\"file\"").contains("\"catalog\"");

        assertThat(run("", "vacuum")).isEqualTo(UrlSentryCli.EXIT_OK);
        assertThat(stdout()).contains("\"removed\":0");

        Path other = dir.resolve("old-data");
        Files.createDirectories(other);
        Files.writeString(other.resolve("approved_groups.json"),
                "{\"legacy\":{\"subject\":\"legacy\",\"kind\":\"GROUP_APPROVAL\",\"grantedAt\":\"2024-01-01T00:00:00Z\"}}");
        assertThat(run("", "migrate", other.toString())).isEqualTo(UrlSentryCli.EXIT_OK);
        assertThat(stdout()).contains("\"source\":\"file\"");

        assertThat(run("", "check", "--requester", "zed", "--group", "legacy")).isEqualTo(UrlSentryCli.EXIT_OK);
    }

    @Test
    void usage_errors() {
        assertThat(run("", "frobnicate")).isEqualTo(UrlSentryCli.EXIT_USAGE);
        assertThat(run("", "grant", "alice")).isEqualTo(UrlSentryCli.EXIT_USAGE);
        assertThat(stderr()).contains("--days");
        assertThat(run("")).isEqualTo(UrlSentryCli.EXIT_USAGE);
        assertThat(stderr()).contains("usage:");
    }
}
