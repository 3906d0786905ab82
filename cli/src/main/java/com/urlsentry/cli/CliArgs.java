package com.urlsentry.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 명령행 파싱: 첫 위치 인자가 명령, 나머지는 위치 인자 + --key value 옵션.
 * 값 없는 플래그는 FLAGS에 등록된 이름만 허용.
 */
final class CliArgs {
    private static final Set<String> FLAGS = Set.of("verbose", "pretty", "help");

    private final String command;
    private final List<String> positional;
    private final Map<String, String> options;

    private CliArgs(String command, List<String> positional, Map<String, String> options) {
        this.command = command;
        this.positional = Collections.unmodifiableList(positional);
        this.options = Collections.unmodifiableMap(options);
    }

    /** 잘못된 형식이면 IllegalArgumentException */
    static CliArgs parse(String[] args) {
        String command = null;
        List<String> pos = new ArrayList<>();
        Map<String, String> opts = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String name = a.substring(2);
                String value;
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    value = name.substring(eq + 1);
                    name = name.substring(0, eq);
                } else if (FLAGS.contains(name)) {
                    value = "true";
                } else {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("missing value for --" + name);
                    value = args[++i];
                }
                if (name.isEmpty()) throw new IllegalArgumentException("empty option name");
                opts.put(name, value);
            } else if (command == null) {
                command = a;
            } else {
                pos.add(a);
            }
        }
        return new CliArgs(command, pos, opts);
    }

    String command() { return command; }
    List<String> positional() { return positional; }

    String positional(int i, String name) {
        if (i >= positional.size()) throw new IllegalArgumentException("missing argument <" + name + ">");
        return positional.get(i);
    }

    Optional<String> option(String name) { return Optional.ofNullable(options.get(name)); }

    String requireOption(String name) {
        return option(name).orElseThrow(() -> new IllegalArgumentException("missing option --" + name));
    }

    boolean flag(String name) {
        return Boolean.parseBoolean(options.getOrDefault(name, "false"));
    }
}
