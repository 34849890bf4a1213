package com.trade.foresight.pipeline.runner;

import com.trade.foresight.pipeline.common.exception.ValidationException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Command word, positionals and options of one process launch.
 * Accepts {@code --key value} and {@code --key=value}; a flag followed by
 * another option or by nothing has an empty value.
 */
@Getter
public final class LaunchArgs {

    private final String command;
    private final List<String> positionals;
    private final Map<String, String> options;

    private LaunchArgs(String command, List<String> positionals, Map<String, String> options) {
        this.command = command;
        this.positionals = positionals;
        this.options = options;
    }

    public static LaunchArgs parse(String... args) {
        List<String> pos = new ArrayList<>();
        Map<String, String> opts = new LinkedHashMap<>();
        String[] a = args == null ? new String[0] : args;
        for (int i = 0; i < a.length; i++) {
            String t = a[i];
            if (t.startsWith("--") && t.length() > 2) {
                String k = t.substring(2);
                int eq = k.indexOf('=');
                if (eq >= 0) {
                    opts.put(k.substring(0, eq).toLowerCase(Locale.ROOT), k.substring(eq + 1));
                } else if (i + 1 < a.length && !a[i + 1].startsWith("--")) {
                    opts.put(k.toLowerCase(Locale.ROOT), a[++i]);
                } else {
                    opts.put(k.toLowerCase(Locale.ROOT), "");
                }
            } else {
                pos.add(t);
            }
        }
        String command = pos.isEmpty() ? null : pos.remove(0).toLowerCase(Locale.ROOT);
        return new LaunchArgs(command, Collections.unmodifiableList(pos), Collections.unmodifiableMap(opts));
    }

    /** First positional after the command word, e.g. {@code flush} in {@code training-status flush}. */
    public Optional<String> subcommand() {
        return positionals.isEmpty() ? Optional.empty() : Optional.of(positionals.get(0).toLowerCase(Locale.ROOT));
    }

    public Optional<String> option(String name) {
        String v = options.get(name);
        return v == null || v.isEmpty() ? Optional.empty() : Optional.of(v);
    }

    public String require(String name) {
        return option(name).orElseThrow(() -> new ValidationException("Missing required option --" + name));
    }

    public int requireInt(String name) {
        String v = require(name);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ValidationException("--" + name + " must be a number, got " + v);
        }
    }

    /**
     * Name used for the process log file: the command word, plus the entity
     * for worker processes ({@code consumer_BTCUSDT_lightgbm_v1}).
     */
    public String processName() {
        if (command == null) return "foresight";
        if ("consumer".equals(command)) {
            return command + "_" + option("crypto").orElse("NA").toUpperCase(Locale.ROOT)
                    + "_" + option("model").orElse("NA") + "_" + option("version").orElse("NA");
        }
        if ("producer".equals(command)) {
            return command + "_" + option("symbol").orElse("main").toUpperCase(Locale.ROOT);
        }
        return command.replace('-', '_');
    }
}
