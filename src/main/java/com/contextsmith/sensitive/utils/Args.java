package com.contextsmith.sensitive.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Simple command line parser.
 * Options are registered with {@code on(...)} and dispatched by {@link #parse}.
 * An option handler taking a {@code Consumer} also consumes the next argument
 * as its value; anything left unconsumed goes to the {@link #rest} handler.
 */
public class Args {
    private final List<Option> options = new ArrayList<>();
    private Consumer<List<String>> restHandler;

    public static Args match() {
        return new Args();
    }

    public static Predicate<String> options(String... alternatives) {
        if (alternatives.length == 1) {
            return s -> alternatives[0].equalsIgnoreCase(s);
        }
        return s -> Arrays.stream(alternatives).anyMatch(alt -> alt.equalsIgnoreCase(s));
    }

    public Args on(String option, Runnable handler) {
        return on(options(option), handler);
    }

    public Args on(String option, Consumer<String> handler) {
        return on(options(option), handler);
    }

    public Args on(Predicate<String> test, Runnable handler) {
        options.add(new Option(test, value -> handler.run(), false));
        return this;
    }

    public Args on(Predicate<String> test, Consumer<String> handler) {
        options.add(new Option(test, handler, true));
        return this;
    }

    public Args rest(Consumer<List<String>> handler) {
        this.restHandler = handler;
        return this;
    }

    public void parse(String... args) {
        List<String> rest = new ArrayList<>();
        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            Option option = find(arg);
            if (option == null) {
                rest.add(arg);
                i++;
                continue;
            }
            if (option.takesValue) {
                // a trailing option gets a null value
                String value = (i + 1 < args.length) ? args[i + 1] : null;
                option.handler.accept(value);
                i += 2;
            } else {
                option.handler.accept(null);
                i++;
            }
        }
        if (restHandler != null) {
            restHandler.accept(rest);
        }
    }

    private Option find(String arg) {
        for (Option option : options) {
            if (option.test.test(arg)) return option;
        }
        return null;
    }

    private static class Option {
        final Predicate<String> test;
        final Consumer<String> handler;
        final boolean takesValue;

        Option(Predicate<String> test, Consumer<String> handler, boolean takesValue) {
            this.test = test;
            this.handler = handler;
            this.takesValue = takesValue;
        }
    }
}
