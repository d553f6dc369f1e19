package com.contextsmith.sensitive.demo;

import static com.contextsmith.sensitive.utils.Args.options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Scanner;

import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.sensitive.SearchConfig;
import com.contextsmith.sensitive.SensitiveWordSearch;
import com.contextsmith.sensitive.WordListLoader;
import com.contextsmith.sensitive.dfa.DfaBuildException;
import com.contextsmith.sensitive.dfa.SearchResult;
import com.contextsmith.sensitive.utils.Args;
import com.google.common.base.Stopwatch;

/**
 * Loads a word list and checks text against it.
 *
 * <pre>
 *   --words, -w &lt;path&gt;   word list (.json array or one word per line)
 *   --capacity &lt;n&gt;       node capacity
 *   --max, -m &lt;n&gt;        maximum number of matches to report
 *   --text, -t &lt;text&gt;    text to check; reads stdin lines when absent
 * </pre>
 */
public class SensitiveSearchMain {
  private static final Logger log =
      LoggerFactory.getLogger(SensitiveSearchMain.class);

  static class Options {
    String wordsPath;
    String capacity;
    String maxMatches;
    String text;
  }

  public static void main(String[] args) {
    SearchConfig config = null;
    try {
      config = SearchConfig.load();
    } catch (IOException e) {
      die("Could not read configuration", e);
    }

    Options opts = parseArgs(args);
    String wordsPath = (opts.wordsPath != null) ? opts.wordsPath
                                                : config.getWordsPath();
    int capacity = toInt("capacity", opts.capacity, config.getCapacity());
    int maxMatches = toInt("max", opts.maxMatches, config.getMaxMatches());

    try (SensitiveWordSearch search = SensitiveWordSearch.create(
        WordListLoader.load(wordsPath), capacity)) {
      if (opts.text != null) {
        run(search, opts.text, maxMatches);
      } else {
        interactiveRun(search, maxMatches);
      }
    } catch (IOException e) {
      die("Could not load word list " + wordsPath, e);
    } catch (DfaBuildException e) {
      die("Could not build the word index, check dfa.capacity", e);
    }
  }

  static Options parseArgs(String... args) {
    Options opts = new Options();
    Args.match()
        .on(options("--words", "-w"), value -> opts.wordsPath = value)
        .on("--capacity", value -> opts.capacity = value)
        .on(options("--max", "-m"), value -> opts.maxMatches = value)
        .on(options("--text", "-t"), value -> opts.text = value)
        .rest(rest -> {
          if (!rest.isEmpty()) log.warn("Ignoring arguments: {}", rest);
        })
        .parse(args);
    return opts;
  }

  static List<String> run(SensitiveWordSearch search, String text,
                          int maxMatches) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    SearchResult result = search.check(text, maxMatches);
    log.info("Checked {} bytes in {}, found {} match(es)",
             text.getBytes(StandardCharsets.UTF_8).length, stopwatch,
             result.size());

    List<String> lines = search.describe(text, result);
    for (String line : lines) {
      System.out.println(line);
    }
    return lines;
  }

  private static void interactiveRun(SensitiveWordSearch search,
                                     int maxMatches) {
    Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8);
    while (true) {
      System.out.print("Enter a sentence: ");
      if (!scanner.hasNextLine()) break;
      String text = scanner.nextLine();
      if (text.isEmpty()) continue;
      if (text.equalsIgnoreCase("exit")) break;
      if (run(search, text, maxMatches).isEmpty()) {
        System.out.println("No sensitive words found.");
      }
    }
    scanner.close();
  }

  private static int toInt(String name, String value, int defaultValue) {
    if (value == null) return defaultValue;
    if (!NumberUtils.isDigits(value)) {
      die("Expected a non-negative integer for --" + name + ": " + value, null);
    }
    return Integer.parseInt(value);
  }

  private static void die(String msg, Exception e) {
    log.error(msg, e);
    System.exit(-1);
  }
}
