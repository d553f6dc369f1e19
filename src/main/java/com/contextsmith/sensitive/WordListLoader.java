package com.contextsmith.sensitive;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.sensitive.utils.FileUtil;
import com.google.common.io.CharSource;
import com.google.common.io.LineProcessor;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Reads sensitive word lists, either as a JSON array of strings or as a plain
 * text file with one word per line.
 */
public class WordListLoader {
  private static final Logger log = LoggerFactory.getLogger(WordListLoader.class);

  public static final String COMMENT_PREFIX = "#";
  public static final String JSON_FILE_RE = ".+?\\.json(\\.(gz|gzip))?";

  private static final Type WORD_LIST_TYPE =
      new TypeToken<List<String>>() {}.getType();

  public static List<String> load(String path) throws IOException {
    return path.matches(JSON_FILE_RE) ? loadJson(path) : loadLines(path);
  }

  /**
   * Words are kept verbatim; null entries are dropped.
   */
  public static List<String> loadJson(String path) throws IOException {
    log.debug("Loading JSON word list: {}", path);
    CharSource cs = FileUtil.findResourceAsCharSource(path);
    List<String> parsed;
    try (Reader reader = cs.openStream()) {
      parsed = new Gson().fromJson(reader, WORD_LIST_TYPE);
    } catch (JsonParseException e) {
      throw new IOException("Malformed word list: " + path, e);
    }

    List<String> words = new ArrayList<>();
    if (parsed != null) {
      for (String word : parsed) {
        if (word != null) words.add(word);
      }
    }
    log.info("Loaded {} words from {}", words.size(), path);
    return words;
  }

  /**
   * Lines are trimmed; blank lines and lines starting with
   * {@value #COMMENT_PREFIX} are skipped.
   */
  public static List<String> loadLines(String path) throws IOException {
    log.debug("Loading word list: {}", path);
    CharSource cs = FileUtil.findResourceAsCharSource(path);

    List<String> words = cs.readLines(new LineProcessor<List<String>>() {
      List<String> words = new ArrayList<>();

      @Override
      public List<String> getResult() {
        return this.words;
      }

      @Override
      public boolean processLine(String line) {
        String word = StringUtils.trim(line);
        if (StringUtils.isEmpty(word) || word.startsWith(COMMENT_PREFIX)) {
          return true;
        }
        this.words.add(word);
        return true;
      }
    });
    log.info("Loaded {} words from {}", words.size(), path);
    return words;
  }

  private WordListLoader() {
  }
}
