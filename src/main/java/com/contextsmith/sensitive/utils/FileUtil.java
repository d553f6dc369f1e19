package com.contextsmith.sensitive.utils;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.ByteSource;
import com.google.common.io.CharSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;

public class FileUtil {
  private static final Logger log = LoggerFactory.getLogger(FileUtil.class);

  public static final String COMPRESSED_FILE_RE = ".+?\\.(gz|gzip)";

  public static boolean exists(String filename) {
    return locate(filename) != null;
  }

  /**
   * Looks the file up on disk first, then in the class-path. Compressed files
   * are decompressed transparently.
   *
   * @throws FileNotFoundException if the file is in neither place
   */
  public static ByteSource findResourceAsByteSource(String filename)
      throws FileNotFoundException {
    checkNotNull(filename);
    ByteSource source = locate(filename);
    if (source == null) {
      log.error("Could not locate: {}", filename);
      throw new FileNotFoundException("Could not locate: " + filename);
    }
    if (!filename.matches(COMPRESSED_FILE_RE)) return source;

    final ByteSource compressed = source;
    return new ByteSource() {
      @Override
      public InputStream openStream() throws IOException {
        return new GZIPInputStream(compressed.openStream());
      }
    };
  }

  public static CharSource findResourceAsCharSource(String filename)
      throws FileNotFoundException {
    return findResourceAsByteSource(filename).asCharSource(
        StandardCharsets.UTF_8);
  }

  public static Properties loadProperties(String filename) throws IOException {
    Properties prop = new Properties();
    try (Reader reader = findResourceAsCharSource(filename).openStream()) {
      prop.load(reader);
    }
    log.debug("Loaded {} properties from {}", prop.size(), filename);
    return prop;
  }

  private static ByteSource locate(String filename) {
    File f = new File(filename);
    if (f.isFile()) return Files.asByteSource(f);

    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    URL url = classLoader.getResource(filename);
    if (url == null) url = classLoader.getResource(f.getName());
    return (url == null) ? null : Resources.asByteSource(url);
  }

  private FileUtil() {
  }
}
