package com.verlumen.symreg.evaluation;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads samples from a text file with one {@code x,y} pair per line. Blank lines and lines
 * starting with {@code #} are ignored; pairs may be separated by commas or whitespace.
 */
public final class FileSampleProvider implements SampleProvider {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter FIELDS = Splitter.onPattern("[,\\s]+").omitEmptyStrings();

  private final File file;

  public static FileSampleProvider create(File file) {
    return new FileSampleProvider(checkNotNull(file));
  }

  private FileSampleProvider(File file) {
    this.file = file;
  }

  @Override
  public SampleSet samples() {
    List<String> lines;
    try {
      lines = Files.asCharSource(file, UTF_8).readLines();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read samples from " + file, e);
    }

    ImmutableList.Builder<SamplePair> pairs = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      pairs.add(parseLine(line, i + 1));
    }
    SampleSet samples = SampleSet.of(pairs.build());
    logger.atInfo().log("Loaded %d samples from %s", samples.size(), file);
    return samples;
  }

  private SamplePair parseLine(String line, int lineNumber) {
    List<String> fields = FIELDS.splitToList(line);
    if (fields.size() != 2) {
      throw new IllegalArgumentException(
          String.format("%s:%d: expected 'x,y' but got '%s'", file, lineNumber, line));
    }
    try {
      return SamplePair.of(Double.parseDouble(fields.get(0)), Double.parseDouble(fields.get(1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s:%d: not a number in '%s'", file, lineNumber, line), e);
    }
  }
}
