package com.verlumen.symreg.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FileSampleProviderTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void samples_readsPairsSkippingCommentsAndBlankLines() throws IOException {
    File file = write("# x, y\n0.0,1.0\n\n  0.5 , 1.75\n1e-1 1.11\n");

    SampleSet samples = FileSampleProvider.create(file).samples();

    assertThat(samples.pairs())
        .containsExactly(
            SamplePair.of(0.0, 1.0), SamplePair.of(0.5, 1.75), SamplePair.of(0.1, 1.11))
        .inOrder();
  }

  @Test
  public void samples_withMalformedLine_namesTheLine() throws IOException {
    File file = write("0.0,1.0\n0.5\n");

    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> FileSampleProvider.create(file).samples());

    assertThat(thrown).hasMessageThat().contains(":2:");
  }

  @Test
  public void samples_withNonNumericField_throws() throws IOException {
    File file = write("0.0,one\n");

    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> FileSampleProvider.create(file).samples());

    assertThat(thrown).hasCauseThat().isInstanceOf(NumberFormatException.class);
  }

  @Test
  public void samples_withOnlyComments_throws() throws IOException {
    File file = write("# nothing here\n");

    assertThrows(IllegalArgumentException.class, () -> FileSampleProvider.create(file).samples());
  }

  @Test
  public void samples_withMissingFile_throwsUncheckedIOException() {
    File missing = new File(temporaryFolder.getRoot(), "missing.csv");

    assertThrows(UncheckedIOException.class, () -> FileSampleProvider.create(missing).samples());
  }

  private File write(String content) throws IOException {
    File file = temporaryFolder.newFile();
    Files.asCharSink(file, UTF_8).write(content);
    return file;
  }
}
