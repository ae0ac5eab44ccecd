package dev.scriptorium.ingestion.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MarkdownTextExtractorTest {

  private final MarkdownTextExtractor extractor = new MarkdownTextExtractor();

  @Test
  void supportsMarkdownExtensions() {
    assertThat(extractor.supports(".md")).isTrue();
    assertThat(extractor.supports(".markdown")).isTrue();
    assertThat(extractor.supports(".txt")).isFalse();
  }

  @Test
  void rendersMarkupAsPlainText() {
    ExtractedDocument document =
        extractor.render("# Guide\n\nSome **bold** and `code` with a [link](https://example.com).\n");

    assertThat(document.text())
        .contains("Guide")
        .contains("Some bold and")
        .contains("link")
        .doesNotContain("**")
        .doesNotContain("](");
  }

  @Test
  void firstLevelOneHeadingBecomesTitle() {
    ExtractedDocument document =
        extractor.render("Intro text\n\n## Setup\n\n# Real Title\n\n# Second Title\n");

    assertThat(document.metadata())
        .containsEntry("file_type", "md")
        .containsEntry("heading_count", 3)
        .containsEntry("title", "Real Title");
  }

  @Test
  void documentWithoutHeadingsHasNoTitle() {
    ExtractedDocument document = extractor.render("Just a paragraph.");

    assertThat(document.metadata()).containsEntry("heading_count", 0).doesNotContainKey("title");
  }

  @Test
  void tableCellsAreRendered() {
    ExtractedDocument document =
        extractor.render("| Name | Size |\n|------|------|\n| alpha | 10 |\n");

    assertThat(document.text()).contains("alpha").contains("10").doesNotContain("---");
  }

  @Test
  void extractReadsFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("readme.md");
    Files.writeString(file, "# Readme\n\nBody.");

    ExtractedDocument document = extractor.extract(file);

    assertThat(document.metadata()).containsEntry("title", "Readme");
    assertThat(document.text()).contains("Body.");
  }
}
