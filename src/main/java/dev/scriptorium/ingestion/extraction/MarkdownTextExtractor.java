package dev.scriptorium.ingestion.extraction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Reads {@code .md} files and renders them to plain text with commonmark, GFM tables included.
 * The first level-1 heading, if any, becomes the {@code title} metadata entry.
 */
@Component
public class MarkdownTextExtractor implements TextExtractor {

  private final Parser parser;
  private final TextContentRenderer textRenderer;

  public MarkdownTextExtractor() {
    List<Extension> extensions = List.of(TablesExtension.create());
    this.parser = Parser.builder().extensions(extensions).build();
    this.textRenderer = TextContentRenderer.builder().extensions(extensions).build();
  }

  @Override
  public boolean supports(String extension) {
    return ".md".equals(extension) || ".markdown".equals(extension);
  }

  @Override
  public ExtractedDocument extract(Path path) throws IOException {
    return render(Files.readString(path, StandardCharsets.UTF_8));
  }

  /** Renders Markdown source to plain text plus heading metadata. */
  ExtractedDocument render(String markdown) {
    Node document = parser.parse(markdown);
    HeadingCollector headings = new HeadingCollector();
    document.accept(headings);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("file_type", "md");
    metadata.put("heading_count", headings.count);
    if (headings.title != null) {
      metadata.put("title", headings.title);
    }
    return new ExtractedDocument(textRenderer.render(document), metadata);
  }

  private final class HeadingCollector extends AbstractVisitor {

    private int count;
    private @Nullable String title;

    @Override
    public void visit(Heading heading) {
      count++;
      if (title == null && heading.getLevel() == 1) {
        title = textRenderer.render(heading).trim();
      }
      visitChildren(heading);
    }
  }
}
