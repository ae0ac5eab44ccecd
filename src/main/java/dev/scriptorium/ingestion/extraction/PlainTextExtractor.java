package dev.scriptorium.ingestion.extraction;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads {@code .txt} files. Decodes strictly as UTF-8 first, then falls back to windows-1251 and
 * ISO-8859-1 for legacy files.
 */
@Component
public class PlainTextExtractor implements TextExtractor {

  private static final Logger log = LoggerFactory.getLogger(PlainTextExtractor.class);

  static final List<Charset> CHARSETS =
      List.of(StandardCharsets.UTF_8, Charset.forName("windows-1251"), StandardCharsets.ISO_8859_1);

  @Override
  public boolean supports(String extension) {
    return ".txt".equals(extension);
  }

  @Override
  public ExtractedDocument extract(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    for (Charset charset : CHARSETS) {
      try {
        String text = decodeStrictly(bytes, charset);
        if (!charset.equals(StandardCharsets.UTF_8)) {
          log.debug("Decoded {} as {}", path, charset.name());
        }
        return new ExtractedDocument(
            text,
            Map.of(
                "file_type", "txt",
                "line_count", text.split("\n", -1).length,
                "encoding", charset.name()));
      } catch (CharacterCodingException e) {
        log.debug("{} is not valid {}", path, charset.name());
      }
    }
    throw new IOException("Could not decode text file " + path);
  }

  private static String decodeStrictly(byte[] bytes, Charset charset)
      throws CharacterCodingException {
    return charset
        .newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }
}
