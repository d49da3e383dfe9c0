package dev.citecrawl.text;

import dev.citecrawl.crawl.SeedDocument;
import dev.citecrawl.crawl.TextSource;
import dev.citecrawl.document.DocumentRef;
import dev.citecrawl.scopus.ScopusAbstract;
import dev.citecrawl.scopus.ScopusReferenceSource;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link TextSource} reading seed PDFs from disk and discovered documents from their Scopus
 * abstracts.
 *
 * <p>A seed that is not an existing file is treated as a DOI and loaded from Scopus like any
 * discovered document.
 */
@Service
public class DocumentTextSource implements TextSource {

  private static final Logger log = LoggerFactory.getLogger(DocumentTextSource.class);

  private final PdfTextExtractor pdfTextExtractor;
  private final ScopusReferenceSource scopus;

  public DocumentTextSource(PdfTextExtractor pdfTextExtractor, ScopusReferenceSource scopus) {
    this.pdfTextExtractor = pdfTextExtractor;
    this.scopus = scopus;
  }

  @Override
  public String fetch(String id) {
    return scopus.findAbstract(id).map(ScopusAbstract::toText).orElse("");
  }

  @Override
  public SeedDocument fetchSeed(String pathOrId) {
    Optional<Path> file = asExistingFile(pathOrId);
    if (file.isPresent()) {
      String text = pdfTextExtractor.extract(file.get());
      if (text.isBlank()) {
        return SeedDocument.unreadable();
      }
      return new SeedDocument(SeedMetadataExtractor.recover(text), text);
    }

    log.info("Seed {} is not a file, loading it from Scopus", pathOrId);
    Optional<ScopusAbstract> found = scopus.findAbstract(pathOrId);
    if (found.isEmpty()) {
      return SeedDocument.unreadable();
    }
    String title =
        found.get().title().isBlank() ? DocumentRef.PLACEHOLDER_TITLE : found.get().title();
    return new SeedDocument(new DocumentRef(pathOrId, title), found.get().toText());
  }

  private static Optional<Path> asExistingFile(String pathOrId) {
    try {
      Path path = Path.of(pathOrId);
      return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    } catch (InvalidPathException e) {
      return Optional.empty();
    }
  }
}
