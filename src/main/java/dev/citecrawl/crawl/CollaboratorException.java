package dev.citecrawl.crawl;

/** Transport or authentication failure of an external collaborator. */
public class CollaboratorException extends RuntimeException {

  public CollaboratorException(String message) {
    super(message);
  }

  public CollaboratorException(String message, Throwable cause) {
    super(message, cause);
  }
}
