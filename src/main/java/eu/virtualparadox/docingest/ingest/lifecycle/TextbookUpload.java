package eu.virtualparadox.docingest.ingest.lifecycle;

import eu.virtualparadox.docingest.ingest.exception.FileContext;

/**
 * A textbook upload with the book details supplied by the caller.
 *
 * @param grade       optional, may be {@code null}
 * @param productName optional display name, defaults to the book's full name
 */
public record TextbookUpload(String filename,
                             String mimeType,
                             byte[] content,
                             String bookName,
                             String publisher,
                             String grade,
                             String productName) {

    public TextbookUpload {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public FileContext context() {
        return new FileContext(filename, content.length, mimeType);
    }

    public TextbookDetails details() {
        return TextbookDetails.of(bookName, publisher, grade, productName);
    }
}
