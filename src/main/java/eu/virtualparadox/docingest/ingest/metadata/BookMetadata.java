package eu.virtualparadox.docingest.ingest.metadata;

/**
 * Human-readable description of a textbook, derived from its filename.
 *
 * @param bookType  e.g. {@code "Sách giáo khoa"}
 * @param subject   e.g. {@code "Tin học"}
 * @param publisher e.g. {@code "Cánh Diều"}
 * @param grade     e.g. {@code "Lớp 3"}
 * @param fullName  the four labels joined by spaces, or the filename when it could not be parsed
 */
public record BookMetadata(String bookType, String subject, String publisher, String grade, String fullName) {

    public static BookMetadata unparsed(final String filename) {
        return new BookMetadata("", "", "", "", filename);
    }

    public boolean isParsed() {
        return !bookType.isEmpty();
    }
}
