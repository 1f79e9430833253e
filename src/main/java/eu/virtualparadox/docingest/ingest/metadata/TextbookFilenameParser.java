package eu.virtualparadox.docingest.ingest.metadata;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses textbook filenames of the form {@code TYPE_SUBJECT_PUBLISHER_GRADE.ext},
 * e.g. {@code SGK_TIN_CD_3.pdf} becomes "Sách giáo khoa Tin học Cánh Diều Lớp 3".
 * Codes missing from the tables are used verbatim.
 */
@Slf4j
@Component
public class TextbookFilenameParser {

    private static final Map<String, String> BOOK_TYPES = Map.of(
            "SGK", "Sách giáo khoa",
            "SBT", "Sách bài tập",
            "STK", "Sách tham khảo"
    );

    private static final Map<String, String> SUBJECTS = Map.of(
            "TIN", "Tin học",
            "TOAN", "Toán",
            "VAN", "Ngữ văn",
            "ANH", "Tiếng Anh",
            "LY", "Vật lý",
            "HOA", "Hóa học",
            "SINH", "Sinh học",
            "SU", "Lịch sử",
            "DIA", "Địa lý",
            "GDCD", "Giáo dục công dân"
    );

    private static final Map<String, String> PUBLISHERS = Map.of(
            "CD", "Cánh Diều",
            "KN", "Kết Nối Tri Thức",
            "CT", "Chân Trời Sáng Tạo",
            "NXB", "Nhà xuất bản"
    );

    private static final List<String> CONVENTION_PREFIXES = List.of("SGK_", "SBT_", "STK_");

    /**
     * @param filename uploaded filename, with or without extension
     * @return the decoded labels; {@link BookMetadata#unparsed(String)} when fewer than four fields are present
     */
    public BookMetadata parse(final String filename) {
        if (filename == null || filename.isBlank()) {
            log.warn("Cannot parse textbook metadata from an empty filename");
            return BookMetadata.unparsed(filename == null ? "" : filename);
        }

        final int dot = filename.indexOf('.');
        final String stem = dot >= 0 ? filename.substring(0, dot) : filename;
        final String[] parts = stem.split("_", -1);
        if (parts.length < 4) {
            log.warn("Filename {} does not follow TYPE_SUBJECT_PUBLISHER_GRADE, using it as the book name", filename);
            return BookMetadata.unparsed(filename);
        }

        final String bookType = lookup(BOOK_TYPES, parts[0]);
        final String subject = lookup(SUBJECTS, parts[1]);
        final String publisher = lookup(PUBLISHERS, parts[2]);
        final String grade = "Lớp " + parts[3];

        final BookMetadata metadata = new BookMetadata(bookType, subject, publisher, grade,
                String.join(" ", bookType, subject, publisher, grade));
        log.debug("Parsed {} as {}", filename, metadata.fullName());
        return metadata;
    }

    /**
     * @return {@code true} if the filename starts with a known book type prefix, ignoring case
     */
    public boolean followsConvention(final String filename) {
        if (filename == null) {
            return false;
        }
        final String upper = filename.toUpperCase(Locale.ROOT);
        return CONVENTION_PREFIXES.stream().anyMatch(upper::startsWith);
    }

    private static String lookup(final Map<String, String> table, final String code) {
        return table.getOrDefault(code.toUpperCase(Locale.ROOT), code);
    }
}
