package eu.virtualparadox.docingest.ingest.metadata;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextbookFilenameParserTest {

    private final TextbookFilenameParser parser = new TextbookFilenameParser();

    @Test
    @DisplayName("Conventional filename is decoded into Vietnamese labels")
    void parsesConventionalFilename() {
        BookMetadata metadata = parser.parse("SGK_TIN_CD_3.pdf");

        assertEquals(new BookMetadata("Sách giáo khoa", "Tin học", "Cánh Diều", "Lớp 3",
                "Sách giáo khoa Tin học Cánh Diều Lớp 3"), metadata);
        assertTrue(metadata.isParsed());
    }

    @Test
    @DisplayName("Codes are matched case-insensitively")
    void lowercaseCodes() {
        BookMetadata metadata = parser.parse("sbt_toan_kn_10.pdf");

        assertEquals("Sách bài tập", metadata.bookType());
        assertEquals("Toán", metadata.subject());
        assertEquals("Kết Nối Tri Thức", metadata.publisher());
        assertEquals("Lớp 10", metadata.grade());
    }

    @Test
    @DisplayName("Unknown codes pass through and extra fields are ignored")
    void unknownCodesPassThrough() {
        BookMetadata metadata = parser.parse("STK_MUSIC_ABC_12_tap1.pdf");

        assertEquals("Sách tham khảo", metadata.bookType());
        assertEquals("MUSIC", metadata.subject());
        assertEquals("ABC", metadata.publisher());
        assertEquals("Lớp 12", metadata.grade());
        assertEquals("Sách tham khảo MUSIC ABC Lớp 12", metadata.fullName());
    }

    @Test
    @DisplayName("Filenames with fewer than four fields fall back to the filename")
    void unparseableFilename() {
        assertEquals(new BookMetadata("", "", "", "", "random.pdf"), parser.parse("random.pdf"));
        assertEquals("SGK_TIN_CD.pdf", parser.parse("SGK_TIN_CD.pdf").fullName());
        assertFalse(parser.parse("random.pdf").isParsed());
        assertEquals("", parser.parse(null).fullName());
    }

    @Test
    @DisplayName("A trailing empty field still counts as the grade")
    void trailingEmptyField() {
        BookMetadata metadata = parser.parse("SGK_TIN_CD_.pdf");

        assertTrue(metadata.isParsed());
        assertEquals("Sách giáo khoa", metadata.bookType());
        assertEquals("Tin học", metadata.subject());
        assertEquals("Cánh Diều", metadata.publisher());
        assertEquals("Lớp ", metadata.grade());
    }

    @Test
    @DisplayName("Only the known book type prefixes follow the convention")
    void conventionCheck() {
        assertTrue(parser.followsConvention("SGK_TIN_CD_3.pdf"));
        assertTrue(parser.followsConvention("sbt_van_ct_6.pdf"));
        assertFalse(parser.followsConvention("notes_TIN_CD_3.pdf"));
        assertFalse(parser.followsConvention("SGKTIN.pdf"));
        assertFalse(parser.followsConvention(null));
    }
}
