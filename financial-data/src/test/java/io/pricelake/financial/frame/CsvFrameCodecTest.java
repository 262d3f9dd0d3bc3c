package io.pricelake.financial.frame;

import io.pricelake.error.DataQualityException;
import io.pricelake.financial.model.Schemas;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvFrameCodecTest {
    private final CsvFrameCodec codec = new CsvFrameCodec();

    private Frame decode(String csv) {
        return codec.decode(csv.getBytes(StandardCharsets.UTF_8), Schemas.RAW);
    }

    @Test
    void typesCellsByDeclaredColumn() {
        Frame f = decode("instrument,date,close,volume\nX,2024-01-02,101.5,1200\n");
        assertEquals(1, f.rowCount());
        assertEquals("X", f.get(0, "instrument"));
        assertEquals(LocalDate.of(2024, 1, 2), f.get(0, "date"));
        assertEquals(101.5, f.get(0, "close"));
        assertEquals(1200L, f.get(0, "volume"));
    }

    @Test
    void emptyCellIsNullAndBadCellStaysText() {
        Frame f = decode("instrument,date,close\nX,,abc\n");
        assertNull(f.get(0, "date"));
        assertEquals("abc", f.get(0, "close"));
    }

    @Test
    void unknownColumnsAreKeptAsText() {
        Frame f = decode("instrument,date,note\nX,2024-01-02,42\n");
        assertEquals("42", f.get(0, "note"));
    }

    @Test
    void quotedCellsSurviveEncoding() {
        Frame f = Frame.builder(List.of("instrument", "note")).addRow("X", "a, \"b\"").build();
        String csv = new String(codec.encode(f), StandardCharsets.UTF_8);
        assertEquals("instrument,note\nX,\"a, \"\"b\"\"\"\n", csv);
        assertEquals("a, \"b\"", decode(csv).get(0, "note"));
    }

    @Test
    void lineBreakInsideAQuotedCellIsPartOfTheCell() {
        Frame f = Frame.builder(List.of("instrument", "note")).addRow("X", "first\nsecond").addRow("Y", "plain").build();
        Frame back = decode(new String(codec.encode(f), StandardCharsets.UTF_8));

        assertEquals(2, back.rowCount());
        assertEquals("first\nsecond", back.get(0, "note"));
        assertEquals("Y", back.get(1, "instrument"));
    }

    @Test
    void crlfAndBlankLinesBetweenRecordsAreIgnored() {
        Frame f = decode("instrument,date\r\nX,2024-01-02\r\n\r\nY,2024-01-03\r\n");
        assertEquals(2, f.rowCount());
        assertEquals("Y", f.get(1, "instrument"));
    }

    @Test
    void unterminatedQuoteIsADataError() {
        assertThrows(DataQualityException.class, () -> decode("instrument,note\nX,\"open\n"));
    }

    @Test
    void raggedLineIsADataError() {
        assertThrows(DataQualityException.class, () -> decode("instrument,date\nX\n"));
    }

    @Test
    void emptyFileIsADataError() {
        assertThrows(DataQualityException.class, () -> decode(""));
    }
}
