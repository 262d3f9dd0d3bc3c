package io.pricelake.financial.frame;

import io.pricelake.error.DataQualityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes a {@link Frame} as UTF-8 CSV with a header line. Cells are typed by the schema column of the
 * same name; an empty cell is null. A cell that does not parse as its declared type is kept as text, and
 * columns unknown to the schema are kept as text.
 */
public final class CsvFrameCodec {
    private static final Logger log = LoggerFactory.getLogger(CsvFrameCodec.class);

    public Frame decode(byte[] data, Schema schema) {
        List<List<String>> records = records(new String(data, StandardCharsets.UTF_8));
        if (records.isEmpty()) {
            throw new DataQualityException("Empty partition file, no header for schema " + schema.name());
        }
        List<String> header = records.get(0);
        List<ColumnType> types = new ArrayList<>(header.size());
        for (String h : header) {
            Optional<Column> declared = schema.column(h);
            types.add(declared.map(Column::type).orElse(ColumnType.STRING));
        }
        Frame.Builder builder;
        try {
            builder = Frame.builder(header);
        } catch (IllegalArgumentException e) {
            throw new DataQualityException("Bad header in " + schema.name() + " file: " + e.getMessage());
        }
        int unparsed = 0;
        for (int i = 1; i < records.size(); i++) {
            List<String> cells = records.get(i);
            if (cells.size() != header.size()) {
                throw new DataQualityException("Record " + (i + 1) + " has " + cells.size() + " cells, header has " + header.size());
            }
            Object[] row = new Object[cells.size()];
            for (int c = 0; c < cells.size(); c++) {
                String cell = cells.get(c);
                if (cell.isEmpty()) continue;
                try {
                    row[c] = types.get(c).parse(cell);
                } catch (RuntimeException e) {
                    row[c] = cell;
                    unparsed++;
                }
            }
            builder.addRow(row);
        }
        if (unparsed > 0) log.debug("{} cells did not match their declared type in a {} file", unparsed, schema.name());
        return builder.build();
    }

    public byte[] encode(Frame frame) {
        StringBuilder out = new StringBuilder();
        List<String> names = new ArrayList<>(frame.columnNames());
        appendLine(out, names);
        List<String> cells = new ArrayList<>(names.size());
        for (int r = 0; r < frame.rowCount(); r++) {
            cells.clear();
            for (String n : names) cells.add(ColumnType.format(frame.get(r, n)));
            appendLine(out, cells);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void appendLine(StringBuilder out, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) out.append(',');
            out.append(quote(cells.get(i)));
        }
        out.append('\n');
    }

    private static String quote(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) return cell;
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    /**
     * Splits CSV text into records of cells. Quoted cells may hold commas, doubled quotes and line breaks; blank
     * lines between records are ignored.
     */
    static List<List<String>> records(String text) {
        List<List<String>> out = new ArrayList<>();
        List<String> cells = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean content = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cur.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
                content = true;
            } else if (ch == ',') {
                cells.add(cur.toString());
                cur.setLength(0);
                content = true;
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                if (content) {
                    cells.add(cur.toString());
                    out.add(cells);
                }
                cells = new ArrayList<>();
                cur.setLength(0);
                content = false;
            } else {
                cur.append(ch);
                if (!Character.isWhitespace(ch)) content = true;
            }
        }
        if (quoted) throw new DataQualityException("Unterminated quoted cell in record " + (out.size() + 1));
        if (content) {
            cells.add(cur.toString());
            out.add(cells);
        }
        return out;
    }
}
