package io.pricelake.financial.registry;

import io.pricelake.error.DataQualityException;
import io.pricelake.error.TransientIoException;
import io.pricelake.financial.frame.Column;
import io.pricelake.financial.frame.ColumnType;
import io.pricelake.financial.frame.CsvFrameCodec;
import io.pricelake.financial.frame.Frame;
import io.pricelake.financial.frame.Schema;
import io.pricelake.financial.model.InstrumentInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry read from a constituents CSV with columns
 * {@code ticker_symbol,security_name,gics_sector,gics_sub_industry,headquarters}. Only {@code ticker_symbol} is
 * required. Share-class dots are normalized to dashes ({@code BRK.B} becomes {@code BRK-B}) to match the
 * price API's symbols.
 */
public class CsvInstrumentRegistry implements InstrumentRegistry {
    private static final Logger log = LoggerFactory.getLogger(CsvInstrumentRegistry.class);

    static final String TICKER = "ticker_symbol";
    static final Schema SCHEMA = new Schema("instruments", List.of(
            Column.required(TICKER, ColumnType.STRING),
            Column.optional("security_name", ColumnType.STRING),
            Column.optional("gics_sector", ColumnType.STRING),
            Column.optional("gics_sub_industry", ColumnType.STRING),
            Column.optional("headquarters", ColumnType.STRING)), List.of(TICKER));

    private final Path file;
    private final CsvFrameCodec codec = new CsvFrameCodec();

    public CsvInstrumentRegistry(Path file) {
        this.file = file;
    }

    @Override
    public List<InstrumentInfo> list() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new TransientIoException("Cannot read instrument list " + file, e);
        }
        Frame frame = codec.decode(bytes, SCHEMA);
        if (!frame.hasColumn(TICKER)) {
            throw new DataQualityException("Instrument list " + file + " has no '" + TICKER + "' column");
        }
        List<InstrumentInfo> out = new ArrayList<>(frame.rowCount());
        Set<String> seen = new LinkedHashSet<>();
        for (int i = 0; i < frame.rowCount(); i++) {
            Object raw = frame.get(i, TICKER);
            if (raw == null) {
                log.warn("Skipping instrument row {} without a ticker in {}", i + 2, file);
                continue;
            }
            String id = normalize(raw.toString());
            if (!seen.add(id)) continue;
            out.add(new InstrumentInfo(id, text(frame, i, "security_name"), text(frame, i, "gics_sector"),
                    text(frame, i, "gics_sub_industry"), text(frame, i, "headquarters")));
        }
        log.info("Loaded {} instruments from {}", out.size(), file);
        return out;
    }

    static String normalize(String symbol) {
        return symbol.trim().replace('.', '-');
    }

    private static String text(Frame frame, int row, String column) {
        if (!frame.hasColumn(column)) return null;
        Object v = frame.get(row, column);
        return v == null ? null : v.toString();
    }
}
