package com.eainde.vocab.table;

import com.eainde.vocab.model.Row;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the vocabulary table as CSV.
 *
 * <p>The header is {@code Term,Reading,Meaning} when no row carries an example or JLPT level,
 * otherwise all five columns. Files are written as UTF-8 with a byte-order mark so spreadsheet
 * tools detect the encoding; reading tolerates the mark either way.</p>
 */
public class CsvTableCodec {

    private static final Logger log = LoggerFactory.getLogger(CsvTableCodec.class);

    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper;

    public CsvTableCodec() {
        this(new CsvMapper());
    }

    public CsvTableCodec(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    // =========================================================================
    //  Write
    // =========================================================================

    public String write(List<Row> rows) {
        StringWriter out = new StringWriter();
        try {
            write(rows, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Writes header and rows; the target writer is flushed but left open.
     */
    public void write(List<Row> rows, Writer out) throws IOException {
        List<String> headers = TableGrid.headersFor(rows);
        CsvSchema schema = CsvSchema.builder()
                .addColumns(headers, CsvSchema.ColumnType.STRING)
                .build()
                .withHeader();

        try (SequenceWriter writer = csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(out)) {
            for (Row row : rows) {
                writer.write(toRecord(row, headers));
            }
        }
        out.flush();
    }

    public void writeFile(List<Row> rows, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write(BOM);
            write(rows, out);
        }
        log.info("Wrote {} rows to {}", rows.size(), path);
    }

    private static Map<String, String> toRecord(Row row, List<String> headers) {
        List<String> fields = row.fields();
        Map<String, String> record = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            record.put(headers.get(i), fields.get(i));
        }
        return record;
    }

    // =========================================================================
    //  Read
    // =========================================================================

    public List<Row> read(String csv) {
        try {
            return read(new StringReader(csv));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads rows after the header line. Short rows are padded, fully blank rows skipped.
     */
    public List<Row> read(Reader in) throws IOException {
        List<List<String>> grid = new ArrayList<>();
        try (MappingIterator<List<String>> records = csvMapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(skipBom(in))) {
            while (records.hasNext()) {
                grid.add(records.next());
            }
        }
        return TableGrid.fromGrid(grid);
    }

    public List<Row> readFile(Path path) throws IOException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Row> rows = read(in);
            log.info("Read {} rows from {}", rows.size(), path);
            return rows;
        }
    }

    private static Reader skipBom(Reader in) throws IOException {
        PushbackReader reader = new PushbackReader(in, 1);
        int first = reader.read();
        if (first != -1 && first != BOM) {
            reader.unread(first);
        }
        return reader;
    }
}
