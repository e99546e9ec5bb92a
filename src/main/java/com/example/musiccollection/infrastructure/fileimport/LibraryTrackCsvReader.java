package com.example.musiccollection.infrastructure.fileimport;

import com.example.musiccollection.infrastructure.persistence.entity.LibraryTrackEntity;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Streams the library's track export (UTF-8 CSV with header, optional BOM) into
 * {@link LibraryTrackEntity} rows.
 */
@Component
public class LibraryTrackCsvReader {

    private static final Logger log = LoggerFactory.getLogger(LibraryTrackCsvReader.class);

    private static final char BOM = '\uFEFF';

    public ImportStats read(Path file, Consumer<LibraryTrackEntity> sink) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, sink);
        }
    }

    public ImportStats read(Reader source, Consumer<LibraryTrackEntity> sink) throws IOException {
        ImportStats stats = new ImportStats();
        try (CSVReader csvReader = new CSVReader(source)) {
            String[] header = csvReader.readNext();
            if (header == null) {
                return stats;
            }
            Map<String, Integer> columns = indexHeader(header);
            long lineNo = 1;
            String[] row;
            while ((row = csvReader.readNext()) != null) {
                lineNo++;
                if (row.length == 1 && row[0].trim().isEmpty()) {
                    continue;
                }
                if (row.length != header.length) {
                    stats.setRecordsSkipped(stats.getRecordsSkipped() + 1);
                    log.warn("TRACK_CSV_ROW_SKIPPED line={} expectedColumns={} actualColumns={}",
                            lineNo, header.length, row.length);
                    continue;
                }
                sink.accept(toEntity(columns, row));
                stats.setRecordsRead(stats.getRecordsRead() + 1);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Unreadable track CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
        return stats;
    }

    private Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            columns.put(name.trim(), i);
        }
        return columns;
    }

    private LibraryTrackEntity toEntity(Map<String, Integer> columns, String[] row) {
        LibraryTrackEntity entity = new LibraryTrackEntity();
        entity.setAlbumArtist(ExportFields.required(value(columns, row, ExportFields.ALBUM_ARTIST), 300));
        entity.setAlbum(ExportFields.required(value(columns, row, ExportFields.ALBUM), 500));
        entity.setDiscNumber(ExportFields.toInteger(value(columns, row, ExportFields.DISC_NUMBER)));
        entity.setTrackNumber(ExportFields.toInteger(value(columns, row, ExportFields.TRACK_NUMBER)));
        entity.setTrackTitle(ExportFields.required(value(columns, row, ExportFields.TITLE), 500));
        entity.setTrackArtists(ExportFields.optional(value(columns, row, ExportFields.TRACK_ARTISTS), 500));
        entity.setComposers(ExportFields.optional(value(columns, row, ExportFields.COMPOSERS), 500));
        entity.setExternalId(ExportFields.optional(value(columns, row, ExportFields.EXTERNAL_ID), 100));
        entity.setSource(ExportFields.required(value(columns, row, ExportFields.SOURCE), 50));
        entity.setIsDuplicate(ExportFields.isYes(value(columns, row, ExportFields.IS_DUPLICATE)));
        entity.setIsHidden(ExportFields.isYes(value(columns, row, ExportFields.IS_HIDDEN)));
        entity.setTags(ExportFields.optional(value(columns, row, ExportFields.TAGS), Integer.MAX_VALUE));
        return entity;
    }

    private String value(Map<String, Integer> columns, String[] row, String column) {
        Integer index = columns.get(column);
        return index == null ? null : row[index];
    }
}
