package com.wbsledger.reports.ingest;

import com.wbsledger.reports.model.ExportTable;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class ExportReaderService {

    private final Map<ExportFormat, ExportReader> readers = new EnumMap<>(ExportFormat.class);

    public ExportReaderService(List<ExportReader> readers) {
        for (ExportReader reader : readers) {
            this.readers.put(reader.format(), reader);
        }
    }

    public ExportTable read(byte[] content, CleaningProfile profile) {
        ExportReader reader = readers.get(profile.format());
        if (reader == null) {
            throw new IllegalArgumentException("No reader registered for format " + profile.format());
        }
        return reader.read(content, profile);
    }
}
