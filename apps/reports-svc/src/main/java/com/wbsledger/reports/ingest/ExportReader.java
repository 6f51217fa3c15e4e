package com.wbsledger.reports.ingest;

import com.wbsledger.reports.model.ExportTable;

public interface ExportReader {

    ExportFormat format();

    /**
     * Decodes, cleans and reads an export.
     *
     * @throws ExportParseException when the content cannot be reconciled into rows
     */
    ExportTable read(byte[] content, CleaningProfile profile);
}
