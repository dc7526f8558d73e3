package io.organise.workbench.modify;

/**
 * Column names of the repository ingest sheet.
 */
public final class Columns {
    public static final String ACCESS_IDENTIFIER = "accessIdentifier";
    public static final String PARENT_ID = "parent_id";
    public static final String FILE = "file";
    public static final String FILE_EXTENSION = "file_extension";
    /** Misspelling found in older sheets; read when {@link #FILE_EXTENSION} is empty. */
    public static final String FILE_EXTENSION_LEGACY = "file_extention";
    public static final String FILE_TITLE = "fileTitle";
    public static final String FIELD_DESCRIPTION = "field_description";
    public static final String FIELD_MODEL = "field_model";

    private Columns() {}
}
