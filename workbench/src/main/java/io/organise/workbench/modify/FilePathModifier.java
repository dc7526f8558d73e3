package io.organise.workbench.modify;

import java.util.Optional;

/**
 * Rewrites {@code file} as {@code {parent}/{base}.{extension}}, where the parent directory comes
 * from {@code accessIdentifier}, the base name is the current value without its extension and the
 * extension comes from {@code file_extension} (or the legacy {@code file_extention}).
 * When any of the three inputs is missing the row fails validation and the target is cleared.
 */
public class FilePathModifier implements ColumnModifier {
    public static final String NAME = "file-extension";

    @Override
    public String modify(String value, RowContext context) {
        String file = Cells.normalize(value);
        String accessIdentifier = context.getOrEmpty(Columns.ACCESS_IDENTIFIER);
        Optional<String> extension = extension(context);
        if (file.isEmpty() || accessIdentifier.isEmpty() || extension.isEmpty()) {
            return "";
        }
        return Cells.beforeLastUnderscore(accessIdentifier) + '/' + stripExtension(file) + '.' + extension.get();
    }

    @Override
    public boolean validate(String value, RowContext context) {
        return !Cells.isAbsent(value)
                && !context.getOrEmpty(Columns.ACCESS_IDENTIFIER).isEmpty()
                && extension(context).isPresent();
    }

    @Override
    public boolean appliesTo(RowContext context) {
        return context.has(Columns.ACCESS_IDENTIFIER)
                && (context.has(Columns.FILE_EXTENSION) || context.has(Columns.FILE_EXTENSION_LEGACY));
    }

    @Override
    public String description() {
        return "Creates file path with parent_id directory and file extension from accessIdentifier";
    }

    private static Optional<String> extension(RowContext context) {
        return context.firstNonEmpty(Columns.FILE_EXTENSION, Columns.FILE_EXTENSION_LEGACY);
    }

    private static String stripExtension(String file) {
        int dot = file.lastIndexOf('.');
        return dot < 0 ? file : file.substring(0, dot);
    }
}
