package io.organise.workbench.modify;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * File extension to repository model lookup, loaded once before a run and immutable afterwards.
 *
 * <p>Properties layout:
 * <pre>
 * default.model=Binary
 * extension.tif=Image
 * category.image.model=Image
 * category.image.extensions=jpg,jpeg,png
 * </pre>
 * Explicit {@code extension.*} entries win over category lists; when two categories list the same
 * extension the one whose name sorts first wins.
 */
public final class FieldModelMappings {
    public static final String DEFAULT_RESOURCE = "/field-model-mappings.properties";
    static final String FALLBACK_MODEL = "Binary";

    private final Map<String, String> byExtension;
    private final String defaultModel;

    private FieldModelMappings(Map<String, String> byExtension, String defaultModel) {
        this.byExtension = Map.copyOf(byExtension);
        this.defaultModel = defaultModel;
    }

    public static FieldModelMappings defaults() throws IOException {
        try (InputStream in = FieldModelMappings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("Bundled field model mappings not found: " + DEFAULT_RESOURCE);
            Properties props = new Properties();
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return from(props);
        }
    }

    public static FieldModelMappings load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new IOException("Failed to read field model mapping configuration from " + file, e);
        }
        return from(props);
    }

    public static FieldModelMappings from(Properties props) {
        Map<String, String> mappings = new HashMap<>();
        TreeSet<String> categories = new TreeSet<>();
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key).trim();
            if (key.startsWith("extension.")) {
                String ext = normalizeExtension(key.substring("extension.".length()));
                if (ext.isEmpty() || value.isEmpty()) {
                    throw new IllegalArgumentException("Invalid extension mapping '" + key + "=" + value + "'");
                }
                mappings.put(ext, value);
            } else if (key.startsWith("category.")) {
                int dot = key.lastIndexOf('.');
                if (dot <= "category.".length()) {
                    throw new IllegalArgumentException("Invalid category key '" + key + "'");
                }
                categories.add(key.substring("category.".length(), dot));
            }
        }
        for (String category : categories) {
            String model = props.getProperty("category." + category + ".model", "").trim();
            String extensions = props.getProperty("category." + category + ".extensions", "");
            if (model.isEmpty()) {
                throw new IllegalArgumentException("Category '" + category + "' has no model");
            }
            for (String ext : extensions.split(",")) {
                String key = normalizeExtension(ext);
                if (!key.isEmpty()) mappings.putIfAbsent(key, model);
            }
        }
        String defaultModel = props.getProperty("default.model", FALLBACK_MODEL).trim();
        return new FieldModelMappings(mappings, defaultModel.isEmpty() ? FALLBACK_MODEL : defaultModel);
    }

    public String modelFor(String extension) {
        String key = normalizeExtension(extension);
        if (key.isEmpty()) return defaultModel;
        return byExtension.getOrDefault(key, defaultModel);
    }

    public String defaultModel() { return defaultModel; }

    public int size() { return byExtension.size(); }

    static String normalizeExtension(String value) {
        String v = value == null ? "" : value.trim();
        while (v.startsWith(".")) v = v.substring(1);
        return v.toLowerCase(Locale.ROOT);
    }
}
