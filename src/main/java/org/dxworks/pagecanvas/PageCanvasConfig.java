package org.dxworks.pagecanvas;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.pagecanvas.markup.BoundedMarkupScanner;
import org.dxworks.pagecanvas.model.CanvasMarkup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Settings that shape how canvas markup is parsed and written. Immutable; pass one instance to
 * every page that should share them.
 */
public class PageCanvasConfig {

    private static final Logger log = LoggerFactory.getLogger(PageCanvasConfig.class);

    private static final String CONFIG_FILE_NAME = "pagecanvas-config.yml";
    private static final String DEFAULT_DATA_VERSION = CanvasMarkup.DEFAULT_DATA_VERSION;
    private static final int DEFAULT_MAX_NESTING_DEPTH = BoundedMarkupScanner.DEFAULT_MAX_DEPTH;
    private static final boolean DEFAULT_STRICT_TEXT_CONTENT = false;
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final List<String> DEFAULT_FILE_EXTENSIONS = List.of(".html", ".htm", ".aspx");

    private static final PageCanvasConfig DEFAULTS = new PageCanvasConfig(DEFAULT_DATA_VERSION,
            DEFAULT_MAX_NESTING_DEPTH, DEFAULT_STRICT_TEXT_CONTENT, DEFAULT_MAX_FILE_LINES, DEFAULT_FILE_EXTENSIONS);

    private final String dataVersion;
    private final int maxNestingDepth;
    private final boolean strictTextContent;
    private final int maxFileLines;
    private final List<String> fileExtensions;
    private final BoundedMarkupScanner markupScanner;

    private PageCanvasConfig(String dataVersion, int maxNestingDepth, boolean strictTextContent,
                             int maxFileLines, List<String> fileExtensions) {
        this.dataVersion = dataVersion;
        this.maxNestingDepth = maxNestingDepth;
        this.strictTextContent = strictTextContent;
        this.maxFileLines = maxFileLines;
        this.fileExtensions = List.copyOf(fileExtensions);
        this.markupScanner = new BoundedMarkupScanner(maxNestingDepth);
    }

    /** Value written to {@code data-sp-canvasdataversion} on new sections, columns and controls. */
    public String getDataVersion() {
        return dataVersion;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /** When set, a text control without its content holder fails the parse instead of reading as empty. */
    public boolean isStrictTextContent() {
        return strictTextContent;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public List<String> getFileExtensions() {
        return fileExtensions;
    }

    public BoundedMarkupScanner markupScanner() {
        return markupScanner;
    }

    public boolean acceptsFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return fileExtensions.stream().anyMatch(lower::endsWith);
    }

    public static PageCanvasConfig defaults() {
        return DEFAULTS;
    }

    public static PageCanvasConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PageCanvasConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return DEFAULTS;
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                String effectiveDataVersion = (yamlConfig.dataVersion != null && !yamlConfig.dataVersion.isBlank())
                        ? yamlConfig.dataVersion.trim()
                        : DEFAULT_DATA_VERSION;
                int effectiveMaxNestingDepth = (yamlConfig.maxNestingDepth != null && yamlConfig.maxNestingDepth > 0)
                        ? yamlConfig.maxNestingDepth
                        : DEFAULT_MAX_NESTING_DEPTH;
                boolean effectiveStrictTextContent = (yamlConfig.strictTextContent != null)
                        ? yamlConfig.strictTextContent
                        : DEFAULT_STRICT_TEXT_CONTENT;
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                List<String> effectiveFileExtensions = (yamlConfig.fileExtensions != null && !yamlConfig.fileExtensions.isEmpty())
                        ? normalizeExtensions(yamlConfig.fileExtensions)
                        : DEFAULT_FILE_EXTENSIONS;

                return new PageCanvasConfig(effectiveDataVersion, effectiveMaxNestingDepth,
                        effectiveStrictTextContent, effectiveMaxFileLines, effectiveFileExtensions);
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable {}, using defaults: {}", configPath, e.getMessage());
        }

        return DEFAULTS;
    }

    public static PageCanvasConfig with(String dataVersion, int maxNestingDepth, boolean strictTextContent) {
        String effectiveDataVersion = (dataVersion != null && !dataVersion.isBlank()) ? dataVersion : DEFAULT_DATA_VERSION;
        int effectiveMaxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
        return new PageCanvasConfig(effectiveDataVersion, effectiveMaxNestingDepth, strictTextContent,
                DEFAULT_MAX_FILE_LINES, DEFAULT_FILE_EXTENSIONS);
    }

    private static List<String> normalizeExtensions(List<String> extensions) {
        return extensions.stream()
                .filter(e -> e != null && !e.isBlank())
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toList());
    }

    private static class YamlConfig {
        public String dataVersion;
        public Integer maxNestingDepth;
        public Boolean strictTextContent;
        public Integer maxFileLines;
        public List<String> fileExtensions;
    }
}
