package com.beautifier.core;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.beautifier.api.CodeFormatter;
import com.beautifier.api.FormatterPlugin;
import com.beautifier.api.FormatterResult;
import com.beautifier.api.error.ErrorKind;
import com.beautifier.api.error.FormatterException;
import com.beautifier.config.FormatterConfig;
import com.beautifier.layout.LayoutText;
import com.beautifier.plugins.FileType;
import com.beautifier.plugins.css.CssFormatter;
import com.beautifier.plugins.html.HtmlFormatter;
import com.beautifier.plugins.js.JsTsFormatter;
import com.beautifier.util.LoggerUtil;

/**
 * Entry point of the formatting process. Normalizes the input and delegates to
 * the plugin registered for the file type.
 */
public class SourceFormatter implements CodeFormatter {
    private static final Logger logger = LoggerUtil.getLogger(SourceFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new EnumMap<>(FileType.class);
    private final FormatterConfig config;

    private final AtomicInteger processedCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    /**
     * Creates a formatter with no plugins registered.
     */
    public SourceFormatter(FormatterConfig config) {
        this.config = config;
        logger.fine("Source formatter created (indent " + config.getIndentSize()
                + ", line length " + config.getLineLength() + ")");
    }

    /**
     * Creates a formatter with the HTML, CSS and script plugins registered.
     * JavaScript and TypeScript share one plugin instance.
     */
    public static SourceFormatter createDefault(FormatterConfig config) {
        SourceFormatter formatter = new SourceFormatter(config);
        formatter.registerPlugin(FileType.HTML, new HtmlFormatter());
        formatter.registerPlugin(FileType.CSS, new CssFormatter());
        FormatterPlugin script = new JsTsFormatter();
        formatter.registerPlugin(FileType.JAVASCRIPT, script);
        formatter.registerPlugin(FileType.TYPESCRIPT, script);
        return formatter;
    }

    /**
     * Registers a plugin for a file type and initializes it with this formatter's
     * configuration. A plugin shared between types is initialized once per type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Formats source text of a known type.
     *
     * @throws FormatterException if no plugin is registered for the type
     */
    public String format(FileType fileType, String sourceCode) throws FormatterException {
        return _format(fileType, sourceCode, null);
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        processedCount.incrementAndGet();
        try {
            String formatted = _format(FileType.detect(filePath), sourceCode, filePath);
            successCount.incrementAndGet();
            logger.fine("Successfully formatted: " + filePath);
            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(formatted)
                    .build();
        } catch (FormatterException e) {
            errorCount.incrementAndGet();
            logger.warning("Failed to format: " + filePath + " - " + e.getMessage());
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(e.toError())
                    .build();
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            throw e;
        }
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    private String _format(FileType fileType, String sourceCode, Path filePath) throws FormatterException {
        FormatterPlugin plugin = plugins.get(fileType);
        if (plugin == null) {
            throw new FormatterException(ErrorKind.UNSUPPORTED_FILE_TYPE, filePath, fileType.getExtension());
        }
        return plugin.format(LayoutText.normalizeInput(sourceCode));
    }
}
