package com.beautifier.cli;

import com.beautifier.api.error.ErrorKind;
import com.beautifier.api.error.FormatterException;
import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import com.beautifier.core.SourceFormatter;
import com.beautifier.plugins.FileType;
import com.beautifier.util.ErrorFormatter;
import com.beautifier.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface: formats one input file into one output file.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".beautifier.yml";
    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs the command line and returns the process exit code.
     */
    public static int run(String[] args) {
        boolean useColors = !_hasOption(args, "--no-color");
        errorFormatter = new ErrorFormatter(useColors);

        if (_hasOption(args, "--help", "-h")) {
            _printUsage();
            return 0;
        }
        if (_hasOption(args, "--version", "-v")) {
            _printVersion();
            return 0;
        }

        boolean verbose = _hasOption(args, "--verbose");
        LoggerUtil.setConsoleLevel(verbose ? Level.FINE : Level.WARNING);

        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            LoggerUtil.setLogFile(Paths.get(logFile));
        }

        try {
            String input = _getOptionValue(args, "--input", "-i");
            String output = _getOptionValue(args, "--output", "-o");
            if (input == null || output == null) {
                _printError("Error: Missing required option " + (input == null ? "--input" : "--output"));
                _printUsage();
                return 1;
            }

            FormatterConfig config = _loadConfig(_getOptionValue(args, "--config"));
            Integer indent = _getIntInRange(args, ConfigurationLoader.MIN_INDENT_SIZE,
                    ConfigurationLoader.MAX_INDENT_SIZE, "--indent", "-n");
            if (indent != null) {
                config = config.withGeneral(FormatterConfig.INDENT_SIZE, indent);
            }
            Integer lineLength = _getIntInRange(args, ConfigurationLoader.MIN_LINE_LENGTH,
                    ConfigurationLoader.MAX_LINE_LENGTH, "--line-length", "-l");
            if (lineLength != null) {
                config = config.withGeneral(FormatterConfig.LINE_LENGTH, lineLength);
            }

            return _formatFile(Paths.get(input), Paths.get(output), config);
        } catch (IllegalArgumentException e) {
            // bad option value or unusable path
            _printError("Error: " + e.getMessage());
            _printUsage();
            return 1;
        } catch (FormatterException e) {
            _printError(errorFormatter.formatError(e.toError()));
            logger.log(Level.FINE, "Formatting aborted", e);
            return 1;
        } catch (RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (verbose) {
                e.printStackTrace();
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return 1;
        }
    }

    private static int _formatFile(Path input, Path output, FormatterConfig config) throws FormatterException {
        FileType fileType = FileType.detect(input);
        String source = _readInput(input);

        _printInfo("Formatting " + fileType.getExtension() + " file (indent: " + config.getIndentSize()
                + ", line length: " + config.getLineLength() + ")");

        SourceFormatter formatter = SourceFormatter.createDefault(config);
        String formatted = formatter.format(fileType, source);

        _writeOutput(output, formatted);
        _printSuccess("Formatted successfully: " + output);
        return 0;
    }

    private static FormatterConfig _loadConfig(String configFile) {
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static String _readInput(Path input) throws FormatterException {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FormatterException(ErrorKind.INPUT_READ_FAILURE, input, e.getMessage(), e);
        }
    }

    private static void _writeOutput(Path output, String content) throws FormatterException {
        try {
            Files.writeString(output, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FormatterException(ErrorKind.OUTPUT_WRITE_FAILURE, output, e.getMessage(), e);
        }
    }

    private static void _printVersion() {
        System.out.println("Source Beautifier version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Source Beautifier CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  beautifier -i <input> -o <output> [-n <indent>] [-l <line-length>]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -i, --input <file>                - File to format (.html, .css, .js, .ts)");
        System.out.println("  -o, --output <file>               - Where to write the formatted result");
        System.out.println("  -n, --indent <num>                - Spaces per indent level, 0-16 (default: 4)");
        System.out.println("  -l, --line-length <num>           - Preferred maximum line length, 20-400 (default: 80)");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --log-file=<path>                 - Also write log records to a file");
        System.out.println("  --help|-h                         - Show this help");
        System.out.println("  --version|-v                      - Show version information");
    }

    private static boolean _hasOption(String[] args, String... options) {
        return Arrays.stream(options).anyMatch(Arrays.asList(args)::contains);
    }

    /**
     * Looks up an option given either as {@code --name=value} or as
     * {@code --name value}; every alias is tried in order.
     */
    private static String _getOptionValue(String[] args, String... aliases) {
        for (String option : aliases) {
            String prefix = option + "=";
            for (int i = 0; i < args.length; i++) {
                if (args[i].startsWith(prefix)) {
                    return args[i].substring(prefix.length());
                }
                if (args[i].equals(option)) {
                    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
                        throw new IllegalArgumentException("Missing value for option " + option);
                    }
                    return args[i + 1];
                }
            }
        }
        return null;
    }

    private static Integer _getIntInRange(String[] args, int min, int max, String... aliases) {
        String value = _getOptionValue(args, aliases);
        if (value == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= min && parsed <= max) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.fine("Not a number for " + aliases[0] + ": " + value);
        }
        throw new IllegalArgumentException("Invalid value for " + aliases[0] + ": " + value
                + " (expected an integer from " + min + " to " + max + ")");
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
