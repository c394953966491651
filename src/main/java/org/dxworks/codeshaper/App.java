package org.dxworks.codeshaper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codeshaper.format.FormatOptions;
import org.dxworks.codeshaper.modify.ModificationRequest;
import org.dxworks.codeshaper.refactoring.SuggestionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, new CodeEngine(CodeshaperConfig.load()), System.out, System.err));
    }

    static int run(String[] args, CodeEngine engine, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            printUsage(err);
            return EXIT_USAGE;
        }

        String command = args[0];
        Path file = Paths.get(args[1]);
        try {
            Object result;
            switch (command) {
                case "analyze":
                    result = engine.analyze(file);
                    break;
                case "suggest":
                    result = engine.suggestRefactoring(file, suggestionOptions(args));
                    break;
                case "modify": {
                    if (args.length < 3) {
                        printUsage(err);
                        return EXIT_USAGE;
                    }
                    String json = Files.readString(Paths.get(args[2]), StandardCharsets.UTF_8);
                    List<ModificationRequest> requests = engine.parseRequests(json);
                    result = engine.modify(file, requests);
                    break;
                }
                case "format":
                    result = engine.format(file, hasFlag(args, "--check") ? FormatOptions.checkOnly() : FormatOptions.defaults());
                    break;
                default:
                    err.println("Unknown command: " + command);
                    printUsage(err);
                    return EXIT_USAGE;
            }
            out.println(MAPPER.writeValueAsString(result));
            return EXIT_OK;
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (CodeshaperException e) {
            printError(out, err, e.getKind().name(), e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            printError(out, err, "IO", e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Unexpected failure running {} on {}", command, file, e);
            printError(out, err, "INTERNAL", e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static SuggestionOptions suggestionOptions(String[] args) {
        String area = optionValue(args, "--type=");
        String max = optionValue(args, "--max=");
        int maxSuggestions = 0;
        if (max != null) {
            try {
                maxSuggestions = Integer.parseInt(max);
            } catch (NumberFormatException e) {
                throw new UsageException("--max expects a number, got '" + max + "'");
            }
        }
        try {
            return SuggestionOptions.forArea(area, maxSuggestions);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static String optionValue(String[] args, String prefix) {
        for (int i = 2; i < args.length; i++) {
            if (args[i].startsWith(prefix)) {
                return args[i].substring(prefix.length());
            }
        }
        return null;
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (int i = 2; i < args.length; i++) {
            if (flag.equals(args[i])) return true;
        }
        return false;
    }

    private static void printError(PrintStream out, PrintStream err, String kind, String message) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("errorKind", kind);
        error.put("error", message);
        try {
            out.println(MAPPER.writeValueAsString(error));
        } catch (IOException e) {
            err.println("Failed to write error: " + e.getMessage());
        }
        err.println("Error: " + message);
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java -jar codeshaper.jar <command> <file> [options]");
        err.println("  analyze <file>                          Structure and quality metrics");
        err.println("  suggest <file> [--type=<area>] [--max=<n>]");
        err.println("                                          Refactoring suggestions (area: all or a suggestion type)");
        err.println("  modify <file> <requests.json>           Apply modification requests, backing up the file first");
        err.println("  format <file> [--check]                 Normalize formatting; --check reports without writing");
    }

    private static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
