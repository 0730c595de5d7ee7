package com.txt2tex.dump;

import com.txt2tex.ErrorFormatter;
import com.txt2tex.LexerException;
import com.txt2tex.ParseException;
import com.txt2tex.Parser;
import com.txt2tex.ast.ParseResult;
import com.txt2tex.json.AstJsonProvider;
import com.txt2tex.json.AstJsonSerializer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses a txt2tex source file and prints its tree as JSON.
 *
 * Usage:
 *   java -cp ... com.txt2tex.dump.AstDump [--pretty] [--max-depth=N] <file>
 *
 * Exit status is 0 on success, 1 on a lexer or parser error, 2 on bad usage or I/O failure.
 */
public class AstDump {
    private static final Logger LOG = Logger.getLogger(AstDump.class.getName());

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean pretty = false;
        int maxDepth = Parser.DEFAULT_MAX_DEPTH;
        String file = null;
        for (String arg : args) {
            if (arg.equals("--pretty")) {
                pretty = true;
            } else if (arg.startsWith("--max-depth=")) {
                try {
                    maxDepth = Integer.parseInt(arg.substring("--max-depth=".length()));
                } catch (NumberFormatException e) {
                    maxDepth = 0;
                }
                if (maxDepth < 1) {
                    err.println("Invalid --max-depth value: " + arg);
                    return 2;
                }
            } else if (arg.startsWith("--") || file != null) {
                printUsage(err);
                return 2;
            } else {
                file = arg;
            }
        }
        if (file == null) {
            printUsage(err);
            return 2;
        }

        String source;
        try {
            source = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Cannot read " + file, e);
            err.println("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }

        ErrorFormatter formatter = new ErrorFormatter(source);
        ParseResult result;
        try {
            result = Parser.parse(source, maxDepth);
        } catch (LexerException e) {
            err.println(formatter.format(e));
            return 1;
        } catch (ParseException e) {
            err.println(formatter.format(e));
            return 1;
        }
        String parsed = file;
        String kind = result.type();
        LOG.info(() -> "Parsed " + parsed + " as " + kind);

        AstJsonSerializer serializer = AstJsonProvider.getProvider().getSerializer();
        out.println(pretty ? serializer.serializePretty(result) : serializer.serialize(result));
        return 0;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: AstDump [--pretty] [--max-depth=N] <file>");
    }
}
