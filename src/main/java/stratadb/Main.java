package stratadb;

import stratadb.datastore.StrataEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length > 1) {
            logger.error("Usage: stratadb [script-file]");
            System.exit(2);
        }

        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        try (BufferedReader in = openInput(args)) {
            new StrataConsole(new StrataEngine(), in, out).listen();
        } catch (IOException | UncheckedIOException e) {
            logger.error("Error while reading commands {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    private static BufferedReader openInput(String[] args) throws IOException {
        if (args.length == 1) return Files.newBufferedReader(Path.of(args[0]), StandardCharsets.UTF_8);
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }
}
