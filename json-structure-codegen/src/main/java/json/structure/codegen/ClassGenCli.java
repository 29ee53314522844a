package json.structure.codegen;

import json.structure.tree.JsonParseException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/// CLI entry point for generating classes from a JSON sample.
///
/// Usage:
/// `java -jar json-structure-codegen.jar sample.json RootName language`
///
/// The source is written to stdout as UTF-8. Exit status is 2 for usage, input and
/// language errors and 1 for anything unexpected.
public final class ClassGenCli {
    private ClassGenCli() {}

    public static void main(String[] args) {
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);

        if (args == null || args.length != 3) {
            err.println("Usage: java -jar json-structure-codegen.jar <sample.json> <RootName> <language>");
            System.exit(2);
            return;
        }

        try {
            write(run(Path.of(args[0]), args[1], args[2]), System.out);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            System.exit(2);
        } catch (JsonParseException e) {
            err.println("Invalid JSON in " + args[0] + ": " + e.getMessage());
            System.exit(2);
        } catch (NoSuchFileException e) {
            err.println("No such file: " + e.getFile());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace(err);
            System.exit(1);
        }
    }

    static void write(String source, OutputStream out) {
        final var writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        writer.print(source);
        writer.flush();
    }

    static String run(Path sampleFile, String rootClassName, String languageId) throws IOException {
        Objects.requireNonNull(sampleFile, "sampleFile must not be null");
        Objects.requireNonNull(rootClassName, "rootClassName must not be null");
        Objects.requireNonNull(languageId, "languageId must not be null");

        final var language = TargetLanguage.fromId(languageId);
        final String json = Files.readString(sampleFile, StandardCharsets.UTF_8);
        return JsonStructureGenerator.generate(json, rootClassName, language);
    }
}
