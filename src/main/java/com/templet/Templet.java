package com.templet;

import com.templet.data.Entity;
import com.templet.data.EntityJsonReader;
import com.templet.node.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "templet", mixinStandardHelpOptions = true, version = "1.0",
         description = "Render a template against JSON data")
public class Templet implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Templet.class);

    @Parameters(index = "0", description = "The template file to render")
    private File templateFile;

    @Parameters(index = "1", arity = "0..1", description = "Input JSON data file (default: stdin)")
    private File dataFile;

    @Option(names = {"-o", "--output"}, description = "Write the rendered text to this file (default: stdout)")
    private File outputFile;

    @Option(names = {"--strict"}, description = "Fail on value tags that name missing data")
    private boolean strict = false;

    @Option(names = {"--no-data"}, description = "Render against an empty scope instead of reading data")
    private boolean noData = false;

    @Option(names = {"--charset"}, description = "Charset of the template and output (default: UTF-8)")
    private Charset charset = StandardCharsets.UTF_8;

    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public Templet() {
        this(System.in, System.out, System.err);
    }

    Templet(InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Templet()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            // Parse the template
            Template template = Template.compile(Files.readString(templateFile.toPath(), charset));

            // Load the data
            Entity.MapValue scope = noData ? Entity.MapValue.empty() : readData();

            // Render before writing anything, so a failed render produces no output
            String rendered = template.render(scope, new RenderOptions(strict));
            if (outputFile != null) {
                Files.writeString(outputFile.toPath(), rendered, charset);
            } else {
                stdout.print(rendered);
                stdout.flush();
            }

            return 0;
        } catch (Exception e) {
            log.debug("Rendering {} failed", templateFile, e);
            stderr.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Entity.MapValue readData() throws IOException {
        EntityJsonReader reader = new EntityJsonReader();
        if (dataFile == null) {
            return reader.read(stdin);
        }
        try (InputStream input = Files.newInputStream(dataFile.toPath())) {
            return reader.read(input);
        }
    }
}
