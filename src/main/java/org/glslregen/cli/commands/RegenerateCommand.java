package org.glslregen.cli.commands;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.glslregen.cli.CommandLineInterface;
import org.glslregen.compiler.api.RegenerationException;
import org.glslregen.compiler.backend.emit.GlslRegenerator;
import org.glslregen.compiler.backend.emit.RegeneratorOptions;
import org.glslregen.compiler.frontend.io.PackFormatException;
import org.glslregen.compiler.frontend.io.PackJsonReader;
import org.glslregen.compiler.ir.Pack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that reads a JSON pack and writes the regenerated source.
 * <p>
 * Output goes to stdout unless {@code --output} is given. A failed regeneration never writes a
 * partial output file.
 */
@Command(
    name = "regenerate",
    mixinStandardHelpOptions = true,
    description = "Regenerate GLSL source from a JSON IR pack"
)
public class RegenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RegenerateCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "JSON pack to regenerate"
    )
    private File inputFile;

    @Option(
        names = {"-o", "--output"},
        description = "File to write the source to (default: stdout)"
    )
    private File outputFile;

    @Option(
        names = {"--glsl-version"},
        description = "Emit a leading #version directive, e.g. \"450\" or \"300 es\" (overrides regen.version-directive)"
    )
    private String glslVersion;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        RegeneratorOptions options;
        try {
            options = RegeneratorOptions.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: failed to load configuration: " + e.getMessage());
            return 1;
        }
        if (glslVersion != null) {
            options = options.withVersionDirective(glslVersion);
        }

        Pack pack;
        try {
            pack = PackJsonReader.read(inputFile.toPath());
        } catch (IOException e) {
            err.println("Error: cannot read " + inputFile + ": " + e.getMessage());
            return 1;
        } catch (PackFormatException e) {
            err.println("Error: " + inputFile + " is not a valid pack: " + e.getMessage());
            return 1;
        }

        String source;
        try {
            source = new GlslRegenerator(options).regenerate(pack);
        } catch (RegenerationException e) {
            log.debug("Regeneration of {} failed", inputFile, e);
            err.println("Error: regeneration failed: " + e.getMessage());
            return 1;
        }

        if (outputFile == null) {
            out.print(source);
            out.flush();
            return 0;
        }
        try {
            Files.writeString(outputFile.toPath(), source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot write " + outputFile + ": " + e.getMessage());
            return 1;
        }
        log.info("Wrote {} characters to {}", source.length(), outputFile);
        return 0;
    }
}
