package com.ttennebkram.enhancer;

import com.google.gson.JsonParseException;
import com.ttennebkram.enhancer.engine.EnhancementEngine;
import com.ttennebkram.enhancer.engine.EnhancementException;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.OperationDescriptor;
import com.ttennebkram.enhancer.image.ImageCodec;
import com.ttennebkram.enhancer.image.RasterImage;
import com.ttennebkram.enhancer.recipe.Recipe;
import com.ttennebkram.enhancer.recipe.RecipeRunner;
import com.ttennebkram.enhancer.recipe.RecipeSerializer;
import com.ttennebkram.enhancer.util.OpenCVLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line entry point: applies one operation or a recipe to an image file.
 */
@CommandLine.Command(
        name = "image-enhancer",
        description = "Apply an enhancement operation or recipe to an image.",
        version = "1.0",
        showDefaultValues = true,
        mixinStandardHelpOptions = true
)
public class EnhancerLauncher implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(EnhancerLauncher.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Option(names = {"-i", "--input"}, description = "Input image file")
    Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output image (.png, .jpg, .webp) or palette (.json)")
    Path output;

    @CommandLine.Option(names = {"-p", "--param"}, description = "Operation parameter as key=value")
    Map<String, String> params = new LinkedHashMap<>();

    @CommandLine.Option(names = "--recipe", description = "JSON recipe to run instead of a single operation")
    Path recipe;

    @CommandLine.Option(names = "--quality", defaultValue = "95", description = "JPEG/WEBP quality (1-100)")
    int quality;

    @CommandLine.Option(names = "--list", description = "List the available operations and exit")
    boolean list;

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "Operation name, e.g. clahe_enhance")
    String operation;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        OpenCVLoader.ensureLoaded();
        int exitCode = new CommandLine(new EnhancerLauncher()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        EnhancementEngine engine;
        try {
            engine = new EnhancementEngine();
        } catch (UncheckedIOException | JsonParseException e) {
            logger.warn("Cannot load engine configuration", e);
            err.println("Invalid engine configuration: " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (list) {
            for (OperationDescriptor d : engine.catalog()) {
                out.printf(Locale.ROOT, "%-28s %-8s %s%n", d.getOperation(), d.getCategory(), d.getDefaults());
            }
            out.flush();
            return EXIT_OK;
        }

        if (input == null || (operation == null) == (recipe == null)) {
            err.println("Provide --input and exactly one of an operation name or --recipe");
            spec.commandLine().usage(err);
            return EXIT_USAGE;
        }

        try {
            RasterImage image = ImageCodec.read(input);
            EnhancementResult result;
            if (recipe != null) {
                Recipe loaded = RecipeSerializer.load(recipe);
                result = new RecipeRunner(engine).run(loaded, image);
            } else {
                result = engine.apply(operation, image, params);
            }
            return writeResult(result, out, err);
        } catch (EnhancementException e) {
            logger.warn("Enhancement failed: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.warn("I/O error", e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (JsonParseException e) {
            err.println("Invalid recipe " + recipe + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            // unsupported output extension
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int writeResult(EnhancementResult result, PrintWriter out, PrintWriter err) throws IOException {
        if (result.isPalette()) {
            String json = result.palette().toJson();
            if (output != null) {
                Files.write(output, json.getBytes(StandardCharsets.UTF_8));
            } else {
                out.println(json);
                out.flush();
            }
            return EXIT_OK;
        }
        if (output == null) {
            err.println("--output is required for image results");
            return EXIT_USAGE;
        }
        ImageCodec.write(output, result.image(), quality);
        logger.info("Wrote {} ({})", output, result.image());
        return EXIT_OK;
    }
}
