package com.ttennebkram.enhancer;

import com.ttennebkram.enhancer.engine.EngineConfig;
import com.ttennebkram.enhancer.image.ColorImage;
import com.ttennebkram.enhancer.image.ImageCodec;
import com.ttennebkram.enhancer.image.RasterImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class EnhancerLauncherTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path inputFile;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        inputFile = tempDir.resolve("in.png");
        ImageCodec.write(inputFile, RasterImage.filledColor(20, 30, 30, 120, 200), ImageCodec.DEFAULT_QUALITY);
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new EnhancerLauncher());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void listsOperations() {
        int code = run("--list");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_OK);
        assertThat(out.toString()).contains("clahe_enhance").contains("extract_palette").contains("sepia_filter");
    }

    @Test
    void appliesOperationToFile() throws Exception {
        Path output = tempDir.resolve("out.png");

        int code = run("-i", inputFile.toString(), "-o", output.toString(),
                "-p", "scale_factor=2", "super_resolution");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_OK);
        ColorImage result = ImageCodec.read(output);
        assertThat(result.height()).isEqualTo(40);
        assertThat(result.width()).isEqualTo(60);
    }

    @Test
    void printsPaletteAsJson() {
        int code = run("-i", inputFile.toString(), "-p", "num_colors=1", "extract_palette");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_OK);
        assertThat(out.toString()).contains("\"colors\"").contains("c87820");
    }

    @Test
    void runsRecipe() throws IOException {
        Path recipe = tempDir.resolve("recipe.json");
        Files.write(recipe, ("{\"name\": \"r\", \"steps\": [{\"operation\": \"sharpen\"},"
                + " {\"operation\": \"gaussian_blur\", \"params\": {\"radius\": 5}}]}").getBytes(StandardCharsets.UTF_8));
        Path output = tempDir.resolve("out.jpg");

        int code = run("-i", inputFile.toString(), "-o", output.toString(), "--recipe", recipe.toString());

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_OK);
        assertThat(Files.size(output)).isPositive();
    }

    @Test
    void unknownOperationFails() {
        int code = run("-i", inputFile.toString(), "-o", tempDir.resolve("x.png").toString(), "posterize");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_FAILURE);
        assertThat(err.toString()).contains("posterize");
    }

    @Test
    void invalidParameterFails() {
        int code = run("-i", inputFile.toString(), "-o", tempDir.resolve("x.png").toString(),
                "-p", "gamma=abc", "gamma_correction");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_FAILURE);
        assertThat(err.toString()).contains("gamma");
    }

    @Test
    void undecodableInputFails() throws IOException {
        Path garbage = tempDir.resolve("garbage.png");
        Files.write(garbage, new byte[]{1, 2, 3, 4});

        int code = run("-i", garbage.toString(), "-o", tempDir.resolve("x.png").toString(), "sharpen");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_FAILURE);
    }

    @Test
    void badConfigurationFileFails() throws IOException {
        Path config = tempDir.resolve("engine.json");
        Files.write(config, "{\"maxScaleFactor\": 0}".getBytes(StandardCharsets.UTF_8));
        System.setProperty(EngineConfig.PATH_PROPERTY, config.toString());
        try {
            int code = run("-i", inputFile.toString(), "-o", tempDir.resolve("x.png").toString(), "sharpen");

            assertThat(code).isEqualTo(EnhancerLauncher.EXIT_FAILURE);
            assertThat(err.toString()).contains("maxScaleFactor");
        } finally {
            System.clearProperty(EngineConfig.PATH_PROPERTY);
        }
    }

    @Test
    void missingConfigurationFileFails() {
        System.setProperty(EngineConfig.PATH_PROPERTY, tempDir.resolve("absent.json").toString());
        try {
            int code = run("--list");

            assertThat(code).isEqualTo(EnhancerLauncher.EXIT_FAILURE);
            assertThat(err.toString()).contains("Invalid engine configuration");
        } finally {
            System.clearProperty(EngineConfig.PATH_PROPERTY);
        }
    }

    @Test
    void missingOperationIsAUsageError() {
        int code = run("-i", inputFile.toString());

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_USAGE);
    }

    @Test
    void imageResultNeedsOutput() {
        int code = run("-i", inputFile.toString(), "sharpen");

        assertThat(code).isEqualTo(EnhancerLauncher.EXIT_USAGE);
        assertThat(err.toString()).contains("--output");
    }
}
