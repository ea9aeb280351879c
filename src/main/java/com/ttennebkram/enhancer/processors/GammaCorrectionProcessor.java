package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gamma correction through a 256-entry lookup table:
 * {@code out = 255 * (in / 255) ^ (1 / gamma)}.
 *
 * A gamma of zero or below is not rejected: it is replaced with the configured
 * floor (0.01 by default). This is the only parameter the engine repairs
 * instead of reporting.
 */
@ProcessorInfo(
    operation = "gamma_correction",
    category = "Tonal",
    description = "Gamma correction\nCore.LUT(src, table, dst), table[i] = 255 * (i/255)^(1/gamma)"
)
public class GammaCorrectionProcessor extends ProcessorBase<GammaCorrectionProcessor.Params> {

    private static final Logger logger = LoggerFactory.getLogger(GammaCorrectionProcessor.class);

    public static final class Params {
        public final double gamma;

        public Params(double gamma) {
            this.gamma = gamma;
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        double gamma = reader.getDouble("gamma", 1.0);
        if (gamma <= 0) {
            logger.warn("gamma {} is not positive, using {}", gamma, config.getGammaFloor());
            gamma = config.getGammaFloor();
        }
        return new Params(gamma);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        return result(RasterImage.adopt(applyLut(input.mat(), buildTable(params.gamma))));
    }

    static int[] buildTable(double gamma) {
        double invGamma = 1.0 / gamma;
        int[] table = new int[LUT_SIZE];
        for (int i = 0; i < LUT_SIZE; i++) {
            table[i] = clampToByte(Math.pow(i / 255.0, invGamma) * 255.0);
        }
        return table;
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        json.addProperty("gamma", params.gamma);
    }
}
