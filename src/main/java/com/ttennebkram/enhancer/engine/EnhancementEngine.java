package com.ttennebkram.enhancer.engine;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.image.ImageVariant;
import com.ttennebkram.enhancer.image.RasterImage;
import com.ttennebkram.enhancer.processors.EnhancementProcessor;
import com.ttennebkram.enhancer.processors.ProcessorInfo;
import com.ttennebkram.enhancer.processors.ProcessorRegistry;
import com.ttennebkram.enhancer.util.OpenCVLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches named operations to the transform catalog.
 *
 * Resolves the operation, coerces its parameters, converts the image to a
 * variant the transform accepts and runs it. The engine keeps no state between
 * calls and may be shared across threads.
 *
 * Usage:
 *   EnhancementEngine engine = new EnhancementEngine();
 *   RasterImage out = engine.apply("gamma_correction", image, Map.of("gamma", "1.8")).image();
 */
public class EnhancementEngine {

    private static final Logger logger = LoggerFactory.getLogger(EnhancementEngine.class);

    private final EngineConfig config;
    private final Map<String, EnhancementProcessor<?>> processors = new LinkedHashMap<>();

    public EnhancementEngine() {
        this(EngineConfig.load());
    }

    public EnhancementEngine(EngineConfig config) {
        OpenCVLoader.ensureLoaded();
        this.config = config;
        for (String operation : ProcessorRegistry.getRegisteredOperations()) {
            EnhancementProcessor<?> processor = ProcessorRegistry.createProcessor(operation);
            processor.configure(config);
            processors.put(operation, processor);
        }
        logger.debug("Engine ready with {} operations", processors.size());
    }

    public boolean supports(String operation) {
        return operation != null && processors.containsKey(operation.trim());
    }

    public Set<String> operations() {
        return Collections.unmodifiableSet(processors.keySet());
    }

    /**
     * Apply one operation.
     *
     * @param operation catalog name, e.g. "clahe_enhance"
     * @param image input image; never modified
     * @param params raw parameters; absent keys take defaults, unknown keys are ignored
     */
    public EnhancementResult apply(String operation, RasterImage image, Map<String, String> params)
            throws UnknownOperationException, InvalidParameterException, ProcessingFailureException {
        String name = operation == null ? "" : operation.trim();
        EnhancementProcessor<?> processor = processors.get(name);
        if (processor == null) {
            throw new UnknownOperationException(operation);
        }
        if (image == null) {
            throw new ProcessingFailureException(name, "no image supplied");
        }

        logger.debug("Applying {} to {} with {}", name, image, params);
        long start = System.nanoTime();
        EnhancementResult result = invoke(processor, new ParameterReader(name, params), image);
        logger.debug("{} finished in {} ms", name, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    public EnhancementResult apply(String operation, RasterImage image)
            throws UnknownOperationException, InvalidParameterException, ProcessingFailureException {
        return apply(operation, image, Collections.emptyMap());
    }

    private static <P> EnhancementResult invoke(EnhancementProcessor<P> processor, ParameterReader reader,
                                                RasterImage image)
            throws InvalidParameterException, ProcessingFailureException {
        P params = processor.parseParameters(reader);
        RasterImage prepared = toAcceptedVariant(image, processor.getAcceptedVariants());
        try {
            return processor.process(prepared, params);
        } catch (RuntimeException e) {
            // CvException and anything else the transform throws
            throw new ProcessingFailureException(processor.getOperation(), e);
        } finally {
            if (prepared != image) {
                prepared.release();
            }
        }
    }

    private static RasterImage toAcceptedVariant(RasterImage image, Set<ImageVariant> accepted) {
        if (accepted.contains(image.variant())) {
            return image;
        }
        return image.as(accepted.iterator().next());
    }

    /**
     * Describe every operation, sorted by name.
     */
    public List<OperationDescriptor> catalog() {
        List<OperationDescriptor> out = new ArrayList<>();
        for (EnhancementProcessor<?> processor : processors.values()) {
            out.add(describe(processor));
        }
        return out;
    }

    public OperationDescriptor describe(String operation) throws UnknownOperationException {
        EnhancementProcessor<?> processor = operation == null ? null : processors.get(operation.trim());
        if (processor == null) {
            throw new UnknownOperationException(operation);
        }
        return describe(processor);
    }

    private static OperationDescriptor describe(EnhancementProcessor<?> processor) {
        ProcessorInfo info = processor.getClass().getAnnotation(ProcessorInfo.class);
        return new OperationDescriptor(
                processor.getOperation(),
                processor.getCategory(),
                processor.getDescription(),
                processor.getAcceptedVariants(),
                info != null && info.producesPalette(),
                defaultsOf(processor));
    }

    private static <P> JsonObject defaultsOf(EnhancementProcessor<P> processor) {
        JsonObject json = new JsonObject();
        try {
            P defaults = processor.parseParameters(new ParameterReader(processor.getOperation(), null));
            processor.serializeParameters(defaults, json);
        } catch (InvalidParameterException e) {
            throw new IllegalStateException("Defaults of " + processor.getOperation() + " are invalid", e);
        }
        return json;
    }
}
