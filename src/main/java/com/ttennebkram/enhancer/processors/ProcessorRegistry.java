package com.ttennebkram.enhancer.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry for EnhancementProcessor implementations.
 * Auto-discovers processors at runtime via classpath scanning.
 * Processors must be annotated with @ProcessorInfo to be discovered.
 *
 * Usage:
 *   EnhancementProcessor&lt;?&gt; processor = ProcessorRegistry.createProcessor("gamma_correction");
 */
public class ProcessorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorRegistry.class);

    // Map from operation name to processor class, sorted for stable listings
    private static final Map<String, Class<? extends EnhancementProcessor<?>>> processorClasses = new TreeMap<>();

    private static boolean initialized = false;

    /**
     * Initialize the registry by scanning for processor classes.
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;

        for (Class<? extends EnhancementProcessor<?>> processorClass : ProcessorScanner.findProcessorClasses()) {
            ProcessorInfo info = processorClass.getAnnotation(ProcessorInfo.class);
            Class<? extends EnhancementProcessor<?>> previous = processorClasses.put(info.operation(), processorClass);
            if (previous != null && previous != processorClass) {
                throw new IllegalStateException("Operation " + info.operation() + " is declared by both "
                        + previous.getName() + " and " + processorClass.getName());
            }
        }

        logger.debug("Registered operations: {}", processorClasses.keySet());
        initialized = true;
    }

    /**
     * Create a new processor instance for the given operation.
     * Returns null if no processor is registered for it.
     */
    public static synchronized EnhancementProcessor<?> createProcessor(String operation) {
        initialize();
        Class<? extends EnhancementProcessor<?>> processorClass = processorClasses.get(operation);
        if (processorClass == null) {
            return null;
        }
        try {
            return processorClass.getDeclaredConstructor().newInstance();
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalStateException("Failed to create processor for " + operation, e);
        }
    }

    /**
     * All registered operation names, sorted.
     */
    public static synchronized Set<String> getRegisteredOperations() {
        initialize();
        return Collections.unmodifiableSet(processorClasses.keySet());
    }
}
