package com.ttennebkram.enhancer.processors;

import com.ttennebkram.enhancer.image.ImageVariant;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for EnhancementProcessor classes to declare their catalog metadata.
 * Used for auto-registration at runtime - no compile-time registration needed.
 *
 * Example usage:
 * <pre>
 * {@literal @}ProcessorInfo(
 *     operation = "gaussian_blur",
 *     category = "Spatial",
 *     description = "Gaussian blur\nImgproc.GaussianBlur(src, dst, ksize, 0)"
 * )
 * public class GaussianBlurProcessor extends ProcessorBase&lt;GaussianBlurProcessor.Params&gt; { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ProcessorInfo {

    /**
     * Operation name callers use (e.g. "gamma_correction").
     */
    String operation();

    /**
     * Catalog grouping: "Tonal", "Spatial" or "Color".
     */
    String category();

    /**
     * Description shown by the catalog listing.
     */
    String description() default "";

    /**
     * Image variants the transform works on directly.
     * Other inputs are converted before the transform runs.
     */
    ImageVariant[] accepts() default {ImageVariant.GRAY, ImageVariant.COLOR};

    /**
     * Whether the result is a palette instead of an image.
     */
    boolean producesPalette() default false;
}
