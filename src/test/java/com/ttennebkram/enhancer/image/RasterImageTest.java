package com.ttennebkram.enhancer.image;

import com.ttennebkram.enhancer.TestImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterImageTest {

    @Test
    void colorFactory_keepsBlueGreenRedOrder() {
        ColorImage image = RasterImage.color(1, 2, new byte[]{10, 20, 30, 40, 50, 60});

        assertThat(image.variant()).isEqualTo(ImageVariant.COLOR);
        assertThat(image.height()).isEqualTo(1);
        assertThat(image.width()).isEqualTo(2);
        assertThat(image.channels()).isEqualTo(3);
        assertThat(image.get(0, 1, 0)).isEqualTo(40);
        assertThat(image.get(0, 1, 2)).isEqualTo(60);
    }

    @Test
    void grayFactory_rejectsWrongBufferLength() {
        assertThatThrownBy(() -> RasterImage.gray(2, 2, new byte[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 4 bytes");
    }

    @Test
    void filledColor_rejectsNonPositiveSize() {
        assertThatThrownBy(() -> RasterImage.filledColor(0, 5, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toGray_onColorUsesLumaWeights() {
        // Pure red in BGR order
        ColorImage red = RasterImage.filledColor(2, 2, 0, 0, 255);

        GrayImage gray = red.toGray();

        assertThat(gray.channels()).isEqualTo(1);
        // 0.299 * 255
        assertThat(gray.get(0, 0, 0)).isEqualTo(76);
    }

    @Test
    void toColor_onGrayReplicatesIntensity() {
        GrayImage gray = RasterImage.filledGray(3, 4, 77);

        ColorImage color = gray.toColor();

        assertThat(color.sameShape(gray)).isFalse();
        assertThat(color.channels()).isEqualTo(3);
        assertThat(TestImages.unsigned(color.toBytes())).containsOnly(77);
    }

    @Test
    void conversionToOwnVariant_returnsSameInstance() {
        GrayImage gray = RasterImage.filledGray(2, 2, 1);
        ColorImage color = RasterImage.filledColor(2, 2, 1, 2, 3);

        assertThat(gray.toGray()).isSameAs(gray);
        assertThat(color.toColor()).isSameAs(color);
        assertThat(color.as(ImageVariant.COLOR)).isSameAs(color);
    }

    @Test
    void wrap_copiesTheSourceMat() {
        Mat source = new Mat(2, 2, CvType.CV_8UC1, new Scalar(5));

        RasterImage image = RasterImage.wrap(source);
        source.setTo(new Scalar(99));

        assertThat(TestImages.unsigned(image.toBytes())).containsOnly(5);
    }

    @Test
    void wrap_dropsAlphaChannel() {
        Mat bgra = new Mat(2, 2, CvType.CV_8UC4, new Scalar(1, 2, 3, 4));

        RasterImage image = RasterImage.wrap(bgra);

        assertThat(image).isInstanceOf(ColorImage.class);
        assertThat(image.get(1, 1, 2)).isEqualTo(3);
    }

    @Test
    void wrap_rejectsFloatImages() {
        Mat floats = new Mat(2, 2, CvType.CV_32FC1, new Scalar(0.5));

        assertThatThrownBy(() -> RasterImage.wrap(floats))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported pixel type");
    }
}
