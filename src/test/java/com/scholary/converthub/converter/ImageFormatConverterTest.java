package com.scholary.converthub.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class ImageFormatConverterTest {

  private final ImageFormatConverter converter = new ImageFormatConverter();

  @Test
  void convert_pngToJpegKeepsDimensions() throws IOException {
    byte[] png = png(40, 20, true);

    ConvertedFile result =
        converter.convert(png, ConversionOptions.of(Map.of("output_format", "JPEG")));

    assertThat(result.format()).isEqualTo("jpg");
    assertThat(result.contentType()).isEqualTo("image/jpeg");
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(result.data()));
    assertThat(decoded.getWidth()).isEqualTo(40);
    assertThat(decoded.getHeight()).isEqualTo(20);
    assertThat(result.metadata())
        .containsEntry("output_format", "jpg")
        .containsEntry("quality", 80)
        .containsEntry("original_size_bytes", png.length);
  }

  @Test
  void convert_resizeWithOneSideKeepsAspectRatio() throws IOException {
    ConvertedFile result =
        converter.convert(png(100, 50, false), ConversionOptions.of(Map.of("resize_width", "40")));

    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(result.data()));
    assertThat(decoded.getWidth()).isEqualTo(40);
    assertThat(decoded.getHeight()).isEqualTo(20);
    assertThat(result.metadata()).containsEntry("original_width", 100).containsEntry("width", 40);
  }

  @Test
  void convert_reportsProgressInOrder() throws IOException {
    List<Integer> steps = new ArrayList<>();
    ConversionProgress recorder =
        new ConversionProgress() {
          @Override
          public void report(int step, String message) {
            steps.add(step);
          }

          @Override
          public boolean isCancelled() {
            return false;
          }
        };

    converter.convert(png(8, 8, false), ConversionOptions.EMPTY, recorder);

    assertThat(steps).isNotEmpty().isSorted();
  }

  @Test
  void convert_rejectsQualityOutOfRange() {
    ConversionOptions options =
        ConversionOptions.of(Map.of("output_format", "jpg", "quality", "0"));

    assertThatThrownBy(() -> converter.convert(png(4, 4, false), options))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("quality");
  }

  @Test
  void convert_rejectsNonImageInput() {
    byte[] text = "definitely not an image".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> converter.convert(text, ConversionOptions.EMPTY))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("not a supported image");
  }

  @Test
  void normalizeFormat_rejectsUnknownFormat() {
    assertThatThrownBy(() -> ImageFormatConverter.normalizeFormat("tiff"))
        .isInstanceOf(ConversionException.class);
    assertThat(ImageFormatConverter.normalizeFormat("PNG")).isEqualTo("png");
  }

  static byte[] png(int width, int height, boolean alpha) throws IOException {
    BufferedImage image =
        new BufferedImage(
            width, height, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = image.createGraphics();
    try {
      graphics.setColor(new Color(30, 120, 200, alpha ? 128 : 255));
      graphics.fillRect(0, 0, width, height);
    } finally {
      graphics.dispose();
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, "png", out);
    return out.toByteArray();
  }
}
