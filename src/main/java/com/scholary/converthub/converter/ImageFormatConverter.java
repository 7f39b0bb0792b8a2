package com.scholary.converthub.converter;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raster images between formats using ImageIO.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code output_format}: png (default), jpg/jpeg, bmp or gif
 *   <li>{@code quality}: 1-100, JPEG only (default 80)
 *   <li>{@code resize_width}, {@code resize_height}: target size; giving only one keeps the
 *       aspect ratio
 * </ul>
 */
@Component
public class ImageFormatConverter implements FileConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageFormatConverter.class);

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "png", "image/png",
          "jpg", "image/jpeg",
          "bmp", "image/bmp",
          "gif", "image/gif");

  private static final int DEFAULT_QUALITY = 80;
  private static final int MAX_DIMENSION = 10_000;

  @Override
  public String operation() {
    return "image_convert";
  }

  @Override
  public ConvertedFile convert(
      byte[] input, ConversionOptions options, ConversionProgress progress) {
    String format = normalizeFormat(options.getOrDefault("output_format", "png"));
    int quality = options.getInt("quality", DEFAULT_QUALITY);
    if (quality < 1 || quality > 100) {
      throw new ConversionException("Option 'quality' must be between 1 and 100");
    }

    BufferedImage source = read(input);
    progress.report(30, "Image decoded");

    BufferedImage resized =
        resize(
            source,
            options.getInt("resize_width").orElse(null),
            options.getInt("resize_height").orElse(null));
    BufferedImage output = "jpg".equals(format) || "bmp".equals(format) ? toRgb(resized) : resized;
    progress.report(60, "Encoding " + format);

    byte[] encoded = write(output, format, quality);
    progress.report(90, "Image encoded");

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("output_format", format);
    metadata.put("original_width", source.getWidth());
    metadata.put("original_height", source.getHeight());
    metadata.put("width", output.getWidth());
    metadata.put("height", output.getHeight());
    metadata.put("original_size_bytes", input.length);
    metadata.put("output_size_bytes", encoded.length);
    if ("jpg".equals(format)) {
      metadata.put("quality", quality);
    }

    LOGGER.debug(
        "Converted image to {}: {}x{} -> {}x{}, {} -> {} bytes",
        format,
        source.getWidth(),
        source.getHeight(),
        output.getWidth(),
        output.getHeight(),
        input.length,
        encoded.length);
    return new ConvertedFile(encoded, format, CONTENT_TYPES.get(format), metadata);
  }

  static String normalizeFormat(String requested) {
    String format = requested.toLowerCase(Locale.ROOT);
    if ("jpeg".equals(format)) {
      format = "jpg";
    }
    if (!CONTENT_TYPES.containsKey(format)) {
      throw new ConversionException("Unsupported image output format: " + requested);
    }
    return format;
  }

  private BufferedImage read(byte[] input) {
    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(input));
      if (image == null) {
        throw new ConversionException("Input is not a supported image");
      }
      return image;
    } catch (IOException e) {
      throw new ConversionException("Failed to decode image: " + e.getMessage(), e);
    }
  }

  private BufferedImage resize(BufferedImage source, Integer width, Integer height) {
    if (width == null && height == null) {
      return source;
    }
    int targetWidth =
        width != null
            ? width
            : (int) Math.round(source.getWidth() * (height / (double) source.getHeight()));
    int targetHeight =
        height != null
            ? height
            : (int) Math.round(source.getHeight() * (width / (double) source.getWidth()));
    if (targetWidth < 1
        || targetHeight < 1
        || targetWidth > MAX_DIMENSION
        || targetHeight > MAX_DIMENSION) {
      throw new ConversionException(
          String.format("Invalid target size %dx%d", targetWidth, targetHeight));
    }

    int type =
        source.getColorModel().hasAlpha()
            ? BufferedImage.TYPE_INT_ARGB
            : BufferedImage.TYPE_INT_RGB;
    BufferedImage target = new BufferedImage(targetWidth, targetHeight, type);
    Graphics2D graphics = target.createGraphics();
    try {
      graphics.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      graphics.drawImage(source, 0, 0, targetWidth, targetHeight, null);
    } finally {
      graphics.dispose();
    }
    return target;
  }

  // JPEG and BMP writers reject images with an alpha channel
  private BufferedImage toRgb(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_INT_RGB) {
      return image;
    }
    BufferedImage rgb =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = rgb.createGraphics();
    try {
      graphics.drawImage(image, 0, 0, Color.WHITE, null);
    } finally {
      graphics.dispose();
    }
    return rgb;
  }

  private byte[] write(BufferedImage image, String format, int quality) {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
    if (!writers.hasNext()) {
      throw new ConversionException("No image writer available for " + format);
    }
    ImageWriter writer = writers.next();
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (ImageOutputStream out = ImageIO.createImageOutputStream(buffer)) {
      writer.setOutput(out);
      ImageWriteParam param = writer.getDefaultWriteParam();
      if ("jpg".equals(format)) {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality / 100f);
      }
      writer.write(null, new IIOImage(image, null, null), param);
    } catch (IOException e) {
      throw new ConversionException("Failed to encode image as " + format, e);
    } finally {
      writer.dispose();
    }
    return buffer.toByteArray();
  }
}
