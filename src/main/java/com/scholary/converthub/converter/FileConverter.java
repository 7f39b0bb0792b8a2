package com.scholary.converthub.converter;

/**
 * A format-specific converter.
 *
 * <p>Implementations must be stateless between calls: the batch coordinator invokes the same
 * instance concurrently for different files.
 */
public interface FileConverter {

  /** Operation name this converter is registered under, e.g. {@code image_convert}. */
  String operation();

  /**
   * Convert one file.
   *
   * @param input the raw input bytes
   * @param options options shared by every file of a batch
   * @param progress progress sink and cancellation probe
   * @return the converted artifact
   * @throws ConversionException if the input cannot be converted
   */
  ConvertedFile convert(byte[] input, ConversionOptions options, ConversionProgress progress);

  default ConvertedFile convert(byte[] input, ConversionOptions options) {
    return convert(input, options, ConversionProgress.NONE);
  }
}
