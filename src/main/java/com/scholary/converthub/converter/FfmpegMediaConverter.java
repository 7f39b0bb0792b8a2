package com.scholary.converthub.converter;

import com.scholary.converthub.config.ConversionProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts audio and video files by running the ffmpeg binary.
 *
 * <p>Input and output live in a private working directory under {@code conversion.tempDir}, which
 * is removed afterwards. ffmpeg's stderr goes to a log file that is polled while the process
 * runs: {@code Duration:} and the latest {@code time=} give the progress fraction.
 *
 * <p>The process is destroyed when the caller cancels, when the thread is interrupted (batch
 * timeout or batch cancellation) or when {@code conversion.ffmpegTimeout} elapses.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code output_format}: mp3 (default), wav, ogg, flac, aac, m4a, mp4, webm, mkv or mov
 *   <li>{@code audio_bitrate}: e.g. {@code 192k}
 *   <li>{@code sample_rate}: Hz
 *   <li>{@code channels}: 1 or 2
 * </ul>
 */
@Component
public class FfmpegMediaConverter implements FileConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaConverter.class);

  // Example: Duration: 00:03:25.47, start: 0.025057, bitrate: 128 kb/s
  private static final Pattern DURATION_PATTERN =
      Pattern.compile("Duration:\\s*(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");
  // Example: size=    1024kB time=00:01:02.50 bitrate= 134.2kbits/s speed=41.6x
  private static final Pattern TIME_PATTERN =
      Pattern.compile("time=(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");
  private static final Pattern BITRATE_PATTERN = Pattern.compile("\\d{1,4}k");

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "mp3", "audio/mpeg",
          "wav", "audio/wav",
          "ogg", "audio/ogg",
          "flac", "audio/flac",
          "aac", "audio/aac",
          "m4a", "audio/mp4",
          "mp4", "video/mp4",
          "webm", "video/webm",
          "mkv", "video/x-matroska",
          "mov", "video/quicktime");

  private static final long POLL_MILLIS = 250;

  private final ConversionProperties properties;

  public FfmpegMediaConverter(ConversionProperties properties) {
    this.properties = properties;
  }

  @Override
  public String operation() {
    return "media_convert";
  }

  @Override
  public ConvertedFile convert(
      byte[] input, ConversionOptions options, ConversionProgress progress) {
    String format = normalizeFormat(options.getOrDefault("output_format", "mp3"));
    Path workDir = createWorkDir();
    try {
      Path inputFile = workDir.resolve("input");
      Path outputFile = workDir.resolve("output." + format);
      Path logFile = workDir.resolve("ffmpeg.log");
      Files.write(inputFile, input);
      progress.report(5, "Input staged");

      List<String> command = buildCommand(inputFile, outputFile, options);
      LOGGER.debug("Executing: {}", String.join(" ", command));

      Process process =
          new ProcessBuilder(command)
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .redirectError(logFile.toFile())
              .start();
      int exitCode = await(process, logFile, progress);
      if (exitCode != 0) {
        throw new ConversionException(
            String.format("ffmpeg exited with code %d: %s", exitCode, lastLine(readLog(logFile))));
      }

      byte[] output = Files.readAllBytes(outputFile);
      progress.report(95, "Media encoded");

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("output_format", format);
      parseDuration(readLog(logFile))
          .ifPresent(seconds -> metadata.put("duration_seconds", seconds));
      metadata.put("original_size_bytes", input.length);
      metadata.put("output_size_bytes", output.length);
      return new ConvertedFile(output, format, CONTENT_TYPES.get(format), metadata);

    } catch (IOException e) {
      throw new ConversionException("Media conversion failed: " + e.getMessage(), e);
    } finally {
      deleteQuietly(workDir);
    }
  }

  private int await(Process process, Path logFile, ConversionProgress progress)
      throws IOException {
    long deadline = System.nanoTime() + properties.ffmpegTimeout().toNanos();
    try {
      while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (progress.isCancelled()) {
          process.destroyForcibly();
          throw new ConversionException("Conversion cancelled");
        }
        if (System.nanoTime() - deadline > 0) {
          process.destroyForcibly();
          throw new ConversionException(
              "ffmpeg timed out after " + properties.ffmpegTimeout().toSeconds() + "s");
        }
        int percent = progressPercent(readLog(logFile));
        if (percent >= 0) {
          // ffmpeg owns 10-90 of the scale; staging and read-back take the rest
          progress.report(10 + percent * 80 / 100, "Encoding " + percent + "%");
        }
      }
      return process.exitValue();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ConversionException("Media conversion interrupted", e);
    }
  }

  List<String> buildCommand(Path inputFile, Path outputFile, ConversionOptions options) {
    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-hide_banner");
    command.add("-nostdin");
    command.add("-y");
    command.add("-i");
    command.add(inputFile.toString());

    options
        .get("audio_bitrate")
        .ifPresent(
            bitrate -> {
              if (!BITRATE_PATTERN.matcher(bitrate).matches()) {
                throw new ConversionException("Option 'audio_bitrate' must look like 192k");
              }
              command.add("-b:a");
              command.add(bitrate);
            });
    options
        .getInt("sample_rate")
        .ifPresent(
            rate -> {
              if (rate < 8000 || rate > 192000) {
                throw new ConversionException("Option 'sample_rate' out of range: " + rate);
              }
              command.add("-ar");
              command.add(Integer.toString(rate));
            });
    options
        .getInt("channels")
        .ifPresent(
            channels -> {
              if (channels != 1 && channels != 2) {
                throw new ConversionException("Option 'channels' must be 1 or 2");
              }
              command.add("-ac");
              command.add(Integer.toString(channels));
            });

    command.add(outputFile.toString());
    return command;
  }

  static String normalizeFormat(String requested) {
    String format = requested.toLowerCase(Locale.ROOT);
    if (!CONTENT_TYPES.containsKey(format)) {
      throw new ConversionException("Unsupported media output format: " + requested);
    }
    return format;
  }

  /** Total input duration in seconds, from the {@code Duration:} line. */
  static OptionalDouble parseDuration(String stderr) {
    Matcher matcher = DURATION_PATTERN.matcher(stderr);
    return matcher.find() ? OptionalDouble.of(toSeconds(matcher)) : OptionalDouble.empty();
  }

  /** Percentage encoded so far, or -1 if ffmpeg has not reported enough yet. */
  static int progressPercent(String stderr) {
    OptionalDouble total = parseDuration(stderr);
    if (total.isEmpty() || total.getAsDouble() <= 0) {
      return -1;
    }
    Matcher matcher = TIME_PATTERN.matcher(stderr);
    double latest = -1;
    while (matcher.find()) {
      latest = toSeconds(matcher);
    }
    if (latest < 0) {
      return -1;
    }
    return (int) Math.min(100, Math.floor(latest / total.getAsDouble() * 100));
  }

  private static double toSeconds(Matcher matcher) {
    return Integer.parseInt(matcher.group(1)) * 3600
        + Integer.parseInt(matcher.group(2)) * 60
        + Double.parseDouble(matcher.group(3));
  }

  private static String lastLine(String log) {
    String trimmed = log.strip();
    int newline = Math.max(trimmed.lastIndexOf('\n'), trimmed.lastIndexOf('\r'));
    return newline < 0 ? trimmed : trimmed.substring(newline + 1);
  }

  private static String readLog(Path logFile) throws IOException {
    if (!Files.exists(logFile)) {
      return "";
    }
    // ffmpeg writes whatever bytes the container metadata holds; never fail on decoding
    return new String(Files.readAllBytes(logFile), StandardCharsets.ISO_8859_1);
  }

  private Path createWorkDir() {
    try {
      Path root = Path.of(properties.tempDir());
      Files.createDirectories(root);
      return Files.createTempDirectory(root, "media-");
    } catch (IOException e) {
      throw new ConversionException("Cannot create working directory: " + e.getMessage(), e);
    }
  }

  private static void deleteQuietly(Path dir) {
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(FfmpegMediaConverter::deleteFile);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up working directory {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
