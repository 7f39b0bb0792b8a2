package com.scholary.converthub.converter;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Rewrites UTF-8 text: case transforms, whitespace clean-up and line ending normalization.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code case}: upper, lower, title, sentence, camel, pascal, snake or kebab
 *   <li>{@code remove_extra_whitespace}: collapse runs of spaces and blank lines (default false)
 *   <li>{@code line_endings}: unix (default), windows or mac
 * </ul>
 */
@Component
public class TextTransformConverter implements FileConverter {

  private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]*");
  private static final Pattern SPACES = Pattern.compile(" +");
  private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n+");

  @Override
  public String operation() {
    return "text_transform";
  }

  @Override
  public ConvertedFile convert(
      byte[] input, ConversionOptions options, ConversionProgress progress) {
    String text = decode(input);
    progress.report(20, "Text decoded");

    String result = text.replace("\r\n", "\n").replace('\r', '\n');
    String caseType =
        options.get("case").map(value -> value.toLowerCase(Locale.ROOT)).orElse(null);
    if (caseType != null) {
      result = transformCase(result, caseType);
    }
    if (options.getBoolean("remove_extra_whitespace", false)) {
      result = removeExtraWhitespace(result);
    }
    String lineEndings = options.getOrDefault("line_endings", "unix").toLowerCase(Locale.ROOT);
    result = applyLineEndings(result, lineEndings);
    progress.report(80, "Text transformed");

    byte[] output = result.getBytes(StandardCharsets.UTF_8);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("output_format", "txt");
    if (caseType != null) {
      metadata.put("case", caseType);
    }
    metadata.put("line_endings", lineEndings);
    metadata.put("character_count", result.length());
    metadata.put("word_count", countWords(result));
    metadata.put("line_count", result.isEmpty() ? 0 : result.split("\r\n|\r|\n", -1).length);
    metadata.put("original_size_bytes", input.length);
    metadata.put("output_size_bytes", output.length);
    return new ConvertedFile(output, "txt", "text/plain; charset=utf-8", metadata);
  }

  static String transformCase(String text, String caseType) {
    switch (caseType) {
      case "upper":
        return text.toUpperCase(Locale.ROOT);
      case "lower":
        return text.toLowerCase(Locale.ROOT);
      case "title":
        return replaceWords(text, TextTransformConverter::capitalize);
      case "sentence":
        return sentenceCase(text);
      case "camel":
        {
          List<String> words = words(text);
          if (words.isEmpty()) {
            return text;
          }
          return words.get(0)
              + words.stream()
                  .skip(1)
                  .map(TextTransformConverter::capitalize)
                  .collect(Collectors.joining());
        }
      case "pascal":
        return words(text).stream()
            .map(TextTransformConverter::capitalize)
            .collect(Collectors.joining());
      case "snake":
        return String.join("_", words(text));
      case "kebab":
        return String.join("-", words(text));
      default:
        throw new ConversionException("Unsupported case transform: " + caseType);
    }
  }

  static String removeExtraWhitespace(String text) {
    String collapsed = SPACES.matcher(text).replaceAll(" ");
    collapsed = BLANK_LINES.matcher(collapsed).replaceAll("\n\n");
    return collapsed.lines().map(String::stripTrailing).collect(Collectors.joining("\n")).strip();
  }

  private static String applyLineEndings(String text, String lineEndings) {
    switch (lineEndings) {
      case "unix":
        return text;
      case "windows":
        return text.replace("\n", "\r\n");
      case "mac":
        return text.replace('\n', '\r');
      default:
        throw new ConversionException("Unsupported line ending style: " + lineEndings);
    }
  }

  private static String decode(byte[] input) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(input))
          .toString();
    } catch (CharacterCodingException e) {
      throw new ConversionException("Input is not valid UTF-8 text", e);
    }
  }

  private static List<String> words(String text) {
    List<String> words = new ArrayList<>();
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      words.add(matcher.group());
    }
    return words;
  }

  private static int countWords(String text) {
    Matcher matcher = WORD.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private static String replaceWords(String text, UnaryOperator<String> fn) {
    Matcher matcher = WORD.matcher(text);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(result, Matcher.quoteReplacement(fn.apply(matcher.group())));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static String sentenceCase(String text) {
    Matcher matcher = SENTENCE.matcher(text);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String sentence = matcher.group();
      int first = 0;
      while (first < sentence.length() && !Character.isLetterOrDigit(sentence.charAt(first))) {
        first++;
      }
      String cased =
          first < sentence.length()
              ? sentence.substring(0, first)
                  + Character.toUpperCase(sentence.charAt(first))
                  + sentence.substring(first + 1).toLowerCase(Locale.ROOT)
              : sentence;
      matcher.appendReplacement(result, Matcher.quoteReplacement(cased));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static String capitalize(String word) {
    if (word.isEmpty()) {
      return word;
    }
    return Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase(Locale.ROOT);
  }
}
