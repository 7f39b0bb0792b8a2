package com.scholary.converthub.converter;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Looks up converters by operation name. */
@Component
public class ConverterRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConverterRegistry.class);

  private final Map<String, FileConverter> converters = new TreeMap<>();

  public ConverterRegistry(List<FileConverter> converters) {
    for (FileConverter converter : converters) {
      FileConverter previous = this.converters.put(converter.operation(), converter);
      if (previous != null) {
        throw new IllegalStateException(
            String.format(
                "Operation %s registered twice: %s and %s",
                converter.operation(),
                previous.getClass().getSimpleName(),
                converter.getClass().getSimpleName()));
      }
    }
    LOGGER.info("Registered converters: {}", this.converters.keySet());
  }

  /**
   * Resolve the converter for an operation.
   *
   * @throws UnknownOperationException if none is registered
   */
  public FileConverter require(String operation) {
    FileConverter converter = converters.get(operation);
    if (converter == null) {
      throw new UnknownOperationException(operation);
    }
    return converter;
  }

  public Set<String> operations() {
    return converters.keySet();
  }
}
