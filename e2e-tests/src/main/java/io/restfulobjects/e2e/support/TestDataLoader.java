package io.restfulobjects.e2e.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.restfulobjects.client.model.ObjectCreateRequest;
import io.restfulobjects.client.model.ObjectsJson;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads JSON fixtures either from the {@code testdata/} folder on the classpath or from a directory
 * on disk.
 */
public final class TestDataLoader {

  public static final String CLASSPATH_FOLDER = "testdata";

  private final Optional<Path> directory;
  private final ObjectMapper objectMapper;

  private TestDataLoader(Optional<Path> directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  public static TestDataLoader fromClasspath() {
    return new TestDataLoader(Optional.empty(), ObjectsJson.newObjectMapper());
  }

  public static TestDataLoader fromDirectory(Path directory) {
    Objects.requireNonNull(directory, "directory");
    return new TestDataLoader(Optional.of(directory), ObjectsJson.newObjectMapper());
  }

  public static TestDataLoader from(Optional<Path> directory) {
    return directory.map(TestDataLoader::fromDirectory).orElseGet(TestDataLoader::fromClasspath);
  }

  public ObjectCreateRequest loadCreateRequest(String fileName) {
    return load(fileName, ObjectCreateRequest.class);
  }

  /**
   * Parses the named fixture.
   *
   * @throws TestDataNotFoundException when the file does not exist
   * @throws UncheckedIOException when the file cannot be read or parsed
   */
  public <T> T load(String fileName, Class<T> type) {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(type, "type");
    try (InputStream in = open(fileName)) {
      T value = objectMapper.readValue(in, type);
      if (value == null) {
        throw new IllegalStateException("Test data file " + fileName + " is empty");
      }
      return value;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read test data file " + fileName, ex);
    }
  }

  private InputStream open(String fileName) throws IOException {
    if (directory.isPresent()) {
      Path path = directory.get().resolve(fileName);
      if (!Files.isRegularFile(path)) {
        throw new TestDataNotFoundException("Test data file not found: " + path.toAbsolutePath());
      }
      return Files.newInputStream(path);
    }
    String resource = CLASSPATH_FOLDER + "/" + fileName;
    InputStream in = TestDataLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new TestDataNotFoundException("Test data file not found on classpath: " + resource);
    }
    return in;
  }
}
