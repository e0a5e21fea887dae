package io.restfulobjects.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.restfulobjects.client.http.NetworkException;
import io.restfulobjects.client.http.RawResponse;
import io.restfulobjects.client.http.RetryPolicy;
import io.restfulobjects.client.http.RetryingExecutor;
import io.restfulobjects.client.http.Sleeper;
import io.restfulobjects.client.model.DeleteResult;
import io.restfulobjects.client.model.ObjectCreateRequest;
import io.restfulobjects.client.model.ObjectRecord;
import io.restfulobjects.client.model.ObjectsJson;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;

/**
 * Blocking client for a REST collection of objects ({@code /objects} by default).
 * <p>
 * Every operation is one {@link RetryingExecutor#execute} call followed by a best-effort decode of
 * the final response body. Statuses are never turned into exceptions; only a network failure that
 * survives every retry escapes as {@link NetworkException}.
 */
public final class ObjectsClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectsClient.class);

  public static final URI DEFAULT_BASE_URL = URI.create("https://api.restful-api.dev/");
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  public static final String DEFAULT_COLLECTION = "objects";
  public static final int DEFAULT_MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

  private static final TypeReference<List<ObjectRecord>> OBJECT_LIST = new TypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final RetryingExecutor executor;
  private final Duration timeout;
  private final String collection;
  private final int maxResponseBytes;

  private ObjectsClient(Builder builder) {
    this.webClient = builder.webClientBuilder.baseUrl(builder.baseUrl.toString()).build();
    this.objectMapper = builder.objectMapper;
    this.executor = new RetryingExecutor(builder.retryPolicy, builder.sleeper);
    this.timeout = builder.timeout;
    this.collection = builder.collection;
    this.maxResponseBytes = builder.maxResponseBytes;
  }

  public static ObjectsClient create(URI baseUrl) {
    return builder().baseUrl(baseUrl).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy retryPolicy() {
    return executor.policy();
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * GET on the collection, returning the undecoded response.
   */
  public RawResponse listRaw() {
    return executor.execute(() -> exchange(HttpMethod.GET, "/{collection}", null, collection));
  }

  public ApiResult<List<ObjectRecord>> list() {
    RawResponse response = listRaw();
    return new ApiResult<>(response.statusCode(),
        decode(response, objectMapper.getTypeFactory().constructType(OBJECT_LIST)));
  }

  public ApiResult<ObjectRecord> create(ObjectCreateRequest request) {
    Objects.requireNonNull(request, "request");
    String json = encode(request);
    RawResponse response = executor.execute(() -> exchange(HttpMethod.POST, "/{collection}", json, collection));
    return recordResult(response);
  }

  public ApiResult<ObjectRecord> getById(String id) {
    Objects.requireNonNull(id, "id");
    RawResponse response = executor.execute(
        () -> exchange(HttpMethod.GET, "/{collection}/{id}", null, collection, id));
    return recordResult(response);
  }

  /**
   * PUT of a complete replacement; attributes missing from {@code request} are removed.
   */
  public ApiResult<ObjectRecord> update(String id, ObjectCreateRequest request) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(request, "request");
    String json = encode(request);
    RawResponse response = executor.execute(
        () -> exchange(HttpMethod.PUT, "/{collection}/{id}", json, collection, id));
    return recordResult(response);
  }

  public ApiResult<DeleteResult> delete(String id) {
    Objects.requireNonNull(id, "id");
    RawResponse response = executor.execute(
        () -> exchange(HttpMethod.DELETE, "/{collection}/{id}", null, collection, id));
    return result(response, DeleteResult.class);
  }

  private RawResponse exchange(HttpMethod method, String pathTemplate, String json, Object... uriVariables) {
    WebClient.RequestBodySpec spec = webClient.method(method)
        .uri(pathTemplate, uriVariables)
        .accept(MediaType.APPLICATION_JSON);
    WebClient.RequestHeadersSpec<?> request = json == null
        ? spec
        : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(json);

    RawResponse response = request
        .exchangeToMono(clientResponse -> readBody(clientResponse, method, pathTemplate)
            .map(body -> new RawResponse(clientResponse.statusCode().value(), body)))
        .timeout(timeout)
        .onErrorMap(TimeoutException.class,
            ex -> new NetworkException(method + " " + pathTemplate + " timed out after " + timeout, ex))
        .onErrorMap(WebClientRequestException.class,
            ex -> new NetworkException(method + " " + pathTemplate + " failed: " + ex.getMessage(), ex))
        .onErrorMap(ex -> ex instanceof IOException || ex instanceof AbortedException,
            ex -> new NetworkException(method + " " + pathTemplate + " connection lost: " + ex.getMessage(), ex))
        .block();
    if (response == null) {
      throw new NetworkException(method + " " + pathTemplate + " completed without a response");
    }
    LOGGER.debug("{} {} {} -> {}", method, pathTemplate, Arrays.asList(uriVariables), response.summary());
    return response;
  }

  /**
   * Buffers the whole body up to {@code maxResponseBytes}. A larger body is dropped so the caller
   * still sees the status with an absent body.
   */
  private Mono<String> readBody(ClientResponse clientResponse, HttpMethod method, String pathTemplate) {
    Charset charset = clientResponse.headers().contentType()
        .map(MediaType::getCharset)
        .orElse(StandardCharsets.UTF_8);
    return DataBufferUtils.join(clientResponse.body(BodyExtractors.toDataBuffers()), maxResponseBytes)
        .map(buffer -> {
          try {
            return buffer.toString(charset);
          } finally {
            DataBufferUtils.release(buffer);
          }
        })
        .defaultIfEmpty("")
        .onErrorResume(DataBufferLimitException.class, ex -> {
          LOGGER.warn("{} {} returned {} with a body over {} bytes; body discarded",
              method, pathTemplate, clientResponse.statusCode().value(), maxResponseBytes);
          return Mono.just("");
        });
  }

  private String encode(ObjectCreateRequest request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Unable to serialise request for " + request.name(), ex);
    }
  }

  private <T> ApiResult<T> result(RawResponse response, Class<T> type) {
    return new ApiResult<>(response.statusCode(), decode(response, objectMapper.constructType(type)));
  }

  // error payloads such as {"error": "..."} decode into an id-less record
  private ApiResult<ObjectRecord> recordResult(RawResponse response) {
    Optional<ObjectRecord> body = this.<ObjectRecord>decode(response, objectMapper.constructType(ObjectRecord.class))
        .filter(ObjectRecord::hasId);
    return new ApiResult<>(response.statusCode(), body);
  }

  private <T> Optional<T> decode(RawResponse response, JavaType type) {
    if (!response.hasBody()) {
      return Optional.empty();
    }
    try {
      T value = objectMapper.readValue(response.body(), type);
      return Optional.ofNullable(value);
    } catch (JsonProcessingException | RuntimeException ex) {
      LOGGER.debug("Could not decode {} from {}: {}", type, response.summary(), ex.getMessage());
      return Optional.empty();
    }
  }

  public static final class Builder {

    private URI baseUrl = DEFAULT_BASE_URL;
    private Duration timeout = DEFAULT_TIMEOUT;
    private String collection = DEFAULT_COLLECTION;
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private Sleeper sleeper = Sleeper.THREAD;
    private int maxResponseBytes = DEFAULT_MAX_RESPONSE_BYTES;
    private ObjectMapper objectMapper;
    private WebClient.Builder webClientBuilder;

    private Builder() {
    }

    public Builder baseUrl(URI baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      return this;
    }

    public Builder timeout(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      if (timeout.isZero() || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be positive but was " + timeout);
      }
      this.timeout = timeout;
      return this;
    }

    public Builder collection(String collection) {
      Objects.requireNonNull(collection, "collection");
      if (collection.isBlank()) {
        throw new IllegalArgumentException("collection must not be blank");
      }
      this.collection = collection.trim();
      return this;
    }

    /**
     * Largest response body kept in memory; anything bigger is reported as an absent body.
     */
    public Builder maxResponseBytes(int maxResponseBytes) {
      if (maxResponseBytes <= 0) {
        throw new IllegalArgumentException("maxResponseBytes must be positive but was " + maxResponseBytes);
      }
      this.maxResponseBytes = maxResponseBytes;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
      return this;
    }

    /**
     * Starting point for the underlying {@link WebClient}; the base URL is applied on top.
     */
    public Builder webClientBuilder(WebClient.Builder webClientBuilder) {
      this.webClientBuilder = Objects.requireNonNull(webClientBuilder, "webClientBuilder");
      return this;
    }

    public ObjectsClient build() {
      if (objectMapper == null) {
        objectMapper = ObjectsJson.newObjectMapper();
      }
      if (webClientBuilder == null) {
        webClientBuilder = WebClient.builder();
      }
      return new ObjectsClient(this);
    }
  }
}
