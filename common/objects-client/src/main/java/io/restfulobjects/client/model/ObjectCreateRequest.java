package io.restfulobjects.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;
import java.util.UUID;

/**
 * Body of create and update calls. Update uses the same shape and replaces the stored object
 * wholesale, so attributes left out of {@code data} are dropped by the server.
 *
 * @param name display name, sent as-is (an empty name is left for the server to judge)
 * @param data attributes, or {@code null} to send {@code "data": null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectCreateRequest(String name, Attributes data) {

  public ObjectCreateRequest {
    Objects.requireNonNull(name, "name");
  }

  public static ObjectCreateRequest of(String name) {
    return new ObjectCreateRequest(name, null);
  }

  /**
   * Copy whose name ends with a random suffix so runs against a shared server do not collide.
   */
  public ObjectCreateRequest withUniqueName() {
    return withNameSuffix(UUID.randomUUID().toString().replace("-", ""));
  }

  public ObjectCreateRequest withNameSuffix(String suffix) {
    Objects.requireNonNull(suffix, "suffix");
    Attributes copy = data == null ? null : data.toBuilder().build();
    return new ObjectCreateRequest(name + " " + suffix, copy);
  }

  public ObjectCreateRequest withData(Attributes replacement) {
    return new ObjectCreateRequest(name, replacement);
  }
}
