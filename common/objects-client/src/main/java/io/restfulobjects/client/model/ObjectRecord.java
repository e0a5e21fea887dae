package io.restfulobjects.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Optional;

/**
 * An object as returned by the API.
 *
 * @param id server-assigned identifier
 * @param name display name chosen by the caller
 * @param data free-form attributes, {@code null} when the server sent none
 * @param createdAt set by create responses
 * @param updatedAt set by update responses
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectRecord(String id,
                           String name,
                           Attributes data,
                           Instant createdAt,
                           Instant updatedAt) {

  public boolean hasId() {
    return id != null && !id.isBlank();
  }

  public Attributes attributes() {
    return data == null ? Attributes.empty() : data;
  }

  public Optional<Instant> created() {
    return Optional.ofNullable(createdAt);
  }

  public Optional<Instant> updated() {
    return Optional.ofNullable(updatedAt);
  }
}
