package io.restfulobjects.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Advisory body of a delete response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeleteResult(String message) {
}
