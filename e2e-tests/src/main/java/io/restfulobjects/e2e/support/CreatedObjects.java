package io.restfulobjects.e2e.support;

import io.restfulobjects.client.ApiResult;
import io.restfulobjects.client.ObjectsClient;
import io.restfulobjects.client.model.DeleteResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks objects created by a scenario so they can be removed whatever the scenario outcome.
 */
public final class CreatedObjects {

  private static final Logger LOGGER = LoggerFactory.getLogger(CreatedObjects.class);

  private final Deque<String> ids = new ArrayDeque<>();

  public void register(String id) {
    Objects.requireNonNull(id, "id");
    if (!ids.contains(id)) {
      ids.push(id);
    }
  }

  /**
   * Marks an object as already removed by the scenario itself.
   */
  public void forget(String id) {
    ids.remove(id);
  }

  public List<String> pending() {
    return List.copyOf(ids);
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }

  public List<String> deleteAll(ObjectsClient client) {
    Objects.requireNonNull(client, "client");
    return deleteAll(client::delete);
  }

  /**
   * Deletes every tracked object, most recent first. Failures are logged and do not stop the sweep.
   *
   * @return ids that could not be deleted
   */
  public List<String> deleteAll(Deleter deleter) {
    Objects.requireNonNull(deleter, "deleter");
    List<String> leaked = new ArrayList<>();
    while (!ids.isEmpty()) {
      String id = ids.pop();
      try {
        ApiResult<DeleteResult> result = deleter.delete(id);
        if (result.isDeleteAccepted() || result.statusCode() == 404) {
          LOGGER.info("Cleaned up object {} (status {})", id, result.statusCode());
        } else {
          LOGGER.warn("Cleanup of object {} returned status {}", id, result.statusCode());
          leaked.add(id);
        }
      } catch (RuntimeException ex) {
        LOGGER.warn("Cleanup of object {} failed: {}", id, ex.getMessage());
        leaked.add(id);
      }
    }
    return leaked;
  }

  @FunctionalInterface
  public interface Deleter {

    ApiResult<DeleteResult> delete(String id);
  }
}
