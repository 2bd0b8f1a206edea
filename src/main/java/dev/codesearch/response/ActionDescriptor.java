package dev.codesearch.response;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A follow-up the client can take, with the cost of taking it.
 *
 * @param id stable identifier, unique within one response
 * @param description human-readable summary
 * @param command tool to invoke
 * @param parameters tool arguments
 * @param estimatedTokens estimated size of what the command would return
 * @param priority higher means more useful; actions are listed by descending priority
 */
public record ActionDescriptor(
    String id,
    String description,
    String command,
    Map<String, String> parameters,
    int estimatedTokens,
    int priority) {

  public ActionDescriptor {
    parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
  }
}
