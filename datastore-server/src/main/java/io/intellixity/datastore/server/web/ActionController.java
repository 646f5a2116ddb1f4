package io.intellixity.datastore.server.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.datastore.actions.ActionDispatcher;
import io.intellixity.datastore.context.ActionScope;
import org.springframework.http.HttpStatus;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/3/action")
public final class ActionController {
  /** Actions without side effects may also be called with query parameters. */
  static final Set<String> READ_ACTIONS =
      Set.of(ActionDispatcher.SEARCH, ActionDispatcher.SEARCH_SQL, ActionDispatcher.INFO);

  /** Query parameters that carry JSON objects when given as GET parameters. */
  private static final Set<String> JSON_PARAMS = Set.of("filters", "q");

  private final ActionDispatcher dispatcher;
  private final ObjectMapper mapper;

  public ActionController(ActionDispatcher dispatcher, ObjectMapper mapper) {
    this.dispatcher = dispatcher;
    this.mapper = mapper;
  }

  @PostMapping("/{action}")
  public Map<String, Object> post(@PathVariable("action") String action,
                                  @RequestBody(required = false) JsonNode body) {
    return success(action, dispatcher.dispatch(action, ActionScope.currentOrNull(), body));
  }

  @GetMapping("/{action}")
  public Map<String, Object> get(@PathVariable("action") String action,
                                 @RequestParam MultiValueMap<String, String> params) {
    if (ActionDispatcher.ACTIONS.contains(action) && !READ_ACTIONS.contains(action)) {
      throw new ResponseStatusException(HttpStatus.METHOD_NOT_ALLOWED, action + " requires POST");
    }
    return success(action, dispatcher.dispatch(action, ActionScope.currentOrNull(), toJson(params)));
  }

  static String help(String action) {
    return "/api/3/action/help_show?name=" + action;
  }

  private static Map<String, Object> success(String action, Object result) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("help", help(action));
    out.put("success", true);
    out.put("result", result);
    return out;
  }

  ObjectNode toJson(MultiValueMap<String, String> params) {
    ObjectNode node = mapper.createObjectNode();
    for (Map.Entry<String, List<String>> e : params.entrySet()) {
      List<String> values = e.getValue();
      if (values.size() > 1) {
        ArrayNode arr = node.putArray(e.getKey());
        values.forEach(arr::add);
        continue;
      }
      String v = values.isEmpty() ? null : values.get(0);
      if (v != null && JSON_PARAMS.contains(e.getKey()) && v.trim().startsWith("{")) {
        try {
          node.set(e.getKey(), mapper.readTree(v));
          continue;
        } catch (JsonProcessingException ex) {
          throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid JSON in parameter " + e.getKey(), ex);
        }
      }
      node.put(e.getKey(), v);
    }
    return node;
  }
}
