package io.intellixity.datastore.server.web;

import io.intellixity.datastore.context.ActionContext;
import io.intellixity.datastore.context.ActionScope;
import io.intellixity.datastore.server.config.DatastoreProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the caller's {@link ActionContext} for the request.\n
 *
 * The API key is read from {@code Authorization} or {@code X-CKAN-API-Key}. Requests without a key run as
 * anonymous callers; an unknown key is rejected with 403.\n
 */
@Component
public final class ApiKeyContextFilter extends OncePerRequestFilter {
  public static final String AUTHORIZATION_HEADER = "Authorization";
  public static final String API_KEY_HEADER = "X-CKAN-API-Key";

  private final Map<String, DatastoreProperties.ApiKey> apiKeys;

  public ApiKeyContextFilter(DatastoreProperties props) {
    this.apiKeys = props.getApiKeys();
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    String key = request.getHeader(AUTHORIZATION_HEADER);
    if (key == null || key.isBlank()) key = request.getHeader(API_KEY_HEADER);

    ActionContext ctx;
    if (key == null || key.isBlank()) {
      ctx = ActionContext.of(Map.of(), "anonymous");
    } else {
      DatastoreProperties.ApiKey found = apiKeys.get(key.trim());
      if (found == null || found.getUser() == null) {
        response.sendError(403, "Invalid API key");
        return;
      }
      Map<String, Object> ctxMap = new HashMap<>();
      ctxMap.put(ActionContext.USER, found.getUser());
      ctxMap.put(ActionContext.ROLES, found.getRoles() == null ? List.of() : List.copyOf(found.getRoles()));
      ctx = ActionContext.of(ctxMap, "user:" + found.getUser());
    }

    try {
      ActionScope.inContext(ctx, () -> {
          try {
              filterChain.doFilter(request, response);
          } catch (Exception e) {
              throw new RuntimeException(e);
          }
          return null;
      });
    } catch (RuntimeException e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      if (c instanceof ServletException se) throw se;
      throw e;
    }
  }
}
