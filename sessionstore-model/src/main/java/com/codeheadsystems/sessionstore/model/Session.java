package com.codeheadsystems.sessionstore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Application-owned session state as seen by the host framework.
 * <p>
 * The attribute map may hold any Jackson-serializable values (strings, numbers, booleans,
 * lists, nested maps). The store never hands out a reference to its own copy: every write
 * serializes the session and every read deserializes a fresh instance.
 *
 * @param cookie     cookie metadata, may be {@code null}
 * @param attributes application attributes, never {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(
    @JsonProperty("cookie") SessionCookie cookie,
    @JsonProperty("attributes") Map<String, Object> attributes) {

  /**
   * Instantiates a new Session.
   *
   * @param cookie     the cookie
   * @param attributes the attributes
   */
  public Session {
    attributes = attributes == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Creates a session with the given cookie and attributes.
   *
   * @param cookie     the cookie
   * @param attributes the attributes
   * @return the session
   */
  public static Session of(SessionCookie cookie, Map<String, Object> attributes) {
    return new Session(cookie, attributes);
  }

  /**
   * The cookie max-age in milliseconds, if the session carries one.
   *
   * @return the max age
   */
  @JsonIgnore
  public Optional<Long> cookieMaxAge() {
    return Optional.ofNullable(cookie).map(SessionCookie::maxAge);
  }

  /**
   * Returns a copy of this session with one attribute added or replaced.
   *
   * @param name  attribute name
   * @param value attribute value
   * @return the new session
   */
  public Session withAttribute(String name, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(attributes);
    copy.put(name, value);
    return new Session(cookie, copy);
  }
}
