package com.codeheadsystems.sessionstore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cookie metadata attached to a {@link Session} by the host framework.
 * <p>
 * Only {@code maxAge} influences storage: when present it determines the session's
 * time-to-live. The remaining attributes are carried through unchanged so the host
 * framework can reissue the cookie.
 *
 * @param maxAge   cookie max-age in milliseconds, or {@code null} for a browser-session cookie
 * @param path     cookie path
 * @param domain   cookie domain
 * @param httpOnly whether the cookie is flagged HttpOnly
 * @param secure   whether the cookie is flagged Secure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCookie(
    @JsonProperty("maxAge") Long maxAge,
    @JsonProperty("path") String path,
    @JsonProperty("domain") String domain,
    @JsonProperty("httpOnly") Boolean httpOnly,
    @JsonProperty("secure") Boolean secure) {

  /**
   * A root-path, HttpOnly cookie with the given max-age.
   *
   * @param maxAgeMillis the max age in milliseconds
   * @return the session cookie
   */
  public static SessionCookie withMaxAge(long maxAgeMillis) {
    return new SessionCookie(maxAgeMillis, "/", null, true, null);
  }

  /**
   * A root-path, HttpOnly cookie without a max-age.
   *
   * @return the session cookie
   */
  public static SessionCookie browserSession() {
    return new SessionCookie(null, "/", null, true, null);
  }
}
