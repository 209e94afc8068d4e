package com.codeheadsystems.pds.identity.handle;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Syntax and service rules for handles.
 * <p>
 * A handle is a DNS name: ASCII letters, digits, dashes and periods, at least two labels,
 * each label 1 to 63 characters and not starting or ending with a dash, the last label
 * starting with a letter. Handles are compared in lower case.
 */
public class HandleRules {

  /**
   * Maximum length of a whole handle.
   */
  public static final int MAX_HANDLE_LENGTH = 253;

  /**
   * Maximum length of a single label.
   */
  public static final int MAX_LABEL_LENGTH = 63;

  /**
   * Shortest front part of a handle on a service domain.
   */
  public static final int MIN_SERVICE_FRONT_LENGTH = 3;

  /**
   * Longest handle on a service domain.
   */
  public static final int MAX_SERVICE_HANDLE_LENGTH = 30;

  /**
   * Front parts that are never handed out, regardless of configuration.
   */
  public static final Set<String> DEFAULT_RESERVED = Set.of(
      "about", "abuse", "account", "accounts", "admin", "administrator", "api", "app",
      "atproto", "auth", "blog", "bot", "dev", "did", "docs", "feed", "feeds", "help",
      "home", "info", "login", "mail", "moderator", "mod", "news", "official", "pds",
      "plc", "privacy", "root", "security", "server", "service", "settings", "signup",
      "staff", "status", "support", "sysadmin", "system", "team", "terms", "test",
      "webmaster", "www", "xrpc");

  private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9.-]*$");

  private HandleRules() {
  }

  /**
   * Lower-cases the handle and checks its syntax.
   *
   * @param handle the raw handle
   * @return the normalized handle
   * @throws InvalidHandleException if the handle is malformed
   */
  public static String normalizeAndEnsureValid(final String handle) {
    if (handle == null) {
      throw new InvalidHandleException("Handle is required");
    }
    final String normalized = handle.toLowerCase(Locale.ROOT);
    ensureValid(normalized);
    return normalized;
  }

  /**
   * Checks the syntax of an already normalized handle.
   *
   * @param handle the handle
   * @throws InvalidHandleException if the handle is malformed
   */
  public static void ensureValid(final String handle) {
    if (!ALLOWED.matcher(handle).matches()) {
      throw new InvalidHandleException(
          "Disallowed characters in handle (ASCII letters, digits, dashes, periods only)");
    }
    if (handle.length() > MAX_HANDLE_LENGTH) {
      throw new InvalidHandleException("Handle too long (253 chars max)");
    }
    final List<String> labels = List.of(handle.split("\\.", -1));
    if (labels.size() < 2) {
      throw new InvalidHandleException("Handle domain needs at least two parts");
    }
    for (int i = 0; i < labels.size(); i++) {
      final String label = labels.get(i);
      if (label.isEmpty()) {
        throw new InvalidHandleException("Handle parts can not be empty");
      }
      if (label.length() > MAX_LABEL_LENGTH) {
        throw new InvalidHandleException("Handle part too long (max 63 chars)");
      }
      if (label.startsWith("-") || label.endsWith("-")) {
        throw new InvalidHandleException("Handle parts can not start or end with hyphens");
      }
      if (i == labels.size() - 1 && !isAsciiLetter(label.charAt(0))) {
        throw new InvalidHandleException("Handle final component (TLD) must start with ASCII letter");
      }
    }
  }

  /**
   * Checks a normalized handle against the domains and reservations of this service.
   *
   * @param handle               the normalized handle
   * @param availableUserDomains served suffixes, each starting with a period (e.g. {@code .test})
   * @param reserved             reserved front parts
   * @throws UnsupportedDomainException if no served suffix matches
   * @throws InvalidHandleException     if the front part is malformed, too short or too long
   * @throws ReservedHandleException    if the front part is reserved
   */
  public static void ensureServiceConstraints(final String handle,
                                              final Collection<String> availableUserDomains,
                                              final Collection<String> reserved) {
    final String supportedDomain = availableUserDomains.stream()
        .filter(handle::endsWith)
        .findFirst()
        .orElseThrow(() -> new UnsupportedDomainException("Not a supported handle domain"));
    final String front = handle.substring(0, handle.length() - supportedDomain.length());
    if (front.contains(".")) {
      throw new InvalidHandleException("Invalid characters in handle");
    }
    if (front.length() < MIN_SERVICE_FRONT_LENGTH) {
      throw new InvalidHandleException("Handle too short");
    }
    if (handle.length() > MAX_SERVICE_HANDLE_LENGTH) {
      throw new InvalidHandleException("Handle too long");
    }
    if (reserved.contains(front)) {
      throw new ReservedHandleException("Reserved handle");
    }
  }

  private static boolean isAsciiLetter(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
