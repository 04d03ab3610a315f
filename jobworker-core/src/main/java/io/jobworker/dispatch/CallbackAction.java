package io.jobworker.dispatch;

import java.util.Set;

/**
 * Decoded form of a callback button's data string.
 *
 * <p>Data is either an exact action name ({@code "help"}) or {@code namespace:argument}
 * ({@code "pay:premium_30d"}), split on the first colon. {@link #parse} never throws;
 * anything it does not recognize becomes {@link Unknown}.
 */
public sealed interface CallbackAction
    permits CallbackAction.Simple, CallbackAction.Paged, CallbackAction.Payment,
    CallbackAction.Language, CallbackAction.Wizard, CallbackAction.Unknown {

  /** Action names accepted without an argument. */
  Set<String> SIMPLE_NAMES = Set.of(
      "my_account", "check_live", "back", "help", "referrals", "settings", "buy",
      "toggle_notifications", "clear_notifications");

  enum Kind {
    SIMPLE, PAGED, PAYMENT, LANGUAGE, WIZARD, UNKNOWN
  }

  Kind kind();

  /** The data string this action was parsed from. */
  String raw();

  static CallbackAction parse(String data) {
    if (data == null || data.isBlank()) {
      return new Unknown(data == null ? "" : data);
    }
    int colon = data.indexOf(':');
    if (colon < 0) {
      return SIMPLE_NAMES.contains(data) ? new Simple(data) : new Unknown(data);
    }
    String namespace = data.substring(0, colon);
    String argument = data.substring(colon + 1);
    if (argument.isEmpty()) {
      return new Unknown(data);
    }
    switch (namespace) {
      case "check_live":
        return parsePage(data, namespace, argument);
      case "pay":
        return new Payment(data, argument);
      case "setlang":
      case "lang":
        return new Language(data, argument);
      case "promote": {
        int next = argument.indexOf(':');
        return next < 0
            ? new Wizard(data, argument, "")
            : new Wizard(data, argument.substring(0, next), argument.substring(next + 1));
      }
      default:
        return new Unknown(data);
    }
  }

  private static CallbackAction parsePage(String data, String name, String argument) {
    try {
      int page = Integer.parseInt(argument);
      return page < 0 ? new Unknown(data) : new Paged(data, name, page);
    } catch (NumberFormatException e) {
      return new Unknown(data);
    }
  }

  record Simple(String name) implements CallbackAction {
    @Override
    public Kind kind() {
      return Kind.SIMPLE;
    }

    @Override
    public String raw() {
      return name;
    }
  }

  /** A page of a listing, e.g. {@code check_live:2}. */
  record Paged(String raw, String name, int page) implements CallbackAction {
    @Override
    public Kind kind() {
      return Kind.PAGED;
    }
  }

  /** Purchase of a package, e.g. {@code pay:premium_7d}. */
  record Payment(String raw, String packageId) implements CallbackAction {
    @Override
    public Kind kind() {
      return Kind.PAYMENT;
    }
  }

  record Language(String raw, String languageCode) implements CallbackAction {
    @Override
    public Kind kind() {
      return Kind.LANGUAGE;
    }
  }

  /**
   * A step of a multi-step flow, e.g. {@code promote:confirm:42}. {@code argument} is empty
   * when the step carries none.
   */
  record Wizard(String raw, String step, String argument) implements CallbackAction {
    @Override
    public Kind kind() {
      return Kind.WIZARD;
    }
  }

  record Unknown(String raw) implements CallbackAction {
    @Override
    public Kind kind() {
      return Kind.UNKNOWN;
    }
  }
}
