package io.jobworker.dispatch;

/**
 * Answer to a pre-checkout query. {@code errorMessage} is shown to the payer on rejection.
 */
public record PreCheckoutAnswer(boolean ok, String errorMessage) {
  private static final PreCheckoutAnswer APPROVED = new PreCheckoutAnswer(true, null);

  public static PreCheckoutAnswer approve() {
    return APPROVED;
  }

  public static PreCheckoutAnswer reject(String errorMessage) {
    return new PreCheckoutAnswer(false, errorMessage);
  }
}
