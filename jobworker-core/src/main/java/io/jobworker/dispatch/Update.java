package io.jobworker.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobworker.util.PayloadCodec;

import java.util.Objects;
import java.util.Optional;

/**
 * An inbound chat update carried by a {@code process_update} job.
 *
 * <p>The payload has exactly one of the top-level keys {@code message},
 * {@code callback_query}, {@code pre_checkout_query} or {@code chat_join_request};
 * each maps to one variant. The raw object stays available to handlers through
 * {@link #body()}.
 */
public sealed interface Update
    permits Update.Message, Update.CallbackQuery, Update.PreCheckoutQuery, Update.JoinRequest {

  String KEY_MESSAGE = "message";
  String KEY_CALLBACK_QUERY = "callback_query";
  String KEY_PRE_CHECKOUT_QUERY = "pre_checkout_query";
  String KEY_CHAT_JOIN_REQUEST = "chat_join_request";

  /** The object under the variant's top-level key. */
  ObjectNode body();

  /** Id of the originating user, or {@code null} when the update carries none. */
  String senderId();

  /**
   * Decodes the variant of an update payload.
   *
   * @return the update, or empty when none of the known keys holds an object
   */
  static Optional<Update> from(ObjectNode payload) {
    Objects.requireNonNull(payload, "payload");
    ObjectNode body = objectAt(payload, KEY_MESSAGE);
    if (body != null) {
      return Optional.of(new Message(body, fromId(body), PayloadCodec.text(body, "text"),
          body.hasNonNull("successful_payment")));
    }
    body = objectAt(payload, KEY_CALLBACK_QUERY);
    if (body != null) {
      return Optional.of(new CallbackQuery(body, fromId(body), PayloadCodec.text(body, "id"),
          PayloadCodec.text(body, "data")));
    }
    body = objectAt(payload, KEY_PRE_CHECKOUT_QUERY);
    if (body != null) {
      return Optional.of(new PreCheckoutQuery(body, fromId(body), PayloadCodec.text(body, "id"),
          PayloadCodec.text(body, "invoice_payload")));
    }
    body = objectAt(payload, KEY_CHAT_JOIN_REQUEST);
    if (body != null) {
      JsonNode chat = body.get("chat");
      return Optional.of(new JoinRequest(body, fromId(body), PayloadCodec.text(chat, "id")));
    }
    return Optional.empty();
  }

  private static ObjectNode objectAt(ObjectNode payload, String key) {
    JsonNode node = payload.get(key);
    return node != null && node.isObject() ? (ObjectNode) node : null;
  }

  private static String fromId(ObjectNode body) {
    return PayloadCodec.text(body.get("from"), "id");
  }

  /**
   * A chat message; {@code text} is null for non-text messages.
   */
  record Message(ObjectNode body, String senderId, String text, boolean successfulPayment)
      implements Update {
  }

  record CallbackQuery(ObjectNode body, String senderId, String queryId, String data)
      implements Update {
  }

  record PreCheckoutQuery(ObjectNode body, String senderId, String queryId, String invoicePayload)
      implements Update {
  }

  record JoinRequest(ObjectNode body, String senderId, String chatId) implements Update {
  }
}
