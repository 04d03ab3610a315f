package io.jobworker.notify;

/**
 * Outbound messaging channel (chat API) used for live alerts.
 */
public interface MessageGateway {

  /**
   * Sends a text message.
   *
   * @return the id the remote side assigned to the message
   * @throws Exception if delivery failed
   */
  String send(String targetId, String text) throws Exception;

  /**
   * Deletes a previously sent message.
   *
   * @throws Exception if the remote side refused or could not be reached
   */
  void delete(String targetId, String messageId) throws Exception;
}
