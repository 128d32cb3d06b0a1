package com.gentoro.batchinfer.inference;

import com.gentoro.batchinfer.stream.StreamState;
import java.util.List;
import java.util.Locale;

/**
 * Issues one streaming chat-completion request per call and returns the reconstructed stream.
 *
 * <p>Implementations must be safe to call from many worker threads at once; each call is
 * independent and shares no mutable request state.
 */
public interface InferenceClient {

  /**
   * Stream a completion for {@code messages} and return the accumulated content and reasoning.
   *
   * @param jobId identifier used in diagnostics only
   * @throws com.gentoro.batchinfer.exception.TransportException on connection failures, timeouts
   *     and non-2xx responses
   */
  StreamState streamChat(String jobId, List<Message> messages);

  enum Role {
    USER;

    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  record Message(Role role, String content) {
    public static Message user(String content) {
      return new Message(Role.USER, content);
    }
  }
}
