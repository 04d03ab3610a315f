package io.jobworker.dispatch;

import io.jobworker.DispatchResult;
import io.jobworker.ratelimit.RateLimitRules;
import io.jobworker.ratelimit.SlidingWindowRateLimiter;
import io.jobworker.spi.MetricsExporter;
import io.jobworker.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes the payload of a {@code process_update} job to the matching update handler.
 *
 * <ul>
 *   <li>message with {@code successful_payment}: the successful-payment handler;
 *   <li>message text: the handler of the longest registered command prefix, ignored when
 *       none matches;
 *   <li>callback query: checked against the {@code button_click} rate limit of its sender,
 *       then routed by action name (simple actions) or {@link CallbackAction.Kind};
 *   <li>pre-checkout query: answered within the pre-checkout deadline, negatively when the
 *       handler fails or runs out of time;
 *   <li>chat join request: the join-request handler.
 * </ul>
 *
 * <p>Updates without a handler are ignored and reported as {@link DispatchResult#ok()}.
 * Handler exceptions propagate to the caller.
 *
 * <p>Create instances via {@link #builder()}. Close the router to stop the pre-checkout
 * executor.
 */
public final class UpdateRouter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(UpdateRouter.class.getName());

  private final List<Map.Entry<String, MessageHandler>> commands;
  private final MessageHandler successfulPaymentHandler;
  private final Map<String, CallbackHandler> namedCallbacks;
  private final Map<CallbackAction.Kind, CallbackHandler> kindCallbacks;
  private final JoinRequestHandler joinRequestHandler;
  private final PreCheckoutHandler preCheckoutHandler;
  private final PreCheckoutResponder preCheckoutResponder;
  private final Duration preCheckoutDeadline;
  private final Duration preCheckoutResponseMargin;
  private final SlidingWindowRateLimiter rateLimiter;
  private final MetricsExporter metrics;
  private final ThreadPoolExecutor preCheckoutExecutor;

  private UpdateRouter(Builder builder) {
    this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
    this.preCheckoutDeadline = Objects.requireNonNull(builder.preCheckoutDeadline, "preCheckoutDeadline");
    this.preCheckoutResponseMargin = Objects.requireNonNull(builder.preCheckoutResponseMargin,
        "preCheckoutResponseMargin");
    if (preCheckoutResponseMargin.isNegative()
        || preCheckoutResponseMargin.compareTo(preCheckoutDeadline) >= 0) {
      throw new IllegalArgumentException("preCheckoutResponseMargin must be >= 0 and < preCheckoutDeadline");
    }
    if (builder.preCheckoutHandler != null && builder.preCheckoutResponder == null) {
      throw new IllegalArgumentException("preCheckoutHandler requires a preCheckoutResponder");
    }
    if (builder.preCheckoutThreads < 1) {
      throw new IllegalArgumentException("preCheckoutThreads must be >= 1");
    }

    List<Map.Entry<String, MessageHandler>> sorted = new ArrayList<>(builder.commands.entrySet());
    sorted.sort(Comparator.comparingInt((Map.Entry<String, MessageHandler> e) -> e.getKey().length()).reversed());
    this.commands = List.copyOf(sorted);
    this.successfulPaymentHandler = builder.successfulPaymentHandler;
    this.namedCallbacks = Map.copyOf(builder.namedCallbacks);
    this.kindCallbacks = new EnumMap<>(CallbackAction.Kind.class);
    this.kindCallbacks.putAll(builder.kindCallbacks);
    this.joinRequestHandler = builder.joinRequestHandler;
    this.preCheckoutHandler = builder.preCheckoutHandler;
    this.preCheckoutResponder = builder.preCheckoutResponder;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.preCheckoutExecutor = new ThreadPoolExecutor(0, builder.preCheckoutThreads,
        60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new DaemonThreadFactory("jobworker-precheckout-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Routes one decoded update.
   *
   * @throws Exception whatever the selected handler throws
   */
  public DispatchResult route(Update update) throws Exception {
    Objects.requireNonNull(update, "update");
    if (update instanceof Update.Message) {
      return routeMessage((Update.Message) update);
    }
    if (update instanceof Update.CallbackQuery) {
      return routeCallback((Update.CallbackQuery) update);
    }
    if (update instanceof Update.PreCheckoutQuery) {
      return routePreCheckout((Update.PreCheckoutQuery) update);
    }
    Update.JoinRequest request = (Update.JoinRequest) update;
    if (joinRequestHandler == null) {
      logger.log(Level.FINE, "No join-request handler; ignoring request from {0}", request.senderId());
      return DispatchResult.ok();
    }
    return orOk(joinRequestHandler.handle(request));
  }

  private DispatchResult routeMessage(Update.Message message) throws Exception {
    if (message.successfulPayment()) {
      if (successfulPaymentHandler == null) {
        logger.log(Level.WARNING, "Successful payment from {0} has no handler", message.senderId());
        return DispatchResult.ok();
      }
      return orOk(successfulPaymentHandler.handle(message));
    }
    if (message.text() == null) {
      return DispatchResult.ok();
    }
    String text = message.text().strip();
    for (Map.Entry<String, MessageHandler> command : commands) {
      if (text.startsWith(command.getKey())) {
        logger.log(Level.FINE, "Routing command {0} from {1}", new Object[]{command.getKey(), message.senderId()});
        return orOk(command.getValue().handle(message));
      }
    }
    return DispatchResult.ok();
  }

  private DispatchResult routeCallback(Update.CallbackQuery query) throws Exception {
    if (query.senderId() == null) {
      return DispatchResult.dropped("Callback query without sender");
    }
    if (!rateLimiter.allowed(query.senderId(), RateLimitRules.BUTTON_CLICK)) {
      metrics.incrementRateLimited();
      logger.log(Level.WARNING, "Rate limit exceeded for button clicks by user {0}", query.senderId());
      return DispatchResult.dropped("Rate limited: " + RateLimitRules.BUTTON_CLICK);
    }
    CallbackAction action = CallbackAction.parse(query.data());
    CallbackHandler handler = null;
    if (action instanceof CallbackAction.Simple) {
      handler = namedCallbacks.get(((CallbackAction.Simple) action).name());
    }
    if (handler == null) {
      handler = kindCallbacks.get(action.kind());
    }
    if (handler == null) {
      logger.log(Level.FINE, "No callback handler for {0}", action.raw());
      return DispatchResult.ok();
    }
    return orOk(handler.handle(query, action));
  }

  private DispatchResult routePreCheckout(Update.PreCheckoutQuery query) throws Exception {
    if (preCheckoutHandler == null) {
      logger.log(Level.WARNING, "Pre-checkout query {0} has no handler", query.queryId());
      return DispatchResult.ok();
    }
    PreCheckoutAnswer answer;
    String failure = null;
    Future<PreCheckoutAnswer> pending = null;
    try {
      pending = preCheckoutExecutor.submit(() -> preCheckoutHandler.check(query));
      answer = pending.get(handlerBudget().toMillis(), TimeUnit.MILLISECONDS);
      if (answer == null) {
        answer = PreCheckoutAnswer.approve();
      }
    } catch (TimeoutException e) {
      pending.cancel(true);
      failure = "Pre-checkout handler exceeded deadline";
      logger.log(Level.WARNING, failure + " for query " + query.queryId());
      answer = PreCheckoutAnswer.reject("Payment could not be verified in time, please try again");
    } catch (ExecutionException | RejectedExecutionException e) {
      failure = "Pre-checkout handler failed";
      logger.log(Level.WARNING, failure + " for query " + query.queryId(), e);
      answer = PreCheckoutAnswer.reject("Payment could not be verified, please try again");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.cancel(true);
      preCheckoutResponder.answer(query.queryId(), PreCheckoutAnswer.reject("Payment interrupted"));
      throw e;
    }
    preCheckoutResponder.answer(query.queryId(), answer);
    return failure == null ? DispatchResult.ok() : DispatchResult.dropped(failure);
  }

  private Duration handlerBudget() {
    return preCheckoutDeadline.minus(preCheckoutResponseMargin);
  }

  private static DispatchResult orOk(DispatchResult result) {
    return result == null ? DispatchResult.ok() : result;
  }

  /**
   * Stops the pre-checkout executor; queries still running are interrupted.
   */
  @Override
  public void close() {
    preCheckoutExecutor.shutdownNow();
  }

  /** Builder for {@link UpdateRouter}. */
  public static final class Builder {
    private final Map<String, MessageHandler> commands = new HashMap<>();
    private MessageHandler successfulPaymentHandler;
    private final Map<String, CallbackHandler> namedCallbacks = new HashMap<>();
    private final Map<CallbackAction.Kind, CallbackHandler> kindCallbacks = new EnumMap<>(CallbackAction.Kind.class);
    private JoinRequestHandler joinRequestHandler;
    private PreCheckoutHandler preCheckoutHandler;
    private PreCheckoutResponder preCheckoutResponder;
    private Duration preCheckoutDeadline = Duration.ofSeconds(10);
    private Duration preCheckoutResponseMargin = Duration.ofSeconds(1);
    private int preCheckoutThreads = 4;
    private SlidingWindowRateLimiter rateLimiter;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Routes messages whose text starts with {@code prefix} (e.g. {@code "/start"}).
     * When several prefixes match, the longest wins.
     */
    public Builder command(String prefix, MessageHandler handler) {
      Objects.requireNonNull(prefix, "prefix");
      if (prefix.isEmpty()) {
        throw new IllegalArgumentException("prefix must not be empty");
      }
      commands.put(prefix, Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder successfulPayment(MessageHandler handler) {
      this.successfulPaymentHandler = handler;
      return this;
    }

    /**
     * Routes a simple callback action by exact name. Takes precedence over a
     * {@link CallbackAction.Kind#SIMPLE} handler.
     */
    public Builder callback(String name, CallbackHandler handler) {
      namedCallbacks.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder callback(CallbackAction.Kind kind, CallbackHandler handler) {
      kindCallbacks.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder joinRequest(JoinRequestHandler handler) {
      this.joinRequestHandler = handler;
      return this;
    }

    /**
     * Sets the pre-checkout handler and the responder that delivers its answer.
     */
    public Builder preCheckout(PreCheckoutHandler handler, PreCheckoutResponder responder) {
      this.preCheckoutHandler = handler;
      this.preCheckoutResponder = responder;
      return this;
    }

    /**
     * Hard deadline by which a pre-checkout query must be answered.
     *
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder preCheckoutDeadline(Duration preCheckoutDeadline) {
      this.preCheckoutDeadline = preCheckoutDeadline;
      return this;
    }

    /**
     * Part of the deadline reserved for sending the answer. The handler gets
     * {@code deadline - margin}.
     *
     * <p>Optional. Defaults to 1 second.
     */
    public Builder preCheckoutResponseMargin(Duration preCheckoutResponseMargin) {
      this.preCheckoutResponseMargin = preCheckoutResponseMargin;
      return this;
    }

    /**
     * Maximum concurrently running pre-checkout handlers. Queries beyond it are rejected.
     *
     * <p>Optional. Defaults to 4.
     */
    public Builder preCheckoutThreads(int preCheckoutThreads) {
      this.preCheckoutThreads = preCheckoutThreads;
      return this;
    }

    /**
     * <b>Required.</b> Limiter consulted before callback handlers.
     */
    public Builder rateLimiter(SlidingWindowRateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public UpdateRouter build() {
      return new UpdateRouter(this);
    }
  }
}
