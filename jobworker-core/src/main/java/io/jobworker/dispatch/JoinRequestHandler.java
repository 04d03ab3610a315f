package io.jobworker.dispatch;

import io.jobworker.DispatchResult;

@FunctionalInterface
public interface JoinRequestHandler {

  DispatchResult handle(Update.JoinRequest request) throws Exception;
}
