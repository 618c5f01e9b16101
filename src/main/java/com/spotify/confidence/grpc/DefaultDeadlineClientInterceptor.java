package com.spotify.confidence.grpc;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.MethodDescriptor;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Gives calls that do not set a deadline a default one. Explicit deadlines are left alone. */
class DefaultDeadlineClientInterceptor implements ClientInterceptor {
  private final Duration deadline;

  DefaultDeadlineClientInterceptor(Duration deadline) {
    this.deadline = deadline;
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    if (callOptions.getDeadline() == null) {
      callOptions = callOptions.withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
    }
    return next.newCall(method, callOptions);
  }
}
