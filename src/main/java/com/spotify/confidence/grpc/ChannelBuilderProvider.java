package com.spotify.confidence.grpc;

import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.ManagedChannelBuilder;

/** Creates the transport specific builder for a target. */
@FunctionalInterface
interface ChannelBuilderProvider {
  ChannelBuilderProvider DEFAULT = Grpc::newChannelBuilder;

  ManagedChannelBuilder<?> builderFor(String target, ChannelCredentials credentials);
}
