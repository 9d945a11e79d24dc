// file: server/src/main/java/io/shardlite/server/transport/GrpcTransportService.java
package io.shardlite.server.transport;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import io.shardlite.core.exception.MessageEncodingException;
import io.shardlite.server.transport.grpc.ShardingTransportGrpc;
import io.shardlite.server.transport.grpc.ShardingTransportProto;

import java.util.Map;

/**
 * Server side of {@link GrpcTransport}: decodes an envelope and hands it to
 * the sink bound at its destination address.
 * <p>
 * Maps an unknown address to NOT_FOUND, an undecodable or disallowed body to
 * INVALID_ARGUMENT, everything else to INTERNAL.
 */
final class GrpcTransportService extends ShardingTransportGrpc.ShardingTransportImplBase {

    private static final ShardingTransportProto.DeliveryAck ACK =
            ShardingTransportProto.DeliveryAck.getDefaultInstance();

    private final Map<String, MessageSink> sinks;
    private final MessageSerializer serializer;

    GrpcTransportService(Map<String, MessageSink> sinks, MessageSerializer serializer) {
        this.sinks = sinks;
        this.serializer = serializer;
    }

    @Override
    public void deliver(ShardingTransportProto.TransportEnvelope request,
                        StreamObserver<ShardingTransportProto.DeliveryAck> responseObserver) {
        try {
            MessageSink sink = sinks.get(request.getTo());
            if (sink == null) {
                responseObserver.onError(Status.NOT_FOUND
                        .withDescription("no endpoint bound at " + request.getTo())
                        .asException());
                return;
            }
            Object message = serializer.decode(request.getType(), request.getBody().toByteArray());
            sink.deliver(request.getFrom(), message);
            responseObserver.onNext(ACK);
            responseObserver.onCompleted();
        } catch (MessageEncodingException bad) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                    .withDescription(bad.getMessage())
                    .asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL
                    .withDescription(e.getMessage())
                    .asException());
        }
    }
}
