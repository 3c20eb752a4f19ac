package ai.convoy.util.grpc;

import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.TextFormat;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.UUID;

public class GrpcLogsInterceptor {
    private static final Logger SERVER_LOG = LogManager.getLogger("GrpcServer");

    private GrpcLogsInterceptor() {
    }

    public static ServerInterceptor server() {
        return new ServerInterceptor() {
            @Override
            public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                         ServerCallHandler<ReqT, RespT> next)
            {
                var callId = UUID.randomUUID().toString();
                var methodName = call.getMethodDescriptor().getFullMethodName();

                var grpcServerCall = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void sendMessage(RespT message) {
                        if (SERVER_LOG.isTraceEnabled()) {
                            SERVER_LOG.trace("{}::<{}>: response: ({})", methodName, callId, printMessage(message));
                        } else {
                            SERVER_LOG.debug("{}::<{}>: response: <...>", methodName, callId);
                        }
                        super.sendMessage(message);
                    }

                    @Override
                    public void close(Status status, Metadata trailers) {
                        if (status.isOk()) {
                            SERVER_LOG.debug("{}::<{}>: closed", methodName, callId);
                        } else {
                            SERVER_LOG.info("{}::<{}>: closed with {}: {}", methodName, callId,
                                status.getCode(), status.getDescription());
                        }
                        super.close(status, trailers);
                    }
                };

                var listener = next.startCall(grpcServerCall, headers);

                return new SimpleForwardingServerCallListener<>(listener) {
                    @Override
                    public void onMessage(ReqT message) {
                        if (SERVER_LOG.isTraceEnabled()) {
                            SERVER_LOG.trace("{}::<{}>, request: ({})", methodName, callId, printMessage(message));
                        } else {
                            SERVER_LOG.debug("{}::<{}>, request: <...>", methodName, callId);
                        }
                        super.onMessage(message);
                    }

                    @Override
                    public void onCancel() {
                        SERVER_LOG.debug("{}::<{}>: cancelled by client", methodName, callId);
                        super.onCancel();
                    }
                };
            }
        };
    }

    static String printMessage(Object message) {
        return message instanceof MessageOrBuilder msg
            ? TextFormat.printer().shortDebugString(msg)
            : message.getClass().getName();
    }
}
