package ai.convoy.util.grpc;

import com.google.protobuf.StringValue;
import io.grpc.Status;
import io.grpc.StatusException;
import org.junit.Assert;
import org.junit.Test;

public class GrpcUtilsTest {

    @Test
    public void testExceptionMapping() {
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT,
            GrpcUtils.mapToGrpcException(new IllegalArgumentException("bad quantity")).getStatus().getCode());
        Assert.assertEquals(Status.Code.FAILED_PRECONDITION,
            GrpcUtils.mapToGrpcException(new IllegalStateException("closed")).getStatus().getCode());
        Assert.assertEquals(Status.Code.INTERNAL,
            GrpcUtils.mapToGrpcException(new NullPointerException()).getStatus().getCode());
        Assert.assertEquals(Status.Code.UNKNOWN,
            GrpcUtils.mapToGrpcException(new Exception("checked")).getStatus().getCode());
    }

    @Test
    public void testStatusPassThrough() {
        var unavailable = Status.UNAVAILABLE.withDescription("store is down");

        var mapped = GrpcUtils.mapToGrpcException(unavailable.asException());
        Assert.assertEquals(Status.Code.UNAVAILABLE, mapped.getStatus().getCode());
        Assert.assertEquals("store is down", mapped.getStatus().getDescription());

        var runtime = unavailable.asRuntimeException();
        Assert.assertSame(runtime, GrpcUtils.mapToGrpcException(runtime));

        StatusException checked = Status.ALREADY_EXISTS.asException();
        Assert.assertEquals(Status.Code.ALREADY_EXISTS, GrpcUtils.mapToGrpcException(checked).getStatus().getCode());
    }

    @Test
    public void testPrintMessage() {
        Assert.assertEquals("value: \"c1\"", GrpcLogsInterceptor.printMessage(StringValue.of("c1")));
        Assert.assertEquals(String.class.getName(), GrpcLogsInterceptor.printMessage("raw"));
    }
}
