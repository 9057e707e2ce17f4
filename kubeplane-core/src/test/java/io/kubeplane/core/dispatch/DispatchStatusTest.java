package io.kubeplane.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import io.kubeplane.core.error.ErrorKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class DispatchStatusTest {
    private static final OperationResult OK = OperationResult.success("a", List.of());
    private static final OperationResult BROKEN = OperationResult.failure("b", new ErrorDetail(ErrorKind.NOT_FOUND, "gone"));

    @Test
    void statusIsDerivedFromConstituentResults() {
        assertThat(DispatchStatus.of(List.of())).isEqualTo(DispatchStatus.SUCCESS);
        assertThat(DispatchStatus.of(List.of(OK, OK))).isEqualTo(DispatchStatus.SUCCESS);
        assertThat(DispatchStatus.of(List.of(OK, BROKEN))).isEqualTo(DispatchStatus.PARTIAL_FAILURE);
        assertThat(DispatchStatus.of(List.of(BROKEN, BROKEN))).isEqualTo(DispatchStatus.FAILURE);
    }

    @Test
    void exitCodesKeepPartialFailureDistinct() {
        assertThat(DispatchStatus.SUCCESS.exitCode()).isZero();
        assertThat(DispatchStatus.FAILURE.exitCode()).isEqualTo(1);
        assertThat(DispatchStatus.PARTIAL_FAILURE.exitCode()).isEqualTo(3);
    }
}
