package com.packsync.unit.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.packsync.exception.ErrorCode;
import com.packsync.exception.PackValidationException;
import com.packsync.exception.PerformanceLockException;
import com.packsync.exception.PosVendorException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BaseExceptionTest {

    @Test
    @DisplayName("describe appends the details in key order")
    void describeAppendsSortedDetails() {
        PerformanceLockException e = new PerformanceLockException("PERF1", 30000);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PERFORMANCE_LOCKED);
        assertThat(e.describe()).isEqualTo(
                "Performance PERF1 is being reconciled by another worker [performanceId=PERF1, waitedMs=30000]");
    }

    @Test
    @DisplayName("describe is the plain message when there are no details")
    void describeWithoutDetails() {
        assertThat(new PackValidationException("Pack data is missing").describe()).isEqualTo("Pack data is missing");
        assertThat(new PosVendorException("circuit open", new IllegalStateException()).getDetails()).isEmpty();
    }

    @Test
    @DisplayName("Vendor status codes are kept both as a field and as a detail")
    void vendorStatusInDetails() {
        PosVendorException e = new PosVendorException("Vendor rejected push", 503);

        assertThat(e.getStatusCode()).isEqualTo(503);
        assertThat(e.getDetails()).containsExactly(Map.entry("statusCode", 503));
        assertThat(e.describe()).isEqualTo("Vendor rejected push [statusCode=503]");
    }
}
