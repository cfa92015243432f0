package com.libragraph.atomizer.core.dispatch;

import com.libragraph.atomizer.formats.api.ResourceLimitExceededException;
import com.libragraph.atomizer.formats.api.StructuralParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NodeFailureTest {

    @Test
    void shouldClassifyByExceptionType() {
        assertThat(NodeFailure.from(new StructuralParseException("bad header")).kind())
                .isEqualTo(NodeFailure.Kind.STRUCTURAL);
        assertThat(NodeFailure.from(new ResourceLimitExceededException("limit", 1, 2)).kind())
                .isEqualTo(NodeFailure.Kind.RESOURCE_LIMIT);
        assertThat(NodeFailure.from(new IllegalStateException("boom")).kind())
                .isEqualTo(NodeFailure.Kind.ERROR);
    }

    @Test
    void shouldCaptureMessageTypeAndStackTrace() {
        NodeFailure failure = NodeFailure.from(new StructuralParseException("bad header"));

        assertThat(failure.message()).isEqualTo("bad header");
        assertThat(failure.exceptionType()).isEqualTo(StructuralParseException.class.getName());
        assertThat(failure.stackTrace()).contains("NodeFailureTest");
    }

    @Test
    void shouldDescribeUnsupportedWithoutException() {
        NodeFailure failure = NodeFailure.unsupported("No atomizer for application/x-thing");

        assertThat(failure.kind()).isEqualTo(NodeFailure.Kind.UNSUPPORTED);
        assertThat(failure.exceptionType()).isNull();
        assertThat(failure.stackTrace()).isNull();
    }
}
