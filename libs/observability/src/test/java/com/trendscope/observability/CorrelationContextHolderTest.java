package com.trendscope.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and scoped
 * execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store context and populate MDC")
        void shouldStoreContextAndPopulateMdc() {
            var ctx = new CorrelationContext("corr-1", "http");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_ORIGIN)).isEqualTo("http");
        }

        @Test
        @DisplayName("should clear context and MDC")
        void shouldClearContextAndMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "http"));

            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_ORIGIN)).isNull();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Scoped execution")
    class Scoped {

        @Test
        @DisplayName("should install context for the duration of the work only")
        void shouldInstallContextTemporarily() {
            var seen = new AtomicReference<String>();

            String result = CorrelationContextHolder.callWithContext(
                    CorrelationContext.forJob("refresh-loop"),
                    () -> {
                        seen.set(MDC.get(CorrelationContext.MDC_ORIGIN));
                        return "done";
                    });

            assertThat(result).isEqualTo("done");
            assertThat(seen.get()).isEqualTo("refresh-loop");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore the previous context afterwards")
        void shouldRestorePreviousContext() {
            var outer = new CorrelationContext("outer", "http");
            CorrelationContextHolder.set(outer);

            CorrelationContextHolder.runWithContext(new CorrelationContext("inner", "self-healing"),
                    () -> assertThat(CorrelationContextHolder.get().orElseThrow().correlationId())
                            .isEqualTo("inner"));

            assertThat(CorrelationContextHolder.get()).contains(outer);
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("outer");
        }

        @Test
        @DisplayName("should run work unchanged when context is null")
        void shouldRunWithoutContext() {
            String result = CorrelationContextHolder.callWithContext(null, () -> "plain");

            assertThat(result).isEqualTo("plain");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even when the work throws")
        void shouldRestoreOnException() {
            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(
                    new CorrelationContext("x", "http"),
                    () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
